package oikosnomos.billing.exception;

/**
 * A malformed or out-of-range reading. The reading is dropped, ingest continues.
 */
public class ReadingValidationException extends BillingEngineException {

    private final String reason;

    public ReadingValidationException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    /** Short machine-friendly reason, used as a metric tag. */
    public String getReason() {
        return reason;
    }
}
