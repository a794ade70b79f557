package oikosnomos.billing.exception;

/**
 * Base class of all failures raised by the billing engine.
 */
public abstract class BillingEngineException extends RuntimeException {

    protected BillingEngineException(String message) {
        super(message);
    }

    protected BillingEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
