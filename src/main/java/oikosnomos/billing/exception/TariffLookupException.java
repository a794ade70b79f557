package oikosnomos.billing.exception;

/**
 * No tariff is active for the home at the requested instant, or the home is unknown.
 */
public class TariffLookupException extends BillingEngineException {

    public TariffLookupException(String message) {
        super(message);
    }
}
