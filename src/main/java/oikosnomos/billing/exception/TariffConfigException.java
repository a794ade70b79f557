package oikosnomos.billing.exception;

/**
 * A tariff definition that cannot be priced against: bad TOU partition,
 * unordered tiers, missing rates.
 */
public class TariffConfigException extends BillingEngineException {

    public TariffConfigException(String message) {
        super(message);
    }

    public TariffConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
