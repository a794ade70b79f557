package oikosnomos.billing.exception;

/**
 * Retryable I/O failure against the durable store.
 */
public class TransientStoreException extends BillingEngineException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
