package oikosnomos.billing.exception;

/**
 * A billing computation could not complete because a collaborator failed.
 * The tick is aborted and retried at the next period.
 */
public class DependencyException extends BillingEngineException {

    public DependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
