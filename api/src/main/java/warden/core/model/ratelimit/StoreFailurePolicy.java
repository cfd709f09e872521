package warden.core.model.ratelimit;

/**
 * What to do when the counting store cannot be reached.
 */
public enum StoreFailurePolicy {
    /** Admit the request and log the failure. */
    FAIL_OPEN,
    /** Reject the request as rate limited. */
    FAIL_CLOSED
}
