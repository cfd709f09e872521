package warden.core.model.ratelimit;

/**
 * What to do with requests whose HTTP method has no configured limit.
 */
public enum UnconfiguredMethodPolicy {
    /** Admit without counting. */
    ALLOW,
    /** Reject as if the limit were zero. */
    REJECT
}
