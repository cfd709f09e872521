package warden.core.model.gateway;

/**
 * Classification of a failed backend call.
 */
public enum ForwardFailure {
    /** Connection refused, reset, DNS failure or any other transport error. */
    BACKEND_UNAVAILABLE,
    /** The backend did not answer within the configured request timeout. */
    BACKEND_TIMEOUT,
    /** Unexpected failure inside the forwarding path. */
    INTERNAL_ERROR
}
