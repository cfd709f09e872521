package warden.core.model.gateway;

/**
 * Outcome of a single forwarding attempt.
 */
public sealed interface ForwardResult {

    record Forwarded(ProxyResponse response) implements ForwardResult {}

    record Failed(ForwardFailure failure, String message) implements ForwardResult {}
}
