package warden.core.port.out;

/**
 * A transport-level failure talking to the backend: refused or reset connection,
 * unresolvable host, connection closed mid-response.
 */
public class BackendConnectionException extends RuntimeException {

    public BackendConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
