package warden.core.port.out;

/**
 * The counting store could not be reached or did not answer in time.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, Throwable cause) {
        super("Counting store unavailable during " + operation, cause);
        this.operation = operation;
    }

    public StoreUnavailableException(String operation, String message) {
        super("Counting store unavailable during " + operation + ": " + message);
        this.operation = operation;
    }

    /** Returns the store operation that failed. */
    public String getOperation() {
        return operation;
    }
}
