package turnstile.core.model.common;

/**
 * Thrown when the primary counter storage cannot serve a request.
 *
 * <p>Timeouts are reported as this exception too. Callers switch to the
 * fallback counter tier; the exception never reaches the client.
 */
public class StorageUnavailableException extends RuntimeException {

    private final String operation;

    public StorageUnavailableException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public StorageUnavailableException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /** Returns the storage operation that failed. */
    public String getOperation() {
        return operation;
    }
}
