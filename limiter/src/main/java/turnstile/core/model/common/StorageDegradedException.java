package turnstile.core.model.common;

/**
 * Thrown when the fallback counter tier fails after exhausting its retries.
 */
public class StorageDegradedException extends RuntimeException {

    public StorageDegradedException(String message) {
        super(message);
    }

    public StorageDegradedException(String message, Throwable cause) {
        super(message, cause);
    }
}
