package turnstile.core.model.access;

/**
 * Result of an administrative operation.
 *
 * @param success whether the operation succeeded
 * @param message human-readable outcome
 */
public record AdminResult(boolean success, String message) {

    public static AdminResult ok(String message) {
        return new AdminResult(true, message);
    }

    public static AdminResult failed(String message) {
        return new AdminResult(false, message);
    }
}
