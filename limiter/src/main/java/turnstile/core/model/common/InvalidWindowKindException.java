package turnstile.core.model.common;

/**
 * Thrown when a window kind name cannot be parsed.
 */
public class InvalidWindowKindException extends IllegalArgumentException {

    private final String value;

    public InvalidWindowKindException(String value) {
        super("Unknown window kind: " + value);
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
