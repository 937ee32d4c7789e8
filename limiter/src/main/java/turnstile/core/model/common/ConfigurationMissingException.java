package turnstile.core.model.common;

/**
 * Thrown when required limit configuration cannot be resolved.
 */
public class ConfigurationMissingException extends RuntimeException {

    public ConfigurationMissingException(String message) {
        super(message);
    }
}
