package turnstile.core.model.access;

/**
 * The two administrative access lists.
 */
public enum AccessListType {
    ALLOW,
    DENY
}
