package turnstile.core.model.access;

/**
 * Why an access decision came out the way it did.
 */
public enum DecisionReason {
    ALLOWED,
    IP_BLACKLISTED,
    GEO_RESTRICTED,
    TEMPORARILY_BLOCKED,
    RATE_LIMIT_EXCEEDED
}
