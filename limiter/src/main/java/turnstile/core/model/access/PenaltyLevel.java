package turnstile.core.model.access;

/**
 * Escalation level derived from an identity's penalty state.
 */
public enum PenaltyLevel {
    CLEAN,
    WARNED,
    TEMPORARILY_BLOCKED,
    PERMANENTLY_BANNED
}
