package turnstile.core.model.access;

/**
 * Violation counts at which each escalation level is reached.
 *
 * @param soft violations before a warning is logged
 * @param hard violations before a temporary block is applied
 * @param ban violations before the identity is banned
 */
public record PenaltyThresholds(int soft, int hard, int ban) {

    public PenaltyThresholds {
        if (soft < 1 || hard < soft || ban < hard) {
            throw new IllegalArgumentException(
                    "Thresholds must satisfy 1 <= soft <= hard <= ban, got " + soft + "/" + hard + "/" + ban);
        }
    }
}
