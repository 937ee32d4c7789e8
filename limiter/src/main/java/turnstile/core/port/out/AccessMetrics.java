package turnstile.core.port.out;

import turnstile.core.model.access.DecisionReason;
import turnstile.core.model.access.PenaltyLevel;

/**
 * Port interface for recording admission-control metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface AccessMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a produced decision.
     *
     * @param reason the decision reason
     */
    void recordDecision(DecisionReason reason);

    /**
     * Record a counter operation served by the fallback tier.
     *
     * @param operation {@code consume} or {@code peek}
     */
    void recordCounterFallback(String operation);

    /**
     * Record a counter operation that failed open on both tiers.
     *
     * @param operation {@code consume} or {@code peek}
     */
    void recordCounterFailOpen(String operation);

    /**
     * Record a storage operation timeout.
     *
     * @param repository the repository name
     * @param operation the operation name
     */
    void recordStorageTimeout(String repository, String operation);

    /**
     * Record a non-timeout storage failure.
     *
     * @param repository the repository name
     * @param operation the operation name
     */
    void recordStorageFailure(String repository, String operation);

    /**
     * Record an escalation to a new penalty level.
     *
     * @param level the level reached
     */
    void recordPenaltyEscalation(PenaltyLevel level);

    /**
     * Record entries deleted by the storage janitor.
     *
     * @param tier {@code counters}, {@code fallback} or {@code penalties}
     * @param count entries deleted
     */
    void recordJanitorDeleted(String tier, long count);
}
