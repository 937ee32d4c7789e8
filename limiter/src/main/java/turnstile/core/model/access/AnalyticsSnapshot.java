package turnstile.core.model.access;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of decision and penalty statistics.
 *
 * @param totalEvaluations decisions produced since startup
 * @param allowed allowed decisions
 * @param denied denied decisions
 * @param denialsByReason denied decisions per reason
 * @param uniqueIdentities distinct identities recently evaluated, capped at the tracking bound
 * @param totalViolations violations recorded since startup
 * @param topViolators identities with the most recorded violations, highest first
 * @param trackedPenalties penalty records currently stored
 * @param countedIdentities identities currently holding counters, 0 if unknown
 */
public record AnalyticsSnapshot(
        long totalEvaluations,
        long allowed,
        long denied,
        Map<DecisionReason, Long> denialsByReason,
        long uniqueIdentities,
        long totalViolations,
        List<Violator> topViolators,
        long trackedPenalties,
        long countedIdentities) {

    public AnalyticsSnapshot {
        denialsByReason = Map.copyOf(denialsByReason);
        topViolators = List.copyOf(topViolators);
    }

    /**
     * An identity and its violation count.
     */
    public record Violator(String identity, int violationCount) {}
}
