package turnstile.core.model.access;

import java.util.List;

import turnstile.core.model.ratelimit.SweepResult;

/**
 * Outcome of one storage janitor run.
 *
 * @param counters result of the counter storage sweep
 * @param fallbackEvicted fallback entries evicted
 * @param penaltiesDeleted stale penalty states deleted
 * @param failures tiers whose sweep failed, with the failure message
 */
public record JanitorReport(
        SweepResult counters, long fallbackEvicted, long penaltiesDeleted, List<String> failures) {

    public JanitorReport {
        counters = counters == null ? SweepResult.empty() : counters;
        failures = List.copyOf(failures);
    }

    public long totalDeleted() {
        return counters.deletedKeys().size() + fallbackEvicted + penaltiesDeleted;
    }
}
