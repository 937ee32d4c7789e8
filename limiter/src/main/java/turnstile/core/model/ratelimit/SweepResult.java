package turnstile.core.model.ratelimit;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a sweep over counter storage.
 *
 * @param deletedKeys keys removed by the sweep
 * @param errors per-key failures; a failure never aborts the sweep
 * @param unknownAgeKeys legacy keys kept because their age could not be determined
 */
public record SweepResult(List<String> deletedKeys, List<SweepError> errors, List<String> unknownAgeKeys) {

    public SweepResult {
        deletedKeys = List.copyOf(deletedKeys);
        errors = List.copyOf(errors);
        unknownAgeKeys = List.copyOf(unknownAgeKeys);
    }

    public static SweepResult empty() {
        return new SweepResult(List.of(), List.of(), List.of());
    }

    /**
     * Combines two sweep results.
     *
     * @param other the result to append
     * @return a result holding the entries of both
     */
    public SweepResult merge(SweepResult other) {
        final var deleted = new ArrayList<>(deletedKeys);
        deleted.addAll(other.deletedKeys);
        final var failed = new ArrayList<>(errors);
        failed.addAll(other.errors);
        final var unknown = new ArrayList<>(unknownAgeKeys);
        unknown.addAll(other.unknownAgeKeys);
        return new SweepResult(deleted, failed, unknown);
    }

    /**
     * A key that could not be processed during a sweep.
     *
     * @param key the storage key
     * @param message the failure message
     */
    public record SweepError(String key, String message) {}
}
