package turnstile.core.model.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a stored counter has outlived its window.
 */
public final class CounterRetention {

    private CounterRetention() {}

    /**
     * What a sweep should do with one stored counter.
     */
    public enum Verdict {
        KEEP,
        DELETE,
        UNKNOWN_AGE
    }

    /**
     * Judges one stored counter.
     *
     * <p>A structured counter is deleted once its window has closed or when
     * its last increment is older than {@code now - retention}. A legacy count
     * carries no metadata, so its window is estimated from the identifier in
     * its storage key; if that is not possible the age is unknown.
     *
     * @param storageKey the key the value is stored under
     * @param value the stored value
     * @param retention maximum idle age
     * @param now current time
     * @return the verdict
     * @throws turnstile.core.model.common.InvalidWindowKindException if the key names an unknown window kind
     */
    public static Verdict judge(String storageKey, StoredCounter value, Duration retention, Instant now) {
        final var cutoff = now.minus(retention);
        if (value instanceof StoredCounter.Structured structured) {
            final var record = structured.record();
            if (record.isExpired(now)) {
                return Verdict.DELETE;
            }
            final var last = record.lastIncrementAt();
            return last != null && last.isBefore(cutoff) ? Verdict.DELETE : Verdict.KEEP;
        }

        final var key = CounterKey.parse(storageKey);
        if (key.isEmpty()) {
            return Verdict.UNKNOWN_AGE;
        }
        final var start = WindowKeyer.estimateWindowStart(key.get().kind(), key.get().windowId());
        if (start.isEmpty()) {
            return Verdict.UNKNOWN_AGE;
        }
        final var window = WindowKeyer.keyFor(key.get().kind(), start.get());
        return window.expiresAt().isAfter(now) ? Verdict.KEEP : Verdict.DELETE;
    }
}
