package turnstile.core.model.ratelimit;

import java.util.Objects;

/**
 * Value held in counter storage.
 *
 * <p>Older deployments stored a bare integer per key. Newer ones store a
 * structured {@link WindowRecord}. Every read through the storage boundary
 * resolves to one of the two variants, and increments always write back the
 * structured form.
 */
public sealed interface StoredCounter permits StoredCounter.LegacyCount, StoredCounter.Structured {

    /**
     * Current count regardless of representation.
     *
     * @return the count
     */
    long count();

    /**
     * Resolves this value into a record for the given window.
     *
     * <p>Legacy values carry no metadata, so the window metadata is taken from
     * {@code key} and {@code lastIncrementAt} is left null.
     *
     * @param key the window the value was stored under
     * @param consumer the consumer the value belongs to
     * @return the resolved record
     */
    WindowRecord toRecord(WindowKey key, String consumer);

    static StoredCounter of(WindowRecord record) {
        return new Structured(record);
    }

    /**
     * Bare integer written by the legacy storage format.
     *
     * @param count the stored count
     */
    record LegacyCount(long count) implements StoredCounter {

        public LegacyCount {
            if (count < 0) {
                throw new IllegalArgumentException("count must not be negative");
            }
        }

        @Override
        public WindowRecord toRecord(WindowKey key, String consumer) {
            return new WindowRecord(count, key.kind(), consumer, key.windowId(), key.expiresAt(), null);
        }
    }

    /**
     * Structured record with full window metadata.
     *
     * @param record the record
     */
    record Structured(WindowRecord record) implements StoredCounter {

        public Structured {
            Objects.requireNonNull(record, "record must not be null");
        }

        @Override
        public long count() {
            return record.count();
        }

        @Override
        public WindowRecord toRecord(WindowKey key, String consumer) {
            return record;
        }
    }
}
