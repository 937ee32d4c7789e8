package turnstile.adapter.out.counter.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.model.ratelimit.CounterRetention;
import turnstile.core.model.ratelimit.StoredCounter;
import turnstile.core.model.ratelimit.SweepResult;
import turnstile.core.model.ratelimit.SweepResult.SweepError;
import turnstile.core.model.ratelimit.WindowKeyer;
import turnstile.core.model.ratelimit.WindowKind;
import turnstile.core.model.ratelimit.WindowRecord;
import turnstile.core.port.out.CounterActor;

/**
 * In-memory counter actor for one identity.
 *
 * <p>Every transaction runs under this actor's own lock, so increments for
 * one identity are serialized while other identities proceed in parallel.
 * Once the directory retires an empty actor, transactions that still reach it
 * are handed to the identity's current actor.
 */
public class InMemoryCounterActor implements CounterActor {

    private static final Logger LOG = Logger.getLogger(InMemoryCounterActor.class);

    private final String identity;
    private final Supplier<InMemoryCounterActor> successor;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, StoredCounter> counters = new HashMap<>();
    private boolean retired;

    /**
     * @param identity the identity this actor owns
     * @param successor resolves the identity's current actor after retirement
     */
    public InMemoryCounterActor(String identity, Supplier<InMemoryCounterActor> successor) {
        this.identity = identity;
        this.successor = successor;
    }

    @Override
    public String identity() {
        return identity;
    }

    @Override
    public Uni<WindowRecord> increment(WindowKind kind, String consumer, Instant now) {
        return Uni.createFrom().item(() -> execute(actor -> actor.incrementLocked(kind, consumer, now)));
    }

    @Override
    public Uni<WindowRecord> read(WindowKind kind, String consumer, Instant now) {
        return Uni.createFrom().item(() -> execute(actor -> actor.readLocked(kind, consumer, now)));
    }

    @Override
    public Uni<SweepResult> sweepExpired(Duration retention, Instant now) {
        return Uni.createFrom().item(() -> execute(actor -> actor.sweepLocked(retention, now)));
    }

    /**
     * Stores a bare legacy count, as written by older deployments.
     */
    public void storeLegacy(String storageKey, long count) {
        execute(actor -> actor.counters.put(storageKey, new StoredCounter.LegacyCount(count)));
    }

    /**
     * Returns the raw stored value of a key (for testing).
     */
    public StoredCounter stored(String storageKey) {
        return execute(actor -> actor.counters.get(storageKey));
    }

    /**
     * Get the number of stored counters (for testing).
     */
    public int keyCount() {
        return execute(actor -> actor.counters.size());
    }

    /**
     * Retires this actor if it holds no counters.
     *
     * @return true if the actor is retired
     */
    boolean retireIfEmpty() {
        lock.lock();
        try {
            if (counters.isEmpty()) {
                retired = true;
            }
            return retired;
        } finally {
            lock.unlock();
        }
    }

    private <T> T execute(Function<InMemoryCounterActor, T> transaction) {
        lock.lock();
        try {
            if (!retired) {
                return transaction.apply(this);
            }
        } finally {
            lock.unlock();
        }
        return successor.get().execute(transaction);
    }

    private WindowRecord incrementLocked(WindowKind kind, String consumer, Instant now) {
        final var window = WindowKeyer.keyFor(kind, now);
        final var storageKey = window.counterKey(consumer);
        final var stored = counters.get(storageKey);
        if (stored instanceof StoredCounter.LegacyCount legacy) {
            LOG.debugf("Migrating legacy counter %s for %s (count=%d)", storageKey, identity, legacy.count());
        }
        final var current = stored == null ? WindowRecord.empty(window, consumer) : stored.toRecord(window, consumer);
        final var next = current.increment(window, now);
        counters.put(storageKey, StoredCounter.of(next));
        return next;
    }

    private WindowRecord readLocked(WindowKind kind, String consumer, Instant now) {
        final var window = WindowKeyer.keyFor(kind, now);
        final var stored = counters.get(window.counterKey(consumer));
        return stored == null ? WindowRecord.empty(window, consumer) : stored.toRecord(window, consumer);
    }

    private SweepResult sweepLocked(Duration retention, Instant now) {
        final var deleted = new ArrayList<String>();
        final var errors = new ArrayList<SweepError>();
        final var unknown = new ArrayList<String>();

        final var it = counters.entrySet().iterator();
        while (it.hasNext()) {
            final var entry = it.next();
            final var reportedKey = identity + ":" + entry.getKey();
            try {
                switch (CounterRetention.judge(entry.getKey(), entry.getValue(), retention, now)) {
                    case DELETE -> {
                        it.remove();
                        deleted.add(reportedKey);
                    }
                    case UNKNOWN_AGE -> unknown.add(reportedKey);
                    case KEEP -> {}
                }
            } catch (RuntimeException e) {
                LOG.warnf("Failed to sweep counter %s: %s", reportedKey, e.getMessage());
                errors.add(new SweepError(reportedKey, e.getMessage()));
            }
        }
        return new SweepResult(deleted, errors, unknown);
    }
}
