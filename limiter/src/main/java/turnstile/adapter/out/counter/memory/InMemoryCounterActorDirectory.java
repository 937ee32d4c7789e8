package turnstile.adapter.out.counter.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.model.ratelimit.SweepResult;
import turnstile.core.port.out.CounterActorDirectory;

/**
 * In-memory directory of counter actors, one per identity.
 *
 * <p>
 * This implementation is intended for single-instance deployments.
 * Counters are lost on restart and not shared across instances.
 */
public class InMemoryCounterActorDirectory implements CounterActorDirectory {

    private static final Logger LOG = Logger.getLogger(InMemoryCounterActorDirectory.class);

    private final ConcurrentMap<String, InMemoryCounterActor> actors = new ConcurrentHashMap<>();

    public InMemoryCounterActorDirectory() {
        LOG.info("Initialized in-memory counter storage");
    }

    @Override
    public InMemoryCounterActor actorFor(String identity) {
        return actors.computeIfAbsent(identity, id -> new InMemoryCounterActor(id, () -> actorFor(id)));
    }

    @Override
    public Uni<SweepResult> sweepExpired(Duration retention, Instant now) {
        return Multi.createFrom()
                .iterable(List.copyOf(actors.values()))
                .onItem()
                .transformToUniAndConcatenate(actor -> actor.sweepExpired(retention, now)
                        .invoke(() -> evictIfEmpty(actor)))
                .collect()
                .asList()
                .map(results -> results.stream().reduce(SweepResult.empty(), SweepResult::merge));
    }

    @Override
    public Uni<Long> identityCount() {
        return Uni.createFrom().item(() -> (long) actors.size());
    }

    private void evictIfEmpty(InMemoryCounterActor actor) {
        actors.computeIfPresent(actor.identity(), (id, current) -> {
            if (current != actor) {
                return current;
            }
            return actor.retireIfEmpty() ? null : actor;
        });
    }

    /**
     * Clear all actors (for testing).
     */
    public void clear() {
        actors.clear();
    }
}
