package turnstile.adapter.out.counter.redis;

import java.time.Duration;
import java.time.Instant;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.ratelimit.SweepResult;
import turnstile.core.model.ratelimit.WindowKind;
import turnstile.core.model.ratelimit.WindowRecord;
import turnstile.core.port.out.CounterActor;

/**
 * Redis counter actor for one identity.
 *
 * <p>Redis runs each Lua script to completion before serving another
 * command, so the script is the single writer for the identity's keys.
 */
public final class RedisCounterActor implements CounterActor {

    private final String identity;
    private final RedisCounterActorDirectory directory;

    RedisCounterActor(String identity, RedisCounterActorDirectory directory) {
        this.identity = identity;
        this.directory = directory;
    }

    @Override
    public String identity() {
        return identity;
    }

    @Override
    public Uni<WindowRecord> increment(WindowKind kind, String consumer, Instant now) {
        return directory.increment(identity, kind, consumer, now);
    }

    @Override
    public Uni<WindowRecord> read(WindowKind kind, String consumer, Instant now) {
        return directory.read(identity, kind, consumer, now);
    }

    @Override
    public Uni<SweepResult> sweepExpired(Duration retention, Instant now) {
        return directory.sweep(directory.identityPattern(identity), retention, now);
    }
}
