package turnstile.adapter.out.counter.memory;

import turnstile.core.port.out.CounterActorDirectory;
import turnstile.spi.CounterStorageProvider;

/**
 * In-memory counter storage provider.
 *
 * <p>This provider is always available as a fallback. It has the lowest
 * priority (0), so Redis is preferred when configured.
 */
public final class InMemoryCounterStorageProvider implements CounterStorageProvider {

    private static final int PRIORITY = 0;
    private static final String NAME = "memory";

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public CounterActorDirectory createDirectory() {
        return new InMemoryCounterActorDirectory();
    }
}
