package turnstile.spi;

import turnstile.core.port.out.CounterActorDirectory;

/**
 * Service Provider Interface for counter storage implementations.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>In-memory (priority 0) - Default, single-instance only</li>
 *   <li>Redis (priority 10) - Shared between instances</li>
 * </ul>
 *
 * @see turnstile.core.port.out.CounterActorDirectory
 */
public interface CounterStorageProvider {

    /**
     * Return the priority of this provider. Higher values are preferred.
     *
     * @return the provider priority
     */
    int priority();

    /**
     * Return the name of this provider for logging and configuration.
     *
     * @return the provider name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Check if this provider can be used in the current environment.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the counter actor directory.
     *
     * <p>Called once during application startup.
     *
     * @return the directory instance
     */
    CounterActorDirectory createDirectory();
}
