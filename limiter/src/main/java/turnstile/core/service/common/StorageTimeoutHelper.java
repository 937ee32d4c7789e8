package turnstile.core.service.common;

import java.time.Duration;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.model.common.StorageUnavailableException;
import turnstile.core.port.out.AccessMetrics;

/**
 * Applies timeouts and failure handling to storage operations.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: timeouts and failures surface as
 *       {@link StorageUnavailableException}. Used for primary counter calls,
 *       where the caller switches to the fallback tier.</li>
 *   <li>{@link #withTimeoutFallback} - Fail-open: returns a fallback value on
 *       timeout or any failure. Used for penalty and access-list reads.</li>
 * </ul>
 *
 * <h2>Metrics</h2>
 * Records separate metrics for timeouts ({@code turnstile.storage.timeouts.total})
 * and non-timeout failures ({@code turnstile.storage.failures.total}).
 */
public class StorageTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(StorageTimeoutHelper.class);

    private final Duration timeout;
    private final AccessMetrics metrics;
    private final String repositoryName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout for storage operations
     * @param metrics metrics for recording timeouts (may be null)
     * @param repositoryName the repository name for logging and metrics tags
     */
    public StorageTimeoutHelper(Duration timeout, AccessMetrics metrics, String repositoryName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.repositoryName = repositoryName;
    }

    /**
     * Apply a timeout to an operation whose failure the caller handles.
     *
     * @param operation the storage operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with StorageUnavailableException on timeout or failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Storage operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return new StorageUnavailableException(
                            operationName, "Storage operation timeout: " + operationName + " in " + repositoryName);
                })
                .onFailure(error -> !(error instanceof StorageUnavailableException))
                .transform(error -> {
                    LOG.debugf("Storage operation failure: %s in %s: %s", operationName, repositoryName, error);
                    recordFailure(operationName);
                    return new StorageUnavailableException(
                            operationName, "Storage operation failed: " + operationName + " in " + repositoryName, error);
                });
    }

    /**
     * Apply a timeout with a fallback value on timeout or failure.
     *
     * @param operation the storage operation
     * @param operationName name for logging and metrics
     * @param fallback supplier for the fallback value
     * @param <T> the result type
     * @return a Uni that returns the fallback value on timeout or failure
     */
    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Storage operation timeout (fallback): {0} in {1} after {2}",
                            operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Storage operation failure (fallback): {0} in {1}: {2}",
                            operationName, repositoryName, error.getMessage());
                    recordFailure(operationName);
                    return fallback.get();
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStorageTimeout(repositoryName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStorageFailure(repositoryName, operationName);
        }
    }
}
