package turnstile.core.service.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import turnstile.core.model.common.StorageUnavailableException;
import turnstile.core.port.out.AccessMetrics;

@DisplayName("StorageTimeoutHelper")
@ExtendWith(MockitoExtension.class)
class StorageTimeoutHelperTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);
    private static final String REPOSITORY_NAME = "penalty";
    private static final String OPERATION_NAME = "find";

    @Mock
    private AccessMetrics metrics;

    private StorageTimeoutHelper helper;

    @BeforeEach
    void setUp() {
        helper = new StorageTimeoutHelper(TIMEOUT, metrics, REPOSITORY_NAME);
    }

    @Nested
    @DisplayName("withTimeout()")
    class WithTimeoutTests {

        @Test
        @DisplayName("should return result when operation completes within timeout")
        void shouldReturnResult() {
            final var result = helper.withTimeout(Uni.createFrom().item("ok"), OPERATION_NAME)
                    .await()
                    .indefinitely();

            assertEquals("ok", result);
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("should fail with StorageUnavailableException on timeout")
        void shouldFailOnTimeout() {
            final var operation = Uni.createFrom().<String>nothing();

            final var exception = assertThrows(
                    StorageUnavailableException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertEquals(OPERATION_NAME, exception.getOperation());
            assertTrue(exception.getMessage().contains(REPOSITORY_NAME));
            verify(metrics).recordStorageTimeout(REPOSITORY_NAME, OPERATION_NAME);
            verify(metrics, never()).recordStorageFailure(REPOSITORY_NAME, OPERATION_NAME);
        }

        @Test
        @DisplayName("should wrap other failures and keep the cause")
        void shouldWrapFailures() {
            final var cause = new IllegalStateException("connection reset");
            final var operation = Uni.createFrom().<String>failure(cause);

            final var exception = assertThrows(
                    StorageUnavailableException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertEquals(cause, exception.getCause());
            verify(metrics).recordStorageFailure(REPOSITORY_NAME, OPERATION_NAME);
        }
    }

    @Nested
    @DisplayName("withTimeoutFallback()")
    class WithTimeoutFallbackTests {

        @Test
        @DisplayName("should return fallback value on timeout")
        void shouldReturnFallbackOnTimeout() {
            final var result = helper.withTimeoutFallback(
                            Uni.createFrom().<String>nothing(), OPERATION_NAME, () -> "fallback")
                    .await()
                    .indefinitely();

            assertEquals("fallback", result);
            verify(metrics).recordStorageTimeout(REPOSITORY_NAME, OPERATION_NAME);
        }

        @Test
        @DisplayName("should return fallback value on failure")
        void shouldReturnFallbackOnFailure() {
            final var result = helper.withTimeoutFallback(
                            Uni.createFrom().<String>failure(new RuntimeException("boom")),
                            OPERATION_NAME,
                            () -> "fallback")
                    .await()
                    .indefinitely();

            assertEquals("fallback", result);
            verify(metrics).recordStorageFailure(REPOSITORY_NAME, OPERATION_NAME);
        }
    }

    @Test
    @DisplayName("should tolerate missing metrics")
    void shouldTolerateMissingMetrics() {
        final var noMetrics = new StorageTimeoutHelper(TIMEOUT, null, REPOSITORY_NAME);

        final var exception = assertThrows(
                StorageUnavailableException.class,
                () -> noMetrics.withTimeout(Uni.createFrom().<String>nothing(), OPERATION_NAME)
                        .await()
                        .indefinitely());

        assertInstanceOf(StorageUnavailableException.class, exception);
    }
}
