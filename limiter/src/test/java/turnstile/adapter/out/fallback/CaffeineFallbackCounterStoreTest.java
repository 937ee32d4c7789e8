package turnstile.adapter.out.fallback;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turnstile.mock.MutableClock;

@DisplayName("CaffeineFallbackCounterStore")
class CaffeineFallbackCounterStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private CaffeineFallbackCounterStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-06-24T14:30:00Z");
        store = new CaffeineFallbackCounterStore(100, clock);
    }

    @Test
    @DisplayName("should return stored counts until their TTL elapses")
    void shouldExpireAfterTtl() {
        store.put("k", 3, Duration.ofMinutes(5)).await().atMost(TIMEOUT);

        assertEquals(3L, store.get("k").await().atMost(TIMEOUT).orElseThrow());

        clock.advance(Duration.ofMinutes(5));

        assertTrue(store.get("k").await().atMost(TIMEOUT).isEmpty());
    }

    @Test
    @DisplayName("should evict expired entries on demand")
    void shouldEvictExpired() {
        store.put("a", 1, Duration.ofMinutes(1)).await().atMost(TIMEOUT);
        store.put("b", 1, Duration.ofHours(2)).await().atMost(TIMEOUT);
        clock.advance(Duration.ofHours(1));

        assertEquals(1L, store.evictExpired().await().atMost(TIMEOUT));
        assertEquals(1, store.size());
    }
}
