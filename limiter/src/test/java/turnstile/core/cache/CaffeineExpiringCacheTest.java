package turnstile.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turnstile.mock.MutableClock;

@DisplayName("CaffeineExpiringCache")
class CaffeineExpiringCacheTest {

    private MutableClock clock;
    private CaffeineExpiringCache<String, Long> cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-06-24T14:30:00Z");
        cache = new CaffeineExpiringCache<>(100, clock);
    }

    @Test
    @DisplayName("should return values until their expiry")
    void shouldReturnValuesUntilExpiry() {
        cache.put("a", 1L, clock.instant().plus(Duration.ofMinutes(10)));

        assertEquals(1L, cache.get("a").orElseThrow());

        clock.advance(Duration.ofMinutes(10));

        assertTrue(cache.get("a").isEmpty());
    }

    @Test
    @DisplayName("should not store values that are already expired")
    void shouldNotStoreExpiredValues() {
        cache.put("a", 1L, clock.instant().plus(Duration.ofMinutes(10)));
        cache.put("a", 2L, clock.instant());

        assertTrue(cache.get("a").isEmpty());
    }

    @Test
    @DisplayName("should count entries removed by evictExpired()")
    void shouldCountEvictedEntries() {
        cache.put("short-1", 1L, clock.instant().plus(Duration.ofMinutes(1)));
        cache.put("short-2", 1L, clock.instant().plus(Duration.ofMinutes(2)));
        cache.put("long", 1L, clock.instant().plus(Duration.ofDays(1)));

        clock.advance(Duration.ofHours(1));

        assertEquals(2, cache.evictExpired());
        assertEquals(1, cache.estimatedSize());
        assertEquals(1L, cache.get("long").orElseThrow());
    }

    @Test
    @DisplayName("should remove invalidated entries")
    void shouldInvalidate() {
        cache.put("a", 1L, clock.instant().plus(Duration.ofMinutes(10)));
        cache.invalidate("a");

        assertTrue(cache.get("a").isEmpty());
    }
}
