package turnstile.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turnstile.core.model.access.AccessListEntry;
import turnstile.core.model.access.AccessListType;

@DisplayName("InMemoryAccessListRepository")
class InMemoryAccessListRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant NOW = Instant.parse("2025-06-24T14:30:00Z");

    private InMemoryAccessListRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAccessListRepository();
    }

    private void save(AccessListType type, String pattern) {
        repository.save(AccessListEntry.of(type, pattern, "test", "admin", NOW)).await().atMost(TIMEOUT);
    }

    @Test
    @DisplayName("should prefer exact entries, then the longest prefix")
    void shouldFindBestMatch() {
        save(AccessListType.DENY, "10.*");
        save(AccessListType.DENY, "10.0.*");
        save(AccessListType.DENY, "10.0.0.1");

        assertEquals(
                "10.0.0.1",
                repository.findMatch(AccessListType.DENY, "10.0.0.1").await().atMost(TIMEOUT).orElseThrow().pattern());
        assertEquals(
                "10.0.*",
                repository.findMatch(AccessListType.DENY, "10.0.0.2").await().atMost(TIMEOUT).orElseThrow().pattern());
        assertEquals(
                "10.*",
                repository.findMatch(AccessListType.DENY, "10.9.0.1").await().atMost(TIMEOUT).orElseThrow().pattern());
    }

    @Test
    @DisplayName("should keep the allow-list and deny-list apart")
    void shouldSeparateLists() {
        save(AccessListType.ALLOW, "10.0.0.1");

        assertTrue(repository.findMatch(AccessListType.DENY, "10.0.0.1").await().atMost(TIMEOUT).isEmpty());
        assertEquals(1, repository.streamAll(AccessListType.ALLOW).collect().asList().await().atMost(TIMEOUT).size());
        assertTrue(repository.streamAll(AccessListType.DENY).collect().asList().await().atMost(TIMEOUT).isEmpty());
    }

    @Test
    @DisplayName("should remove entries by pattern")
    void shouldRemoveEntries() {
        save(AccessListType.DENY, "10.*");

        assertTrue(repository.remove(AccessListType.DENY, "10.*").await().atMost(TIMEOUT));
        assertFalse(repository.remove(AccessListType.DENY, "10.*").await().atMost(TIMEOUT));
        assertTrue(repository.findMatch(AccessListType.DENY, "10.0.0.1").await().atMost(TIMEOUT).isEmpty());
    }
}
