package turnstile.core.service.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import turnstile.adapter.out.counter.memory.InMemoryCounterActorDirectory;
import turnstile.adapter.out.fallback.CaffeineFallbackCounterStore;
import turnstile.adapter.out.storage.memory.InMemoryAccessListRepository;
import turnstile.adapter.out.storage.memory.InMemoryPenaltyRepository;
import turnstile.core.cache.UsageCache;
import turnstile.core.config.FallbackConfig;
import turnstile.core.config.GeoRestrictionConfig;
import turnstile.core.config.PenaltyConfig;
import turnstile.core.config.StorageConfig;
import turnstile.core.model.access.AccessListEntry;
import turnstile.core.model.access.AccessListType;
import turnstile.core.model.access.AccessRequest;
import turnstile.core.model.access.Decision;
import turnstile.core.model.access.DecisionReason;
import turnstile.core.model.access.PenaltyLevel;
import turnstile.core.model.access.ViolationRecord;
import turnstile.core.model.common.ConfigurationMissingException;
import turnstile.core.model.ratelimit.WindowKind;
import turnstile.core.model.ratelimit.WindowLimits;
import turnstile.core.model.ratelimit.WindowRecord;
import turnstile.core.port.out.AccessMetrics;
import turnstile.core.port.out.CounterActor;
import turnstile.core.port.out.CounterActorDirectory;
import turnstile.core.port.out.FallbackCounterStore;
import turnstile.core.port.out.LimitsProvider;
import turnstile.core.service.ratelimit.FallbackCounter;
import turnstile.core.service.ratelimit.RateLimitCoordinator;
import turnstile.mock.MutableClock;
import turnstile.spi.AccessListRepository;
import turnstile.spi.PenaltyRepository;

@DisplayName("AccessPolicy")
class AccessPolicyTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);
    private static final String IDENTITY = "10.0.0.1";
    private static final String CONSUMER = "reports";
    private static final WindowLimits LIMITS = WindowLimits.of(3, 50, 250, 1000);

    private MutableClock clock;
    private InMemoryCounterActorDirectory directory;
    private InMemoryPenaltyRepository penalties;
    private InMemoryAccessListRepository accessLists;
    private LimitsProvider limitsProvider;
    private AccessMetrics metrics;
    private StorageConfig storageConfig;
    private PenaltyConfig penaltyConfig;
    private DecisionStatistics statistics;
    private ViolationHistory history;
    private RateLimitCoordinator coordinator;
    private PenaltyLedger ledger;
    private AccessPolicy policy;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-06-24T14:30:00Z");
        directory = new InMemoryCounterActorDirectory();
        penalties = new InMemoryPenaltyRepository();
        accessLists = new InMemoryAccessListRepository();
        metrics = mock(AccessMetrics.class);
        statistics = new DecisionStatistics();
        history = new ViolationHistory(50, 100);

        storageConfig = mock(StorageConfig.class);
        lenient().when(storageConfig.primaryTimeout()).thenReturn(Duration.ofMillis(500));
        lenient().when(storageConfig.auxiliaryTimeout()).thenReturn(Duration.ofMillis(500));

        var fallbackConfig = mock(FallbackConfig.class);
        lenient().when(fallbackConfig.maxRetries()).thenReturn(0);

        penaltyConfig = mock(PenaltyConfig.class);
        lenient().when(penaltyConfig.softThreshold()).thenReturn(3);
        lenient().when(penaltyConfig.hardThreshold()).thenReturn(6);
        lenient().when(penaltyConfig.banThreshold()).thenReturn(12);
        lenient().when(penaltyConfig.baseBlockDuration()).thenReturn(Duration.ofMinutes(5));
        lenient().when(penaltyConfig.blockMultiplier()).thenReturn(2.0);
        lenient().when(penaltyConfig.maxBlockDuration()).thenReturn(Duration.ofHours(24));

        limitsProvider = mock(LimitsProvider.class);
        lenient().when(limitsProvider.limitsFor(anyString())).thenReturn(Uni.createFrom().item(LIMITS));

        coordinator = new RateLimitCoordinator(
                directory,
                new FallbackCounter(new CaffeineFallbackCounterStore(100, clock), fallbackConfig),
                new UsageCache(100, clock),
                metrics,
                storageConfig);
        ledger = new PenaltyLedger(penalties, accessLists, penaltyConfig, metrics);
        policy = policy(accessLists, Optional.empty(), Optional.empty());
    }

    private AccessPolicy policy(
            AccessListRepository lists, Optional<Set<String>> blocked, Optional<Set<String>> allowed) {
        var geo = mock(GeoRestrictionConfig.class);
        when(geo.blockedCountries()).thenReturn(blocked);
        when(geo.allowedCountries()).thenReturn(allowed);
        return new AccessPolicy(
                lists, ledger, coordinator, limitsProvider, geo, statistics, history, metrics, clock, storageConfig);
    }

    private Decision evaluate(String identity) {
        return policy.evaluate(identity, CONSUMER).await().atMost(TIMEOUT);
    }

    private void commit(String identity, int times) {
        for (int i = 0; i < times; i++) {
            policy.commit(identity, CONSUMER).await().atMost(TIMEOUT);
        }
    }

    private void addEntry(AccessListType type, String pattern) {
        accessLists
                .save(AccessListEntry.of(type, pattern, "test", "admin", clock.instant()))
                .await()
                .atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("Window checks")
    class WindowTests {

        @Test
        @DisplayName("should allow within limits and report usage, limits and reset times")
        void shouldAllowWithinLimits() {
            commit(IDENTITY, 2);

            var decision = evaluate(IDENTITY);

            assertTrue(decision.allowed());
            assertEquals(DecisionReason.ALLOWED, decision.reason());
            assertEquals(2L, decision.usage().get(WindowKind.HOURLY));
            assertEquals(3L, decision.limits().get(WindowKind.HOURLY));
            assertEquals(Instant.parse("2025-06-24T15:00:00Z"), decision.resetAt().get(WindowKind.HOURLY));
            assertEquals(PenaltyLevel.CLEAN, decision.penaltyLevel());
            assertFalse(decision.allowListed());
        }

        @Test
        @DisplayName("should not consume quota when evaluating")
        void shouldNotConsumeOnEvaluate() {
            evaluate(IDENTITY);
            evaluate(IDENTITY);

            assertEquals(0L, evaluate(IDENTITY).usage().get(WindowKind.HOURLY));
        }

        @Test
        @DisplayName("should deny once a window reaches its limit and record the violation")
        void shouldDenyAtLimit() {
            commit(IDENTITY, 3);

            var decision = evaluate(IDENTITY);

            assertFalse(decision.allowed());
            assertEquals(DecisionReason.RATE_LIMIT_EXCEEDED, decision.reason());
            assertEquals(WindowKind.HOURLY, decision.exceededWindow());
            assertEquals(1, ledger.find(IDENTITY).await().atMost(TIMEOUT).orElseThrow().violationCount());
            assertEquals(1, statistics.totalViolations());
            assertEquals(
                    List.of(new ViolationRecord(IDENTITY, CONSUMER, WindowKind.HOURLY, clock.instant())),
                    history.recent(IDENTITY));
        }

        @Test
        @DisplayName("should allow again once the window rolls over")
        void shouldAllowAfterRollover() {
            commit(IDENTITY, 3);
            clock.advance(Duration.ofMinutes(30));

            assertTrue(evaluate(IDENTITY).allowed());
        }

        @Test
        @DisplayName("should fall back to safe defaults when limits cannot be resolved")
        void shouldUseSafeDefaults() {
            when(limitsProvider.limitsFor(anyString()))
                    .thenReturn(Uni.createFrom().failure(new ConfigurationMissingException("no limits")));

            var decision = evaluate(IDENTITY);

            assertTrue(decision.allowed());
            assertEquals(WindowLimits.SAFE_DEFAULTS.limits(), decision.limits());
        }
    }

    @Nested
    @DisplayName("Penalties")
    class PenaltyTests {

        @Test
        @DisplayName("should block after repeated violations and report the remaining time")
        void shouldBlockAfterRepeatedViolations() {
            commit(IDENTITY, 3);

            Decision sixth = null;
            for (int i = 0; i < 6; i++) {
                sixth = evaluate(IDENTITY);
            }

            assertEquals(DecisionReason.RATE_LIMIT_EXCEEDED, sixth.reason());
            assertEquals(PenaltyLevel.TEMPORARILY_BLOCKED, sixth.penaltyLevel());
            assertEquals(clock.instant().plus(Duration.ofMinutes(5)), sixth.blockExpiresAt());

            clock.advance(Duration.ofMinutes(1));
            var blocked = evaluate(IDENTITY);

            assertEquals(DecisionReason.TEMPORARILY_BLOCKED, blocked.reason());
            assertEquals(Duration.ofMinutes(4), blocked.remainingTime());
        }

        @Test
        @DisplayName("should report a warning level after the soft threshold")
        void shouldReportWarning() {
            commit(IDENTITY, 3);
            for (int i = 0; i < 3; i++) {
                evaluate(IDENTITY);
            }
            clock.advance(Duration.ofMinutes(30));

            var decision = evaluate(IDENTITY);

            assertTrue(decision.allowed());
            assertEquals(PenaltyLevel.WARNED, decision.penaltyLevel());
        }

        @Test
        @DisplayName("should keep a temporary block in force across an hourly rollover")
        void shouldKeepBlockAcrossHourlyRollover() {
            clock.set(Instant.parse("2025-06-24T14:58:00Z"));
            commit(IDENTITY, 3);
            for (int i = 0; i < 6; i++) {
                evaluate(IDENTITY);
            }

            clock.set(Instant.parse("2025-06-24T15:01:00Z"));
            var afterRollover = evaluate(IDENTITY);

            assertEquals(DecisionReason.TEMPORARILY_BLOCKED, afterRollover.reason());
            assertEquals(Instant.parse("2025-06-24T15:03:00Z"), afterRollover.blockExpiresAt());
            assertEquals(Duration.ofMinutes(2), afterRollover.remainingTime());

            clock.set(Instant.parse("2025-06-24T15:03:00Z"));
            var afterBlock = evaluate(IDENTITY);

            assertTrue(afterBlock.allowed());
            assertEquals(0L, afterBlock.usage().get(WindowKind.HOURLY));
            assertEquals(3L, afterBlock.usage().get(WindowKind.DAILY));
        }

        @Test
        @DisplayName("should deny banned identities as blacklisted")
        void shouldDenyBannedIdentities() {
            penalties.markBanned(IDENTITY).await().atMost(TIMEOUT);

            var decision = evaluate(IDENTITY);

            assertEquals(DecisionReason.IP_BLACKLISTED, decision.reason());
            assertEquals(PenaltyLevel.PERMANENTLY_BANNED, decision.penaltyLevel());
        }
    }

    @Nested
    @DisplayName("Access lists and geo restrictions")
    class ListTests {

        @Test
        @DisplayName("should deny deny-listed identities without counter work")
        void shouldDenyDenyListed() {
            addEntry(AccessListType.DENY, "10.0.*");

            var decision = evaluate(IDENTITY);

            assertEquals(DecisionReason.IP_BLACKLISTED, decision.reason());
            assertEquals(0L, directory.identityCount().await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should check the deny-list before the allow-list")
        void shouldPreferDenyOverAllow() {
            addEntry(AccessListType.ALLOW, IDENTITY);
            addEntry(AccessListType.DENY, IDENTITY);

            assertEquals(DecisionReason.IP_BLACKLISTED, evaluate(IDENTITY).reason());
        }

        @Test
        @DisplayName("should bypass window checks for allow-listed identities")
        void shouldBypassForAllowListed() {
            addEntry(AccessListType.ALLOW, "10.0.0.*");
            commit(IDENTITY, 10);

            var decision = evaluate(IDENTITY);

            assertTrue(decision.allowed());
            assertTrue(decision.allowListed());
            assertTrue(decision.usage().isEmpty());
        }

        @Test
        @DisplayName("should restrict blocked countries")
        void shouldRestrictBlockedCountries() {
            var geoPolicy = policy(accessLists, Optional.of(Set.of("kp")), Optional.empty());

            var decision = geoPolicy
                    .evaluate(new AccessRequest(IDENTITY, CONSUMER, "KP"))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(DecisionReason.GEO_RESTRICTED, decision.reason());
        }

        @Test
        @DisplayName("should restrict countries outside the allowed set but never unknown ones")
        void shouldRestrictOutsideAllowedSet() {
            var geoPolicy = policy(accessLists, Optional.empty(), Optional.of(Set.of("DE", "FR")));

            var outside = geoPolicy
                    .evaluate(new AccessRequest(IDENTITY, CONSUMER, "us"))
                    .await()
                    .atMost(TIMEOUT);
            var inside = geoPolicy
                    .evaluate(new AccessRequest(IDENTITY, CONSUMER, "fr"))
                    .await()
                    .atMost(TIMEOUT);
            var unknown = geoPolicy.evaluate(IDENTITY, CONSUMER).await().atMost(TIMEOUT);

            assertEquals(DecisionReason.GEO_RESTRICTED, outside.reason());
            assertTrue(inside.allowed());
            assertTrue(unknown.allowed());
        }

        @Test
        @DisplayName("should fail open when the access lists are unavailable")
        void shouldFailOpenOnAccessListFailure() {
            var failing = mock(AccessListRepository.class);
            when(failing.findMatch(any(), anyString()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("down")));
            var failOpenPolicy = policy(failing, Optional.empty(), Optional.empty());

            var decision = failOpenPolicy.evaluate(IDENTITY, CONSUMER).await().atMost(TIMEOUT);

            assertTrue(decision.allowed());
            verify(metrics).recordStorageFailure("access-list", "findMatch:deny");
            verify(metrics).recordStorageFailure("access-list", "findMatch:allow");
        }
    }

    @Nested
    @DisplayName("Total storage outage")
    class OutageTests {

        private AccessPolicy outagePolicy;

        @BeforeEach
        void setUpOutage() {
            var down = Uni.createFrom().<WindowRecord>failure(new IllegalStateException("counter storage down"));
            var actor = mock(CounterActor.class);
            lenient().when(actor.increment(any(), anyString(), any())).thenReturn(down);
            lenient().when(actor.read(any(), anyString(), any())).thenReturn(down);
            var failingDirectory = mock(CounterActorDirectory.class);
            lenient().when(failingDirectory.actorFor(anyString())).thenReturn(actor);

            var failingStore = mock(FallbackCounterStore.class);
            lenient().when(failingStore.get(anyString()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("fallback down")));
            lenient().when(failingStore.put(anyString(), anyLong(), any()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("fallback down")));

            var failingPenalties = mock(PenaltyRepository.class);
            lenient().when(failingPenalties.find(anyString()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("penalties down")));
            lenient().when(failingPenalties.recordViolation(anyString(), any()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("penalties down")));

            var failingLists = mock(AccessListRepository.class);
            lenient().when(failingLists.findMatch(any(), anyString()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("lists down")));

            var fallbackConfig = mock(FallbackConfig.class);
            lenient().when(fallbackConfig.maxRetries()).thenReturn(0);
            when(limitsProvider.limitsFor(anyString())).thenReturn(Uni.createFrom().item(WindowLimits.of(1, 1, 1, 1)));

            var outageCoordinator = new RateLimitCoordinator(
                    failingDirectory,
                    new FallbackCounter(failingStore, fallbackConfig),
                    new UsageCache(100, clock),
                    metrics,
                    storageConfig);
            var outageLedger = new PenaltyLedger(failingPenalties, failingLists, penaltyConfig, metrics);
            var geo = mock(GeoRestrictionConfig.class);
            when(geo.blockedCountries()).thenReturn(Optional.empty());
            when(geo.allowedCountries()).thenReturn(Optional.empty());
            outagePolicy = new AccessPolicy(
                    failingLists,
                    outageLedger,
                    outageCoordinator,
                    limitsProvider,
                    geo,
                    statistics,
                    history,
                    metrics,
                    clock,
                    storageConfig);
        }

        @Test
        @DisplayName("should keep allowing requests while every tier is down")
        void shouldAllowWhileEveryTierIsDown() {
            for (int i = 0; i < 5; i++) {
                outagePolicy.commit(IDENTITY, CONSUMER).await().atMost(TIMEOUT);
                var decision = outagePolicy.evaluate(IDENTITY, CONSUMER).await().atMost(TIMEOUT);

                assertTrue(decision.allowed());
                assertEquals(DecisionReason.ALLOWED, decision.reason());
                assertEquals(0L, decision.usage().get(WindowKind.HOURLY));
            }

            verify(metrics, atLeastOnce()).recordCounterFailOpen("consume");
            verify(metrics, atLeastOnce()).recordCounterFailOpen("peek");
            verify(metrics, atLeastOnce()).recordStorageFailure("penalty", "find");
        }
    }

    @Nested
    @DisplayName("Bookkeeping")
    class BookkeepingTests {

        @Test
        @DisplayName("should normalize blank identities and consumers")
        void shouldNormalizeBlankInput() {
            policy.commit(" ", null).await().atMost(TIMEOUT);

            var decision = policy.evaluate(null, "").await().atMost(TIMEOUT);

            assertEquals(1L, decision.usage().get(WindowKind.HOURLY));
            assertEquals(
                    1L,
                    directory
                            .actorFor(AccessRequest.UNKNOWN_IDENTITY)
                            .read(WindowKind.HOURLY, AccessRequest.UNKNOWN_CONSUMER, clock.instant())
                            .await()
                            .atMost(TIMEOUT)
                            .count());
        }

        @Test
        @DisplayName("should record statistics and metrics for every decision")
        void shouldRecordStatistics() {
            addEntry(AccessListType.DENY, "192.168.0.1");

            evaluate(IDENTITY);
            evaluate("192.168.0.1");

            assertEquals(2, statistics.totalEvaluations());
            assertEquals(1, statistics.allowed());
            assertEquals(1, statistics.denied());
            assertEquals(1L, statistics.denialsByReason().get(DecisionReason.IP_BLACKLISTED));
            assertNull(statistics.denialsByReason().get(DecisionReason.ALLOWED));
            verify(metrics).recordDecision(DecisionReason.ALLOWED);
            verify(metrics).recordDecision(DecisionReason.IP_BLACKLISTED);
        }
    }
}
