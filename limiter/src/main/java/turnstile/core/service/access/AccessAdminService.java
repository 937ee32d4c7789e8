package turnstile.core.service.access;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.model.access.AccessListEntry;
import turnstile.core.model.access.AccessListType;
import turnstile.core.model.access.AccessRequest;
import turnstile.core.model.access.AdminResult;
import turnstile.core.model.access.AnalyticsSnapshot;
import turnstile.core.model.access.PenaltyState;
import turnstile.core.model.access.UsageReport;
import turnstile.core.model.access.ViolationRecord;
import turnstile.core.model.ratelimit.WindowKind;
import turnstile.core.model.ratelimit.WindowLimits;
import turnstile.core.port.in.AccessAdministration;
import turnstile.core.port.out.CounterActorDirectory;
import turnstile.core.port.out.LimitsProvider;
import turnstile.core.service.ratelimit.RateLimitCoordinator;
import turnstile.spi.AccessListRepository;

/**
 * Administrative operations on access lists, penalty state and usage.
 */
@ApplicationScoped
public class AccessAdminService implements AccessAdministration {

    private static final Logger LOG = Logger.getLogger(AccessAdminService.class);

    private final AccessListRepository accessLists;
    private final PenaltyLedger ledger;
    private final DecisionStatistics statistics;
    private final ViolationHistory history;
    private final RateLimitCoordinator coordinator;
    private final LimitsProvider limitsProvider;
    private final CounterActorDirectory directory;
    private final Clock clock;

    public AccessAdminService(
            AccessListRepository accessLists,
            PenaltyLedger ledger,
            DecisionStatistics statistics,
            ViolationHistory history,
            RateLimitCoordinator coordinator,
            LimitsProvider limitsProvider,
            CounterActorDirectory directory,
            Clock clock) {
        this.accessLists = accessLists;
        this.ledger = ledger;
        this.statistics = statistics;
        this.history = history;
        this.coordinator = coordinator;
        this.limitsProvider = limitsProvider;
        this.directory = directory;
        this.clock = clock;
    }

    @Override
    public Uni<AdminResult> addToAllowList(String pattern, String reason, String actor) {
        return addEntry(AccessListType.ALLOW, pattern, reason, actor);
    }

    @Override
    public Uni<AdminResult> removeFromAllowList(String pattern) {
        return removeEntry(AccessListType.ALLOW, pattern);
    }

    @Override
    public Uni<AdminResult> addToDenyList(String pattern, String reason, String actor) {
        return addEntry(AccessListType.DENY, pattern, reason, actor);
    }

    @Override
    public Uni<AdminResult> removeFromDenyList(String pattern) {
        return removeEntry(AccessListType.DENY, pattern);
    }

    @Override
    public Uni<AdminResult> clearBlocks(String identity, String actor) {
        if (identity == null || identity.isBlank()) {
            return Uni.createFrom().item(AdminResult.failed("Identity must not be blank"));
        }
        return ledger.reset(identity)
                .map(deleted -> {
                    LOG.infof("Penalties cleared for %s by %s", identity, actor);
                    return deleted
                            ? AdminResult.ok("Penalties cleared for " + identity)
                            : AdminResult.ok("No penalties recorded for " + identity);
                })
                .onFailure()
                .recoverWithItem(error -> failure("clear penalties for " + identity, error));
    }

    @Override
    public Uni<Optional<PenaltyState>> getPenaltyState(String identity) {
        return ledger.find(identity);
    }

    @Override
    public Uni<UsageReport> getUsage(String identity, String consumer) {
        final var request = AccessRequest.of(identity, consumer).normalized();
        final var now = clock.instant();
        return Uni.createFrom()
                .deferred(() -> limitsProvider.limitsFor(request.consumer()))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(
                            "Limits unavailable for %s, reporting safe defaults: %s",
                            request.consumer(), error.getMessage());
                    return WindowLimits.SAFE_DEFAULTS;
                })
                .flatMap(limits -> coordinator
                        .peek(request.identity(), request.consumer(), limits.enforcedWindows(), now)
                        .map(usage -> {
                            final var windows = coordinator.currentWindows(now);
                            final var resetAt = new EnumMap<WindowKind, Instant>(WindowKind.class);
                            for (var kind : limits.enforcedWindows()) {
                                resetAt.put(kind, windows.get(kind).expiresAt());
                            }
                            return new UsageReport(
                                    request.identity(), request.consumer(), usage, limits.limits(), resetAt);
                        }));
    }

    @Override
    public List<ViolationRecord> getViolationHistory(String identity) {
        return history.recent(AccessRequest.of(identity, null).normalized().identity());
    }

    @Override
    public Multi<AccessListEntry> listEntries(AccessListType type) {
        return accessLists.streamAll(type);
    }

    @Override
    public Uni<AnalyticsSnapshot> getAnalytics(int topN) {
        final var limit = Math.max(0, topN);
        final Uni<Long> counted = Uni.createFrom()
                .deferred(directory::identityCount)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Counter identity count unavailable for analytics: %s", error.getMessage());
                    return 0L;
                });
        return counted.flatMap(countedIdentities -> snapshot(limit, countedIdentities));
    }

    private Uni<AnalyticsSnapshot> snapshot(long limit, long countedIdentities) {
        return ledger.streamAll()
                .collect()
                .asList()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Penalty states unavailable for analytics: %s", error.getMessage());
                    return List.of();
                })
                .map(states -> new AnalyticsSnapshot(
                        statistics.totalEvaluations(),
                        statistics.allowed(),
                        statistics.denied(),
                        statistics.denialsByReason(),
                        statistics.uniqueIdentities(),
                        statistics.totalViolations(),
                        states.stream()
                                .filter(state -> state.violationCount() > 0)
                                .sorted(Comparator.comparingInt(PenaltyState::violationCount)
                                        .reversed()
                                        .thenComparing(PenaltyState::identity))
                                .limit(limit)
                                .map(state -> new AnalyticsSnapshot.Violator(state.identity(), state.violationCount()))
                                .collect(Collectors.toList()),
                        states.size(),
                        countedIdentities));
    }

    private Uni<AdminResult> addEntry(AccessListType type, String pattern, String reason, String actor) {
        final var listName = listName(type);
        if (pattern == null || pattern.isBlank()) {
            return Uni.createFrom().item(AdminResult.failed("Pattern must not be blank"));
        }
        final var entry = AccessListEntry.of(type, pattern.trim(), reason, actor, clock.instant());
        return accessLists
                .save(entry)
                .map(ignored -> {
                    LOG.infof("Added %s to %s by %s: %s", entry.pattern(), listName, actor, reason);
                    return AdminResult.ok("Added " + entry.pattern() + " to " + listName);
                })
                .onFailure()
                .recoverWithItem(error -> failure("add " + entry.pattern() + " to " + listName, error));
    }

    private Uni<AdminResult> removeEntry(AccessListType type, String pattern) {
        final var listName = listName(type);
        if (pattern == null || pattern.isBlank()) {
            return Uni.createFrom().item(AdminResult.failed("Pattern must not be blank"));
        }
        final var trimmed = pattern.trim();
        return accessLists
                .remove(type, trimmed)
                .map(removed -> {
                    if (!removed) {
                        return AdminResult.failed(trimmed + " is not on the " + listName);
                    }
                    LOG.infof("Removed %s from %s", trimmed, listName);
                    return AdminResult.ok("Removed " + trimmed + " from " + listName);
                })
                .onFailure()
                .recoverWithItem(error -> failure("remove " + trimmed + " from " + listName, error));
    }

    private static AdminResult failure(String action, Throwable error) {
        LOG.warnf("Failed to %s: %s", action, error.getMessage());
        return AdminResult.failed("Failed to " + action + ": " + error.getMessage());
    }

    private static String listName(AccessListType type) {
        return type == AccessListType.ALLOW ? "allow-list" : "deny-list";
    }
}
