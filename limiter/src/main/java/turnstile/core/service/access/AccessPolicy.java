package turnstile.core.service.access;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.GeoRestrictionConfig;
import turnstile.core.config.StorageConfig;
import turnstile.core.model.access.AccessListEntry;
import turnstile.core.model.access.AccessListType;
import turnstile.core.model.access.AccessRequest;
import turnstile.core.model.access.Decision;
import turnstile.core.model.access.PenaltyLevel;
import turnstile.core.model.access.PenaltyState;
import turnstile.core.model.access.ViolationRecord;
import turnstile.core.model.ratelimit.WindowKind;
import turnstile.core.model.ratelimit.WindowLimits;
import turnstile.core.port.in.AccessEvaluation;
import turnstile.core.port.out.AccessMetrics;
import turnstile.core.port.out.LimitsProvider;
import turnstile.core.service.common.StorageTimeoutHelper;
import turnstile.core.service.ratelimit.RateLimitCoordinator;
import turnstile.spi.AccessListRepository;

/**
 * Decides whether a request may proceed.
 *
 * <p>Checks run in a fixed order and the first match wins:
 * <ol>
 *   <li>Deny-list match: {@code IP_BLACKLISTED}, no counter work</li>
 *   <li>Geo restriction: {@code GEO_RESTRICTED}</li>
 *   <li>Allow-list match: allowed, window checks bypassed</li>
 *   <li>Permanent ban: {@code IP_BLACKLISTED}</li>
 *   <li>Active temporary block: {@code TEMPORARILY_BLOCKED}</li>
 *   <li>Any enforced window at its limit: {@code RATE_LIMIT_EXCEEDED}, and a
 *       violation is recorded</li>
 *   <li>Otherwise allowed</li>
 * </ol>
 *
 * <p>Failed list or penalty reads are treated as no match.
 */
@ApplicationScoped
public class AccessPolicy implements AccessEvaluation {

    private static final Logger LOG = Logger.getLogger(AccessPolicy.class);

    private final AccessListRepository accessLists;
    private final PenaltyLedger ledger;
    private final RateLimitCoordinator coordinator;
    private final LimitsProvider limitsProvider;
    private final DecisionStatistics statistics;
    private final ViolationHistory history;
    private final AccessMetrics metrics;
    private final Clock clock;
    private final Set<String> blockedCountries;
    private final Set<String> allowedCountries;
    private final StorageTimeoutHelper accessListTimeout;
    private final StorageTimeoutHelper penaltyTimeout;

    public AccessPolicy(
            AccessListRepository accessLists,
            PenaltyLedger ledger,
            RateLimitCoordinator coordinator,
            LimitsProvider limitsProvider,
            GeoRestrictionConfig geoConfig,
            DecisionStatistics statistics,
            ViolationHistory history,
            AccessMetrics metrics,
            Clock clock,
            StorageConfig storageConfig) {
        this.accessLists = accessLists;
        this.ledger = ledger;
        this.coordinator = coordinator;
        this.limitsProvider = limitsProvider;
        this.statistics = statistics;
        this.history = history;
        this.metrics = metrics;
        this.clock = clock;
        this.blockedCountries = upperCase(geoConfig.blockedCountries());
        this.allowedCountries = upperCase(geoConfig.allowedCountries());
        this.accessListTimeout =
                new StorageTimeoutHelper(storageConfig.auxiliaryTimeout(), metrics, "access-list");
        this.penaltyTimeout = new StorageTimeoutHelper(storageConfig.auxiliaryTimeout(), metrics, "penalty");
    }

    @Override
    public Uni<Decision> evaluate(String identity, String consumer, Instant now) {
        return decide(AccessRequest.of(identity, consumer).normalized(), now);
    }

    @Override
    public Uni<Decision> evaluate(String identity, String consumer) {
        return evaluate(identity, consumer, clock.instant());
    }

    @Override
    public Uni<Decision> evaluate(AccessRequest request) {
        return decide(request.normalized(), clock.instant());
    }

    @Override
    public Uni<Void> commit(String identity, String consumer) {
        final var request = AccessRequest.of(identity, consumer).normalized();
        final var now = clock.instant();
        return resolveLimits(request.consumer())
                .flatMap(limits -> coordinator.consume(
                        request.identity(), request.consumer(), limits.enforcedWindows(), now))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Usage commit failed for %s/%s: %s", request.identity(), request.consumer(), error);
                    return Map.of();
                })
                .replaceWithVoid();
    }

    private Uni<Decision> decide(AccessRequest request, Instant now) {
        final var identity = request.identity();
        return findListEntry(AccessListType.DENY, identity)
                .flatMap(deny -> {
                    if (deny.isPresent()) {
                        LOG.debugf("Identity %s matched deny-list entry %s", identity, deny.get().pattern());
                        return Uni.createFrom().item(Decision.blacklisted(PenaltyLevel.CLEAN));
                    }
                    if (isGeoRestricted(request)) {
                        LOG.debugf("Identity %s restricted by country %s", identity, request.country());
                        return Uni.createFrom().item(Decision.geoRestricted());
                    }
                    return findListEntry(AccessListType.ALLOW, identity).flatMap(allow -> allow.isPresent()
                            ? Uni.createFrom().item(Decision.allowListedBypass())
                            : checkPenaltyAndWindows(request, now));
                })
                .invoke(decision -> {
                    statistics.record(identity, decision);
                    metrics.recordDecision(decision.reason());
                });
    }

    private Uni<Decision> checkPenaltyAndWindows(AccessRequest request, Instant now) {
        final var identity = request.identity();
        return penaltyTimeout
                .withTimeoutFallback(ledger.find(identity), "find", Optional::<PenaltyState>empty)
                .flatMap(state -> {
                    final var level = ledger.levelOf(state, now);
                    if (level == PenaltyLevel.PERMANENTLY_BANNED) {
                        return Uni.createFrom().item(Decision.blacklisted(level));
                    }
                    if (level == PenaltyLevel.TEMPORARILY_BLOCKED) {
                        final var blocked = state.get();
                        return Uni.createFrom()
                                .item(Decision.temporarilyBlocked(
                                        blocked.blockExpiresAt(), blocked.remainingBlock(now)));
                    }
                    return checkWindows(request, level, now);
                });
    }

    private Uni<Decision> checkWindows(AccessRequest request, PenaltyLevel level, Instant now) {
        final var identity = request.identity();
        final var consumer = request.consumer();
        return resolveLimits(consumer).flatMap(limits -> coordinator
                .peek(identity, consumer, limits.enforcedWindows(), now)
                .flatMap(usage -> {
                    final var resetAt = resetInstants(limits, now);
                    final var exceeded = limits.firstExceeded(usage);
                    if (exceeded == null) {
                        return Uni.createFrom().item(Decision.allow(usage, limits.limits(), resetAt, level));
                    }

                    LOG.debugf(
                            "Rate limit exceeded for %s/%s on %s window: %d/%d",
                            identity, consumer, exceeded.key(), usage.get(exceeded), limits.limits().get(exceeded));
                    final var denied = Decision.rateLimited(exceeded, usage, limits.limits(), resetAt, level);
                    return recordViolation(identity, consumer, exceeded, denied, now);
                }));
    }

    private Uni<Decision> recordViolation(
            String identity, String consumer, WindowKind exceeded, Decision denied, Instant now) {
        statistics.recordViolation();
        history.record(new ViolationRecord(identity, consumer, exceeded, now));
        return penaltyTimeout
                .withTimeout(ledger.recordViolation(identity, now), "recordViolation")
                .map(state -> denied.withPenalty(
                        ledger.levelOf(Optional.of(state), now), state.blockExpiresAt(), state.remainingBlock(now)))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Failed to record violation for %s: %s", identity, error.getMessage());
                    return denied;
                });
    }

    private Uni<WindowLimits> resolveLimits(String consumer) {
        return Uni.createFrom()
                .deferred(() -> limitsProvider.limitsFor(consumer))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Limits unavailable for %s, using safe defaults: %s", consumer, error.getMessage());
                    return WindowLimits.SAFE_DEFAULTS;
                });
    }

    private Uni<Optional<AccessListEntry>> findListEntry(AccessListType type, String identity) {
        return accessListTimeout.withTimeoutFallback(
                accessLists.findMatch(type, identity),
                "findMatch:" + type.name().toLowerCase(),
                Optional::<AccessListEntry>empty);
    }

    private Map<WindowKind, Instant> resetInstants(WindowLimits limits, Instant now) {
        final var windows = coordinator.currentWindows(now);
        final var resetAt = new EnumMap<WindowKind, Instant>(WindowKind.class);
        for (var kind : limits.enforcedWindows()) {
            resetAt.put(kind, windows.get(kind).expiresAt());
        }
        return resetAt;
    }

    private boolean isGeoRestricted(AccessRequest request) {
        if (!request.hasCountry()) {
            return false;
        }
        final var country = request.country();
        if (blockedCountries.contains(country)) {
            return true;
        }
        return !allowedCountries.isEmpty() && !allowedCountries.contains(country);
    }

    private static Set<String> upperCase(Optional<Set<String>> countries) {
        return countries.orElse(Set.of()).stream()
                .map(String::trim)
                .filter(code -> !code.isEmpty())
                .map(String::toUpperCase)
                .collect(Collectors.toUnmodifiableSet());
    }
}
