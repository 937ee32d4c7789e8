package turnstile.core.service.access;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.PenaltyConfig;
import turnstile.core.model.access.AccessListEntry;
import turnstile.core.model.access.AccessListType;
import turnstile.core.model.access.PenaltyLevel;
import turnstile.core.model.access.PenaltyState;
import turnstile.core.model.access.PenaltyThresholds;
import turnstile.core.port.out.AccessMetrics;
import turnstile.spi.AccessListRepository;
import turnstile.spi.PenaltyRepository;

/**
 * Tracks rate limit violations and escalates penalties for repeat offenders.
 *
 * <p>
 * Escalation follows the violation count:
 * <ul>
 * <li>soft threshold: a warning is logged, the decision flow is unchanged</li>
 * <li>hard threshold: a temporary block is applied</li>
 * <li>ban threshold: the identity is banned and added to the deny-list</li>
 * </ul>
 *
 * <p>
 * Block duration grows with each block applied, either from the configured
 * block schedule or as {@code base * multiplier^blocks}, capped at the
 * configured maximum. The
 * repository only ever extends an active block, so escalation never relaxes.
 */
@ApplicationScoped
public class PenaltyLedger {

    private static final Logger LOG = Logger.getLogger(PenaltyLedger.class);

    static final String BAN_REASON = "Persistent violator - automatic ban";
    static final String SYSTEM_ACTOR = "system";

    private final PenaltyRepository repository;
    private final AccessListRepository accessLists;
    private final PenaltyConfig config;
    private final AccessMetrics metrics;
    private final PenaltyThresholds thresholds;

    public PenaltyLedger(
            PenaltyRepository repository,
            AccessListRepository accessLists,
            PenaltyConfig config,
            AccessMetrics metrics) {
        this.repository = repository;
        this.accessLists = accessLists;
        this.config = config;
        this.metrics = metrics;
        this.thresholds = new PenaltyThresholds(config.softThreshold(), config.hardThreshold(), config.banThreshold());
    }

    public PenaltyThresholds thresholds() {
        return thresholds;
    }

    /**
     * Record a violation and apply any escalation it triggers.
     *
     * @param identity the violating identity
     * @param now time of the violation
     * @return Uni with the state after escalation
     */
    public Uni<PenaltyState> recordViolation(String identity, Instant now) {
        return repository.recordViolation(identity, now).flatMap(state -> escalate(state, now));
    }

    /**
     * @param identity the identity
     * @return Uni with the stored state, empty if the identity is clean
     */
    public Uni<Optional<PenaltyState>> find(String identity) {
        return repository.find(identity);
    }

    /**
     * Delete an identity's penalty state, returning it to clean.
     *
     * @param identity the identity
     * @return Uni with true if a state existed
     */
    public Uni<Boolean> reset(String identity) {
        return repository.delete(identity).invoke(deleted -> {
            if (deleted) {
                LOG.infof("Penalty state reset for %s", identity);
            }
        });
    }

    public Multi<PenaltyState> streamAll() {
        return repository.streamAll();
    }

    /**
     * Level of a possibly missing state.
     */
    public PenaltyLevel levelOf(Optional<PenaltyState> state, Instant now) {
        return state.map(s -> s.level(now, thresholds)).orElse(PenaltyLevel.CLEAN);
    }

    /**
     * Duration of the next block after {@code previousBlocks} blocks.
     *
     * @param previousBlocks blocks applied so far
     * @return the block duration
     */
    Duration blockDuration(int previousBlocks) {
        final var schedule = config.blockSchedule().orElse(List.of());
        if (!schedule.isEmpty()) {
            return schedule.get(Math.min(Math.max(0, previousBlocks), schedule.size() - 1));
        }

        if (config.blockMultiplier() <= 1.0) {
            return config.baseBlockDuration();
        }

        final var multiplier = Math.pow(config.blockMultiplier(), previousBlocks);
        final var seconds = (long) (config.baseBlockDuration().toSeconds() * multiplier);
        final var progressive = Duration.ofSeconds(seconds);

        if (progressive.compareTo(config.maxBlockDuration()) > 0) {
            return config.maxBlockDuration();
        }
        return progressive;
    }

    private Uni<PenaltyState> escalate(PenaltyState state, Instant now) {
        final var identity = state.identity();
        final var count = state.violationCount();

        if (state.banned()) {
            return Uni.createFrom().item(state);
        }

        if (count >= thresholds.ban()) {
            final var entry = AccessListEntry.of(AccessListType.DENY, identity, BAN_REASON, SYSTEM_ACTOR, now);
            return repository
                    .markBanned(identity)
                    .call(() -> accessLists.save(entry))
                    .invoke(banned -> {
                        LOG.warnf("Identity %s permanently banned after %d violations", identity, count);
                        metrics.recordPenaltyEscalation(PenaltyLevel.PERMANENTLY_BANNED);
                    });
        }

        if (count >= thresholds.hard() && !state.isBlocked(now)) {
            final var duration = blockDuration(state.blockCount());
            return repository.applyBlock(identity, now.plus(duration), now).invoke(blocked -> {
                LOG.warnf(
                        "Identity %s temporarily blocked: violations=%d, duration=%s, until=%s",
                        identity, count, duration, blocked.blockExpiresAt());
                metrics.recordPenaltyEscalation(PenaltyLevel.TEMPORARILY_BLOCKED);
            });
        }

        if (count >= thresholds.soft()) {
            LOG.warnf("Identity %s warned: violations=%d", identity, count);
            if (count == thresholds.soft()) {
                metrics.recordPenaltyEscalation(PenaltyLevel.WARNED);
            }
        }
        return Uni.createFrom().item(state);
    }
}
