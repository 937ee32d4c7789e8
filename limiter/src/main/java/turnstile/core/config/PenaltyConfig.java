package turnstile.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for penalty escalation.
 *
 * <p>Configuration prefix: {@code turnstile.penalty}
 *
 * <p>Every rate limit violation is counted per identity. Escalation follows
 * the violation count:
 * <ul>
 *   <li>{@code soft-threshold}: a warning is logged</li>
 *   <li>{@code hard-threshold}: the identity is blocked temporarily</li>
 *   <li>{@code ban-threshold}: the identity is banned and added to the deny-list</li>
 * </ul>
 *
 * @see turnstile.core.service.access.PenaltyLedger
 * @see turnstile.spi.PenaltyRepository
 */
@ConfigMapping(prefix = "turnstile.penalty")
public interface PenaltyConfig {

    /**
     * @return violations before a warning (default: 3)
     */
    @WithDefault("3")
    int softThreshold();

    /**
     * @return violations before a temporary block (default: 6)
     */
    @WithDefault("6")
    int hardThreshold();

    /**
     * @return violations before a permanent ban (default: 12)
     */
    @WithDefault("12")
    int banThreshold();

    /**
     * Duration of the first temporary block.
     *
     * @return base block duration (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration baseBlockDuration();

    /**
     * Multiplier for progressive block duration.
     *
     * <p>Each further block lasts {@code multiplier} times longer than the
     * previous one. Set to 1.0 to use a fixed duration.
     *
     * <p>Example with multiplier 2.0:
     * <ul>
     *   <li>First block: 5 minutes</li>
     *   <li>Second block: 10 minutes</li>
     *   <li>Third block: 20 minutes</li>
     * </ul>
     *
     * @return multiplier (default: 2.0)
     */
    @WithDefault("2.0")
    double blockMultiplier();

    /**
     * Upper bound for progressive block duration.
     *
     * @return max duration (default: 24 hours)
     */
    @WithDefault("PT24H")
    Duration maxBlockDuration();

    /**
     * Explicit block durations, indexed by the number of blocks already
     * applied. Once exhausted, the last entry repeats. When set, it replaces
     * the multiplier progression.
     *
     * <p>Example: {@code PT5M,PT30M,PT2H,PT24H}
     *
     * @return block schedule, empty to use the multiplier
     */
    Optional<List<Duration>> blockSchedule();

    /**
     * @return violations remembered per identity (default: 50)
     */
    @WithDefault("50")
    int historySize();

    /**
     * @return identities whose violation history is remembered (default: 10000)
     */
    @WithDefault("10000")
    long historyMaxIdentities();
}
