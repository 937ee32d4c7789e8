package turnstile.core.service.access;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import turnstile.core.config.PenaltyConfig;
import turnstile.core.model.access.ViolationRecord;

/**
 * Recent violations per identity, kept in memory for administrators.
 *
 * <p>Each identity keeps its latest {@code history-size} violations, oldest
 * first. At most {@code history-max-identities} identities are remembered;
 * the least recently used are evicted beyond that. Nothing is persisted.
 */
@ApplicationScoped
public class ViolationHistory {

    private final int perIdentity;
    private final Cache<String, List<ViolationRecord>> histories;

    @Inject
    public ViolationHistory(PenaltyConfig config) {
        this(config.historySize(), config.historyMaxIdentities());
    }

    public ViolationHistory(int perIdentity, long maxIdentities) {
        if (perIdentity < 1) {
            throw new IllegalArgumentException("history size must be positive: " + perIdentity);
        }
        this.perIdentity = perIdentity;
        this.histories = Caffeine.newBuilder()
                .maximumSize(maxIdentities)
                .executor(Runnable::run)
                .build();
    }

    public void record(ViolationRecord violation) {
        histories.asMap().compute(violation.identity(), (identity, previous) -> {
            final var next = new ArrayList<ViolationRecord>(perIdentity);
            if (previous != null) {
                next.addAll(previous.subList(Math.max(0, previous.size() - perIdentity + 1), previous.size()));
            }
            next.add(violation);
            return List.copyOf(next);
        });
    }

    /**
     * @param identity the normalized identity
     * @return recent violations, oldest first, empty if none are remembered
     */
    public List<ViolationRecord> recent(String identity) {
        final var history = histories.getIfPresent(identity);
        return history == null ? List.of() : history;
    }

    public void forget(String identity) {
        histories.invalidate(identity);
    }
}
