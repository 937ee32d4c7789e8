package turnstile.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import turnstile.core.model.access.AccessListEntry;
import turnstile.core.model.access.AccessListType;
import turnstile.core.model.access.AdminResult;
import turnstile.core.model.access.AnalyticsSnapshot;
import turnstile.core.model.access.PenaltyState;
import turnstile.core.model.access.UsageReport;
import turnstile.core.model.access.ViolationRecord;

/**
 * Port for administering access lists and penalties.
 *
 * <p>Mutating operations report storage failures through
 * {@link AdminResult#failed(String)} rather than a failed {@link Uni}.
 */
public interface AccessAdministration {

    /**
     * Adds an exact or prefix pattern to the allow-list.
     *
     * @param pattern identity, or prefix ending in {@code *}
     * @param reason  why the entry is added
     * @param actor   who adds the entry
     * @return Uni with the outcome
     */
    Uni<AdminResult> addToAllowList(String pattern, String reason, String actor);

    Uni<AdminResult> removeFromAllowList(String pattern);

    /**
     * Adds an exact or prefix pattern to the deny-list.
     *
     * @param pattern identity, or prefix ending in {@code *}
     * @param reason  why the entry is added
     * @param actor   who adds the entry
     * @return Uni with the outcome
     */
    Uni<AdminResult> addToDenyList(String pattern, String reason, String actor);

    Uni<AdminResult> removeFromDenyList(String pattern);

    /**
     * Resets an identity's penalty state, lifting any block or ban.
     *
     * <p>Deny-list entries, including those added by an automatic ban, are
     * left in place.
     *
     * @param identity the identity to reset
     * @param actor    who requested the reset
     * @return Uni with the outcome
     */
    Uni<AdminResult> clearBlocks(String identity, String actor);

    /**
     * @param identity the identity
     * @return Uni with the penalty state, empty if the identity is clean
     */
    Uni<Optional<PenaltyState>> getPenaltyState(String identity);

    /**
     * Reports current usage against every enforced window without consuming
     * quota. Counter failures degrade the same way evaluation does.
     *
     * @param identity the identity
     * @param consumer the consumer
     * @return Uni with the usage report
     */
    Uni<UsageReport> getUsage(String identity, String consumer);

    /**
     * @param identity the identity
     * @return recent violations, oldest first
     */
    List<ViolationRecord> getViolationHistory(String identity);

    /**
     * @param type the list to read
     * @return Multi streaming the list's entries
     */
    Multi<AccessListEntry> listEntries(AccessListType type);

    /**
     * Builds an analytics snapshot.
     *
     * @param topN number of top violators to include
     * @return Uni with the snapshot
     */
    Uni<AnalyticsSnapshot> getAnalytics(int topN);
}
