package turnstile.core.model.access;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Allow-list or deny-list entry.
 *
 * <p>A pattern ending in {@code *} matches every identity starting with the
 * text before the asterisk. Any other pattern matches one identity exactly.
 *
 * @param type the list this entry belongs to
 * @param pattern the identity or prefix pattern
 * @param prefix whether the pattern is a prefix pattern
 * @param reason why the entry was added
 * @param addedBy who added the entry
 * @param addedAt when the entry was added
 */
public record AccessListEntry(
        AccessListType type, String pattern, boolean prefix, String reason, String addedBy, Instant addedAt) {

    public static final String WILDCARD = "*";

    public AccessListEntry {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        if (pattern.isBlank()) {
            throw new IllegalArgumentException("pattern must not be blank");
        }
    }

    /**
     * Creates an entry, deriving the prefix flag from the pattern.
     */
    public static AccessListEntry of(
            AccessListType type, String pattern, String reason, String addedBy, Instant addedAt) {
        return new AccessListEntry(type, pattern, pattern.endsWith(WILDCARD), reason, addedBy, addedAt);
    }

    /**
     * Whether this entry covers {@code identity}.
     */
    public boolean matches(String identity) {
        if (identity == null) {
            return false;
        }
        return prefix ? identity.startsWith(prefixText()) : pattern.equals(identity);
    }

    /**
     * Pattern text without the trailing wildcard.
     */
    public String prefixText() {
        return prefix ? pattern.substring(0, pattern.length() - WILDCARD.length()) : pattern;
    }

    /**
     * Picks the entry that governs {@code identity}.
     *
     * <p>An exact entry wins over any prefix entry. Among prefix entries the
     * longest prefix wins.
     *
     * @param entries candidate entries
     * @param identity the identity to match
     * @return the governing entry, if any
     */
    public static Optional<AccessListEntry> bestMatch(Collection<AccessListEntry> entries, String identity) {
        AccessListEntry best = null;
        for (var entry : entries) {
            if (!entry.matches(identity)) {
                continue;
            }
            if (!entry.prefix()) {
                return Optional.of(entry);
            }
            if (best == null || entry.prefixText().length() > best.prefixText().length()) {
                best = entry;
            }
        }
        return Optional.ofNullable(best);
    }
}
