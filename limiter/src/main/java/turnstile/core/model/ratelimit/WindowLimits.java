package turnstile.core.model.ratelimit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-consumer request limits for each window kind.
 *
 * <p>Only windows present with a positive limit are enforced.
 *
 * @param limits limit per window kind
 */
public record WindowLimits(Map<WindowKind, Long> limits) {

    /**
     * Conservative limits used when no configuration can be resolved.
     */
    public static final WindowLimits SAFE_DEFAULTS = of(10, 50, 250, 1000);

    public WindowLimits {
        final var copy = new EnumMap<WindowKind, Long>(WindowKind.class);
        if (limits != null) {
            limits.forEach((kind, limit) -> {
                if (kind != null && limit != null && limit > 0) {
                    copy.put(kind, limit);
                }
            });
        }
        limits = Collections.unmodifiableMap(copy);
    }

    public static WindowLimits of(long hourly, long daily, long weekly, long monthly) {
        final var map = new EnumMap<WindowKind, Long>(WindowKind.class);
        map.put(WindowKind.HOURLY, hourly);
        map.put(WindowKind.DAILY, daily);
        map.put(WindowKind.WEEKLY, weekly);
        map.put(WindowKind.MONTHLY, monthly);
        return new WindowLimits(map);
    }

    /**
     * Window kinds with an enforced limit.
     *
     * @return enforced window kinds
     */
    public Set<WindowKind> enforcedWindows() {
        return limits.keySet();
    }

    /**
     * Restricts these limits to the given window kinds.
     *
     * @param windows the window kinds to keep
     * @return limits for the intersection
     */
    public WindowLimits restrictTo(Set<WindowKind> windows) {
        final var map = new EnumMap<WindowKind, Long>(WindowKind.class);
        limits.forEach((kind, limit) -> {
            if (windows.contains(kind)) {
                map.put(kind, limit);
            }
        });
        return new WindowLimits(map);
    }

    /**
     * Returns the first enforced window whose usage has reached its limit.
     *
     * <p>Windows are checked from shortest to longest.
     *
     * @param usage current usage per window
     * @return the exceeded window, or null if every window is within its limit
     */
    public WindowKind firstExceeded(Map<WindowKind, Long> usage) {
        for (var kind : WindowKind.values()) {
            final var limit = limits.get(kind);
            if (limit == null) {
                continue;
            }
            final var used = usage.getOrDefault(kind, 0L);
            if (used >= limit) {
                return kind;
            }
        }
        return null;
    }
}
