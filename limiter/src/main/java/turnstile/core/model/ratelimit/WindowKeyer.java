package turnstile.core.model.ratelimit;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps a window kind and an instant to the canonical window identifier.
 *
 * <p>All calculations are done in UTC on the instant itself. Weekly windows
 * follow ISO-8601: weeks start on Monday and belong to the year that contains
 * their Thursday, so 2021-01-01 falls in {@code 2020-W53}.
 */
public final class WindowKeyer {

    private static final Pattern HOURLY_ID = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})-(\\d{2})");
    private static final Pattern DAILY_ID = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern MONTHLY_ID = Pattern.compile("(\\d{4})-(\\d{2})");

    private WindowKeyer() {}

    /**
     * Computes the window containing {@code now}.
     *
     * @param kind the window kind
     * @param now the instant to key
     * @return the window identifier and its expiry
     */
    public static WindowKey keyFor(WindowKind kind, Instant now) {
        final var time = LocalDateTime.ofInstant(now, ZoneOffset.UTC);
        final var date = time.toLocalDate();

        return switch (kind) {
            case HOURLY -> {
                final var start = time.truncatedTo(ChronoUnit.HOURS);
                final var id = String.format(
                        "%04d-%02d-%02d-%02d",
                        start.getYear(), start.getMonthValue(), start.getDayOfMonth(), start.getHour());
                yield new WindowKey(kind, id, start.plusHours(1).toInstant(ZoneOffset.UTC));
            }
            case DAILY -> {
                final var id =
                        String.format("%04d-%02d-%02d", date.getYear(), date.getMonthValue(), date.getDayOfMonth());
                yield new WindowKey(kind, id, startOfDay(date.plusDays(1)));
            }
            case WEEKLY -> {
                final var thursday = date.plusDays(4 - date.getDayOfWeek().getValue());
                final var week = (thursday.getDayOfYear() - 1) / 7 + 1;
                final var id = String.format("%04d-W%02d", thursday.getYear(), week);
                yield new WindowKey(kind, id, startOfDay(weekStart(date).plusWeeks(1)));
            }
            case MONTHLY -> {
                final var id = String.format("%04d-%02d", date.getYear(), date.getMonthValue());
                yield new WindowKey(kind, id, startOfDay(date.withDayOfMonth(1).plusMonths(1)));
            }
        };
    }

    /**
     * Computes the inclusive start of the window containing {@code now}.
     *
     * @param kind the window kind
     * @param now the instant
     * @return the window start
     */
    public static Instant windowStart(WindowKind kind, Instant now) {
        final var time = LocalDateTime.ofInstant(now, ZoneOffset.UTC);
        final var date = time.toLocalDate();
        return switch (kind) {
            case HOURLY -> time.truncatedTo(ChronoUnit.HOURS).toInstant(ZoneOffset.UTC);
            case DAILY -> startOfDay(date);
            case WEEKLY -> startOfDay(weekStart(date));
            case MONTHLY -> startOfDay(date.withDayOfMonth(1));
        };
    }

    /**
     * Computes the current window of every kind.
     *
     * @param now the instant
     * @return an immutable map from window kind to its current window
     */
    public static Map<WindowKind, WindowKey> currentWindows(Instant now) {
        final var windows = new EnumMap<WindowKind, WindowKey>(WindowKind.class);
        for (var kind : WindowKind.values()) {
            windows.put(kind, keyFor(kind, now));
        }
        return Collections.unmodifiableMap(windows);
    }

    /**
     * Estimates when a window started from its identifier alone.
     *
     * <p>Used to age legacy counters that carry no metadata. Weekly identifiers
     * are not parsed and always report an unknown age.
     *
     * @param kind the window kind encoded in the storage key
     * @param windowId the window identifier
     * @return the window start, or empty when the age cannot be determined
     */
    public static Optional<Instant> estimateWindowStart(WindowKind kind, String windowId) {
        if (windowId == null) {
            return Optional.empty();
        }
        try {
            return switch (kind) {
                case HOURLY -> {
                    final var m = HOURLY_ID.matcher(windowId);
                    yield m.matches()
                            ? Optional.of(LocalDateTime.of(
                                            Integer.parseInt(m.group(1)),
                                            Integer.parseInt(m.group(2)),
                                            Integer.parseInt(m.group(3)),
                                            Integer.parseInt(m.group(4)),
                                            0)
                                    .toInstant(ZoneOffset.UTC))
                            : Optional.empty();
                }
                case DAILY -> {
                    final var m = DAILY_ID.matcher(windowId);
                    yield m.matches()
                            ? Optional.of(startOfDay(LocalDate.of(
                                    Integer.parseInt(m.group(1)),
                                    Integer.parseInt(m.group(2)),
                                    Integer.parseInt(m.group(3)))))
                            : Optional.empty();
                }
                case MONTHLY -> {
                    final var m = MONTHLY_ID.matcher(windowId);
                    yield m.matches()
                            ? Optional.of(startOfDay(
                                    LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), 1)))
                            : Optional.empty();
                }
                case WEEKLY -> Optional.empty();
            };
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static LocalDate weekStart(LocalDate date) {
        return date.minusDays(date.getDayOfWeek().getValue() - 1L);
    }

    private static Instant startOfDay(LocalDate date) {
        return date.atStartOfDay().toInstant(ZoneOffset.UTC);
    }
}
