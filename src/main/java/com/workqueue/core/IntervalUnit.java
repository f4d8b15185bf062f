package com.workqueue.core;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Unit of a cron entry's repeat interval.
 *
 * <p>MINUTES and HOURS are exact durations on the instant line. DAYS, WEEKS and
 * MONTHS are calendar steps on the local date, so a daily entry keeps its wall-clock
 * time across a daylight-saving change and a monthly entry on the 31st lands on the
 * last day of shorter months.</p>
 *
 * <p>Next-call times are stored as local date-times, so the result of
 * {@link #advance} is always strictly later in local time than its input. In the
 * repeated hour of a fall-back transition a duration step is taken from the later
 * offset, which skips the rest of the repeated hour instead of going back.</p>
 */
public enum IntervalUnit {
    MINUTES("minutes"),
    HOURS("hours"),
    DAYS("days"),
    WEEKS("weeks"),
    MONTHS("months");

    private final String token;

    IntervalUnit(String token) {
        this.token = token;
    }

    /**
     * Get the stored token for this unit.
     *
     * @return one of {@code minutes|hours|days|weeks|months}
     */
    public String getToken() {
        return token;
    }

    /**
     * Compute the date-time {@code amount} units after {@code from}.
     *
     * @param from   the current next-call date-time, local to {@code zone}
     * @param amount number of units to add (positive)
     * @param zone   zone used to interpret {@code from}
     * @return the following call date-time, local to {@code zone}, strictly after {@code from}
     */
    public LocalDateTime advance(LocalDateTime from, int amount, ZoneId zone) {
        ZonedDateTime start = from.atZone(zone);
        LocalDateTime next = step(start, amount).toLocalDateTime();
        if (!next.isAfter(from)) {
            // Ambiguous start in a fall-back overlap: the earlier offset lands back inside the repeated hour
            next = step(start.withLaterOffsetAtOverlap(), amount).toLocalDateTime();
        }
        return next;
    }

    private ZonedDateTime step(ZonedDateTime start, int amount) {
        return switch (this) {
            case MINUTES -> start.plus(Duration.ofMinutes(amount));
            case HOURS -> start.plus(Duration.ofHours(amount));
            case DAYS -> start.plusDays(amount);
            case WEEKS -> start.plusWeeks(amount);
            case MONTHS -> start.plusMonths(amount);
        };
    }

    /**
     * Parse a stored or user-supplied token, case-insensitively.
     *
     * @param token the token, e.g. "minutes"
     * @return the matching unit
     * @throws ValidationException if the token is not one of the five known units
     */
    public static IntervalUnit fromToken(String token) {
        if (token != null) {
            String normalized = token.trim().toLowerCase(Locale.ROOT);
            for (IntervalUnit unit : values()) {
                if (unit.token.equals(normalized)) {
                    return unit;
                }
            }
        }
        throw new ValidationException("Unknown interval unit: " + token
                + " (expected minutes, hours, days, weeks or months)");
    }

    @Override
    public String toString() {
        return token;
    }
}
