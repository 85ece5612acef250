package de.bycsitsm.calsync.ics;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;

/**
 * A date or date-time value resolved by an {@link IcsParsingFacility}.
 *
 * @param instant  the resolved instant; midnight UTC for date-only values
 * @param local    the wall-clock time in {@code zone}
 * @param zone     the zone the value was written in; UTC for UTC and floating values
 * @param dateOnly whether the value is a {@code DATE}
 */
public record ParsedTime(Instant instant, LocalDateTime local, ZoneId zone, boolean dateOnly) {

    public LocalDate date() {
        return local.toLocalDate();
    }

    public boolean atMidnight() {
        return dateOnly || local.toLocalTime().equals(LocalTime.MIDNIGHT);
    }

    /**
     * Converts a temporal delivered by a parser. Floating date-times are read as UTC.
     *
     * @throws IllegalArgumentException for temporal types that carry no date
     */
    public static ParsedTime of(Temporal temporal) {
        if (temporal instanceof LocalDate date) {
            return new ParsedTime(date.atStartOfDay(ZoneOffset.UTC).toInstant(), date.atStartOfDay(),
                    ZoneOffset.UTC, true);
        }
        if (temporal instanceof ZonedDateTime zoned) {
            return new ParsedTime(zoned.toInstant(), zoned.toLocalDateTime(), zoned.getZone(), false);
        }
        if (temporal instanceof OffsetDateTime offset) {
            return new ParsedTime(offset.toInstant(), offset.toLocalDateTime(), offset.getOffset(), false);
        }
        if (temporal instanceof Instant instant) {
            return new ParsedTime(instant, LocalDateTime.ofInstant(instant, ZoneOffset.UTC), ZoneOffset.UTC, false);
        }
        if (temporal instanceof LocalDateTime floating) {
            return new ParsedTime(floating.toInstant(ZoneOffset.UTC), floating, ZoneOffset.UTC, false);
        }
        throw new IllegalArgumentException("Unsupported date value " + temporal.getClass().getSimpleName());
    }
}
