package com.conveyal.coverage.fetch;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A closed time interval, or a single instant when begin and end coincide. Either bound may be null, meaning the
 * interval is open on that side.
 */
public class TemporalSubset {

    public final Instant begin;

    public final Instant end;

    private TemporalSubset (Instant begin, Instant end) {
        checkArgument(begin != null || end != null, "A temporal subset needs at least one bound.");
        checkArgument(begin == null || end == null || !end.isBefore(begin), "Temporal subset ends before it begins.");
        this.begin = begin;
        this.end = end;
    }

    public static TemporalSubset instant (Instant instant) {
        return new TemporalSubset(instant, instant);
    }

    public static TemporalSubset interval (Instant begin, Instant end) {
        return new TemporalSubset(begin, end);
    }

    public boolean isInstant () {
        return begin != null && begin.equals(end);
    }

    /** The quoted form used inside an OGC API subset parameter, e.g. "2020-09-10T00:00:00Z":"2020-09-29T00:00:00Z". */
    public String toQueryValue () {
        if (isInstant()) {
            return quote(begin);
        }
        return quote(begin) + ":" + quote(end);
    }

    private static String quote (Instant instant) {
        return instant == null ? ".." : "\"" + instant + "\"";
    }

    /**
     * Parse an instant written as a full ISO date-time (with Z or an offset) or as a plain date, which is taken as
     * midnight UTC. Returns null for an empty or open ("..") bound.
     */
    public static Instant parseInstant (String text) {
        if (text == null) return null;
        String trimmed = text.trim();
        if (trimmed.isEmpty() || "null".equals(trimmed) || "..".equals(trimmed)) return null;
        try {
            if (trimmed.length() <= 10) {
                return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return OffsetDateTime.parse(trimmed.toUpperCase(Locale.ROOT)).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Could not parse time: " + text, e);
        }
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TemporalSubset that = (TemporalSubset) o;
        return Objects.equals(begin, that.begin) && Objects.equals(end, that.end);
    }

    @Override
    public int hashCode () {
        return Objects.hash(begin, end);
    }

    @Override
    public String toString () {
        return isInstant() ? begin.toString() : String.format("[%s, %s]", begin, end);
    }

}
