package io.fullerstack.series.load;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses timestamp cells into UTC instants. Text that carries an offset keeps it;
 * text without one is read in the configured zone.
 */
final class TimestampParser {

    // yyyy-MM-dd, optionally followed by 'T' or ' ' and a time, optionally followed by an offset or Z
    private static final DateTimeFormatter LENIENT_ISO = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart().appendOffsetId().optionalEnd()
        .optionalEnd()
        .toFormatter(Locale.ROOT);

    private final ZoneId zone;
    private final DateTimeFormatter formatter;

    /**
     * @param formatter pattern-based formatter, or null for ISO-8601
     */
    TimestampParser(ZoneId zone, DateTimeFormatter formatter) {
        this.zone = zone;
        this.formatter = formatter != null ? formatter : LENIENT_ISO;
    }

    Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = formatter.parseBest(text.trim(),
                ZonedDateTime::from, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            return Optional.of(toInstant(parsed));
        } catch (DateTimeException e) {
            // Also covers text that parses but does not resolve to a date-time
            return Optional.empty();
        }
    }

    private Instant toInstant(TemporalAccessor parsed) {
        if (parsed instanceof ZonedDateTime) {
            return ((ZonedDateTime) parsed).toInstant();
        }
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant();
        }
        if (parsed instanceof LocalDateTime) {
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        }
        return ((LocalDate) parsed).atStartOfDay(zone).toInstant();
    }
}
