package io.fullerstack.series.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One sample of a series. Immutable.
 *
 * @param timestamp UTC sample time
 * @param value     numeric value; for state series the state's value
 * @param text      display text; for state series the state name
 * @param units     engineering units copied from the series definition
 * @param quality   sample quality
 */
public record SeriesPoint(Instant timestamp, double value, String text, String units, Quality quality) {

    /**
     * Sample quality. Only good samples are loaded; the type leaves room for sources
     * that report uncertain or bad values.
     */
    public enum Quality {
        GOOD
    }

    public SeriesPoint {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        text = text == null ? "" : text;
        units = units == null ? "" : units;
        quality = quality == null ? Quality.GOOD : quality;
    }

    public static SeriesPoint of(Instant timestamp, double value, String text, String units) {
        return new SeriesPoint(timestamp, value, text, units, Quality.GOOD);
    }

    /**
     * @return a copy of this point at {@code shifted}; every other field is unchanged
     */
    public SeriesPoint withTimestamp(Instant shifted) {
        return new SeriesPoint(shifted, value, text, units, quality);
    }
}
