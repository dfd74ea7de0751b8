package io.fullerstack.series.load;

import io.fullerstack.series.model.SeriesDefinition;
import io.fullerstack.series.model.SeriesPoint;

import java.text.NumberFormat;
import java.text.ParsePosition;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Turns raw cell text into points. State series accept a state name (ignoring
 * case) or a number; numeric series accept numbers in the configured locale.
 * Not thread-safe.
 */
final class SampleValueParser {

    private final NumberFormat parser;
    private final NumberFormat formatter;

    SampleValueParser(Locale locale) {
        this.parser = NumberFormat.getNumberInstance(locale);
        this.formatter = NumberFormat.getNumberInstance(locale);
        this.formatter.setGroupingUsed(false);
        this.formatter.setMaximumFractionDigits(15);
    }

    /**
     * @return the point, or empty if {@code raw} is blank or not a value of this series
     */
    Optional<SeriesPoint> parse(SeriesDefinition series, Instant timestamp, String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim();
        if (series.isState()) {
            OptionalInt state = series.stateValue(text);
            if (state.isPresent()) {
                String name = series.stateName(state.getAsInt()).orElse(text);
                return Optional.of(SeriesPoint.of(timestamp, state.getAsInt(), name, series.units()));
            }
        }
        Double value = parseNumber(text);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(point(series, timestamp, value));
    }

    /**
     * @return a point for {@code value}; state series display the matching state name
     */
    SeriesPoint point(SeriesDefinition series, Instant timestamp, double value) {
        String display = series.isState()
            ? series.stateName(value).orElseGet(() -> format(value))
            : format(value);
        return SeriesPoint.of(timestamp, value, display, series.units());
    }

    private Double parseNumber(String text) {
        ParsePosition position = new ParsePosition(0);
        Number number = parser.parse(text, position);
        if (number != null && position.getIndex() == text.length()) {
            return number.doubleValue();
        }
        // Scientific notation and NaN/Infinity spelled the Java way
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return formatter.format(value);
    }
}
