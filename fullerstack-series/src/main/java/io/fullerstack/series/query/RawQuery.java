package io.fullerstack.series.query;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A raw history request.
 *
 * @param series      ids or names of the series to read
 * @param start       inclusive range start
 * @param end         inclusive range end
 * @param boundary    inside-only or bracketing samples
 * @param sampleCount maximum number of samples to return; less than 1 means unlimited
 */
public record RawQuery(List<String> series, Instant start, Instant end, BoundaryType boundary, int sampleCount) {

    public RawQuery {
        Objects.requireNonNull(series, "series cannot be null");
        Objects.requireNonNull(start, "start cannot be null");
        Objects.requireNonNull(end, "end cannot be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " cannot be before start " + start);
        }
        series = List.copyOf(series);
        boundary = boundary == null ? BoundaryType.INSIDE : boundary;
    }

    public static RawQuery inside(List<String> series, Instant start, Instant end) {
        return new RawQuery(series, start, end, BoundaryType.INSIDE, 0);
    }

    public static RawQuery outside(List<String> series, Instant start, Instant end) {
        return new RawQuery(series, start, end, BoundaryType.OUTSIDE, 0);
    }

    public RawQuery withSampleCount(int limit) {
        return new RawQuery(series, start, end, boundary, limit);
    }

    public boolean isLimited() {
        return sampleCount > 0;
    }
}
