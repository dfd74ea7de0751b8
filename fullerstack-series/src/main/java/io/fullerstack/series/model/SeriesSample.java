package io.fullerstack.series.model;

import java.util.Objects;

/**
 * A query result: a point together with the series it belongs to.
 */
public record SeriesSample(String seriesId, String seriesName, SeriesPoint point) {

    public SeriesSample {
        Objects.requireNonNull(seriesId, "seriesId cannot be null");
        Objects.requireNonNull(seriesName, "seriesName cannot be null");
        Objects.requireNonNull(point, "point cannot be null");
    }

    public static SeriesSample of(SeriesDefinition series, SeriesPoint point) {
        return new SeriesSample(series.id(), series.name(), point);
    }
}
