package io.fullerstack.series.engine;

import io.fullerstack.series.load.Dataset;
import io.fullerstack.series.model.SeriesDefinition;
import io.fullerstack.series.model.SeriesPoint;
import io.fullerstack.series.model.SeriesSample;
import io.fullerstack.series.query.CancellationSignal;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.function.Consumer;

/**
 * Reads the value of each series as of a point in time.
 *
 * <ul>
 *   <li>Without looping, times after the window give the last point and times
 *       before it the first point.</li>
 *   <li>With looping, times inside the window give the last point at or before
 *       them. Times outside are mapped back into the window by a whole number of
 *       periods and the point is returned with its timestamp shifted forward by
 *       the same amount.</li>
 * </ul>
 * A dataset without a positive duration yields nothing.
 */
public final class SnapshotReader {

    private SnapshotReader() {
    }

    public static void read(Dataset dataset, List<SeriesDefinition> series, Instant now,
                            CancellationSignal signal, Consumer<? super SeriesSample> sink) {
        if (series.isEmpty() || !dataset.hasDuration()) {
            return;
        }
        Instant earliest = dataset.earliest();
        Instant latest = dataset.latest();

        Duration offset = Duration.ZERO;
        Instant target = now;
        if (dataset.isLoopingEnabled()) {
            offset = LoopOffsets.stepping(earliest, latest, dataset.duration(), now);
            target = now.minus(offset);
        }

        for (SeriesDefinition definition : series) {
            signal.throwIfCancelled();
            NavigableMap<Instant, SeriesPoint> points = dataset.points(definition.id());
            if (points.isEmpty()) {
                continue;
            }
            Map.Entry<Instant, SeriesPoint> entry;
            if (!dataset.isLoopingEnabled() && target.isAfter(latest)) {
                entry = points.lastEntry();
            } else if (!dataset.isLoopingEnabled() && target.isBefore(earliest)) {
                entry = points.firstEntry();
            } else {
                entry = points.floorEntry(target);
            }
            if (entry == null) {
                continue;
            }
            SeriesPoint point = entry.getValue();
            sink.accept(SeriesSample.of(definition, offset.isZero() ? point : point.withTimestamp(point.timestamp().plus(offset))));
        }
    }
}
