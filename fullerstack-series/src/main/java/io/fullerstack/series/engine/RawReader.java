package io.fullerstack.series.engine;

import io.fullerstack.series.load.Dataset;
import io.fullerstack.series.model.SeriesDefinition;
import io.fullerstack.series.model.SeriesPoint;
import io.fullerstack.series.model.SeriesSample;
import io.fullerstack.series.query.BoundaryType;
import io.fullerstack.series.query.CancellationSignal;
import io.fullerstack.series.query.RawQuery;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Reads the history of series over a time range.
 *
 * <p>When the range lies inside the recorded window, or looping is off, this is
 * a plain inclusive range filter per series, limited to {@code sampleCount}
 * points per series.
 *
 * <p>Otherwise the window is replayed: iteration starts in the copy of the window
 * that contains {@code start}, walks the sample times forward with their
 * timestamps shifted into that copy, and moves on to the next copy when it runs
 * out. An {@link BoundaryType#OUTSIDE} query also emits the last sample before
 * {@code start} and the first after {@code end}, unless a sample falls exactly on
 * {@code end}. Within a series timestamps strictly increase, so the sample at a
 * copy seam is emitted once, with the value of the earlier copy.
 * {@code sampleCount} limits the total across series.
 *
 * <p>The value reported at a seam instant therefore depends on where the range
 * starts: a range starting exactly on the seam begins in the later copy and
 * reports that copy's first value, while a range crossing the seam keeps the
 * earlier copy's last value, which is also what a snapshot at that instant
 * reads. A series sampled only at the window edges loses its first value in
 * every copy after the first.
 */
public final class RawReader {

    private RawReader() {
    }

    public static void read(Dataset dataset, List<SeriesDefinition> series, RawQuery query,
                            CancellationSignal signal, Consumer<? super SeriesSample> sink) {
        if (series.isEmpty() || !dataset.hasDuration()) {
            return;
        }
        boolean insideWindow = !query.start().isBefore(dataset.earliest()) && !query.end().isAfter(dataset.latest());
        if (!dataset.isLoopingEnabled() || insideWindow) {
            readRange(dataset, series, query, signal, sink);
        } else {
            readLooping(dataset, series, query, signal, sink);
        }
    }

    private static void readRange(Dataset dataset, List<SeriesDefinition> series, RawQuery query,
                                  CancellationSignal signal, Consumer<? super SeriesSample> sink) {
        for (SeriesDefinition definition : series) {
            int emitted = 0;
            for (SeriesPoint point : dataset.points(definition.id()).subMap(query.start(), true, query.end(), true).values()) {
                signal.throwIfCancelled();
                sink.accept(SeriesSample.of(definition, point));
                if (query.isLimited() && ++emitted >= query.sampleCount()) {
                    break;
                }
            }
        }
    }

    private static void readLooping(Dataset dataset, List<SeriesDefinition> series, RawQuery query,
                                    CancellationSignal signal, Consumer<? super SeriesSample> sink) {
        List<Instant> times = dataset.sampleTimes();
        Duration period = dataset.duration();
        Instant start = query.start();
        Instant end = query.end();
        boolean outside = query.boundary() == BoundaryType.OUTSIDE;

        Duration offset = LoopOffsets.anchoring(dataset.earliest(), period, start);
        int index = 0;
        while (index < times.size() && times.get(index).plus(offset).isBefore(start)) {
            index++;
        }
        if (outside && index > 0 && index < times.size() && times.get(index).plus(offset).isAfter(start)) {
            index--;
        }

        Map<String, Instant> lastEmitted = new HashMap<>();
        boolean onePastEnd = outside;
        int emitted = 0;
        while (true) {
            signal.throwIfCancelled();
            for (int i = index; i < times.size(); i++) {
                Instant recorded = times.get(i);
                Instant shifted = recorded.plus(offset);
                if (shifted.equals(end)) {
                    onePastEnd = false;
                } else if (shifted.isAfter(end)) {
                    if (!onePastEnd) {
                        return;
                    }
                    onePastEnd = false;
                }
                for (SeriesDefinition definition : series) {
                    SeriesPoint point = dataset.points(definition.id()).get(recorded);
                    if (point == null) {
                        continue;
                    }
                    Instant previous = lastEmitted.get(definition.id());
                    if (previous != null && !shifted.isAfter(previous)) {
                        continue;
                    }
                    signal.throwIfCancelled();
                    sink.accept(SeriesSample.of(definition, offset.isZero() ? point : point.withTimestamp(shifted)));
                    lastEmitted.put(definition.id(), shifted);
                    if (query.isLimited() && ++emitted >= query.sampleCount()) {
                        return;
                    }
                }
            }
            offset = offset.plus(period);
            index = 0;
        }
    }
}
