package io.fullerstack.series.load;

import io.fullerstack.series.model.SeriesDefinition;
import io.fullerstack.series.model.SeriesPoint;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * An immutable, fully loaded dataset.
 *
 * <p>Each series maps strictly increasing timestamps to points. The sample times
 * are the sorted, distinct union of every series' timestamps; earliest and latest
 * bound the recorded window and duration is their difference.
 */
public final class Dataset {

    private final List<SeriesDefinition> definitions;
    private final Map<String, NavigableMap<Instant, SeriesPoint>> points;
    private final List<Instant> sampleTimes;
    private final boolean loopingEnabled;
    private final long rowsRead;
    private final long rowsSkipped;

    Dataset(List<SeriesDefinition> definitions,
            Map<String, NavigableMap<Instant, SeriesPoint>> points,
            boolean loopingEnabled, long rowsRead, long rowsSkipped) {
        this.definitions = List.copyOf(definitions);
        Map<String, NavigableMap<Instant, SeriesPoint>> copy = new HashMap<>();
        TreeSet<Instant> times = new TreeSet<>();
        points.forEach((id, series) -> {
            copy.put(id, Collections.unmodifiableNavigableMap(new TreeMap<>(series)));
            times.addAll(series.keySet());
        });
        this.points = Collections.unmodifiableMap(copy);
        this.sampleTimes = List.copyOf(times);
        this.loopingEnabled = loopingEnabled;
        this.rowsRead = rowsRead;
        this.rowsSkipped = rowsSkipped;
    }

    /**
     * A dataset with no series and no points.
     */
    public static Dataset empty(boolean loopingEnabled) {
        return new Dataset(List.of(), Map.of(), loopingEnabled, 0, 0);
    }

    /**
     * @return definitions in the order they were declared
     */
    public List<SeriesDefinition> definitions() {
        return definitions;
    }

    /**
     * @return points of the series with exactly this id; empty if it has none
     */
    public NavigableMap<Instant, SeriesPoint> points(String seriesId) {
        NavigableMap<Instant, SeriesPoint> series = points.get(seriesId);
        return series != null ? series : Collections.emptyNavigableMap();
    }

    public List<Instant> sampleTimes() {
        return sampleTimes;
    }

    public boolean isEmpty() {
        return sampleTimes.isEmpty();
    }

    /**
     * @return first sample time
     * @throws IndexOutOfBoundsException if the dataset has no points
     */
    public Instant earliest() {
        return sampleTimes.get(0);
    }

    /**
     * @return last sample time
     * @throws IndexOutOfBoundsException if the dataset has no points
     */
    public Instant latest() {
        return sampleTimes.get(sampleTimes.size() - 1);
    }

    /**
     * @return latest minus earliest; zero when there are fewer than two sample times
     */
    public Duration duration() {
        return isEmpty() ? Duration.ZERO : Duration.between(earliest(), latest());
    }

    /**
     * Queries against a dataset without a positive duration return nothing.
     */
    public boolean hasDuration() {
        return sampleTimes.size() > 1;
    }

    public boolean isLoopingEnabled() {
        return loopingEnabled;
    }

    /**
     * @return input rows consumed, including the header
     */
    public long rowsRead() {
        return rowsRead;
    }

    /**
     * @return rows dropped for a missing or unparseable timestamp
     */
    public long rowsSkipped() {
        return rowsSkipped;
    }

    public int pointCount() {
        return points.values().stream().mapToInt(Map::size).sum();
    }

    @Override
    public String toString() {
        return "Dataset[series=" + definitions.size() + ", points=" + pointCount()
            + ", sampleTimes=" + sampleTimes.size()
            + (isEmpty() ? "" : ", window=" + earliest() + ".." + latest())
            + ", looping=" + loopingEnabled + "]";
    }
}
