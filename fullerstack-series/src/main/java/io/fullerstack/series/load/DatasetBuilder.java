package io.fullerstack.series.load;

import io.fullerstack.series.model.SeriesDefinition;
import io.fullerstack.series.model.SeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;

/**
 * Accumulates series definitions and samples, then freezes them into a
 * {@link Dataset}.
 *
 * <p>Samples may arrive in any order. A later sample for the same series and
 * timestamp replaces the earlier one. Redefining a series id replaces its
 * definition and keeps its points. Not thread-safe.
 *
 * <pre>
 * Dataset dataset = new DatasetBuilder()
 *     .define(SeriesDefinition.numeric("Flow"))
 *     .add("Flow", Instant.parse("2024-01-01T00:00:00Z"), "12.5")
 *     .build();
 * </pre>
 */
public final class DatasetBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DatasetBuilder.class);

    // Keyed by id, ignoring case; insertion order kept separately
    private final Map<String, SeriesDefinition> definitions = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final List<String> order = new ArrayList<>();
    private final Map<String, TreeMap<Instant, SeriesPoint>> points = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final SampleValueParser values;

    private boolean loopingEnabled;
    private long rowsRead;
    private long rowsSkipped;

    public DatasetBuilder() {
        this(Locale.ROOT);
    }

    public DatasetBuilder(Locale locale) {
        this.values = new SampleValueParser(Objects.requireNonNull(locale, "locale cannot be null"));
    }

    public DatasetBuilder loopingEnabled(boolean enabled) {
        this.loopingEnabled = enabled;
        return this;
    }

    /**
     * Declares a series, replacing any definition with the same id.
     */
    public DatasetBuilder define(SeriesDefinition series) {
        Objects.requireNonNull(series, "series cannot be null");
        SeriesDefinition previous = definitions.put(series.id(), series);
        if (previous == null) {
            order.add(series.id());
        } else {
            logger.debug("Series '{}' redefined", series.id());
        }
        return this;
    }

    /**
     * Adds a sample for a series by id or name. Unknown series are declared as
     * numeric series named {@code series}.
     */
    public DatasetBuilder add(String series, Instant timestamp, String raw) {
        Objects.requireNonNull(series, "series cannot be null");
        SeriesDefinition definition = find(series);
        if (definition == null) {
            definition = SeriesDefinition.numeric(series);
            define(definition);
        }
        return add(definition, timestamp, raw);
    }

    /**
     * Adds a sample, declaring {@code series} first if its id is unknown.
     *
     * @return this builder; unparseable values are skipped
     */
    public DatasetBuilder add(SeriesDefinition series, Instant timestamp, String raw) {
        Objects.requireNonNull(series, "series cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        SeriesDefinition definition = definitions.get(series.id());
        if (definition == null) {
            define(series);
            definition = series;
        }
        Optional<SeriesPoint> point = values.parse(definition, timestamp, raw);
        if (point.isEmpty()) {
            if (raw != null && !raw.isBlank()) {
                logger.debug("Skipping value '{}' for series '{}' at {}: not a number or state", raw, definition.id(), timestamp);
            }
            return this;
        }
        return put(definition, point.get());
    }

    /**
     * Adds an already-parsed numeric sample.
     */
    public DatasetBuilder add(String series, Instant timestamp, double value) {
        Objects.requireNonNull(series, "series cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        SeriesDefinition definition = find(series);
        if (definition == null) {
            definition = SeriesDefinition.numeric(series);
            define(definition);
        }
        return put(definition, values.point(definition, timestamp, value));
    }

    /**
     * Records one consumed input row, for load statistics.
     */
    DatasetBuilder rowRead() {
        rowsRead++;
        return this;
    }

    /**
     * Records one consumed input row that was dropped.
     */
    DatasetBuilder rowSkipped() {
        rowsRead++;
        rowsSkipped++;
        return this;
    }

    public Dataset build() {
        List<SeriesDefinition> declared = new ArrayList<>(order.size());
        Map<String, NavigableMap<Instant, SeriesPoint>> byId = new HashMap<>();
        for (String id : order) {
            SeriesDefinition definition = definitions.get(id);
            declared.add(definition);
            TreeMap<Instant, SeriesPoint> series = points.get(id);
            if (series != null && !series.isEmpty()) {
                byId.put(definition.id(), series);
            }
        }
        return new Dataset(declared, byId, loopingEnabled, rowsRead, rowsSkipped);
    }

    private DatasetBuilder put(SeriesDefinition definition, SeriesPoint point) {
        points.computeIfAbsent(definition.id(), k -> new TreeMap<>()).put(point.timestamp(), point);
        return this;
    }

    private SeriesDefinition find(String idOrName) {
        SeriesDefinition byId = definitions.get(idOrName);
        if (byId != null) {
            return byId;
        }
        for (String id : order) {
            SeriesDefinition candidate = definitions.get(id);
            if (candidate.name().equalsIgnoreCase(idOrName)) {
                return candidate;
            }
        }
        return null;
    }
}
