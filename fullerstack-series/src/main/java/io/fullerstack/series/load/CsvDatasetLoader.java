package io.fullerstack.series.load;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import io.fullerstack.series.SeriesConfigurationException;
import io.fullerstack.series.SeriesSource;
import io.fullerstack.series.SeriesStoreOptions;
import io.fullerstack.series.model.SeriesDefinition;
import io.fullerstack.series.query.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads a {@link Dataset} from CSV.
 *
 * <p>The first row is the header: the timestamp column is skipped and every other
 * cell declares a series (see {@link SeriesHeaderParser}). Each following row is
 * one sample time. Rows whose timestamp is blank or unparseable are skipped and
 * counted; blank cells and cells that are not a value of their series are skipped.
 */
public final class CsvDatasetLoader {

    private static final Logger logger = LoggerFactory.getLogger(CsvDatasetLoader.class);

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
        .enable(CsvParser.Feature.WRAP_AS_ARRAY)
        .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
        .build();

    private final SeriesSource source;
    private final ZoneId zone;
    private final DateTimeFormatter timestampFormat;
    private final SeriesStoreOptions options;

    private CsvDatasetLoader(SeriesStoreOptions options) {
        this.options = options;
        this.source = options.getSource();
        this.zone = resolveZone(options.getTimeZone());
        this.timestampFormat = resolveFormat(options.getTimestampFormat(), options);
        if (options.getTimestampFieldIndex() < 0) {
            throw new SeriesConfigurationException(
                "Timestamp field index cannot be negative: " + options.getTimestampFieldIndex());
        }
        if (source == null) {
            throw new SeriesConfigurationException("No series source configured");
        }
    }

    /**
     * Validates the options that do not need the data.
     *
     * @throws SeriesConfigurationException for an unknown zone, a bad pattern,
     *                                      a negative column index or a missing source
     */
    public static CsvDatasetLoader create(SeriesStoreOptions options) {
        Objects.requireNonNull(options, "options cannot be null");
        return new CsvDatasetLoader(options);
    }

    /**
     * Shorthand for {@code create(options).load(CancellationSignal.NONE)}.
     */
    public static Dataset load(SeriesStoreOptions options) {
        return create(options).load(CancellationSignal.NONE);
    }

    /**
     * Opens the source and reads it to the end.
     *
     * @throws SeriesConfigurationException if the source cannot be opened or read,
     *                                      or the timestamp column is outside the header
     */
    public Dataset load(CancellationSignal signal) {
        Objects.requireNonNull(signal, "signal cannot be null");
        long started = System.nanoTime();
        Dataset dataset;
        try (InputStream in = source.open();
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            dataset = read(reader, signal);
        } catch (IOException e) {
            throw new SeriesConfigurationException("Unable to read series source: " + e.getMessage(), e);
        }
        if (dataset.rowsSkipped() > 0) {
            logger.warn("Skipped {} of {} rows with a missing or unparseable timestamp",
                dataset.rowsSkipped(), dataset.rowsRead());
        }
        logger.info("Loaded {} in {} ms", dataset, (System.nanoTime() - started) / 1_000_000);
        return dataset;
    }

    private Dataset read(Reader reader, CancellationSignal signal) throws IOException {
        DatasetBuilder builder = new DatasetBuilder(options.getLocale())
            .loopingEnabled(options.isLoopingEnabled());
        TimestampParser timestamps = new TimestampParser(zone, timestampFormat);
        int timestampColumn = options.getTimestampFieldIndex();

        try (MappingIterator<String[]> rows = CSV_MAPPER.readerFor(String[].class).readValues(reader)) {
            if (!rows.hasNext()) {
                logger.warn("Series source is empty");
                return builder.build();
            }
            String[] header = rows.next();
            builder.rowRead();
            if (timestampColumn >= header.length) {
                throw new SeriesConfigurationException("Timestamp field index " + timestampColumn
                    + " is outside the header, which has " + header.length + " columns");
            }
            Map<Integer, SeriesDefinition> columns = declareColumns(header, timestampColumn, builder);
            long line = 1;

            while (rows.hasNext()) {
                signal.throwIfCancelled();
                String[] row = rows.next();
                line++;
                Optional<Instant> timestamp = timestampColumn < row.length
                    ? timestamps.parse(row[timestampColumn])
                    : Optional.empty();
                if (timestamp.isEmpty()) {
                    logger.debug("Skipping row {}: no usable timestamp", line);
                    builder.rowSkipped();
                    continue;
                }
                builder.rowRead();
                for (Map.Entry<Integer, SeriesDefinition> column : columns.entrySet()) {
                    int index = column.getKey();
                    if (index < row.length && row[index] != null && !row[index].isBlank()) {
                        builder.add(column.getValue(), timestamp.get(), row[index]);
                    }
                }
            }
        }
        return builder.build();
    }

    private Map<Integer, SeriesDefinition> declareColumns(String[] header, int timestampColumn, DatasetBuilder builder) {
        Map<Integer, SeriesDefinition> columns = new LinkedHashMap<>();
        for (int i = 0; i < header.length; i++) {
            if (i == timestampColumn) {
                continue;
            }
            int column = i;
            SeriesHeaderParser.parse(header[i]).ifPresent(series -> {
                builder.define(series);
                columns.put(column, series);
            });
        }
        return columns;
    }

    private static ZoneId resolveZone(String timeZone) {
        if (timeZone == null) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timeZone);
        } catch (DateTimeException e) {
            throw new SeriesConfigurationException("Unknown time zone '" + timeZone + "'", e);
        }
    }

    private static DateTimeFormatter resolveFormat(String pattern, SeriesStoreOptions options) {
        if (pattern == null) {
            return null;
        }
        try {
            return DateTimeFormatter.ofPattern(pattern, options.getLocale());
        } catch (IllegalArgumentException e) {
            throw new SeriesConfigurationException("Invalid timestamp format '" + pattern + "'", e);
        }
    }
}
