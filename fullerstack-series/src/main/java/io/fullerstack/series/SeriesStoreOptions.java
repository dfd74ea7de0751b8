package io.fullerstack.series;

import io.fullerstack.config.HierarchicalConfig;
import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Options for {@link LoopingSeriesStore}.
 *
 * <p>Nothing is validated here; the loader reports bad values as
 * {@link SeriesConfigurationException} when the store loads.
 *
 * <pre>
 * SeriesStoreOptions options = SeriesStoreOptions.builder()
 *     .source(SeriesSource.ofPath(Path.of("plant.csv")))
 *     .timeZone("Europe/Oslo")
 *     .loopingEnabled(true)
 *     .build();
 * </pre>
 */
@Getter
public final class SeriesStoreOptions {

    private final SeriesSource source;
    private final String timeZone;
    private final String timestampFormat;
    private final Locale locale;
    private final boolean loopingEnabled;
    private final int timestampFieldIndex;

    /**
     * @param source              where the CSV bytes come from
     * @param timeZone            IANA zone applied to timestamps without an offset; null for the system zone
     * @param timestampFormat     {@link java.time.format.DateTimeFormatter} pattern; null for ISO-8601
     * @param locale              locale for number parsing (default {@link Locale#ROOT})
     * @param loopingEnabled      replay the recorded window outside its bounds (default false)
     * @param timestampFieldIndex zero-based timestamp column (default 0)
     */
    @Builder(toBuilder = true)
    private SeriesStoreOptions(SeriesSource source, String timeZone, String timestampFormat, Locale locale,
                               Boolean loopingEnabled, Integer timestampFieldIndex) {
        this.source = source;
        this.timeZone = blankToNull(timeZone);
        this.timestampFormat = blankToNull(timestampFormat);
        this.locale = locale != null ? locale : Locale.ROOT;
        this.loopingEnabled = loopingEnabled != null ? loopingEnabled : false;
        this.timestampFieldIndex = timestampFieldIndex != null ? timestampFieldIndex : 0;
    }

    /**
     * Reads options from {@code series*.properties}:
     * <ul>
     *   <li>{@code series.file}: path of the CSV file, used when no source is given</li>
     *   <li>{@code series.time-zone}</li>
     *   <li>{@code series.timestamp-format}</li>
     *   <li>{@code series.locale}: BCP 47 language tag</li>
     *   <li>{@code series.looping-enabled}</li>
     *   <li>{@code series.timestamp-field-index}</li>
     * </ul>
     *
     * @param source overrides {@code series.file} when not null
     */
    public static SeriesStoreOptions fromConfig(HierarchicalConfig config, SeriesSource source) {
        SeriesSource resolved = source;
        if (resolved == null) {
            String file = config.getString("series.file", "");
            resolved = file.isBlank() ? null : SeriesSource.ofPath(Path.of(file));
        }
        String localeTag = config.getString("series.locale", "");
        return builder()
            .source(resolved)
            .timeZone(config.getString("series.time-zone", ""))
            .timestampFormat(config.getString("series.timestamp-format", ""))
            .locale(localeTag.isBlank() ? Locale.ROOT : Locale.forLanguageTag(localeTag))
            .loopingEnabled(config.getBoolean("series.looping-enabled", false))
            .timestampFieldIndex(config.getInt("series.timestamp-field-index", 0))
            .build();
    }

    public static SeriesStoreOptions fromConfig(HierarchicalConfig config) {
        return fromConfig(config, null);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public String toString() {
        return "SeriesStoreOptions[timeZone=" + timeZone + ", timestampFormat=" + timestampFormat
            + ", locale=" + locale + ", loopingEnabled=" + loopingEnabled
            + ", timestampFieldIndex=" + timestampFieldIndex + "]";
    }
}
