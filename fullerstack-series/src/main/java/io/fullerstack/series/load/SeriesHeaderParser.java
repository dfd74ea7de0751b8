package io.fullerstack.series.load;

import io.fullerstack.series.model.SeriesDefinition;
import io.fullerstack.series.model.SeriesKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads a series definition from a CSV header cell.
 *
 * <p>A plain cell names the series and is also its id. A cell in brackets holds
 * {@code key=value} entries separated by {@code |}:
 * <pre>
 * [name=Pump 1|id=P1|description=Feed pump|units=rpm]
 * [name=Valve|dataType=STATE|STATE_Open=1|STATE_Closed=0]
 * </pre>
 * Keys ignore case. A missing id defaults to the name and vice versa; any
 * {@code STATE_} entry makes the series a state series. A bracketed cell with
 * neither name nor id declares nothing.
 */
public final class SeriesHeaderParser {

    private static final Logger logger = LoggerFactory.getLogger(SeriesHeaderParser.class);

    private static final String STATE_PREFIX = "state_";

    private SeriesHeaderParser() {
    }

    /**
     * @return the definition, or empty if the cell declares no series
     */
    public static Optional<SeriesDefinition> parse(String cell) {
        if (cell == null || cell.isBlank()) {
            return Optional.empty();
        }
        String text = cell.trim();
        if (!(text.startsWith("[") && text.endsWith("]"))) {
            return Optional.of(SeriesDefinition.numeric(text));
        }

        String name = null;
        String id = null;
        String description = null;
        String units = null;
        SeriesKind kind = null;
        Map<String, Integer> states = new LinkedHashMap<>();

        for (String entry : text.substring(1, text.length() - 1).split("\\|")) {
            int separator = entry.indexOf('=');
            if (separator <= 0) {
                continue;
            }
            String key = entry.substring(0, separator).trim();
            String value = entry.substring(separator + 1).trim();
            if (value.isEmpty()) {
                continue;
            }
            String lowerKey = key.toLowerCase(Locale.ROOT);
            switch (lowerKey) {
                case "name":
                    name = value;
                    break;
                case "id":
                    id = value;
                    break;
                case "description":
                    description = value;
                    break;
                case "units":
                    units = value;
                    break;
                case "datatype":
                    kind = parseKind(value, text);
                    break;
                default:
                    if (lowerKey.startsWith(STATE_PREFIX) && lowerKey.length() > STATE_PREFIX.length()) {
                        putState(states, key.substring(STATE_PREFIX.length()), value, text);
                    } else {
                        logger.debug("Ignoring unknown header entry '{}' in '{}'", key, text);
                    }
            }
        }

        if (name == null && id == null) {
            logger.debug("Header cell '{}' has neither name nor id; column ignored", text);
            return Optional.empty();
        }
        if (!states.isEmpty()) {
            kind = SeriesKind.STATE;
        }
        return Optional.of(new SeriesDefinition(
            id != null ? id : name,
            name != null ? name : id,
            description,
            units,
            kind != null ? kind : SeriesKind.NUMERIC,
            states));
    }

    private static SeriesKind parseKind(String value, String cell) {
        try {
            return SeriesKind.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.debug("Unknown dataType '{}' in '{}'; treating as numeric", value, cell);
            return null;
        }
    }

    private static void putState(Map<String, Integer> states, String stateName, String value, String cell) {
        try {
            states.put(stateName, Integer.parseInt(value));
        } catch (NumberFormatException e) {
            logger.debug("State '{}' in '{}' has non-integer value '{}'; ignored", stateName, cell, value);
        }
    }
}
