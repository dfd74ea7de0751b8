package io.fullerstack.series;

/**
 * The store cannot load its dataset because its options are wrong: unknown time
 * zone, timestamp column outside the header, missing or unreadable source, or a
 * malformed timestamp pattern.
 */
public class SeriesConfigurationException extends SeriesException {

    public SeriesConfigurationException(String message) {
        super(message);
    }

    public SeriesConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
