package io.fullerstack.series;

/**
 * Thrown to readers when the dataset failed to load. The load failure is the cause.
 */
public class DatasetUnavailableException extends SeriesException {

    public DatasetUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
