package io.fullerstack.series.model;

/**
 * How the values of a series are interpreted.
 */
public enum SeriesKind {

    /** Continuous numeric values. */
    NUMERIC,

    /** Discrete states; each numeric value maps to a named state. */
    STATE
}
