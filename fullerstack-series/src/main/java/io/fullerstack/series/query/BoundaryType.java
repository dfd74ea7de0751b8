package io.fullerstack.series.query;

/**
 * Whether a raw query may include the samples just outside its time range.
 */
public enum BoundaryType {

    /** Only samples inside {@code [start, end]}. */
    INSIDE,

    /** Also the last sample before {@code start} and the first after {@code end}. */
    OUTSIDE
}
