package io.fullerstack.hub;

/**
 * What a bounded subscriber queue does with a value that arrives while it is full.
 */
public enum OverflowPolicy {

    /** Reject the incoming value; values already queued are kept. */
    DROP_NEWEST,

    /** Evict the oldest queued value to make room for the incoming one. */
    DROP_OLDEST
}
