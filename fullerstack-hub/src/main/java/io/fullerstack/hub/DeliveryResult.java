package io.fullerstack.hub;

/**
 * Outcome of offering one published value to one subscription.
 */
public enum DeliveryResult {

    /** Value was queued for the subscriber. */
    DELIVERED,

    /** Value was queued, but the oldest queued value was evicted to make room. */
    EVICTED,

    /** Subscriber topics do not match the value topic. */
    FILTERED,

    /** Value sequence is not newer than the last one the subscriber accepted. */
    STALE,

    /** Queue was full and the overflow policy rejected the value. */
    DROPPED,

    /** Subscription was already cancelled. */
    CLOSED,

    /** Delivery threw an unexpected exception. */
    ERROR;

    /**
     * @return true when a value was lost for this subscriber
     */
    public boolean isFailure() {
        return this == EVICTED || this == DROPPED || this == ERROR;
    }

    /**
     * @return true when the subscriber's queue received the value
     */
    public boolean isDelivered() {
        return this == DELIVERED || this == EVICTED;
    }
}
