package io.fullerstack.hub;

/**
 * Observer of hub activity.
 *
 * <p>Callbacks run on the thread that caused them: subscribe and cancel callbacks
 * on the subscribing or cancelling thread, publish and delivery callbacks on the
 * fan-out thread. They must return quickly. Exceptions thrown by a listener are
 * logged and otherwise ignored.
 *
 * @param <T> payload type
 */
public interface HubListener<T> {

    default void onSubscriptionAdded(Subscription<T> subscription) {
    }

    default void onSubscriptionCancelled(Subscription<T> subscription) {
    }

    /**
     * Called once per published value after it was offered to every subscription.
     *
     * @param value     the value
     * @param delivered number of subscriptions whose queue received it
     */
    default void onPublished(PublishedValue<T> value, int delivered) {
    }

    /**
     * Called when a value could not be delivered to one subscription.
     *
     * @param subscription the subscription that lost the value
     * @param value        the value being delivered
     * @param result       {@link DeliveryResult#DROPPED}, {@link DeliveryResult#EVICTED}
     *                     or {@link DeliveryResult#ERROR}
     */
    default void onDeliveryFailed(Subscription<T> subscription, PublishedValue<T> value, DeliveryResult result) {
    }
}
