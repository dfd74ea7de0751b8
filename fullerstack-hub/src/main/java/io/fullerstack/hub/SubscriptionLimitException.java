package io.fullerstack.hub;

/**
 * Thrown by {@link SubscriptionHub#subscribe} when the hub already holds its
 * configured maximum number of subscriptions.
 */
public class SubscriptionLimitException extends HubException {

    private final int limit;

    public SubscriptionLimitException(String hubId, int limit) {
        super("Hub '" + hubId + "' has reached its subscription limit of " + limit);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
