package io.fullerstack.hub;

/**
 * Point-in-time view of a hub.
 *
 * @param hubId             hub identifier
 * @param subscriptionCount live subscriptions
 * @param publishedCount    values fanned out so far
 * @param droppedCount      values lost across all subscribers (rejected, evicted or failed)
 * @param pendingPublishes  values accepted but not yet fanned out
 * @param closed            whether the hub has been closed
 */
public record HubHealth(
    String hubId,
    int subscriptionCount,
    long publishedCount,
    long droppedCount,
    int pendingPublishes,
    boolean closed
) {

    public boolean isHealthy() {
        return !closed;
    }
}
