package io.fullerstack.hub;

/**
 * Base class for failures raised by a {@link SubscriptionHub} to its callers.
 *
 * <p>Delivery problems for individual subscribers are never raised; they are
 * reported through {@link HubListener#onDeliveryFailed} and the log instead.
 */
public class HubException extends RuntimeException {

    public HubException(String message) {
        super(message);
    }

    public HubException(String message, Throwable cause) {
        super(message, cause);
    }
}
