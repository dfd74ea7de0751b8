package io.fullerstack.hub;

/**
 * Thrown when subscribing to, or publishing on, a hub that has been closed.
 */
public class HubClosedException extends HubException {

    public HubClosedException(String hubId) {
        super("Hub '" + hubId + "' is unavailable: it has been closed");
    }
}
