package io.fullerstack.hub;

import java.util.Objects;

/**
 * A value as it travels through the hub: the payload, its optional topic and
 * the sequence number assigned when it was published.
 *
 * @param value    the published payload
 * @param topic    topic the value was published under, or {@code null} for none
 * @param sequence hub-wide sequence number, compared with {@link Sequences#isNewer}
 * @param <T>      payload type
 */
public record PublishedValue<T>(T value, String topic, long sequence) {

    public PublishedValue {
        Objects.requireNonNull(value, "value cannot be null");
    }

    public boolean hasTopic() {
        return topic != null;
    }
}
