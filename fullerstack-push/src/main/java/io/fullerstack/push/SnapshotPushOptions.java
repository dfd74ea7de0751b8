package io.fullerstack.push;

import io.fullerstack.config.HierarchicalConfig;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for {@link SnapshotPushService}.
 */
@Getter
public final class SnapshotPushOptions {

    public static final Duration DEFAULT_POLLING_INTERVAL = Duration.ofMinutes(1);

    /** Time between polls; zero or negative means {@link #DEFAULT_POLLING_INTERVAL}. */
    private final Duration pollingInterval;

    /** Subscriber queue capacity of a hub created by {@link SnapshotPushService#create}. */
    private final int hubChannelCapacity;

    @Builder(toBuilder = true)
    private SnapshotPushOptions(Duration pollingInterval, Integer hubChannelCapacity) {
        this.pollingInterval = pollingInterval == null || pollingInterval.isZero() || pollingInterval.isNegative()
            ? DEFAULT_POLLING_INTERVAL
            : pollingInterval;
        this.hubChannelCapacity = hubChannelCapacity != null ? hubChannelCapacity : 10_000;
    }

    public static SnapshotPushOptions defaults() {
        return builder().build();
    }

    /**
     * Reads {@code push.polling-interval-ms} and {@code push.hub-channel-capacity}.
     */
    public static SnapshotPushOptions fromConfig(HierarchicalConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        return builder()
            .pollingInterval(config.getMillis("push.polling-interval-ms", DEFAULT_POLLING_INTERVAL))
            .hubChannelCapacity(config.getInt("push.hub-channel-capacity", 10_000))
            .build();
    }
}
