package io.fullerstack.hub;

import io.fullerstack.config.ConfigurationException;
import io.fullerstack.config.HierarchicalConfig;
import lombok.Builder;
import lombok.Getter;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Settings for a {@link SubscriptionHub}.
 *
 * <p>Build with {@link #builder()}; any setting left unset takes its default.
 * {@link #fromConfig(HierarchicalConfig)} reads the same settings from a
 * {@code hub.properties} bundle:
 * <pre>
 * hub.max-subscriptions=0
 * hub.channel-capacity=10000
 * hub.overflow-policy=DROP_NEWEST
 * hub.async-publish=true
 * hub.retain-last-value=false
 * hub.wildcard-topics=true
 * hub.topic-separator=/
 * </pre>
 */
@Getter
public final class HubOptions {

    public static final int DEFAULT_CHANNEL_CAPACITY = 10_000;
    public static final String DEFAULT_TOPIC_SEPARATOR = "/";

    /** Identifies the hub in logs, health snapshots and exceptions. */
    private final String id;

    /** Maximum concurrent subscriptions; less than 1 means unlimited. */
    private final int maxSubscriptionCount;

    /** Per-subscriber queue capacity; less than 1 means unbounded. */
    private final int channelCapacity;

    private final OverflowPolicy overflowPolicy;

    /** Fan out on the hub's publish worker instead of the publishing thread. */
    private final boolean asyncPublish;

    /** Keep the last value per topic and replay it to new subscribers. */
    private final boolean retainLastValue;

    /** Interpret {@code +} and {@code #} in subscriber topics. */
    private final boolean wildcardTopics;

    private final String topicLevelSeparator;

    /** First sequence number handed out by the hub. */
    private final long initialSequence;

    @Builder(toBuilder = true)
    private HubOptions(
        String id,
        Integer maxSubscriptionCount,
        Integer channelCapacity,
        OverflowPolicy overflowPolicy,
        Boolean asyncPublish,
        Boolean retainLastValue,
        Boolean wildcardTopics,
        String topicLevelSeparator,
        Long initialSequence
    ) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.maxSubscriptionCount = maxSubscriptionCount != null ? maxSubscriptionCount : 0;
        this.channelCapacity = channelCapacity != null ? channelCapacity : DEFAULT_CHANNEL_CAPACITY;
        this.overflowPolicy = overflowPolicy != null ? overflowPolicy : OverflowPolicy.DROP_NEWEST;
        this.asyncPublish = asyncPublish != null ? asyncPublish : true;
        this.retainLastValue = retainLastValue != null ? retainLastValue : false;
        this.wildcardTopics = wildcardTopics != null ? wildcardTopics : true;
        this.topicLevelSeparator = topicLevelSeparator != null ? topicLevelSeparator : DEFAULT_TOPIC_SEPARATOR;
        this.initialSequence = initialSequence != null ? initialSequence : 0L;

        if (this.id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        if (this.topicLevelSeparator.isEmpty()) {
            throw new IllegalArgumentException("topicLevelSeparator cannot be empty");
        }
    }

    public static HubOptions defaults() {
        return builder().build();
    }

    /**
     * Reads hub settings from configuration. Keys that are absent keep their defaults.
     *
     * @param config configuration, usually {@code HierarchicalConfig.forBundle("hub")}
     * @return options populated from {@code config}
     */
    public static HubOptions fromConfig(HierarchicalConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        String policy = config.getString("hub.overflow-policy", OverflowPolicy.DROP_NEWEST.name());
        return builder()
            .id(config.getString("hub.id", null))
            .maxSubscriptionCount(config.getInt("hub.max-subscriptions", 0))
            .channelCapacity(config.getInt("hub.channel-capacity", DEFAULT_CHANNEL_CAPACITY))
            .overflowPolicy(parsePolicy(policy))
            .asyncPublish(config.getBoolean("hub.async-publish", true))
            .retainLastValue(config.getBoolean("hub.retain-last-value", false))
            .wildcardTopics(config.getBoolean("hub.wildcard-topics", true))
            .topicLevelSeparator(config.getString("hub.topic-separator", DEFAULT_TOPIC_SEPARATOR))
            .build();
    }

    private static OverflowPolicy parsePolicy(String value) {
        try {
            return OverflowPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                "Invalid value for 'hub.overflow-policy': " + value, e
            );
        }
    }

    public boolean isBounded() {
        return channelCapacity > 0;
    }

    public boolean isSubscriptionLimited() {
        return maxSubscriptionCount > 0;
    }
}
