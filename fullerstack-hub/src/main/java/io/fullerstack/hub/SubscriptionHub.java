package io.fullerstack.hub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Fans published values out to any number of independently paced subscribers.
 *
 * <p><b>Delivery rule:</b> a subscription receives a value if its topic filter
 * matches the value's topic (an empty filter matches everything) and the value's
 * sequence number is newer than the last one the subscription accepted.
 *
 * <p><b>Threading:</b>
 * <ul>
 *   <li>Sequence numbers are assigned in publish order under a short lock</li>
 *   <li>With {@link HubOptions#isAsyncPublish()} the fan-out runs on one daemon
 *       worker thread; otherwise on the publishing thread</li>
 *   <li>Offers to subscriber queues never block, so a slow or full subscriber
 *       cannot hold up the others or the publisher</li>
 *   <li>The registry is a {@link ConcurrentHashMap}; cancelling a subscription
 *       only removes its own entry</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>
 * try (SubscriptionHub&lt;Reading&gt; hub = new SubscriptionHub&lt;&gt;(HubOptions.defaults())) {
 *     Subscription&lt;Reading&gt; sub = hub.subscribe("dashboard", Set.of("plant/+/temp"));
 *     hub.publish(reading, "plant/line1/temp");
 *     Reading next = sub.take();
 * }
 * </pre>
 *
 * @param <T> payload type
 */
public class SubscriptionHub<T> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionHub.class);

    private final HubOptions options;
    private final String id;
    private final Map<Long, Subscription<T>> registry = new ConcurrentHashMap<>();
    private final List<HubListener<T>> listeners = new CopyOnWriteArrayList<>();

    private final AtomicLong subscriptionIds = new AtomicLong();
    private final AtomicLong lastSequence;
    private final AtomicLong publishedCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();

    // Last value per topic; the topic-less value is kept separately
    private final Map<String, PublishedValue<T>> retained = new ConcurrentHashMap<>();
    private final AtomicReference<PublishedValue<T>> retainedWithoutTopic = new AtomicReference<>();

    // publishLock orders sequence assignment with hand-off to the fan-out.
    // fanOutLock orders fan-out with registration so retained replay never races a live value.
    private final Object publishLock = new Object();
    private final Object fanOutLock = new Object();

    private final PublishValve valve;
    private volatile boolean closed;

    public SubscriptionHub() {
        this(HubOptions.defaults());
    }

    public SubscriptionHub(HubOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.id = options.getId();
        this.lastSequence = new AtomicLong(options.getInitialSequence() - 1);
        this.valve = options.isAsyncPublish() ? new PublishValve("hub-" + id + "-publisher") : null;
        logger.info("Hub '{}' created (capacity={}, policy={}, async={}, retain={}, wildcards={})",
            id,
            options.isBounded() ? options.getChannelCapacity() : "unbounded",
            options.getOverflowPolicy(),
            options.isAsyncPublish(),
            options.isRetainLastValue(),
            options.isWildcardTopics());
    }

    public String getId() {
        return id;
    }

    public HubOptions getOptions() {
        return options;
    }

    // =========================================================================
    // Subscriptions
    // =========================================================================

    /**
     * Registers a subscriber.
     *
     * @param context       describes the caller that owns the subscription
     * @param initialTopics topics to receive; {@code null} or empty receives everything
     * @return the subscription handle
     * @throws HubClosedException         if the hub has been closed
     * @throws SubscriptionLimitException if the configured subscription limit is reached
     * @throws IllegalArgumentException   if a topic is blank or a malformed wildcard
     */
    public Subscription<T> subscribe(String context, Collection<String> initialTopics) {
        ensureOpen();
        TopicFilter filter = TopicFilter.of(initialTopics, options);

        Subscription<T> subscription;
        synchronized (fanOutLock) {
            ensureOpen();
            if (options.isSubscriptionLimited() && registry.size() >= options.getMaxSubscriptionCount()) {
                throw new SubscriptionLimitException(id, options.getMaxSubscriptionCount());
            }
            long subscriptionId = subscriptionIds.incrementAndGet();
            SubscriberQueue<T> queue = new SubscriberQueue<>(options.getChannelCapacity(), options.getOverflowPolicy());
            subscription = new Subscription<>(subscriptionId, context, this, filter, queue,
                () -> onSubscriptionClosed(subscriptionId));
            registry.put(subscriptionId, subscription);

            if (options.isRetainLastValue()) {
                replayRetained(subscription);
            }
        }

        logger.debug("Hub '{}' added subscription {} for '{}' (topics={})", id, subscription.getId(), context, filter);
        listeners.forEach(listener -> notify(listener, l -> l.onSubscriptionAdded(subscription)));
        return subscription;
    }

    /**
     * Registers a subscriber that receives every value.
     */
    public Subscription<T> subscribe(String context) {
        return subscribe(context, Set.of());
    }

    /**
     * Changes the topics of one subscription. Does nothing if it is already cancelled.
     *
     * @throws IllegalArgumentException if the subscription belongs to another hub,
     *                                  or an added topic is malformed
     */
    public void updateTopics(Subscription<T> subscription, Collection<String> add, Collection<String> remove) {
        Objects.requireNonNull(subscription, "subscription cannot be null");
        if (subscription.hub() != this) {
            throw new IllegalArgumentException("Subscription " + subscription.getId() + " does not belong to hub '" + id + "'");
        }
        if (subscription.isClosed()) {
            return;
        }
        subscription.changeTopics(add, remove);
        logger.debug("Hub '{}' subscription {} topics now {}", id, subscription.getId(), subscription.filter());
    }

    /**
     * Cancels a subscription; equivalent to {@link Subscription#close()}.
     */
    public void unsubscribe(Subscription<T> subscription) {
        Objects.requireNonNull(subscription, "subscription cannot be null");
        subscription.close();
    }

    public int getSubscriptionCount() {
        return registry.size();
    }

    private void onSubscriptionClosed(long subscriptionId) {
        Subscription<T> removed = registry.remove(subscriptionId);
        if (removed != null) {
            logger.debug("Hub '{}' removed subscription {} for '{}'", id, subscriptionId, removed.getContext());
            listeners.forEach(listener -> notify(listener, l -> l.onSubscriptionCancelled(removed)));
        }
    }

    // =========================================================================
    // Publishing
    // =========================================================================

    /**
     * Publishes a value without a topic. Only subscriptions with an empty topic
     * filter receive it.
     *
     * @return the sequence number assigned to the value
     */
    public long publish(T value) {
        return publish(value, null);
    }

    /**
     * Publishes a value. Never blocks on, or fails because of, a subscriber.
     *
     * @param value the value
     * @param topic the topic, or {@code null}
     * @return the sequence number assigned to the value
     * @throws HubClosedException if the hub has been closed
     */
    public long publish(T value, String topic) {
        Objects.requireNonNull(value, "value cannot be null");
        synchronized (publishLock) {
            ensureOpen();
            long sequence = lastSequence.incrementAndGet();
            dispatch(new PublishedValue<>(value, topic, sequence));
            return sequence;
        }
    }

    /**
     * Reserves the next sequence number without publishing anything. A producer
     * that computes values concurrently reserves a number before computing and
     * passes it to {@link #publish(long, Object, String)}, so a slow computation
     * that finishes late cannot replace a newer result at any subscriber.
     *
     * @throws HubClosedException if the hub has been closed
     */
    public long nextSequence() {
        synchronized (publishLock) {
            ensureOpen();
            return lastSequence.incrementAndGet();
        }
    }

    /**
     * Publishes a value under a sequence number obtained from {@link #nextSequence()}.
     *
     * @throws HubClosedException if the hub has been closed
     */
    public void publish(long sequence, T value, String topic) {
        Objects.requireNonNull(value, "value cannot be null");
        synchronized (publishLock) {
            ensureOpen();
            dispatch(new PublishedValue<>(value, topic, sequence));
        }
    }

    /**
     * Publishes a value to one subscription only, for example the current value
     * of a topic it just started watching. The value takes the next sequence
     * number and travels the same path as regular publishes, so it stays ordered
     * with them. It is not retained.
     *
     * @return the sequence number assigned to the value
     * @throws HubClosedException       if the hub has been closed
     * @throws IllegalArgumentException if the subscription belongs to another hub
     */
    public long publishTo(Subscription<T> subscription, T value, String topic) {
        Objects.requireNonNull(subscription, "subscription cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        if (subscription.hub() != this) {
            throw new IllegalArgumentException("Subscription " + subscription.getId() + " does not belong to hub '" + id + "'");
        }
        synchronized (publishLock) {
            ensureOpen();
            long sequence = lastSequence.incrementAndGet();
            PublishedValue<T> published = new PublishedValue<>(value, topic, sequence);
            execute(() -> deliverTo(subscription, published));
            return sequence;
        }
    }

    private void dispatch(PublishedValue<T> published) {
        execute(() -> fanOut(published));
    }

    private void execute(Runnable task) {
        if (valve == null) {
            task.run();
        } else if (!valve.submit(task)) {
            throw new HubClosedException(id);
        }
    }

    private void fanOut(PublishedValue<T> published) {
        int delivered = 0;
        synchronized (fanOutLock) {
            if (options.isRetainLastValue()) {
                retain(published);
            }
            publishedCount.incrementAndGet();
            for (Subscription<T> subscription : registry.values()) {
                if (deliver(subscription, published).isDelivered()) {
                    delivered++;
                }
            }
        }
        logger.trace("Hub '{}' fanned out sequence {} (topic={}) to {} subscription(s)",
            id, published.sequence(), published.topic(), delivered);
        int deliveredCount = delivered;
        listeners.forEach(listener -> notify(listener, l -> l.onPublished(published, deliveredCount)));
    }

    /**
     * Offers one value to one subscription, isolating any failure to that subscription.
     */
    DeliveryResult deliver(Subscription<T> subscription, PublishedValue<T> published) {
        DeliveryResult result;
        try {
            result = subscription.offer(published);
        } catch (RuntimeException e) {
            logger.error("Hub '{}' failed delivering sequence {} to subscription {} ('{}')",
                id, published.sequence(), subscription.getId(), subscription.getContext(), e);
            result = DeliveryResult.ERROR;
        }

        if (result.isFailure()) {
            droppedCount.incrementAndGet();
            if (result != DeliveryResult.ERROR) {
                logger.warn("Hub '{}' subscription {} ('{}') queue full, {} sequence {}",
                    id, subscription.getId(), subscription.getContext(),
                    result == DeliveryResult.EVICTED ? "evicted oldest value for" : "dropped", published.sequence());
            }
            DeliveryResult failure = result;
            listeners.forEach(listener -> notify(listener, l -> l.onDeliveryFailed(subscription, published, failure)));
        } else if (result == DeliveryResult.STALE) {
            logger.trace("Hub '{}' subscription {} ignored stale sequence {}", id, subscription.getId(), published.sequence());
        }
        return result;
    }

    /**
     * Offers a value to a single subscription, ordered with the regular fan-out.
     */
    DeliveryResult deliverTo(Subscription<T> subscription, PublishedValue<T> published) {
        synchronized (fanOutLock) {
            return deliver(subscription, published);
        }
    }

    // =========================================================================
    // Retained values
    // =========================================================================

    private void retain(PublishedValue<T> published) {
        if (published.hasTopic()) {
            retained.merge(published.topic(), published, SubscriptionHub::newerOf);
        } else {
            retainedWithoutTopic.accumulateAndGet(published, (current, next) -> current == null ? next : newerOf(current, next));
        }
    }

    private static <T> PublishedValue<T> newerOf(PublishedValue<T> current, PublishedValue<T> candidate) {
        return Sequences.isNewer(candidate.sequence(), current.sequence()) ? candidate : current;
    }

    private void replayRetained(Subscription<T> subscription) {
        List<PublishedValue<T>> replay = new ArrayList<>(retained.values());
        PublishedValue<T> withoutTopic = retainedWithoutTopic.get();
        if (withoutTopic != null) {
            replay.add(withoutTopic);
        }
        replay.sort((a, b) -> Long.signum(a.sequence() - b.sequence()));
        for (PublishedValue<T> value : replay) {
            deliver(subscription, value);
        }
    }

    /**
     * @return the value retained for {@code topic}, or for topic-less values when
     *         {@code topic} is {@code null}
     */
    public Optional<T> retainedValue(String topic) {
        PublishedValue<T> value = topic == null ? retainedWithoutTopic.get() : retained.get(topic);
        return Optional.ofNullable(value).map(PublishedValue::value);
    }

    // =========================================================================
    // Listeners, health and lifecycle
    // =========================================================================

    public void addListener(HubListener<T> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(HubListener<T> listener) {
        listeners.remove(listener);
    }

    private void notify(HubListener<T> listener, Consumer<HubListener<T>> callback) {
        try {
            callback.accept(listener);
        } catch (RuntimeException e) {
            logger.warn("Hub '{}' listener {} failed", id, listener, e);
        }
    }

    public HubHealth health() {
        return new HubHealth(
            id,
            registry.size(),
            publishedCount.get(),
            droppedCount.get(),
            valve == null ? 0 : valve.pending(),
            closed
        );
    }

    /**
     * Blocks until every value published so far has been fanned out.
     * Returns immediately for a synchronous or closed hub.
     *
     * @throws IllegalStateException if called from the fan-out thread
     */
    public void awaitIdle() {
        if (valve != null && !closed) {
            valve.await();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new HubClosedException(id);
        }
    }

    /**
     * Cancels every subscription and stops the fan-out worker. Values not yet
     * fanned out are discarded. Later subscribe and publish calls throw
     * {@link HubClosedException}. Safe to call more than once.
     */
    @Override
    public void close() {
        synchronized (publishLock) {
            if (closed) {
                return;
            }
            closed = true;
        }

        List<Subscription<T>> live;
        synchronized (fanOutLock) {
            live = new ArrayList<>(registry.values());
        }
        live.forEach(Subscription::close);

        if (valve != null) {
            valve.close();
        }
        retained.clear();
        retainedWithoutTopic.set(null);
        logger.info("Hub '{}' closed ({} subscription(s) cancelled, {} published, {} dropped)",
            id, live.size(), publishedCount.get(), droppedCount.get());
    }

    @Override
    public String toString() {
        return "SubscriptionHub[id=" + id + ", subscriptions=" + registry.size() + "]";
    }
}
