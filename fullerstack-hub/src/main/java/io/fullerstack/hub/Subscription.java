package io.fullerstack.hub;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A subscriber's handle on a {@link SubscriptionHub}.
 *
 * <p>Values are pulled with {@link #take()}, {@link #poll(Duration)}, or as a lazy
 * {@link #stream()} / {@link #iterator()} that ends once the subscription is
 * cancelled. Cancelling with {@link #close()} is idempotent and safe to race with
 * publishes: the queue is closed, pending values are discarded and the hub
 * forgets the subscription.
 *
 * <p>One thread is expected to consume a subscription at a time.
 *
 * @param <T> payload type
 */
public final class Subscription<T> implements AutoCloseable {

    private final long id;
    private final String context;
    private final SubscriptionHub<T> hub;
    private final SubscriberQueue<T> queue;
    private final Runnable onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile TopicFilter filter;

    // Staleness guard; both fields are only touched while holding guard
    private final Object guard = new Object();
    private long lastSequence;
    private boolean hasAccepted;

    Subscription(long id, String context, SubscriptionHub<T> hub, TopicFilter filter,
                 SubscriberQueue<T> queue, Runnable onClose) {
        this.id = id;
        this.context = context;
        this.hub = hub;
        this.filter = filter;
        this.queue = queue;
        this.onClose = Objects.requireNonNull(onClose, "onClose cannot be null");
    }

    public long getId() {
        return id;
    }

    /**
     * @return description of the caller that owns this subscription
     */
    public String getContext() {
        return context;
    }

    /**
     * @return current topics; empty means every value is received
     */
    public Set<String> getTopics() {
        return filter.topics();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @return number of values queued and not yet consumed
     */
    public int pending() {
        return queue.size();
    }

    /**
     * @return sequence of the last value accepted into the queue, if any
     */
    public OptionalLong lastAcceptedSequence() {
        synchronized (guard) {
            return hasAccepted ? OptionalLong.of(lastSequence) : OptionalLong.empty();
        }
    }

    /**
     * Waits for the next value.
     *
     * @return the next value
     * @throws CancellationException if the subscription is, or becomes, cancelled
     * @throws InterruptedException  if interrupted while waiting
     */
    public T take() throws InterruptedException {
        T value = queue.take();
        if (value == null) {
            throw new CancellationException("Subscription " + id + " was cancelled");
        }
        return value;
    }

    /**
     * Waits up to {@code timeout} for the next value.
     *
     * @return the next value, or empty if none arrived in time
     * @throws CancellationException if the subscription is, or becomes, cancelled
     * @throws InterruptedException  if interrupted while waiting
     */
    public Optional<T> poll(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        T value = queue.poll(timeout);
        if (value == null && queue.isClosed()) {
            throw new CancellationException("Subscription " + id + " was cancelled");
        }
        return Optional.ofNullable(value);
    }

    /**
     * Lazy, blocking sequence of values. The stream ends when the subscription is
     * cancelled; closing the stream cancels the subscription. An interrupt while
     * waiting surfaces as {@link CancellationException} with the interrupt flag kept.
     */
    public Stream<T> stream() {
        return StreamSupport.stream(new ValueSpliterator(), false).onClose(this::close);
    }

    /**
     * Blocking iterator over values; {@code hasNext()} waits for the next value and
     * returns false once the subscription is cancelled.
     */
    public Iterator<T> iterator() {
        return Spliterators.iterator(new ValueSpliterator());
    }

    /**
     * Cancels the subscription. Safe to call more than once and from any thread.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.close();
            onClose.run();
        }
    }

    SubscriptionHub<T> hub() {
        return hub;
    }

    TopicFilter filter() {
        return filter;
    }

    void changeTopics(Collection<String> add, Collection<String> remove) {
        synchronized (guard) {
            filter = filter.update(add, remove);
        }
    }

    /**
     * Offers a published value, applying topic filter, staleness guard and the
     * queue's overflow policy in that order.
     */
    DeliveryResult offer(PublishedValue<T> published) {
        if (closed.get()) {
            return DeliveryResult.CLOSED;
        }
        if (!filter.matches(published.topic())) {
            return DeliveryResult.FILTERED;
        }
        synchronized (guard) {
            if (hasAccepted && !Sequences.isNewer(published.sequence(), lastSequence)) {
                return DeliveryResult.STALE;
            }
            SubscriberQueue.Offer outcome = queue.offer(published.value());
            if (outcome == SubscriberQueue.Offer.CLOSED) {
                return DeliveryResult.CLOSED;
            }
            if (outcome == SubscriberQueue.Offer.REJECTED) {
                return DeliveryResult.DROPPED;
            }
            lastSequence = published.sequence();
            hasAccepted = true;
            return outcome == SubscriberQueue.Offer.EVICTED_OLDEST ? DeliveryResult.EVICTED : DeliveryResult.DELIVERED;
        }
    }

    @Override
    public String toString() {
        return "Subscription[id=" + id + ", context=" + context + ", topics=" + filter + "]";
    }

    private final class ValueSpliterator extends Spliterators.AbstractSpliterator<T> {

        ValueSpliterator() {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
        }

        @Override
        public boolean tryAdvance(Consumer<? super T> action) {
            T value;
            try {
                value = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                CancellationException cancelled = new CancellationException("Interrupted while waiting on subscription " + id);
                cancelled.initCause(e);
                throw cancelled;
            }
            if (value == null) {
                return false;
            }
            action.accept(value);
            return true;
        }
    }
}
