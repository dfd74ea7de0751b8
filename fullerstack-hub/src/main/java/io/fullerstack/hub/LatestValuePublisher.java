package io.fullerstack.hub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Publishes a derived value (an aggregate health status, for example) that is
 * recomputed whenever one of its inputs changes.
 *
 * <p>Recompute requests are coalesced: while one is pending, further requests are
 * absorbed. Each computation reserves its hub sequence number before it starts,
 * so when two computations overlap the one that started later always wins at
 * every subscriber, even if the earlier one finishes last.
 *
 * <p>Subscribers obtained through {@link #subscribe(String)} receive the latest
 * computed value immediately.
 *
 * @param <T> value type
 */
public class LatestValuePublisher<T> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LatestValuePublisher.class);

    private final SubscriptionHub<T> hub;
    private final Supplier<? extends T> computation;
    private final ExecutorService executor;
    private final AtomicBoolean recomputePending = new AtomicBoolean(false);
    private final Object latestLock = new Object();

    private volatile PublishedValue<T> latest;
    private volatile boolean closed;

    public LatestValuePublisher(SubscriptionHub<T> hub, Supplier<? extends T> computation) {
        this.hub = Objects.requireNonNull(hub, "hub cannot be null");
        this.computation = Objects.requireNonNull(computation, "computation cannot be null");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "latest-value-" + hub.getId());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Asks for the value to be recomputed in the background.
     *
     * @return false if a recompute was already pending or the publisher is closed
     */
    public boolean requestRecompute() {
        if (closed || !recomputePending.compareAndSet(false, true)) {
            return false;
        }
        try {
            executor.execute(this::runPendingRecompute);
            return true;
        } catch (RejectedExecutionException e) {
            recomputePending.set(false);
            logger.debug("Recompute request for hub '{}' rejected: publisher closed", hub.getId());
            return false;
        }
    }

    private void runPendingRecompute() {
        // Clear first so changes arriving during the computation schedule another pass
        recomputePending.set(false);
        try {
            recomputeNow();
        } catch (HubClosedException e) {
            logger.debug("Hub '{}' closed during recompute", hub.getId());
        }
    }

    /**
     * Computes and publishes the value on the calling thread.
     *
     * @return the value now considered latest; the previous one if the computation failed
     * @throws HubClosedException if the hub has been closed
     */
    public Optional<T> recomputeNow() {
        long sequence = hub.nextSequence();

        T value;
        try {
            value = computation.get();
        } catch (RuntimeException e) {
            logger.error("Computing latest value for hub '{}' failed; keeping previous value", hub.getId(), e);
            return current();
        }
        if (value == null) {
            logger.warn("Computation for hub '{}' returned null; keeping previous value", hub.getId());
            return current();
        }

        PublishedValue<T> candidate = new PublishedValue<>(value, null, sequence);
        synchronized (latestLock) {
            if (latest == null || Sequences.isNewer(sequence, latest.sequence())) {
                latest = candidate;
            } else {
                logger.debug("Hub '{}' discarded result of sequence {}; sequence {} is newer",
                    hub.getId(), sequence, latest.sequence());
            }
        }
        hub.publish(sequence, value, null);
        return current();
    }

    /**
     * @return the most recently computed value, if any computation has succeeded
     */
    public Optional<T> current() {
        PublishedValue<T> snapshot = latest;
        return snapshot == null ? Optional.empty() : Optional.of(snapshot.value());
    }

    /**
     * Subscribes to the value; the latest value, if any, is queued immediately.
     */
    public Subscription<T> subscribe(String context) {
        Subscription<T> subscription = hub.subscribe(context, Set.of());
        PublishedValue<T> snapshot = latest;
        if (snapshot != null) {
            hub.deliverTo(subscription, snapshot);
        }
        return subscription;
    }

    /**
     * Stops background recomputation. The hub stays open.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
