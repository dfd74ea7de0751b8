package io.fullerstack.hub;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Outbound queue of a single subscription.
 *
 * <p>The hub's fan-out is the only producer and the subscription's consumer the
 * only reader. Offers never block: a full bounded queue applies its
 * {@link OverflowPolicy} instead. Closing wakes every waiting consumer and drops
 * whatever is still queued.
 */
final class SubscriberQueue<T> {

    enum Offer {
        ACCEPTED,
        EVICTED_OLDEST,
        REJECTED,
        CLOSED
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final ArrayDeque<T> items = new ArrayDeque<>();
    private final int capacity;
    private final OverflowPolicy policy;
    private boolean closed;

    SubscriberQueue(int capacity, OverflowPolicy policy) {
        this.capacity = capacity;
        this.policy = policy;
    }

    Offer offer(T item) {
        lock.lock();
        try {
            if (closed) {
                return Offer.CLOSED;
            }
            Offer outcome = Offer.ACCEPTED;
            if (capacity > 0 && items.size() >= capacity) {
                if (policy == OverflowPolicy.DROP_NEWEST) {
                    return Offer.REJECTED;
                }
                items.pollFirst();
                outcome = Offer.EVICTED_OLDEST;
            }
            items.addLast(item);
            notEmpty.signal();
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the next item.
     *
     * @return the next item, or {@code null} once the queue is closed
     */
    T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) {
                notEmpty.await();
            }
            return items.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next item.
     *
     * @return the next item, or {@code null} on timeout or once the queue is closed
     */
    T poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) {
                if (remaining <= 0L) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return items.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    void close() {
        lock.lock();
        try {
            closed = true;
            items.clear();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
