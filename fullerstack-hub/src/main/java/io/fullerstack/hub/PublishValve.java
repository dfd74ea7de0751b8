package io.fullerstack.hub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * PublishValve - runs a hub's fan-out tasks on one background thread.
 * <p>
 * <b>Design:</b>
 * <ul>
 * <li>Unbounded FIFO ingress queue, so publishers never wait for subscribers</li>
 * <li>One daemon processor thread, so fan-out happens in submission order</li>
 * <li>Processor blocks on {@link BlockingQueue#take()} while the queue is empty</li>
 * <li>{@link #await()} parks callers until the queue is drained</li>
 * </ul>
 * <p>
 * <b>Usage:</b>
 * <pre>
 * PublishValve valve = new PublishValve("hub-orders");
 * valve.submit(() -> fanOut(value));
 * valve.await();
 * valve.close();
 * </pre>
 */
final class PublishValve implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PublishValve.class);

    private final String name;
    private final BlockingQueue<Runnable> ingressQueue = new LinkedBlockingQueue<>();
    private final Thread processor;
    private volatile boolean running = true;

    // Submitted but not yet finished, including the task currently running
    private final AtomicInteger inFlight = new AtomicInteger();

    // Synchronization for event-driven await()
    private final Object idleLock = new Object();

    PublishValve(String name) {
        this.name = name;
        this.processor = new Thread(this::processQueue, name);
        this.processor.setDaemon(true);
        this.processor.start();
    }

    /**
     * @param task the task to execute
     * @return true if task was accepted, false if valve is closed
     */
    boolean submit(Runnable task) {
        if (task != null && running) {
            inFlight.incrementAndGet();
            if (ingressQueue.offer(task)) {
                return true;
            }
            inFlight.decrementAndGet();
        }
        return false;
    }

    /**
     * Blocks until all queued tasks are executed and the valve is idle.
     *
     * @throws IllegalStateException if called from the valve's own thread
     * @throws HubException          if interrupted while waiting
     */
    void await() {
        if (Thread.currentThread() == processor) {
            throw new IllegalStateException("Cannot await the publish worker from within its own thread");
        }

        synchronized (idleLock) {
            while (running && inFlight.get() > 0) {
                try {
                    idleLock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new HubException("Interrupted while waiting for '" + name + "' to drain", e);
                }
            }
        }
    }

    boolean isIdle() {
        return inFlight.get() == 0;
    }

    int pending() {
        return inFlight.get();
    }

    private void processQueue() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                Runnable task = ingressQueue.take();
                try {
                    task.run();
                } catch (RuntimeException e) {
                    // Keep the worker alive; one failed fan-out must not stop the hub
                    logger.error("Publish task failed in '{}'", name, e);
                } finally {
                    if (inFlight.decrementAndGet() == 0) {
                        notifyIdle();
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        logger.debug("Publish worker '{}' stopped", name);
    }

    private void notifyIdle() {
        synchronized (idleLock) {
            idleLock.notifyAll();
        }
    }

    /**
     * Stops the processor thread, discarding tasks that have not started.
     * Waits up to 1 second for the running task to finish.
     */
    @Override
    public void close() {
        if (running) {
            running = false;
            processor.interrupt();

            synchronized (idleLock) {
                idleLock.notifyAll();
            }

            if (Thread.currentThread() != processor) {
                try {
                    processor.join(1000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            ingressQueue.clear();
            inFlight.set(0);
        }
    }

    String getName() {
        return name;
    }
}
