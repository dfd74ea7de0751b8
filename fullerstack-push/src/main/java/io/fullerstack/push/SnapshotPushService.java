package io.fullerstack.push;

import io.fullerstack.hub.HubClosedException;
import io.fullerstack.hub.HubListener;
import io.fullerstack.hub.HubOptions;
import io.fullerstack.hub.Subscription;
import io.fullerstack.hub.SubscriptionHub;
import io.fullerstack.series.LoopingSeriesStore;
import io.fullerstack.series.model.SeriesDefinition;
import io.fullerstack.series.model.SeriesSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Turns the pull-only {@link LoopingSeriesStore} into a push source.
 * <p>
 * A timer polls the current value of every series that at least one subscriber
 * watches and publishes each value that differs from the last one published for
 * that series. Values are published on the hub with the series id as topic, so
 * each subscriber only sees the series it asked for.
 * <p>
 * <b>Usage:</b>
 * <pre>
 * SnapshotPushService push = SnapshotPushService.create(store, SnapshotPushOptions.defaults());
 * push.start();
 * Subscription&lt;SeriesSample&gt; flow = push.subscribe("dashboard", List.of("Flow"));
 * flow.stream().forEach(sample -&gt; render(sample));
 * </pre>
 */
public class SnapshotPushService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotPushService.class);

    private final LoopingSeriesStore store;
    private final SubscriptionHub<SeriesSample> hub;
    private final boolean ownsHub;
    private final SnapshotPushOptions options;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    // Reference counts per watched series id and the ids each subscription holds; guarded by watchLock
    private final Object watchLock = new Object();
    private final Map<String, Integer> watchCounts = new LinkedHashMap<>();
    private final Map<Long, Set<String>> watchesBySubscription = new HashMap<>();

    private final Object pollLock = new Object();
    private final Map<String, SeriesSample> lastPublished = new ConcurrentHashMap<>();
    private final HubListener<SeriesSample> cancellationListener = new HubListener<>() {
        @Override
        public void onSubscriptionCancelled(Subscription<SeriesSample> subscription) {
            unwatch(subscription.getId());
        }
    };

    private volatile Consumer<? super RuntimeException> errorCallback;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean running;
    private volatile boolean closed;

    /**
     * Pushes onto a caller-supplied hub, which stays open when this service closes.
     * The hub should not interpret wildcards, since series ids are used as topics.
     * A subscriber that joins a series somebody already watches gets the last
     * pushed value straight away, whether or not the hub retains values.
     */
    public SnapshotPushService(LoopingSeriesStore store, SubscriptionHub<SeriesSample> hub,
                               SnapshotPushOptions options, Clock clock) {
        this(store, hub, false, options, clock);
    }

    private SnapshotPushService(LoopingSeriesStore store, SubscriptionHub<SeriesSample> hub, boolean ownsHub,
                                SnapshotPushOptions options, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.hub = Objects.requireNonNull(hub, "hub cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.ownsHub = ownsHub;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "snapshot-push-" + hub.getId());
            t.setDaemon(true);
            return t;
        });
        hub.addListener(cancellationListener);
    }

    /**
     * Creates a service with its own hub. The hub retains the last value per
     * series, so late subscribers get the current value at once, and is closed
     * together with the service.
     */
    public static SnapshotPushService create(LoopingSeriesStore store, SnapshotPushOptions options) {
        Objects.requireNonNull(options, "options cannot be null");
        HubOptions hubOptions = HubOptions.builder()
            .id("snapshot-push-" + UUID.randomUUID())
            .retainLastValue(true)
            .wildcardTopics(false)
            .channelCapacity(options.getHubChannelCapacity())
            .build();
        return new SnapshotPushService(store, new SubscriptionHub<>(hubOptions), true, options, store.getClock());
    }

    /**
     * Reports poll failures to {@code callback} as well as to the log.
     */
    public SnapshotPushService onPollError(Consumer<? super RuntimeException> callback) {
        this.errorCallback = callback;
        return this;
    }

    /**
     * Starts polling. The first poll happens one interval from now.
     */
    public void start() {
        if (closed) {
            throw new IllegalStateException("SnapshotPushService is closed");
        }
        if (running) {
            logger.warn("SnapshotPushService for hub '{}' already running", hub.getId());
            return;
        }

        long intervalMs = options.getPollingInterval().toMillis();
        logger.info("Starting snapshot push for hub '{}' every {} ms", hub.getId(), intervalMs);
        running = true;
        pollTask = scheduler.scheduleAtFixedRate(this::scheduledPoll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Stops polling; {@link #start()} may be called again.
     */
    public void stop() {
        if (!running) {
            return;
        }
        logger.info("Stopping snapshot push for hub '{}'", hub.getId());
        running = false;
        ScheduledFuture<?> task = pollTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Subscribes to the given series. Names are resolved to ids; unknown series
     * are skipped. The current value of each series nobody watched before is
     * published straight away, and the last pushed value of every other series
     * is sent to the new subscription.
     *
     * @throws HubClosedException if this service or its hub is closed
     */
    public Subscription<SeriesSample> subscribe(String context, Collection<String> series) {
        Objects.requireNonNull(series, "series cannot be null");
        if (closed) {
            throw new HubClosedException(hub.getId());
        }
        Set<String> ids = resolveIds(series);

        // An empty topic set would receive every series
        Collection<String> topics = ids.isEmpty() ? new LinkedHashSet<>(series) : ids;
        if (topics.isEmpty()) {
            throw new IllegalArgumentException("series cannot be empty");
        }
        Subscription<SeriesSample> subscription = hub.subscribe(context, topics);

        Set<String> newlyWatched = watch(subscription.getId(), ids);
        if (subscription.isClosed()) {
            // Cancelled before the watch was recorded, so the hub listener found nothing to release
            unwatch(subscription.getId());
            return subscription;
        }
        if (!hub.getOptions().isRetainLastValue()) {
            Set<String> alreadyWatched = new LinkedHashSet<>(ids);
            alreadyWatched.removeAll(newlyWatched);
            sendLastPublished(subscription, alreadyWatched);
        }
        schedulePoll(newlyWatched);
        return subscription;
    }

    /**
     * Adds series to, and removes series from, a live subscription. Names are
     * resolved to ids like in {@link #subscribe}. Added series that nobody watched
     * before are polled straight away; for the others the last pushed value is
     * sent to this subscription. Does nothing if the subscription is cancelled.
     *
     * @throws HubClosedException       if this service or its hub is closed
     * @throws IllegalArgumentException if the subscription belongs to another hub,
     *                                  or the change would leave it without series
     */
    public void updateSeries(Subscription<SeriesSample> subscription, Collection<String> add, Collection<String> remove) {
        Objects.requireNonNull(subscription, "subscription cannot be null");
        Collection<String> toAdd = add == null ? List.of() : add;
        Collection<String> toRemove = remove == null ? List.of() : remove;
        if (closed) {
            throw new HubClosedException(hub.getId());
        }
        if (subscription.isClosed()) {
            return;
        }

        Set<String> addIds = resolveIds(toAdd);
        Set<String> removeIds = resolveIds(toRemove);

        // Unresolved names become topics, as in subscribe, so removing them must work too
        Set<String> addTopics = new LinkedHashSet<>(addIds.isEmpty() ? toAdd : addIds);
        Set<String> removeTopics = new LinkedHashSet<>(removeIds);
        removeTopics.addAll(toRemove);
        // Removal wins for a series named on both sides
        addTopics.removeAll(removeTopics);
        addIds.removeAll(removeIds);

        Set<String> remainingTopics = new LinkedHashSet<>(subscription.getTopics());
        remainingTopics.addAll(addTopics);
        remainingTopics.removeAll(removeTopics);
        if (remainingTopics.isEmpty()) {
            // An empty topic set would receive every series
            throw new IllegalArgumentException("Subscription " + subscription.getId()
                + " would be left without series; close it instead");
        }
        hub.updateTopics(subscription, addTopics, removeTopics);

        Set<String> added = new LinkedHashSet<>();
        Set<String> newlyWatched = new LinkedHashSet<>();
        synchronized (watchLock) {
            Set<String> watched = new LinkedHashSet<>(watchesBySubscription.getOrDefault(subscription.getId(), Set.of()));
            for (String id : addIds) {
                if (watched.add(id)) {
                    added.add(id);
                    if (watchCounts.merge(id, 1, Integer::sum) == 1) {
                        newlyWatched.add(id);
                    }
                }
            }
            for (String id : removeIds) {
                if (watched.remove(id)) {
                    release(id);
                }
            }
            watchesBySubscription.put(subscription.getId(), watched);
        }
        logger.debug("Push subscription {} added {} and removed {}", subscription.getId(), added, removeIds);

        if (subscription.isClosed()) {
            unwatch(subscription.getId());
            return;
        }
        added.removeAll(newlyWatched);
        sendLastPublished(subscription, added);
        schedulePoll(newlyWatched);
    }

    /**
     * Polls every watched series once on the calling thread.
     *
     * @return number of values published
     */
    public int pollOnce() {
        return poll(watchedIds());
    }

    /**
     * @return ids of the series at least one open subscription watches
     */
    public Set<String> watchedSeries() {
        synchronized (watchLock) {
            return Set.copyOf(watchCounts.keySet());
        }
    }

    public SubscriptionHub<SeriesSample> getHub() {
        return hub;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        hub.removeListener(cancellationListener);
        if (ownsHub) {
            hub.close();
        }
        synchronized (watchLock) {
            watchCounts.clear();
            watchesBySubscription.clear();
        }
        lastPublished.clear();
    }

    private Set<String> resolveIds(Collection<String> series) {
        if (series.isEmpty()) {
            return new LinkedHashSet<>();
        }
        return store.getSeries(series).stream()
            .map(SeriesDefinition::id)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private void schedulePoll(Set<String> newlyWatched) {
        if (newlyWatched.isEmpty()) {
            return;
        }
        try {
            scheduler.execute(() -> pollGuarded(newlyWatched));
        } catch (RejectedExecutionException e) {
            logger.debug("Initial poll for {} rejected: service closed", newlyWatched);
        }
    }

    // Under pollLock, so no poll can publish a newer value for these series in between
    private void sendLastPublished(Subscription<SeriesSample> subscription, Set<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        synchronized (pollLock) {
            for (String id : ids) {
                SeriesSample last = lastPublished.get(id);
                if (last != null) {
                    hub.publishTo(subscription, last, id);
                }
            }
        }
    }

    private int poll(Collection<String> ids) {
        if (ids.isEmpty() || closed) {
            return 0;
        }
        synchronized (pollLock) {
            int published = 0;
            for (SeriesSample sample : store.readSnapshot(clock.instant(), ids)) {
                if (!isWatched(sample.seriesId())) {
                    continue;
                }
                SeriesSample previous = lastPublished.put(sample.seriesId(), sample);
                if (previous != null && sample.point().equals(previous.point())) {
                    continue;
                }
                hub.publish(sample, sample.seriesId());
                published++;
            }
            logger.debug("Snapshot poll of {} series published {} values", ids.size(), published);
            return published;
        }
    }

    private void scheduledPoll() {
        pollGuarded(watchedIds());
    }

    private List<String> watchedIds() {
        synchronized (watchLock) {
            return new ArrayList<>(watchCounts.keySet());
        }
    }

    // Runs on the scheduler thread; nothing may escape or the timer stops
    private void pollGuarded(Collection<String> ids) {
        try {
            poll(ids);
        } catch (CancellationException e) {
            logger.debug("Snapshot poll cancelled");
        } catch (HubClosedException e) {
            logger.debug("Hub '{}' closed; snapshot polling stops", hub.getId());
            stop();
        } catch (RuntimeException e) {
            logger.error("Snapshot poll for hub '{}' failed", hub.getId(), e);
            Consumer<? super RuntimeException> callback = errorCallback;
            if (callback != null) {
                try {
                    callback.accept(e);
                } catch (RuntimeException callbackFailure) {
                    logger.warn("Poll error callback threw", callbackFailure);
                }
            }
        }
    }

    private Set<String> watch(long subscriptionId, Set<String> ids) {
        Set<String> newlyWatched = new LinkedHashSet<>();
        synchronized (watchLock) {
            watchesBySubscription.put(subscriptionId, ids);
            for (String id : ids) {
                if (watchCounts.merge(id, 1, Integer::sum) == 1) {
                    newlyWatched.add(id);
                }
            }
        }
        return newlyWatched;
    }

    private void unwatch(long subscriptionId) {
        synchronized (watchLock) {
            Set<String> ids = watchesBySubscription.remove(subscriptionId);
            if (ids == null) {
                return;
            }
            ids.forEach(this::release);
        }
    }

    // Caller holds watchLock
    private void release(String id) {
        Integer remaining = watchCounts.computeIfPresent(id, (key, count) -> count > 1 ? count - 1 : null);
        if (remaining == null) {
            lastPublished.remove(id);
            logger.debug("Series '{}' no longer watched", id);
        }
    }

    private boolean isWatched(String id) {
        synchronized (watchLock) {
            return watchCounts.containsKey(id);
        }
    }
}
