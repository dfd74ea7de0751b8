package io.fullerstack.series;

import io.fullerstack.series.engine.RawReader;
import io.fullerstack.series.engine.SnapshotReader;
import io.fullerstack.series.load.CsvDatasetLoader;
import io.fullerstack.series.load.Dataset;
import io.fullerstack.series.model.SeriesDefinition;
import io.fullerstack.series.model.SeriesSample;
import io.fullerstack.series.query.CancellationSignal;
import io.fullerstack.series.query.RawQuery;
import io.fullerstack.series.query.SeriesFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.Consumer;

/**
 * Read-only time-series store over a dataset loaded once in the background.
 *
 * <p>Every query waits for the load to finish. If the load failed, each query
 * throws {@link DatasetUnavailableException} with the load failure as cause.
 * After loading, queries are lock-free reads of immutable data and may run in
 * parallel. The only mutation is {@link #addSeries(SeriesDefinition)}, which
 * swaps in a new definition index.
 *
 * <p>With looping enabled, the recorded window repeats endlessly in both
 * directions; see {@link SnapshotReader} and {@link RawReader}.
 *
 * <pre>
 * try (LoopingSeriesStore store = LoopingSeriesStore.open(options, true)) {
 *     List&lt;SeriesSample&gt; now = store.readSnapshot(List.of("Flow", "Pressure"));
 * }
 * </pre>
 */
public class LoopingSeriesStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LoopingSeriesStore.class);

    private final CompletableFuture<Dataset> dataset;
    private final ExecutorService loader;
    private final Clock clock;
    private final Object indexLock = new Object();

    private volatile SeriesIndex index;
    private volatile boolean closed;

    private LoopingSeriesStore(CompletableFuture<Dataset> dataset, ExecutorService loader, Clock clock) {
        this.dataset = dataset;
        this.loader = loader;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Starts loading in the background and returns at once.
     *
     * @throws SeriesConfigurationException if the options are invalid before any data is read
     */
    public static LoopingSeriesStore open(SeriesStoreOptions options) {
        return open(options, false, Clock.systemUTC());
    }

    /**
     * @param awaitLoad wait for the load and throw its failure directly
     * @throws SeriesConfigurationException if the options are invalid or, when
     *                                      {@code awaitLoad} is set, the source cannot be read
     */
    public static LoopingSeriesStore open(SeriesStoreOptions options, boolean awaitLoad) {
        return open(options, awaitLoad, Clock.systemUTC());
    }

    public static LoopingSeriesStore open(SeriesStoreOptions options, boolean awaitLoad, Clock clock) {
        CsvDatasetLoader csv = CsvDatasetLoader.create(options);
        ExecutorService loader = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "series-loader");
            t.setDaemon(true);
            return t;
        });
        CompletableFuture<Dataset> future = new CompletableFuture<>();
        LoopingSeriesStore store = new LoopingSeriesStore(future, loader, clock);
        loader.execute(() -> store.complete(() -> csv.load(CancellationSignal.NONE)));
        loader.shutdown();
        if (awaitLoad) {
            store.awaitLoad();
        }
        return store;
    }

    /**
     * A store over an already built dataset.
     */
    public static LoopingSeriesStore of(Dataset dataset) {
        return of(dataset, Clock.systemUTC());
    }

    public static LoopingSeriesStore of(Dataset dataset, Clock clock) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        LoopingSeriesStore store = new LoopingSeriesStore(new CompletableFuture<>(), null, clock);
        store.complete(() -> dataset);
        return store;
    }

    private void complete(Callable<Dataset> load) {
        try {
            Dataset loaded = load.call();
            index = new SeriesIndex(loaded.definitions());
            dataset.complete(loaded);
        } catch (Exception e) {
            logger.error("Loading series dataset failed", e);
            dataset.completeExceptionally(e);
        }
    }

    /**
     * Waits for the load.
     *
     * @return the loaded dataset
     * @throws SeriesException            the load failure itself, when it was a series error
     * @throws DatasetUnavailableException for any other load failure or if the store was closed first
     */
    public Dataset awaitLoad() {
        try {
            return dataset.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof SeriesException) {
                throw (SeriesException) e.getCause();
            }
            throw new DatasetUnavailableException("Series dataset failed to load", e.getCause());
        } catch (CancellationException e) {
            throw new DatasetUnavailableException("Series store was closed before loading finished", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting for the series dataset");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    public boolean isLoaded() {
        return dataset.isDone() && !dataset.isCompletedExceptionally();
    }

    /**
     * Series whose name, description and units match the filter, ordered by name
     * and paged.
     */
    public List<SeriesDefinition> findSeries(SeriesFilter filter) {
        Objects.requireNonNull(filter, "filter cannot be null");
        return filter.apply(loadedIndex().definitions());
    }

    /**
     * Looks each entry up by id, then by name, ignoring case. Unknown entries are
     * skipped.
     */
    public List<SeriesDefinition> getSeries(Collection<String> idsOrNames) {
        Objects.requireNonNull(idsOrNames, "idsOrNames cannot be null");
        return loadedIndex().resolveAll(idsOrNames);
    }

    public Optional<SeriesDefinition> getSeries(String idOrName) {
        return loadedIndex().resolve(idOrName);
    }

    /**
     * Current value of each series, using this store's clock.
     */
    public List<SeriesSample> readSnapshot(Collection<String> idsOrNames) {
        return readSnapshot(clock.instant(), idsOrNames);
    }

    public List<SeriesSample> readSnapshot(Instant now, Collection<String> idsOrNames) {
        List<SeriesSample> samples = new ArrayList<>();
        readSnapshot(now, idsOrNames, CancellationSignal.NONE, samples::add);
        return samples;
    }

    /**
     * Streams the value of each series as of {@code now}.
     *
     * @throws CancellationException if {@code signal} is cancelled
     */
    public void readSnapshot(Instant now, Collection<String> idsOrNames, CancellationSignal signal,
                             Consumer<? super SeriesSample> sink) {
        Objects.requireNonNull(now, "now cannot be null");
        Objects.requireNonNull(idsOrNames, "idsOrNames cannot be null");
        Objects.requireNonNull(signal, "signal cannot be null");
        Objects.requireNonNull(sink, "sink cannot be null");
        Dataset loaded = loadedDataset();
        SnapshotReader.read(loaded, index.resolveAll(idsOrNames), now, signal, sink);
    }

    public List<SeriesSample> readRaw(RawQuery query) {
        List<SeriesSample> samples = new ArrayList<>();
        readRaw(query, CancellationSignal.NONE, samples::add);
        return samples;
    }

    /**
     * Streams raw history. With looping enabled a range far outside the recorded
     * window can take a long time; the signal is checked on every window
     * repetition and every emitted sample.
     *
     * @throws CancellationException if {@code signal} is cancelled
     */
    public void readRaw(RawQuery query, CancellationSignal signal, Consumer<? super SeriesSample> sink) {
        Objects.requireNonNull(query, "query cannot be null");
        Objects.requireNonNull(signal, "signal cannot be null");
        Objects.requireNonNull(sink, "sink cannot be null");
        Dataset loaded = loadedDataset();
        RawReader.read(loaded, index.resolveAll(query.series()), query, signal, sink);
    }

    /**
     * Adds a series with no points.
     *
     * @throws IllegalArgumentException if a series with the same id, ignoring case, exists
     */
    public SeriesDefinition addSeries(SeriesDefinition definition) {
        Objects.requireNonNull(definition, "definition cannot be null");
        loadedDataset();
        synchronized (indexLock) {
            if (index.containsId(definition.id())) {
                throw new IllegalArgumentException("Series '" + definition.id() + "' already exists");
            }
            index = index.with(definition);
        }
        logger.debug("Added series '{}'", definition.id());
        return definition;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Abandons a load still in progress. Queries made afterwards fail with
     * {@link DatasetUnavailableException} if no dataset was loaded.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (dataset.cancel(false)) {
            logger.debug("Series load cancelled by close");
        }
        if (loader != null) {
            loader.shutdownNow();
        }
    }

    private Dataset loadedDataset() {
        try {
            return dataset.get();
        } catch (ExecutionException e) {
            throw new DatasetUnavailableException("Series dataset is unavailable: " + e.getCause().getMessage(), e.getCause());
        } catch (CancellationException e) {
            throw new DatasetUnavailableException("Series store was closed before loading finished", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting for the series dataset");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    private SeriesIndex loadedIndex() {
        loadedDataset();
        return index;
    }
}
