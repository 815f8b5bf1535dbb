package gr.imsi.athenarc.historian.export;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import gr.imsi.athenarc.historian.HistorianExportException;
import gr.imsi.athenarc.historian.datasource.TagStore;
import gr.imsi.athenarc.historian.datasource.connection.ConnectionPool;
import gr.imsi.athenarc.historian.datasource.connection.DatabaseConnection;
import gr.imsi.athenarc.historian.domain.Tag;
import gr.imsi.athenarc.historian.domain.TimeRange;
import gr.imsi.athenarc.historian.fetch.ChunkedBucketFetcher;
import gr.imsi.athenarc.historian.fetch.FetchCancelledException;
import gr.imsi.athenarc.historian.fetch.FetchMode;
import gr.imsi.athenarc.historian.fetch.TagSeries;
import gr.imsi.athenarc.historian.merge.FillPolicy;
import gr.imsi.athenarc.historian.merge.MergedTable;
import gr.imsi.athenarc.historian.merge.SeriesMerger;
import gr.imsi.athenarc.historian.tag.DropReason;
import gr.imsi.athenarc.historian.tag.DroppedTag;
import gr.imsi.athenarc.historian.tag.TagNaming;
import gr.imsi.athenarc.historian.tag.TagResolution;
import gr.imsi.athenarc.historian.tag.TagResolver;

/**
 * Runs an export from raw tags to a written file: resolve the tags, fetch them in parallel,
 * merge the series and write the table. Tags that cannot be used are dropped and reported, the
 * export fails only when nothing is left.
 *
 * @param <C> the connection type of the store
 */
public class ExportPipeline<C extends DatabaseConnection> {

    private static final Logger LOG = LoggerFactory.getLogger(ExportPipeline.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final TagStore<C> store;
    private final ConnectionPool<C> pool;
    private final TagResolver<C> resolver;
    private final ExportSink sink;
    private final Path outputDirectory;
    private final Duration chunkWidth;
    private final FillPolicy fillPolicy;
    private final FetchMode mode;
    private final int parallelism;
    private final Duration requestTimeout;
    private final Clock clock;

    private ExportPipeline(Builder<C> builder) {
        this.store = builder.store;
        this.pool = builder.pool;
        this.resolver = new TagResolver<>(builder.naming, builder.store, builder.pool);
        this.sink = builder.sink;
        this.outputDirectory = builder.outputDirectory;
        this.chunkWidth = builder.chunkWidth;
        this.fillPolicy = builder.fillPolicy;
        this.mode = builder.mode;
        this.parallelism = builder.parallelism > 0 ? builder.parallelism : builder.pool.size();
        this.requestTimeout = builder.requestTimeout;
        this.clock = builder.clock;
    }

    public static <C extends DatabaseConnection> Builder<C> builder(TagStore<C> store, ConnectionPool<C> pool) {
        return new Builder<>(store, pool);
    }

    /**
     * @throws InvalidExportRequestException if the request is malformed or asks for a mode the
     *         store does not support; nothing is queried in that case
     * @throws gr.imsi.athenarc.historian.tag.NoValidTagsException if no tag exists in the store
     * @throws NoDataException if no valid tag has data in the range
     * @throws gr.imsi.athenarc.historian.merge.MergeException if the fetched series cannot be aligned
     * @throws ExportException if the output cannot be written
     */
    public ExportResult run(ExportRequest request) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        request.validate();
        FetchMode requestMode = request.getMode() != null ? request.getMode() : mode;
        if (requestMode == FetchMode.NATIVE_RESAMPLE && !store.supportsNativeResampling()) {
            throw new InvalidExportRequestException("Native resampling is not supported by this data source");
        }
        List<Tag> tags;
        try {
            tags = resolver.normalizeAll(request.getTags());
        } catch (IllegalArgumentException e) {
            throw new InvalidExportRequestException(e.getMessage(), e);
        }
        LOG.info("Starting {} with {} tags", request, tags.size());

        TagResolution resolution = resolver.validate(tags);
        List<DroppedTag> dropped = new ArrayList<>(resolution.getDroppedTags());

        ChunkedBucketFetcher<C> fetcher = new ChunkedBucketFetcher<>(store, pool, chunkWidth, requestMode);
        List<TagSeries> series = fetchAll(fetcher, resolution.getValidTags(), request, dropped);

        int skippedChunks = 0;
        List<TagSeries> withData = new ArrayList<>();
        for (TagSeries s : series) {
            skippedChunks += s.getSkippedChunks();
            if (s.hasData()) {
                withData.add(s);
            } else {
                dropped.add(new DroppedTag(s.getTag(), DropReason.NO_DATA,
                        "No data in range (" + s.getSkippedChunks() + " chunks skipped)"));
            }
        }

        FillPolicy requestFill = request.getFillPolicy() != null ? request.getFillPolicy() : fillPolicy;
        MergedTable table = new SeriesMerger(requestFill).merge(withData);
        if (table.isEmpty()) {
            LOG.error("No data found for any tag of {}", request);
            throw new NoDataException(dropped);
        }

        Path output = outputDirectory.resolve(request.getName() + "_"
                + LocalDateTime.now(clock).format(FILE_TIMESTAMP) + sink.getExtension());
        sink.write(table, output);

        ExportResult result = new ExportResult(request, output, table.getRowCount(), table.getColumns(),
                dropped, skippedChunks, stopwatch.stop().elapsed());
        LOG.info("Export finished in {}: {}", stopwatch, result);
        return result;
    }

    /**
     * Fetches every tag on its own worker, waiting at most the request timeout for all of them.
     * Tags that did not finish in time are cancelled and dropped as timed out.
     */
    private List<TagSeries> fetchAll(ChunkedBucketFetcher<C> fetcher, List<Tag> tags, ExportRequest request,
                                     List<DroppedTag> dropped) {
        TimeRange range = request.getRange();
        List<Callable<TagSeries>> tasks = new ArrayList<>();
        for (Tag tag : tags) {
            tasks.add(() -> fetcher.fetch(tag, range, request.getInterval()));
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, tags.size()),
                new ThreadFactoryBuilder().setNameFormat("fetch-" + request.getName().replace("%", "%%") + "-%d").setDaemon(true).build());
        List<TagSeries> series = new ArrayList<>();
        try {
            List<Future<TagSeries>> futures = executor.invokeAll(tasks, requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            for (int i = 0; i < futures.size(); i++) {
                Tag tag = tags.get(i);
                try {
                    series.add(futures.get(i).get());
                } catch (CancellationException e) {
                    LOG.warn("Fetch of {} did not finish within {}", tag, requestTimeout);
                    dropped.add(new DroppedTag(tag, DropReason.TIMED_OUT, "Not finished within " + requestTimeout));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof FetchCancelledException) {
                        dropped.add(new DroppedTag(tag, DropReason.TIMED_OUT, cause.getMessage()));
                    } else {
                        LOG.error("Fetch of {} failed", tag, cause);
                        dropped.add(new DroppedTag(tag, DropReason.FETCH_FAILED, String.valueOf(cause.getMessage())));
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HistorianExportException("Interrupted while exporting " + request.getName(), e);
        } finally {
            executor.shutdownNow();
        }
        return series;
    }

    public static class Builder<C extends DatabaseConnection> {
        private final TagStore<C> store;
        private final ConnectionPool<C> pool;
        private TagNaming naming = TagNaming.undecorated();
        private ExportSink sink = new CsvExportSink();
        private Path outputDirectory = Paths.get(".");
        private Duration chunkWidth = ChunkedBucketFetcher.DEFAULT_CHUNK_WIDTH;
        private FillPolicy fillPolicy = FillPolicy.FORWARD_BACKWARD;
        private FetchMode mode = FetchMode.AGGREGATE;
        private int parallelism;
        private Duration requestTimeout = Duration.ofMinutes(30);
        private Clock clock = Clock.systemUTC();

        private Builder(TagStore<C> store, ConnectionPool<C> pool) {
            this.store = Preconditions.checkNotNull(store, "No tag store specified.");
            this.pool = Preconditions.checkNotNull(pool, "No connection pool specified.");
        }

        public Builder<C> naming(TagNaming naming) {
            this.naming = naming;
            return this;
        }

        public Builder<C> sink(ExportSink sink) {
            this.sink = sink;
            return this;
        }

        public Builder<C> outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder<C> chunkWidth(Duration chunkWidth) {
            this.chunkWidth = chunkWidth;
            return this;
        }

        public Builder<C> fillPolicy(FillPolicy fillPolicy) {
            this.fillPolicy = fillPolicy;
            return this;
        }

        public Builder<C> mode(FetchMode mode) {
            this.mode = mode;
            return this;
        }

        /**
         * @param parallelism number of tags fetched at once; zero or less uses the pool size
         */
        public Builder<C> parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder<C> requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder<C> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ExportPipeline<C> build() {
            Preconditions.checkArgument(requestTimeout != null && requestTimeout.toMillis() > 0,
                    "Request timeout must be positive");
            return new ExportPipeline<>(this);
        }
    }
}
