package de.bsommerfeld.wsbg.archive.ingest;

import de.bsommerfeld.wsbg.archive.client.FetchOutcome;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.BadRequest;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.EmptyPage;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.NotFound;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.PermanentFailure;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.Success;
import de.bsommerfeld.wsbg.archive.client.PageFetcher;
import de.bsommerfeld.wsbg.archive.client.SearchQuery;
import de.bsommerfeld.wsbg.archive.core.config.ArchiveConfig;
import de.bsommerfeld.wsbg.archive.core.config.IngestConfig;
import de.bsommerfeld.wsbg.archive.core.domain.ArchiveRecord;
import de.bsommerfeld.wsbg.archive.core.domain.ContentType;
import de.bsommerfeld.wsbg.archive.core.event.IngestEventBus;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.ContentConsolidated;
import de.bsommerfeld.wsbg.archive.core.util.Sleeper;
import de.bsommerfeld.wsbg.archive.storage.Checkpoint;
import de.bsommerfeld.wsbg.archive.storage.CheckpointStore;
import de.bsommerfeld.wsbg.archive.storage.ColumnarStore;
import de.bsommerfeld.wsbg.archive.storage.OutputLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Runs the page loop for one (subreddit, content type): recover leftovers,
 * decide between resume, refresh and fresh start, page backward until the
 * data, the row cap or a resource cap runs out, then merge.
 *
 * <h3>Starting point</h3>
 * <ul>
 * <li>A consistent cursor resumes its chunk sequence, counts and frontier,
 * regardless of freshness.</li>
 * <li>Otherwise a fresh consolidated file skips the content type without a
 * request.</li>
 * <li>A stale consolidated file seeds the frontier with its oldest
 * {@code created_utc}, so the refresh extends history backward.</li>
 * </ul>
 *
 * <h3>Ending pagination</h3>
 * An empty page, a 404, a non-retryable 4xx, the row cap or a resource cap
 * end the loop normally and the chunks are merged. A page without a single
 * valid record, or one without a record older than the frontier, also ends
 * it; the archive would otherwise be asked for the same page forever.
 * Records at or above the frontier are dropped, which keeps the frontier
 * monotonically non-increasing.
 *
 * <p>
 * A {@link PermanentFailure} flushes the buffer, keeps cursor and chunks for
 * the next run, and fails the content type.
 */
public class ContentIngestor {

    private static final Logger LOG = LoggerFactory.getLogger(ContentIngestor.class);

    private final PageFetcher fetcher;
    private final ColumnarStore store;
    private final CheckpointStore checkpoints;
    private final ChunkMerger merger;
    private final FreshnessPolicy freshness;
    private final OutputLayout layout;
    private final IngestConfig config;
    private final ArchiveConfig archiveConfig;
    private final Sleeper sleeper;
    private final Clock clock;
    private final IngestEventBus eventBus;

    public ContentIngestor(PageFetcher fetcher, ColumnarStore store, CheckpointStore checkpoints,
            ChunkMerger merger, FreshnessPolicy freshness, OutputLayout layout, IngestConfig config,
            ArchiveConfig archiveConfig, Sleeper sleeper, Clock clock, IngestEventBus eventBus) {
        this.fetcher = fetcher;
        this.store = store;
        this.checkpoints = checkpoints;
        this.merger = merger;
        this.freshness = freshness;
        this.layout = layout;
        this.config = config;
        this.archiveConfig = archiveConfig;
        this.sleeper = sleeper;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    public ContentResult ingest(String subreddit, ContentType type, ResourceGovernor governor, IngestStats stats) {
        ChunkWriter writer = null;
        long resumedRows = 0;
        try {
            Path consolidated = layout.consolidated(subreddit, type);
            Optional<Checkpoint> checkpoint = merger.recover(subreddit, type);
            if (checkpoint.isPresent()) {
                Checkpoint cp = checkpoint.get();
                resumedRows = cp.rowsFlushed();
                stats.subredditsResumed++;
                LOG.info("Resuming {}/{} from chunk {} ({} rows, frontier {})",
                        subreddit, type, cp.chunksWritten(), cp.rowsFlushed(), cp.oldestUtcSeen());
                writer = ChunkWriter.resume(store, checkpoints, layout, clock,
                        config.getChunkSize(), config.getMaxBufferBytes(), cp);
            } else {
                if (freshness.isFresh(consolidated)) {
                    LOG.info("{} is fresh ({} days old), skipping", consolidated.getFileName(),
                            String.format("%.1f", freshness.ageDays(consolidated)));
                    stats.subredditsSkippedFresh++;
                    return ContentResult.skippedFresh();
                }
                Long seed = null;
                if (Files.exists(consolidated)) {
                    OptionalLong oldest = store.oldestCreatedUtc(consolidated);
                    if (oldest.isPresent()) {
                        seed = oldest.getAsLong();
                        LOG.info("Refreshing stale {} backward from {}", consolidated.getFileName(), seed);
                    }
                }
                writer = ChunkWriter.start(store, checkpoints, layout, clock, subreddit, type,
                        config.getChunkSize(), config.getMaxBufferBytes(), seed);
            }

            PageLoopEnd end = paginate(subreddit, type, writer, governor);
            if (end.failure != null) {
                writer.flush();
                stats.totalParquetBytes += writer.parquetBytesWritten();
                countRows(stats, type, writer.totalRows() - resumedRows);
                return ContentResult.failed(end.failure, writer.frontier(), writer.totalRows() - resumedRows);
            }

            writer.flush();
            stats.totalParquetBytes += writer.parquetBytesWritten();
            long rowsThisRun = writer.totalRows() - resumedRows;
            countRows(stats, type, rowsThisRun);

            Optional<Long> merged = merger.merge(subreddit, type);
            if (merged.isPresent()) {
                stats.totalParquetBytes += Files.size(consolidated);
                eventBus.post(new ContentConsolidated(subreddit, type, rowsThisRun, merged.get()));
            } else if (end.exhausted && Files.exists(consolidated)) {
                // nothing older upstream; mark the file as checked
                freshness.touch(consolidated);
            }
            return ContentResult.completed(writer.frontier(), rowsThisRun);
        } catch (IOException e) {
            LOG.error("Storage failure for {}/{}: {}", subreddit, type, e.getMessage());
            Long frontier = writer != null ? writer.frontier() : null;
            long rows = writer != null ? writer.totalRows() - resumedRows : 0;
            return ContentResult.failed("storage: " + e.getMessage(), frontier, Math.max(0, rows));
        }
    }

    private PageLoopEnd paginate(String subreddit, ContentType type, ChunkWriter writer, ResourceGovernor governor)
            throws IOException {
        SearchQuery base = new SearchQuery(subreddit, type, archiveConfig.getPageSize(),
                config.afterEpochSecond(), null);
        long maxRows = config.getMaxRowsPerSubreddit();
        Duration pageDelay = Duration.ofMillis(archiveConfig.getPageDelayMillis());

        while (true) {
            if (writer.totalRows() >= maxRows) {
                LOG.info("Row cap of {} reached for {}/{}", maxRows, subreddit, type);
                return PageLoopEnd.stopped();
            }
            if (governor.checkCaps().isPresent()) {
                return PageLoopEnd.stopped();
            }

            Long before = writer.frontier();
            FetchOutcome outcome = fetcher.fetch(base.withBefore(before), governor);

            if (outcome instanceof Success success) {
                if (success.records().isEmpty()) {
                    LOG.warn("Page of {}/{} had {} items but none valid, stopping",
                            subreddit, type, success.itemsReceived());
                    return PageLoopEnd.stopped();
                }
                long room = maxRows - writer.totalRows();
                List<ArchiveRecord> accepted = new ArrayList<>();
                for (ArchiveRecord record : success.records()) {
                    if (accepted.size() >= room) {
                        break;
                    }
                    if (before != null && record.createdUtc() >= before) {
                        continue;
                    }
                    accepted.add(record);
                }
                writer.appendPage(accepted);
                if (accepted.isEmpty()) {
                    LOG.warn("Page of {}/{} did not move the frontier past {}, stopping", subreddit, type, before);
                    return PageLoopEnd.stopped();
                }
                LOG.info("{}/{}: page {}, {} rows so far, frontier {}", subreddit, type,
                        writer.pagesCompleted(), writer.totalRows(), writer.frontier());
                try {
                    sleeper.sleep(pageDelay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return PageLoopEnd.failed("interrupted");
                }
            } else if (outcome instanceof EmptyPage) {
                LOG.info("Reached the end of {}/{} ({} rows)", subreddit, type, writer.totalRows());
                return PageLoopEnd.endOfData();
            } else if (outcome instanceof NotFound) {
                return PageLoopEnd.endOfData();
            } else if (outcome instanceof BadRequest badRequest) {
                LOG.warn("Skipping {}/{} after HTTP {}", subreddit, type, badRequest.status());
                return PageLoopEnd.stopped();
            } else if (outcome instanceof PermanentFailure failure) {
                return PageLoopEnd.failed(failure.reason());
            } else {
                // retries are resolved inside the fetcher
                return PageLoopEnd.failed("unexpected outcome " + outcome);
            }
        }
    }

    private static void countRows(IngestStats stats, ContentType type, long rows) {
        if (type == ContentType.POSTS) {
            stats.postsDownloaded += rows;
        } else {
            stats.commentsDownloaded += rows;
        }
    }

    private record PageLoopEnd(boolean exhausted, String failure) {

        static PageLoopEnd endOfData() {
            return new PageLoopEnd(true, null);
        }

        static PageLoopEnd stopped() {
            return new PageLoopEnd(false, null);
        }

        static PageLoopEnd failed(String reason) {
            return new PageLoopEnd(false, reason);
        }
    }
}
