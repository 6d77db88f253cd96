package de.bsommerfeld.wsbg.archive.ingest;

import com.google.common.base.Ticker;
import com.google.inject.Singleton;
import de.bsommerfeld.wsbg.archive.client.ArchiveClient;
import de.bsommerfeld.wsbg.archive.client.PageFetcher;
import de.bsommerfeld.wsbg.archive.core.config.ArchiveConfig;
import de.bsommerfeld.wsbg.archive.core.config.IngestConfig;
import de.bsommerfeld.wsbg.archive.core.domain.ContentType;
import de.bsommerfeld.wsbg.archive.core.domain.SubredditNames;
import de.bsommerfeld.wsbg.archive.core.event.IngestEventBus;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.CircuitBreakerTripped;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.RunFinished;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.SkipReason;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.SubredditCompleted;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.SubredditFailed;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.SubredditSkipped;
import de.bsommerfeld.wsbg.archive.core.util.Sleeper;
import de.bsommerfeld.wsbg.archive.storage.AtomicWriter;
import de.bsommerfeld.wsbg.archive.storage.CheckpointStore;
import de.bsommerfeld.wsbg.archive.storage.ColumnarStore;
import de.bsommerfeld.wsbg.archive.storage.DeadLetterQueue;
import de.bsommerfeld.wsbg.archive.storage.DeadLetterQueue.FailureRecord;
import de.bsommerfeld.wsbg.archive.storage.FileLock;
import de.bsommerfeld.wsbg.archive.storage.OutputLayout;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Orchestrates one ingestion run over a list of subreddits.
 *
 * <h3>Per subreddit</h3>
 * <ol>
 * <li>Invalid names are skipped before they are counted.</li>
 * <li>An open circuit breaker skips the subreddit without a request.</li>
 * <li>A breached resource cap ends the run.</li>
 * <li>If every requested content type is fresh and has no pending cursor,
 * the subreddit is skipped without taking the lock.</li>
 * <li>Otherwise the lock is tried; contention counts as skipped-locked.</li>
 * <li>Each content type runs through {@link ContentIngestor}; freshness is
 * re-checked there under the lock.</li>
 * <li>Success resets the breaker, clears the dead-letter entry and removes
 * the lock file. Failure writes the dead-letter entry and feeds the
 * breaker; the lock file stays.</li>
 * </ol>
 *
 * <h3>Error model</h3>
 * {@link #run} does not throw for trouble with a single subreddit. The
 * returned {@link IngestStats} and the dead-letter files are the reporting
 * surface; only an unusable output directory aborts the run.
 */
@Singleton
public class IngestionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(IngestionPipeline.class);

    private final IngestConfig config;
    private final ArchiveConfig archiveConfig;
    private final OutputLayout layout;
    private final ArchiveClient client;
    private final ColumnarStore store;
    private final AtomicWriter atomicWriter;
    private final FileLock fileLock;
    private final Sleeper sleeper;
    private final Ticker ticker;
    private final Clock clock;
    private final IngestEventBus eventBus;

    @Inject
    public IngestionPipeline(IngestConfig config, ArchiveConfig archiveConfig, OutputLayout layout,
            ArchiveClient client, ColumnarStore store, AtomicWriter atomicWriter, FileLock fileLock,
            Sleeper sleeper, Ticker ticker, Clock clock, IngestEventBus eventBus) {
        this.config = config;
        this.archiveConfig = archiveConfig;
        this.layout = layout;
        this.client = client;
        this.store = store;
        this.atomicWriter = atomicWriter;
        this.fileLock = fileLock;
        this.sleeper = sleeper;
        this.ticker = ticker;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    /** Runs over the configured subreddits and content types. */
    public IngestStats run() {
        return run(config.getSubreddits(), config.resolveContentTypes());
    }

    public IngestStats run(List<String> subreddits, Set<ContentType> types) {
        try {
            Files.createDirectories(layout.outputDir());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory " + layout.outputDir(), e);
        }

        IngestStats stats = new IngestStats();
        ResourceGovernor governor = new ResourceGovernor(config.getMaxTotalRequests(), config.maxDuration(),
                ticker, stats, eventBus);
        CircuitBreaker breaker = new CircuitBreaker(config.getCircuitBreakerThreshold());
        DeadLetterQueue deadLetters = new DeadLetterQueue(layout, atomicWriter, config.getMaxDlqAttempts(), clock);
        FreshnessPolicy freshness = new FreshnessPolicy(config.getStaleDays(), clock);
        CheckpointStore checkpoints = new CheckpointStore(atomicWriter);
        ChunkMerger merger = new ChunkMerger(store, checkpoints, layout, atomicWriter);
        ContentIngestor ingestor = new ContentIngestor(new PageFetcher(client, sleeper, config), store,
                checkpoints, merger, freshness, layout, config, archiveConfig, sleeper, clock, eventBus);

        List<String> names = validNames(subreddits);
        LOG.info("Starting ingestion of {} subreddits ({}) into {}", names.size(), types, layout.outputDir());

        int unreached = 0;
        for (int i = 0; i < names.size(); i++) {
            String subreddit = names.get(i);
            stats.subredditsChecked++;

            if (breaker.isOpen()) {
                stats.skippedSubreddits.add(subreddit);
                eventBus.post(new SubredditSkipped(subreddit, SkipReason.CIRCUIT_OPEN));
                continue;
            }
            if (governor.checkCaps().isPresent()) {
                LOG.warn("Stopping before {}: resource cap reached", subreddit);
                unreached = names.size() - i;
                break;
            }
            if (allFresh(subreddit, types, freshness)) {
                LOG.info("All content of {} is fresh, skipping", subreddit);
                stats.subredditsSkippedFresh += types.size();
                eventBus.post(new SubredditSkipped(subreddit, SkipReason.FRESH));
                continue;
            }

            processLocked(subreddit, types, ingestor, governor, breaker, deadLetters, stats,
                    names.subList(i + 1, names.size()));
        }

        stats.latencySeconds = governor.elapsed().toMillis() / 1000d;
        if (stats.stoppedEarly()) {
            LOG.warn("Ingestion stopped early (breaker={}, requestCap={}, durationCap={}), {} subreddits never reached",
                    stats.circuitBreakerTripped, stats.requestCapHit, stats.durationCapHit,
                    unreached + stats.skippedSubreddits.size());
        }
        LOG.info("Ingestion finished: {}", stats);
        eventBus.post(new RunFinished(stats.toString()));
        return stats;
    }

    private void processLocked(String subreddit, Set<ContentType> types, ContentIngestor ingestor,
            ResourceGovernor governor, CircuitBreaker breaker, DeadLetterQueue deadLetters, IngestStats stats,
            List<String> remaining) {
        Path lockFile = layout.lock(subreddit);
        try {
            if (!fileLock.tryAcquire(lockFile)) {
                LOG.info("{} is locked by another worker, skipping", subreddit);
                stats.subredditsSkippedLocked++;
                eventBus.post(new SubredditSkipped(subreddit, SkipReason.LOCKED));
                return;
            }
        } catch (IOException e) {
            LOG.error("Cannot open lock {}: {}", lockFile, e.getMessage());
            recordFailure(subreddit, "lock: " + e.getMessage(), null, 0, breaker, deadLetters, stats, remaining);
            return;
        }

        boolean success = true;
        try {
            String reason = null;
            Long frontier = null;
            long rows = 0;
            boolean allSkipped = true;
            for (ContentType type : types) {
                ContentResult result = ingestor.ingest(subreddit, type, governor, stats);
                rows += result.rowsThisRun();
                if (result.status() != ContentResult.Status.SKIPPED_FRESH) {
                    allSkipped = false;
                }
                if (result.isFailed()) {
                    success = false;
                    reason = type.apiName() + ": " + result.reason();
                    frontier = result.frontier();
                }
            }

            if (!success) {
                recordFailure(subreddit, reason, frontier, rows, breaker, deadLetters, stats, remaining);
            } else if (allSkipped) {
                eventBus.post(new SubredditSkipped(subreddit, SkipReason.FRESH));
            } else {
                stats.subredditsDownloaded++;
                breaker.recordSuccess();
                clearDeadLetter(subreddit, deadLetters, stats);
                LOG.info("Completed {} ({} new rows)", subreddit, rows);
                eventBus.post(new SubredditCompleted(subreddit));
            }
        } finally {
            if (success) {
                fileLock.releaseAndDelete(lockFile);
            } else {
                fileLock.release(lockFile);
            }
        }
    }

    private void recordFailure(String subreddit, String reason, Long frontier, long rows, CircuitBreaker breaker,
            DeadLetterQueue deadLetters, IngestStats stats, List<String> remaining) {
        stats.subredditsFailed++;
        LOG.error("Subreddit {} failed: {}", subreddit, reason);

        int attempts = 0;
        boolean promoted = false;
        try {
            FailureRecord record = deadLetters.recordFailure(subreddit, reason, frontier, rows);
            stats.dlqEntriesWritten++;
            attempts = record.entry().attempts();
            promoted = record.promoted();
            if (promoted) {
                stats.dlqEntriesPromoted++;
            }
        } catch (IOException e) {
            LOG.error("Could not write dead-letter entry for {}: {}", subreddit, e.getMessage());
        }
        eventBus.post(new SubredditFailed(subreddit, reason, attempts, promoted));

        if (breaker.recordFailure()) {
            stats.circuitBreakerTripped = true;
            LOG.warn("Circuit breaker tripped after {} consecutive failures, skipping {} remaining subreddits",
                    breaker.consecutiveFailures(), remaining.size());
            eventBus.post(new CircuitBreakerTripped(breaker.consecutiveFailures(), List.copyOf(remaining)));
        }
    }

    private void clearDeadLetter(String subreddit, DeadLetterQueue deadLetters, IngestStats stats) {
        try {
            if (deadLetters.clear(subreddit)) {
                stats.dlqEntriesCleared++;
            }
        } catch (IOException e) {
            LOG.warn("Could not clear dead-letter entry for {}: {}", subreddit, e.getMessage());
        }
    }

    private boolean allFresh(String subreddit, Set<ContentType> types, FreshnessPolicy freshness) {
        try {
            for (ContentType type : types) {
                if (Files.exists(layout.cursor(subreddit, type))
                        || !freshness.isFresh(layout.consolidated(subreddit, type))) {
                    return false;
                }
            }
            return !types.isEmpty();
        } catch (IOException e) {
            LOG.debug("Freshness pre-check of {} failed, deciding under the lock: {}", subreddit, e.getMessage());
            return false;
        }
    }

    private List<String> validNames(List<String> subreddits) {
        List<String> names = new ArrayList<>();
        for (String raw : subreddits) {
            String name = SubredditNames.normalize(raw);
            if (SubredditNames.isValid(name)) {
                names.add(name);
            } else {
                LOG.warn("Skipping invalid subreddit name '{}'", raw);
                eventBus.post(new SubredditSkipped(String.valueOf(raw), SkipReason.INVALID_NAME));
            }
        }
        return names;
    }
}
