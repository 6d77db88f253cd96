package de.bsommerfeld.wsbg.archive.app;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.CircuitBreakerTripped;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.ContentConsolidated;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.ResourceCapReached;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.RunFinished;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.SkipReason;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.SubredditCompleted;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.SubredditFailed;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.SubredditSkipped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Console view of a run. Subscribes to the pipeline's events and turns them
 * into one log line each; also tallies outcomes for the closing summary.
 */
public class ProgressReporter {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressReporter.class);

    private int completed;
    private int failed;
    private final Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);

    @Subscribe
    public void onContentConsolidated(ContentConsolidated event) {
        LOG.info("[{}] {} consolidated: +{} rows, {} total",
                event.subreddit(), event.contentType().apiName(), event.rowsThisRun(), event.totalRows());
    }

    @Subscribe
    public void onSubredditCompleted(SubredditCompleted event) {
        completed++;
        LOG.info("[{}] done", event.subreddit());
    }

    @Subscribe
    public void onSubredditFailed(SubredditFailed event) {
        failed++;
        if (event.promoted()) {
            LOG.error("[{}] failed for the {}. time, moved to the permanent dead-letter queue: {}",
                    event.subreddit(), event.dlqAttempts(), event.reason());
        } else {
            LOG.warn("[{}] failed (attempt {}): {}", event.subreddit(), event.dlqAttempts(), event.reason());
        }
    }

    @Subscribe
    public void onSubredditSkipped(SubredditSkipped event) {
        skipped.merge(event.reason(), 1, Integer::sum);
        LOG.info("[{}] skipped: {}", event.subreddit(), describe(event.reason()));
    }

    @Subscribe
    public void onCircuitBreakerTripped(CircuitBreakerTripped event) {
        LOG.error("Circuit breaker open after {} consecutive failures, not contacting: {}",
                event.consecutiveFailures(), event.remaining());
    }

    @Subscribe
    public void onResourceCapReached(ResourceCapReached event) {
        LOG.warn("Resource cap {} reached after {} requests and {}s, finishing current work",
                event.cap(), event.requestsIssued(), event.elapsedSeconds());
    }

    @Subscribe
    public void onRunFinished(RunFinished event) {
        LOG.info("Run finished: {} completed, {} failed, skipped {}", completed, failed, skipped);
        LOG.info("Summary: {}", event.summary());
    }

    public int completed() {
        return completed;
    }

    public int failed() {
        return failed;
    }

    public int skipped(SkipReason reason) {
        return skipped.getOrDefault(reason, 0);
    }

    private static String describe(SkipReason reason) {
        switch (reason) {
            case FRESH:
                return "output is fresh";
            case LOCKED:
                return "locked by another worker";
            case CIRCUIT_OPEN:
                return "circuit breaker open";
            case INVALID_NAME:
                return "invalid name";
            default:
                return reason.name();
        }
    }
}
