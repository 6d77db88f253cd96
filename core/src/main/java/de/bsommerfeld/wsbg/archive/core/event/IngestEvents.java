package de.bsommerfeld.wsbg.archive.core.event;

import de.bsommerfeld.wsbg.archive.core.domain.ContentType;

import java.util.List;

/**
 * Lifecycle events posted by the ingestion pipeline.
 */
public final class IngestEvents {

    private IngestEvents() {
    }

    public enum SkipReason {
        FRESH,
        LOCKED,
        CIRCUIT_OPEN,
        INVALID_NAME
    }

    public enum ResourceCap {
        REQUESTS,
        DURATION
    }

    /** One content type of a subreddit finished and was consolidated. */
    public record ContentConsolidated(String subreddit, ContentType contentType, long rowsThisRun,
            long totalRows) {
    }

    public record SubredditCompleted(String subreddit) {
    }

    public record SubredditFailed(String subreddit, String reason, int dlqAttempts, boolean promoted) {
    }

    public record SubredditSkipped(String subreddit, SkipReason reason) {
    }

    public record CircuitBreakerTripped(int consecutiveFailures, List<String> remaining) {
    }

    public record ResourceCapReached(ResourceCap cap, long requestsIssued, long elapsedSeconds) {
    }

    /** Final event of a run; {@code summary} is the formatted statistics line. */
    public record RunFinished(String summary) {
    }
}
