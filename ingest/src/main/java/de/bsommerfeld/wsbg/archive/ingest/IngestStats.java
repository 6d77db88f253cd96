package de.bsommerfeld.wsbg.archive.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters of one ingestion run. The pipeline fills an instance while it
 * walks the subreddit list and returns it to the caller; it is the only
 * place a run reports what happened besides the dead-letter files.
 *
 * <p>
 * {@code subredditsSkippedFresh} and {@code subredditsResumed} count
 * content types, not subreddits: a subreddit whose posts and comments are
 * both fresh adds two.
 */
public class IngestStats {
    public int subredditsChecked = 0;
    public int subredditsDownloaded = 0;
    public int subredditsSkippedFresh = 0;
    public int subredditsSkippedLocked = 0;
    public int subredditsFailed = 0;
    public int subredditsResumed = 0;
    /** Subreddits never contacted because the circuit breaker was open. */
    public List<String> skippedSubreddits = new ArrayList<>();

    public long postsDownloaded = 0;
    public long commentsDownloaded = 0;
    public long totalRequests = 0;
    public long totalBytesDownloaded = 0;
    public long totalParquetBytes = 0;

    public int dlqEntriesWritten = 0;
    public int dlqEntriesPromoted = 0;
    public int dlqEntriesCleared = 0;

    public boolean circuitBreakerTripped = false;
    public boolean requestCapHit = false;
    public boolean durationCapHit = false;

    public double latencySeconds = 0;

    /** Whether the run stopped before the end of its subreddit list. */
    public boolean stoppedEarly() {
        return circuitBreakerTripped || requestCapHit || durationCapHit;
    }

    @Override
    public String toString() {
        return String.format(
                "%d checked, %d downloaded, %d fresh, %d locked, %d failed, %d resumed | "
                        + "%d posts, %d comments, %d requests, %d bytes in, %d parquet bytes | "
                        + "dlq %d written, %d promoted, %d cleared | breaker=%s requestCap=%s durationCap=%s | %.1fs",
                subredditsChecked, subredditsDownloaded, subredditsSkippedFresh, subredditsSkippedLocked,
                subredditsFailed, subredditsResumed,
                postsDownloaded, commentsDownloaded, totalRequests, totalBytesDownloaded, totalParquetBytes,
                dlqEntriesWritten, dlqEntriesPromoted, dlqEntriesCleared,
                circuitBreakerTripped, requestCapHit, durationCapHit, latencySeconds);
    }
}
