package de.bsommerfeld.wsbg.archive.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One line of a dead-letter ledger: a subreddit that failed, and how often.
 * {@code contentType} is {@code "all"} because failures are tracked per
 * subreddit, not per content type.
 */
public record DeadLetterEntry(
        @JsonProperty("subreddit") String subreddit,
        @JsonProperty("content_type") String contentType,
        @JsonProperty("reason") String reason,
        @JsonProperty("oldest_utc_seen") Long oldestUtcSeen,
        @JsonProperty("rows_downloaded") long rowsDownloaded,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("first_failed_at") Instant firstFailedAt,
        @JsonProperty("last_failed_at") Instant lastFailedAt) {

    public static final String ALL_CONTENT_TYPES = "all";

    public static DeadLetterEntry first(String subreddit, String reason, Long oldestUtcSeen, long rowsDownloaded,
            Instant now) {
        return new DeadLetterEntry(subreddit, ALL_CONTENT_TYPES, reason, oldestUtcSeen, rowsDownloaded, 1, now, now);
    }

    /** Counts one more failure, keeping the first failure time. */
    public DeadLetterEntry retried(String reason, Long oldestUtcSeen, long rowsDownloaded, Instant now) {
        return new DeadLetterEntry(subreddit, contentType, reason, oldestUtcSeen, rowsDownloaded, attempts + 1,
                firstFailedAt, now);
    }
}
