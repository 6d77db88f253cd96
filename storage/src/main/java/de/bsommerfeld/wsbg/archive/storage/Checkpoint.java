package de.bsommerfeld.wsbg.archive.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.wsbg.archive.core.domain.ContentType;

import java.time.Instant;

/**
 * Resumable pagination state of one (subreddit, content type), persisted
 * after every chunk flush.
 *
 * @param subreddit      subreddit the cursor belongs to
 * @param contentType    content type the cursor belongs to
 * @param oldestUtcSeen  pagination frontier; the next page is requested
 *                       with {@code before} set to this value
 * @param rowsFlushed    rows written to chunk files over the cursor's lifetime
 * @param chunksWritten  number of numbered chunk files on disk
 * @param pagesCompleted pages fully processed over the cursor's lifetime
 * @param startedAt      when the first chunk of this cursor was flushed
 * @param updatedAt      when the cursor was last rewritten
 */
public record Checkpoint(
        @JsonProperty("subreddit") String subreddit,
        @JsonProperty("content_type") ContentType contentType,
        @JsonProperty("oldest_utc_seen") Long oldestUtcSeen,
        @JsonProperty("rows_flushed") long rowsFlushed,
        @JsonProperty("chunks_written") int chunksWritten,
        @JsonProperty("pages_completed") int pagesCompleted,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    /** Successor state after one more flush. {@code startedAt} is carried over. */
    public Checkpoint advance(Long oldestUtcSeen, long rowsFlushed, int chunksWritten, int pagesCompleted,
            Instant now) {
        return new Checkpoint(subreddit, contentType, oldestUtcSeen, rowsFlushed, chunksWritten, pagesCompleted,
                startedAt, now);
    }
}
