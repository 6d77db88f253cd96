package de.bsommerfeld.wsbg.archive.client;

import de.bsommerfeld.wsbg.archive.core.domain.ArchiveRecord;

import java.util.List;

/**
 * Classified result of one page request. The retry loop in
 * {@link PageFetcher} consumes {@link RetryableError}; every other outcome
 * is handed to the caller.
 *
 * <pre>
 * 200 + non-empty data          Success           continue paging
 * 200 + empty/missing data      EmptyPage         end of data
 * 404                           NotFound          subreddit unknown upstream, no-op
 * 400, other non-retryable 4xx  BadRequest        skip this content type
 * 429, 5xx, transport error     RetryableError    back off and retry
 * retries exhausted, bad JSON,
 * error field set               PermanentFailure  subreddit failure
 * </pre>
 */
public sealed interface FetchOutcome {

    /**
     * A page with items.
     *
     * @param records       valid records in response order (may be empty if
     *                      every item was rejected)
     * @param itemsReceived raw item count before validation
     */
    record Success(List<ArchiveRecord> records, int itemsReceived) implements FetchOutcome {
        public Success {
            records = List.copyOf(records);
        }
    }

    record EmptyPage() implements FetchOutcome {
    }

    record NotFound() implements FetchOutcome {
    }

    record BadRequest(int status, String detail) implements FetchOutcome {
    }

    record RetryableError(String reason) implements FetchOutcome {
    }

    record PermanentFailure(String reason) implements FetchOutcome {
    }
}
