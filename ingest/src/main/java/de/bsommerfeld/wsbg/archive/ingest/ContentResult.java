package de.bsommerfeld.wsbg.archive.ingest;

/**
 * Result of ingesting one (subreddit, content type).
 *
 * @param status        how the content type ended
 * @param reason        failure reason, {@code null} unless {@link Status#FAILED}
 * @param frontier      last persisted frontier, {@code null} if nothing was fetched
 * @param rowsThisRun   rows fetched in this run (resumed rows excluded)
 */
public record ContentResult(Status status, String reason, Long frontier, long rowsThisRun) {

    public enum Status {
        /** Finished for any reason other than failure, including 404 and caps. */
        COMPLETED,
        SKIPPED_FRESH,
        FAILED
    }

    public static ContentResult completed(Long frontier, long rowsThisRun) {
        return new ContentResult(Status.COMPLETED, null, frontier, rowsThisRun);
    }

    public static ContentResult skippedFresh() {
        return new ContentResult(Status.SKIPPED_FRESH, null, null, 0);
    }

    public static ContentResult failed(String reason, Long frontier, long rowsThisRun) {
        return new ContentResult(Status.FAILED, reason, frontier, rowsThisRun);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
