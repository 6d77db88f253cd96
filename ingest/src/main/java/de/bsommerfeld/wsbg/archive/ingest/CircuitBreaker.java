package de.bsommerfeld.wsbg.archive.ingest;

/**
 * Counts consecutive subreddit failures. Once the count reaches the
 * threshold the breaker stays open for the rest of the run; a success
 * before that resets the count.
 */
public class CircuitBreaker {

    private final int threshold;
    private int consecutiveFailures;
    private boolean open;

    public CircuitBreaker(int threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive, was " + threshold);
        }
        this.threshold = threshold;
    }

    public void recordSuccess() {
        consecutiveFailures = 0;
    }

    /**
     * @return {@code true} if this failure tripped the breaker
     */
    public boolean recordFailure() {
        consecutiveFailures++;
        if (!open && consecutiveFailures >= threshold) {
            open = true;
            return true;
        }
        return false;
    }

    public boolean isOpen() {
        return open;
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }
}
