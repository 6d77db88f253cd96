package de.bsommerfeld.wsbg.archive.client;

/**
 * Receives one call per request attempt, retries included, and the size of
 * every successful body. The run's resource governor implements this.
 */
public interface RequestTracker {

    RequestTracker NONE = new RequestTracker() {
        @Override
        public void requestIssued() {
        }

        @Override
        public void bytesReceived(long bytes) {
        }
    };

    void requestIssued();

    void bytesReceived(long bytes);
}
