package de.bsommerfeld.wsbg.archive.ingest;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import de.bsommerfeld.wsbg.archive.client.RequestTracker;
import de.bsommerfeld.wsbg.archive.core.event.IngestEventBus;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.ResourceCap;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.ResourceCapReached;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Job-wide ceilings on request count and wall-clock time. The governor is
 * cooperative: callers ask {@link #checkCaps()} before every subreddit and
 * every page, and an in-flight request always completes.
 *
 * <p>
 * Request and byte counts are written straight into the run's
 * {@link IngestStats}. The first breach sets the matching flag there and
 * posts a single {@link ResourceCapReached} event; every later check
 * reports the same cap again without posting.
 */
public class ResourceGovernor implements RequestTracker {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceGovernor.class);

    private final long maxRequests;
    private final Duration maxDuration;
    private final IngestStats stats;
    private final IngestEventBus eventBus;
    private final Stopwatch stopwatch;

    private ResourceCap breached;

    public ResourceGovernor(long maxRequests, Duration maxDuration, Ticker ticker, IngestStats stats,
            IngestEventBus eventBus) {
        this.maxRequests = maxRequests;
        this.maxDuration = maxDuration;
        this.stats = stats;
        this.eventBus = eventBus;
        this.stopwatch = Stopwatch.createStarted(ticker);
    }

    @Override
    public void requestIssued() {
        stats.totalRequests++;
    }

    @Override
    public void bytesReceived(long bytes) {
        stats.totalBytesDownloaded += bytes;
    }

    /**
     * @return the cap that stops further work, or empty while the run is
     *         within both limits
     */
    public Optional<ResourceCap> checkCaps() {
        if (breached != null) {
            return Optional.of(breached);
        }
        if (stats.totalRequests >= maxRequests) {
            stats.requestCapHit = true;
            breach(ResourceCap.REQUESTS);
        } else if (elapsed().compareTo(maxDuration) > 0) {
            stats.durationCapHit = true;
            breach(ResourceCap.DURATION);
        }
        return Optional.ofNullable(breached);
    }

    public Duration elapsed() {
        return stopwatch.elapsed();
    }

    private void breach(ResourceCap cap) {
        breached = cap;
        long seconds = elapsed().getSeconds();
        LOG.warn("Resource cap reached: {} ({} requests, {}s elapsed)", cap, stats.totalRequests, seconds);
        eventBus.post(new ResourceCapReached(cap, stats.totalRequests, seconds));
    }
}
