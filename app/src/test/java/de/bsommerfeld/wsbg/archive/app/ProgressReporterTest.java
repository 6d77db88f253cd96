package de.bsommerfeld.wsbg.archive.app;

import de.bsommerfeld.wsbg.archive.core.domain.ContentType;
import de.bsommerfeld.wsbg.archive.core.event.IngestEventBus;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.CircuitBreakerTripped;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.ContentConsolidated;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.ResourceCap;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.ResourceCapReached;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.RunFinished;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.SkipReason;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.SubredditCompleted;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.SubredditFailed;
import de.bsommerfeld.wsbg.archive.core.event.IngestEvents.SubredditSkipped;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgressReporterTest {

    private IngestEventBus eventBus;
    private ProgressReporter reporter;

    @BeforeEach
    void setUp() {
        eventBus = new IngestEventBus();
        reporter = new ProgressReporter();
        eventBus.register(reporter);
    }

    @Test
    void subscribe_shouldTallyOutcomesPostedOnTheBus() {
        eventBus.post(new ContentConsolidated("alpha", ContentType.POSTS, 140, 140));
        eventBus.post(new SubredditCompleted("alpha"));
        eventBus.post(new SubredditFailed("beta", "posts: HTTP 500 after 3 retries", 1, false));
        eventBus.post(new SubredditSkipped("gamma", SkipReason.FRESH));
        eventBus.post(new SubredditSkipped("delta", SkipReason.FRESH));
        eventBus.post(new SubredditSkipped("epsilon", SkipReason.LOCKED));
        eventBus.post(new CircuitBreakerTripped(3, List.of("zeta")));
        eventBus.post(new ResourceCapReached(ResourceCap.REQUESTS, 5000, 42));
        eventBus.post(new RunFinished("summary"));

        assertEquals(1, reporter.completed());
        assertEquals(1, reporter.failed());
        assertEquals(2, reporter.skipped(SkipReason.FRESH));
        assertEquals(1, reporter.skipped(SkipReason.LOCKED));
        assertEquals(0, reporter.skipped(SkipReason.CIRCUIT_OPEN));
    }

    @Test
    void unregister_shouldStopReceivingEvents() {
        eventBus.unregister(reporter);

        eventBus.post(new SubredditCompleted("alpha"));

        assertEquals(0, reporter.completed());
    }
}
