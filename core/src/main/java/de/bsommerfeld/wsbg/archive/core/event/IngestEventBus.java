package de.bsommerfeld.wsbg.archive.core.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus} so the pipeline can report
 * progress without knowing who listens (console reporter, tests).
 * Delivery is synchronous on the posting thread.
 */
@Singleton
public class IngestEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(IngestEventBus.class);
    private final EventBus eventBus;

    public IngestEventBus() {
        this.eventBus = new EventBus("WsbgArchive-EventBus");
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }
}
