package de.bsommerfeld.wsbg.archive.app;

import com.google.common.base.Ticker;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.wsbg.archive.client.ArchiveClient;
import de.bsommerfeld.wsbg.archive.client.HttpArchiveClient;
import de.bsommerfeld.wsbg.archive.client.TestArchiveClient;
import de.bsommerfeld.wsbg.archive.core.config.ApplicationMode;
import de.bsommerfeld.wsbg.archive.core.config.ArchiveConfig;
import de.bsommerfeld.wsbg.archive.core.config.GlobalConfig;
import de.bsommerfeld.wsbg.archive.core.config.IngestConfig;
import de.bsommerfeld.wsbg.archive.core.config.StorageConfig;
import de.bsommerfeld.wsbg.archive.core.util.Sleeper;
import de.bsommerfeld.wsbg.archive.storage.AtomicWriter;
import de.bsommerfeld.wsbg.archive.storage.ColumnarStore;
import de.bsommerfeld.wsbg.archive.storage.DuckDbColumnarStore;
import de.bsommerfeld.wsbg.archive.storage.FileLock;
import de.bsommerfeld.wsbg.archive.storage.FilesystemAtomicWriter;
import de.bsommerfeld.wsbg.archive.storage.NioFileLock;
import de.bsommerfeld.wsbg.archive.storage.OutputLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Guice wiring of the downloader. The configuration is loaded by the
 * caller (it may carry command-line overrides) and handed in already
 * validated.
 */
public class ArchiveModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveModule.class);

    private final GlobalConfig config;
    private final ApplicationMode mode;

    public ArchiveModule(GlobalConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        bind(GlobalConfig.class).toInstance(config);

        // Sub-configs for convenience
        bind(ArchiveConfig.class).toInstance(config.getArchive());
        bind(IngestConfig.class).toInstance(config.getIngest());
        bind(StorageConfig.class).toInstance(config.getStorage());

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            // Offline generator, files are still written
            bind(ArchiveClient.class).to(TestArchiveClient.class);
        } else {
            bind(ArchiveClient.class).to(HttpArchiveClient.class);
        }

        bind(ColumnarStore.class).to(DuckDbColumnarStore.class);
        bind(AtomicWriter.class).to(FilesystemAtomicWriter.class);
        bind(FileLock.class).to(NioFileLock.class);

        bind(Sleeper.class).toInstance(Sleeper.SYSTEM);
        bind(Ticker.class).toInstance(Ticker.systemTicker());
        bind(Clock.class).toInstance(Clock.systemUTC());
    }

    @Provides
    @Singleton
    OutputLayout provideOutputLayout(StorageConfig storage) {
        return new OutputLayout(storage.resolveOutputDir(), storage.resolveDeadLetterDir());
    }
}
