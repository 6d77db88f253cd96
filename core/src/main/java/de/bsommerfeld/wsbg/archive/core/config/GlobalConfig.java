package de.bsommerfeld.wsbg.archive.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each section maps to one TOML table.
 */
public class GlobalConfig {

    @JsonProperty("archive")
    private ArchiveConfig archive = new ArchiveConfig();

    @JsonProperty("ingest")
    private IngestConfig ingest = new IngestConfig();

    @JsonProperty("storage")
    private StorageConfig storage = new StorageConfig();

    public ArchiveConfig getArchive() {
        return archive;
    }

    public IngestConfig getIngest() {
        return ingest;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    /**
     * Rejects values that would make a run meaningless or unbounded.
     *
     * @throws IllegalStateException naming the offending key
     */
    public void validate() {
        archive.validate();
        ingest.validate();
    }
}
