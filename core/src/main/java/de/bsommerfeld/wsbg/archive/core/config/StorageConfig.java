package de.bsommerfeld.wsbg.archive.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.wsbg.archive.core.util.StorageUtils;

import java.nio.file.Path;

/**
 * Output locations. Empty values resolve to directories below the
 * application data directory.
 */
public class StorageConfig {

    @JsonProperty("output-dir")
    private String outputDir = "";

    @JsonProperty("dead-letter-dir")
    private String deadLetterDir = "";

    public Path resolveOutputDir() {
        if (outputDir == null || outputDir.isBlank()) {
            return StorageUtils.getDefaultOutputDir(StorageUtils.APP_NAME);
        }
        return Path.of(outputDir).toAbsolutePath();
    }

    /** Defaults to {@code dead_letter/} inside the output directory. */
    public Path resolveDeadLetterDir() {
        if (deadLetterDir == null || deadLetterDir.isBlank()) {
            return resolveOutputDir().resolve("dead_letter");
        }
        return Path.of(deadLetterDir).toAbsolutePath();
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getDeadLetterDir() {
        return deadLetterDir;
    }

    public void setDeadLetterDir(String deadLetterDir) {
        this.deadLetterDir = deadLetterDir;
    }
}
