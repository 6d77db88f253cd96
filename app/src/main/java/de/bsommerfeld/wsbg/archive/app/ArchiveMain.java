package de.bsommerfeld.wsbg.archive.app;

import de.bsommerfeld.wsbg.archive.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

public final class ArchiveMain {

    static {
        // Initialize Logging Directory via StorageUtils
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveMain.class);

    private ArchiveMain() {
    }

    public static void main(String[] args) {
        LOG.info("Starting wsbg-archive");
        int exitCode = new CommandLine(new ArchiveCommand()).execute(args);
        LOG.info("Exiting with code {}", exitCode);
        System.exit(exitCode);
    }
}
