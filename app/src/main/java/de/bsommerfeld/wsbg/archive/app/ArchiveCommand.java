package de.bsommerfeld.wsbg.archive.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.wsbg.archive.core.config.ApplicationMode;
import de.bsommerfeld.wsbg.archive.core.config.ConfigLoader;
import de.bsommerfeld.wsbg.archive.core.config.GlobalConfig;
import de.bsommerfeld.wsbg.archive.core.config.IngestConfig;
import de.bsommerfeld.wsbg.archive.core.domain.ContentType;
import de.bsommerfeld.wsbg.archive.core.event.IngestEventBus;
import de.bsommerfeld.wsbg.archive.core.util.StorageUtils;
import de.bsommerfeld.wsbg.archive.ingest.IngestStats;
import de.bsommerfeld.wsbg.archive.ingest.IngestionPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * The {@code wsbg-archive} command: loads {@code config.toml}, applies the
 * command-line overrides, wires the pipeline and runs it once.
 *
 * <p>
 * Exit codes: {@value #EXIT_OK} when the run went through its list (failed
 * subreddits included, they are in the dead-letter queue),
 * {@value #EXIT_BREAKER_TRIPPED} when the circuit breaker stopped it,
 * {@value #EXIT_USAGE} for bad arguments or configuration.
 */
@Command(name = "wsbg-archive",
        mixinStandardHelpOptions = true,
        version = "wsbg-archive 1.0.0",
        description = "Downloads subreddit posts and comments from the Arctic Shift archive into Parquet files.")
public class ArchiveCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_BREAKER_TRIPPED = 1;
    static final int EXIT_USAGE = 2;

    @Spec
    CommandSpec spec;

    @Parameters(paramLabel = "SUBREDDIT", arity = "0..*",
            description = "Subreddits to download. Replaces ingest.subreddits from the configuration.")
    List<String> subreddits = new ArrayList<>();

    @Option(names = "--after", paramLabel = "YYYY-MM-DD",
            description = "Oldest UTC date to download (inclusive).")
    String after;

    @Option(names = "--output-dir", paramLabel = "PATH",
            description = "Directory for Parquet files, cursors and locks.")
    Path outputDir;

    @Option(names = "--posts-only", description = "Download posts only.")
    boolean postsOnly;

    @Option(names = "--comments-only", description = "Download comments only.")
    boolean commentsOnly;

    @Option(names = "--config", paramLabel = "PATH",
            description = "Configuration file. Defaults to config.toml in the application data directory.")
    Path configFile;

    @Option(names = "--test", description = "Serve synthetic data instead of calling the archive.")
    boolean testMode;

    @Override
    public Integer call() {
        validateArguments();

        GlobalConfig config;
        try {
            config = ConfigLoader.load(resolveConfigFile());
            applyOverrides(config);
            config.validate();
        } catch (IOException | IllegalStateException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }

        ApplicationMode mode = ApplicationMode.resolve(testMode);
        Injector injector = Guice.createInjector(new ArchiveModule(config, mode));
        IngestEventBus eventBus = injector.getInstance(IngestEventBus.class);
        ProgressReporter reporter = new ProgressReporter();
        eventBus.register(reporter);
        try {
            IngestStats stats = injector.getInstance(IngestionPipeline.class).run();
            return exitCodeFor(stats);
        } catch (UncheckedIOException e) {
            LOG.error("Output directory is unusable: {}", e.getMessage());
            return EXIT_USAGE;
        } finally {
            eventBus.unregister(reporter);
        }
    }

    static int exitCodeFor(IngestStats stats) {
        return stats.circuitBreakerTripped ? EXIT_BREAKER_TRIPPED : EXIT_OK;
    }

    void validateArguments() {
        if (postsOnly && commentsOnly) {
            throw new ParameterException(spec.commandLine(),
                    "--posts-only and --comments-only are mutually exclusive");
        }
        if (after != null) {
            try {
                LocalDate.parse(after);
            } catch (DateTimeParseException e) {
                throw new ParameterException(spec.commandLine(),
                        "Invalid value for --after: '" + after + "' is not a YYYY-MM-DD date");
            }
        }
    }

    /** Writes the command-line values over the loaded configuration. */
    void applyOverrides(GlobalConfig config) {
        IngestConfig ingest = config.getIngest();
        if (!subreddits.isEmpty()) {
            ingest.setSubreddits(new ArrayList<>(subreddits));
        }
        if (after != null) {
            ingest.setAfter(after);
        }
        if (postsOnly) {
            ingest.setContentTypes(new ArrayList<>(List.of(ContentType.POSTS.apiName())));
        } else if (commentsOnly) {
            ingest.setContentTypes(new ArrayList<>(List.of(ContentType.COMMENTS.apiName())));
        }
        if (outputDir != null) {
            config.getStorage().setOutputDir(outputDir.toAbsolutePath().toString());
        }
    }

    private Path resolveConfigFile() {
        return configFile != null ? configFile : StorageUtils.getConfigFile(StorageUtils.APP_NAME);
    }
}
