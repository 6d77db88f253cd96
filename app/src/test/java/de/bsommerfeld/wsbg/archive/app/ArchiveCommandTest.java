package de.bsommerfeld.wsbg.archive.app;

import de.bsommerfeld.wsbg.archive.core.config.GlobalConfig;
import de.bsommerfeld.wsbg.archive.core.domain.ContentType;
import de.bsommerfeld.wsbg.archive.ingest.IngestStats;
import de.bsommerfeld.wsbg.archive.storage.OutputLayout;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParameterException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveCommandTest {

    @TempDir
    Path tempDir;

    private static int execute(String... args) {
        return new CommandLine(new ArchiveCommand()).execute(args);
    }

    private static ArchiveCommand parse(String... args) {
        ArchiveCommand command = new ArchiveCommand();
        new CommandLine(command).parseArgs(args);
        return command;
    }

    private Path writeConfig(String toml) throws Exception {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, toml);
        return file;
    }

    // -- overrides --

    @Test
    void applyOverrides_shouldReplaceConfiguredValues() {
        Path out = tempDir.resolve("out");
        ArchiveCommand command = parse("--after", "2024-02-01", "--posts-only",
                "--output-dir", out.toString(), "mauerstrassenwetten", "r/wallstreetbetsGER");
        GlobalConfig config = new GlobalConfig();

        command.applyOverrides(config);

        assertEquals(List.of("mauerstrassenwetten", "r/wallstreetbetsGER"), config.getIngest().getSubreddits());
        assertEquals("2024-02-01", config.getIngest().getAfter());
        assertEquals(EnumSet.of(ContentType.POSTS), config.getIngest().resolveContentTypes());
        assertEquals(out.toAbsolutePath(), config.getStorage().resolveOutputDir());
        assertEquals(out.toAbsolutePath().resolve("dead_letter"), config.getStorage().resolveDeadLetterDir());
    }

    @Test
    void applyOverrides_shouldSelectCommentsOnly() {
        GlobalConfig config = new GlobalConfig();

        parse("--comments-only").applyOverrides(config);

        assertEquals(EnumSet.of(ContentType.COMMENTS), config.getIngest().resolveContentTypes());
    }

    @Test
    void applyOverrides_shouldKeepConfigurationWithoutArguments() {
        GlobalConfig config = new GlobalConfig();

        parse().applyOverrides(config);

        assertEquals(List.of("wallstreetbetsGER"), config.getIngest().getSubreddits());
        assertEquals("2023-01-01", config.getIngest().getAfter());
        assertEquals(EnumSet.allOf(ContentType.class), config.getIngest().resolveContentTypes());
        assertEquals("", config.getStorage().getOutputDir());
    }

    // -- argument validation --

    @Test
    void validateArguments_shouldRejectBothContentFlags() {
        ArchiveCommand command = parse("--posts-only", "--comments-only");

        assertThrows(ParameterException.class, command::validateArguments);
    }

    @Test
    void validateArguments_shouldRejectMalformedAfterDate() {
        ArchiveCommand command = parse("--after", "01.02.2024");

        assertThrows(ParameterException.class, command::validateArguments);
    }

    @Test
    void validateArguments_shouldAcceptIsoDate() {
        ArchiveCommand command = parse("--after", "2024-02-29");

        assertDoesNotThrow(command::validateArguments);
    }

    // -- exit codes --

    @Test
    void exitCodeFor_shouldSignalTrippedBreaker() {
        IngestStats stats = new IngestStats();
        assertEquals(ArchiveCommand.EXIT_OK, ArchiveCommand.exitCodeFor(stats));

        stats.subredditsFailed = 2;
        stats.requestCapHit = true;
        assertEquals(ArchiveCommand.EXIT_OK, ArchiveCommand.exitCodeFor(stats));

        stats.circuitBreakerTripped = true;
        assertEquals(ArchiveCommand.EXIT_BREAKER_TRIPPED, ArchiveCommand.exitCodeFor(stats));
    }

    @Test
    void execute_shouldReturnUsageCodeForUnknownOption() {
        assertEquals(ArchiveCommand.EXIT_USAGE, execute("--no-such-flag"));
    }

    @Test
    void execute_shouldReturnUsageCodeForConflictingFlags() throws Exception {
        Path config = writeConfig("[archive]\npage-delay-millis = 0\n");

        int code = execute("--test", "--config", config.toString(), "--posts-only", "--comments-only");

        assertEquals(ArchiveCommand.EXIT_USAGE, code);
    }

    @Test
    void execute_shouldReturnUsageCodeForInvalidConfiguration() throws Exception {
        Path config = writeConfig("[ingest]\nchunk-size = 0\n");

        int code = execute("--test", "--config", config.toString(), "--output-dir", tempDir.toString());

        assertEquals(ArchiveCommand.EXIT_USAGE, code);
    }

    @Test
    void execute_shouldReturnUsageCodeForUnparseableConfiguration() throws Exception {
        Path config = writeConfig("[ingest\nsubreddits = ");

        int code = execute("--test", "--config", config.toString(), "--output-dir", tempDir.toString());

        assertEquals(ArchiveCommand.EXIT_USAGE, code);
    }

    @Test
    void execute_shouldPrintHelp() {
        assertEquals(ArchiveCommand.EXIT_OK, execute("--help"));
    }

    // -- full run in TEST mode --

    @Test
    void execute_shouldDownloadSyntheticSubredditInTestMode() throws Exception {
        Path config = writeConfig("[archive]\npage-delay-millis = 0\n");
        Path out = tempDir.resolve("out");
        OutputLayout layout = new OutputLayout(out);

        int code = execute("--test", "--config", config.toString(), "--output-dir", out.toString(),
                "--posts-only", "testsub");

        assertEquals(ArchiveCommand.EXIT_OK, code);
        assertTrue(Files.exists(layout.consolidated("testsub", ContentType.POSTS)));
        assertFalse(Files.exists(layout.consolidated("testsub", ContentType.COMMENTS)));
        assertFalse(Files.exists(layout.cursor("testsub", ContentType.POSTS)));
        assertTrue(layout.numberedChunks("testsub", ContentType.POSTS).isEmpty());
        assertFalse(Files.exists(layout.lock("testsub")));
    }

    @Test
    void execute_shouldSkipFreshOutputOnSecondRun() throws Exception {
        Path config = writeConfig("[archive]\npage-delay-millis = 0\n");
        Path out = tempDir.resolve("out");
        Path consolidated = new OutputLayout(out).consolidated("testsub", ContentType.POSTS);
        String[] args = { "--test", "--config", config.toString(), "--output-dir", out.toString(),
                "--posts-only", "testsub" };

        assertEquals(ArchiveCommand.EXIT_OK, execute(args));
        long modified = Files.getLastModifiedTime(consolidated).toMillis();

        assertEquals(ArchiveCommand.EXIT_OK, execute(args));
        assertEquals(modified, Files.getLastModifiedTime(consolidated).toMillis());
    }
}
