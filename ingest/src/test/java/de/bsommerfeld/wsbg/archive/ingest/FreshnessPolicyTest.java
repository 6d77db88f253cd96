package de.bsommerfeld.wsbg.archive.ingest;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class FreshnessPolicyTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void isFresh_shouldBeFalseForMissingFile() throws Exception {
        assertFalse(new FreshnessPolicy(7, clock).isFresh(tempDir.resolve("missing.parquet")));
    }

    @Test
    void isFresh_shouldCompareAgeWithThreshold() throws Exception {
        Path file = Files.createFile(tempDir.resolve("wsb_posts.parquet"));
        var policy = new FreshnessPolicy(7, clock);

        Files.setLastModifiedTime(file, FileTime.from(NOW.minus(Duration.ofDays(6))));
        assertTrue(policy.isFresh(file));

        Files.setLastModifiedTime(file, FileTime.from(NOW.minus(Duration.ofDays(8))));
        assertFalse(policy.isFresh(file));
    }

    @Test
    void isFresh_shouldAlwaysBeFalseWithZeroStaleDays() throws Exception {
        Path file = Files.createFile(tempDir.resolve("wsb_posts.parquet"));
        Files.setLastModifiedTime(file, FileTime.from(NOW));

        assertFalse(new FreshnessPolicy(0, clock).isFresh(file));
    }

    @Test
    void touch_shouldMakeStaleFileFresh() throws Exception {
        Path file = Files.createFile(tempDir.resolve("wsb_posts.parquet"));
        Files.setLastModifiedTime(file, FileTime.from(NOW.minus(Duration.ofDays(30))));
        var policy = new FreshnessPolicy(7, clock);

        policy.touch(file);

        assertTrue(policy.isFresh(file));
        assertEquals(0.0, policy.ageDays(file), 0.001);
    }
}
