package de.bsommerfeld.wsbg.archive.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a consolidated file is recent enough to skip. Age is the
 * file's last-modified time against the clock; a stale-days value of 0
 * treats every file as stale.
 */
public class FreshnessPolicy {

    private static final double SECONDS_PER_DAY = 86_400d;

    private final double staleDays;
    private final Clock clock;

    public FreshnessPolicy(double staleDays, Clock clock) {
        this.staleDays = staleDays;
        this.clock = clock;
    }

    public boolean isFresh(Path consolidated) throws IOException {
        if (staleDays <= 0 || !Files.exists(consolidated)) {
            return false;
        }
        return ageDays(consolidated) < staleDays;
    }

    public double ageDays(Path file) throws IOException {
        Instant modified = Files.getLastModifiedTime(file).toInstant();
        return Duration.between(modified, clock.instant()).toMillis() / 1000d / SECONDS_PER_DAY;
    }

    /** Marks a file as just checked without touching its content. */
    public void touch(Path file) throws IOException {
        Files.setLastModifiedTime(file, FileTime.from(clock.instant()));
    }
}
