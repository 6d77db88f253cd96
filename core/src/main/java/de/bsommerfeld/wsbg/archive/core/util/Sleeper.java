package de.bsommerfeld.wsbg.archive.core.util;

import java.time.Duration;

/**
 * The pipeline's only suspension points (politeness delay, retry backoff,
 * rate-limit pause) go through this interface so tests can record waits
 * instead of performing them.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
