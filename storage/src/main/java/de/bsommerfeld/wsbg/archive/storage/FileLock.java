package de.bsommerfeld.wsbg.archive.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Non-blocking, exclusive, per-file advisory lock shared between worker
 * processes on one host.
 */
public interface FileLock {

    /**
     * @return {@code true} if this caller now holds the lock, {@code false}
     *         if another holder has it
     * @throws IOException if the lock file cannot be created or opened
     */
    boolean tryAcquire(Path lockFile) throws IOException;

    /** Releases a lock taken by {@link #tryAcquire}. Unknown paths are ignored. */
    void release(Path lockFile);

    /**
     * Removes the lock file while the lock is still held, then releases it.
     * A waiter that opened the old file before the removal must not end up
     * holding the subreddit next to a worker that created a new file.
     */
    void releaseAndDelete(Path lockFile);
}
