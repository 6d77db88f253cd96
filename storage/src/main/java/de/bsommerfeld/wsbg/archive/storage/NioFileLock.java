package de.bsommerfeld.wsbg.archive.storage;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link FileLock} on top of {@link FileChannel#tryLock()}. The OS drops the
 * lock when the process dies, so a crashed worker never blocks a subreddit
 * for good; the lock file itself may stay behind and is simply reused.
 *
 * <p>
 * Within one JVM a second {@code tryLock} on the same file throws
 * {@link OverlappingFileLockException}; that is reported as contention just
 * like a lock held by another process.
 *
 * <p>
 * A successful holder deletes the file before releasing it. A waiter that
 * opened the file before the delete can still lock the unlinked file, so
 * every acquisition stamps an owner token through its channel and reads it
 * back through the path; a mismatch means the path now names another file
 * and the acquisition counts as contention.
 */
@Singleton
public class NioFileLock implements FileLock {

    private static final Logger LOG = LoggerFactory.getLogger(NioFileLock.class);

    private final Map<Path, java.nio.channels.FileLock> held = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(Path lockFile) throws IOException {
        Path key = lockFile.toAbsolutePath();
        Path parent = key.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return acquire(key, FileChannel.open(key, StandardOpenOption.CREATE, StandardOpenOption.WRITE));
    }

    /** Locks an already opened channel on {@code key}; closes it unless the lock is kept. */
    boolean acquire(Path key, FileChannel channel) throws IOException {
        try {
            java.nio.channels.FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                return false;
            }
            if (!stampOwner(key, channel)) {
                LOG.debug("Lock file {} was replaced while acquiring it", key);
                lock.release();
                channel.close();
                return false;
            }
            held.put(key, lock);
            return true;
        } catch (OverlappingFileLockException e) {
            channel.close();
            return false;
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    private static boolean stampOwner(Path key, FileChannel channel) throws IOException {
        byte[] token = (ProcessHandle.current().pid() + "@" + UUID.randomUUID())
                .getBytes(StandardCharsets.UTF_8);
        channel.truncate(0);
        channel.write(ByteBuffer.wrap(token), 0);
        channel.force(false);
        try {
            return Arrays.equals(token, Files.readAllBytes(key));
        } catch (NoSuchFileException e) {
            return false;
        }
    }

    @Override
    public void release(Path lockFile) {
        java.nio.channels.FileLock lock = held.remove(lockFile.toAbsolutePath());
        if (lock == null) {
            return;
        }
        try (FileChannel channel = lock.channel()) {
            lock.release();
        } catch (IOException e) {
            LOG.warn("Failed to release lock {}: {}", lockFile, e.getMessage());
        }
    }

    @Override
    public void releaseAndDelete(Path lockFile) {
        Path key = lockFile.toAbsolutePath();
        if (held.containsKey(key)) {
            try {
                Files.deleteIfExists(key);
            } catch (IOException e) {
                LOG.warn("Could not remove lock file {}: {}", lockFile, e.getMessage());
            }
        }
        release(key);
    }
}
