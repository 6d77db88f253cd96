package de.bsommerfeld.wsbg.archive.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static org.junit.jupiter.api.Assertions.*;

class NioFileLockTest {

    @TempDir
    Path tempDir;

    @Test
    void tryAcquire_shouldCreateLockFile() throws IOException {
        var lock = new NioFileLock();
        Path lockFile = tempDir.resolve("wsb.lock");

        assertTrue(lock.tryAcquire(lockFile));
        assertTrue(Files.exists(lockFile));
        lock.release(lockFile);
    }

    @Test
    void tryAcquire_shouldBeExclusiveAcrossHolders() throws IOException {
        var workerA = new NioFileLock();
        var workerB = new NioFileLock();
        Path lockFile = tempDir.resolve("wsb.lock");

        assertTrue(workerA.tryAcquire(lockFile));
        assertFalse(workerB.tryAcquire(lockFile));

        workerA.release(lockFile);
        assertTrue(workerB.tryAcquire(lockFile));
        workerB.release(lockFile);
    }

    @Test
    void tryAcquire_shouldNotBlockOtherSubreddits() throws IOException {
        var workerA = new NioFileLock();
        var workerB = new NioFileLock();

        assertTrue(workerA.tryAcquire(tempDir.resolve("wsb.lock")));
        assertTrue(workerB.tryAcquire(tempDir.resolve("de.lock")));

        workerA.release(tempDir.resolve("wsb.lock"));
        workerB.release(tempDir.resolve("de.lock"));
    }

    @Test
    void release_shouldIgnoreUnknownPath() {
        var lock = new NioFileLock();
        assertDoesNotThrow(() -> lock.release(tempDir.resolve("never.lock")));
    }

    // -- lock file removal --

    @Test
    void releaseAndDelete_shouldRemoveFileAndFreeSubreddit() throws IOException {
        var workerA = new NioFileLock();
        var workerB = new NioFileLock();
        Path lockFile = tempDir.resolve("wsb.lock");

        assertTrue(workerA.tryAcquire(lockFile));
        workerA.releaseAndDelete(lockFile);

        assertFalse(Files.exists(lockFile));
        assertTrue(workerB.tryAcquire(lockFile));
        workerB.release(lockFile);
    }

    @Test
    void releaseAndDelete_shouldKeepFileOfForeignLock() throws IOException {
        var workerA = new NioFileLock();
        var workerB = new NioFileLock();
        Path lockFile = tempDir.resolve("wsb.lock");

        assertTrue(workerA.tryAcquire(lockFile));
        workerB.releaseAndDelete(lockFile);

        assertTrue(Files.exists(lockFile));
        workerA.release(lockFile);
    }

    @Test
    void acquire_shouldRejectWaiterOnRemovedFileWhileNewHolderExists() throws IOException {
        var workerA = new NioFileLock();
        var workerB = new NioFileLock();
        var workerC = new NioFileLock();
        Path lockFile = tempDir.resolve("wsb.lock").toAbsolutePath();

        assertTrue(workerA.tryAcquire(lockFile));
        // B opened the file before A finished and removed it
        FileChannel staleChannel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        workerA.releaseAndDelete(lockFile);
        assertTrue(workerC.tryAcquire(lockFile));

        assertFalse(workerB.acquire(lockFile, staleChannel));
        assertFalse(staleChannel.isOpen());
        workerC.release(lockFile);
    }

    @Test
    void acquire_shouldRejectWaiterOnRemovedFile() throws IOException {
        var workerA = new NioFileLock();
        var workerB = new NioFileLock();
        Path lockFile = tempDir.resolve("wsb.lock").toAbsolutePath();

        assertTrue(workerA.tryAcquire(lockFile));
        FileChannel staleChannel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        workerA.releaseAndDelete(lockFile);

        assertFalse(workerB.acquire(lockFile, staleChannel));
        assertFalse(Files.exists(lockFile));
        assertTrue(workerB.tryAcquire(lockFile));
        workerB.release(lockFile);
    }
}
