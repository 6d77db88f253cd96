package de.bsommerfeld.wsbg.archive.ingest;

import de.bsommerfeld.wsbg.archive.core.domain.ArchivePost;
import de.bsommerfeld.wsbg.archive.core.domain.ArchiveRecord;
import de.bsommerfeld.wsbg.archive.core.domain.ContentType;
import de.bsommerfeld.wsbg.archive.storage.Checkpoint;
import de.bsommerfeld.wsbg.archive.storage.CheckpointStore;
import de.bsommerfeld.wsbg.archive.storage.DuckDbColumnarStore;
import de.bsommerfeld.wsbg.archive.storage.FilesystemAtomicWriter;
import de.bsommerfeld.wsbg.archive.storage.OutputLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Merge sequence and crash recovery against real Parquet files.
 */
class ChunkMergerTest {

    private static final ContentType POSTS = ContentType.POSTS;
    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private OutputLayout layout;
    private DuckDbColumnarStore store;
    private CheckpointStore checkpoints;
    private ChunkMerger merger;

    @BeforeEach
    void setUp() {
        FilesystemAtomicWriter writer = new FilesystemAtomicWriter();
        layout = new OutputLayout(tempDir);
        store = new DuckDbColumnarStore(writer);
        checkpoints = new CheckpointStore(writer);
        merger = new ChunkMerger(store, checkpoints, layout, writer);
    }

    // -- Merge --

    @Test
    void merge_shouldConcatenateChunksInOrderAndCleanUp() throws IOException {
        writeChunk(0, post(300), post(200));
        writeChunk(1, post(100));
        writeCursor(2, 3, 100L);

        Optional<Long> rows = merger.merge("wsb", POSTS);

        assertEquals(Optional.of(3L), rows);
        assertEquals(List.of(post(300), post(200), post(100)),
                store.readAll(layout.consolidated("wsb", POSTS), POSTS));
        assertTrue(layout.numberedChunks("wsb", POSTS).isEmpty());
        assertFalse(Files.exists(layout.cursor("wsb", POSTS)));
        assertFalse(Files.exists(layout.merging("wsb", POSTS)));
    }

    @Test
    void merge_shouldPutExistingConsolidatedFileFirst() throws IOException {
        store.writeChunk(layout.consolidated("wsb", POSTS), POSTS, List.of(post(900), post(800)));
        writeChunk(0, post(700));
        writeCursor(1, 1, 700L);

        merger.merge("wsb", POSTS);

        assertEquals(List.of(post(900), post(800), post(700)),
                store.readAll(layout.consolidated("wsb", POSTS), POSTS));
        assertFalse(Files.exists(layout.existingChunk("wsb", POSTS)));
    }

    @Test
    void merge_shouldLeaveConsolidatedFileAloneWithoutChunks() throws IOException {
        store.writeChunk(layout.consolidated("wsb", POSTS), POSTS, List.of(post(900)));

        assertEquals(Optional.empty(), merger.merge("wsb", POSTS));
        assertEquals(1, store.countRows(layout.consolidated("wsb", POSTS)));
    }

    @Test
    void merge_shouldKeepChunksCursorAndOutputWhenMergeFails() throws IOException {
        store.writeChunk(layout.consolidated("wsb", POSTS), POSTS, List.of(post(900)));
        Files.writeString(layout.chunk("wsb", POSTS, 0), "not parquet");
        writeCursor(1, 1, 700L);

        assertThrows(IOException.class, () -> merger.merge("wsb", POSTS));

        assertTrue(Files.exists(layout.chunk("wsb", POSTS, 0)));
        assertTrue(Files.exists(layout.cursor("wsb", POSTS)));
        assertEquals(1, store.countRows(layout.consolidated("wsb", POSTS)));
        assertFalse(Files.exists(layout.existingChunk("wsb", POSTS)));
    }

    // -- Recovery --

    @Test
    void recover_shouldReturnConsistentCursor() throws IOException {
        writeChunk(0, post(300));
        writeChunk(1, post(200));
        writeCursor(2, 2, 200L);

        Optional<Checkpoint> cursor = merger.recover("wsb", POSTS);

        assertTrue(cursor.isPresent());
        assertEquals(Long.valueOf(200), cursor.get().oldestUtcSeen());
        assertEquals(2, layout.numberedChunks("wsb", POSTS).size());
    }

    @Test
    void recover_shouldDiscardCursorWithoutChunks() throws IOException {
        writeCursor(1, 10, 200L);

        assertTrue(merger.recover("wsb", POSTS).isEmpty());
        assertFalse(Files.exists(layout.cursor("wsb", POSTS)));
    }

    @Test
    void recover_shouldDiscardChunksWithoutCursor() throws IOException {
        writeChunk(0, post(300));

        assertTrue(merger.recover("wsb", POSTS).isEmpty());
        assertTrue(layout.numberedChunks("wsb", POSTS).isEmpty());
    }

    @Test
    void recover_shouldDiscardWhenChunkCountDisagrees() throws IOException {
        writeChunk(0, post(300));
        writeChunk(1, post(200));
        writeCursor(1, 1, 300L);

        assertTrue(merger.recover("wsb", POSTS).isEmpty());
        assertTrue(layout.numberedChunks("wsb", POSTS).isEmpty());
        assertFalse(Files.exists(layout.cursor("wsb", POSTS)));
    }

    @Test
    void recover_shouldDiscardCorruptCursorAndItsChunks() throws IOException {
        writeChunk(0, post(300));
        Files.writeString(layout.cursor("wsb", POSTS), "{ not json");

        assertTrue(merger.recover("wsb", POSTS).isEmpty());
        assertTrue(layout.numberedChunks("wsb", POSTS).isEmpty());
        assertFalse(Files.exists(layout.cursor("wsb", POSTS)));
    }

    @Test
    void recover_shouldDropUncommittedMergeWhileCursorExists() throws IOException {
        writeChunk(0, post(300));
        writeCursor(1, 1, 300L);
        store.writeChunk(layout.merging("wsb", POSTS), POSTS, List.of(post(300)));

        assertTrue(merger.recover("wsb", POSTS).isPresent());
        assertFalse(Files.exists(layout.merging("wsb", POSTS)));
        assertFalse(Files.exists(layout.consolidated("wsb", POSTS)));
    }

    @Test
    void recover_shouldCompleteMergeInterruptedAfterCursorDeletion() throws IOException {
        writeChunk(0, post(300));
        Files.createFile(layout.existingChunk("wsb", POSTS));
        store.writeChunk(layout.merging("wsb", POSTS), POSTS, List.of(post(900), post(300)));

        assertTrue(merger.recover("wsb", POSTS).isEmpty());

        assertEquals(2, store.countRows(layout.consolidated("wsb", POSTS)));
        assertTrue(layout.numberedChunks("wsb", POSTS).isEmpty());
        assertFalse(Files.exists(layout.existingChunk("wsb", POSTS)));
        assertFalse(Files.exists(layout.merging("wsb", POSTS)));
    }

    @Test
    void recover_shouldRestoreRenamedOutputOfInterruptedRefresh() throws IOException {
        store.writeChunk(layout.existingChunk("wsb", POSTS), POSTS, List.of(post(900)));
        writeChunk(0, post(300));
        writeCursor(1, 1, 300L);

        Optional<Checkpoint> cursor = merger.recover("wsb", POSTS);

        assertTrue(cursor.isPresent());
        assertEquals(1, store.countRows(layout.consolidated("wsb", POSTS)));
        assertFalse(Files.exists(layout.existingChunk("wsb", POSTS)));
    }

    @Test
    void recover_shouldDropLeftoverExistingChunkNextToOutput() throws IOException {
        store.writeChunk(layout.consolidated("wsb", POSTS), POSTS, List.of(post(900), post(300)));
        store.writeChunk(layout.existingChunk("wsb", POSTS), POSTS, List.of(post(900)));

        merger.recover("wsb", POSTS);

        assertFalse(Files.exists(layout.existingChunk("wsb", POSTS)));
        assertEquals(2, store.countRows(layout.consolidated("wsb", POSTS)));
    }

    private void writeChunk(int sequence, ArchiveRecord... records) throws IOException {
        store.writeChunk(layout.chunk("wsb", POSTS, sequence), POSTS, List.of(records));
    }

    private void writeCursor(int chunks, long rows, Long frontier) throws IOException {
        checkpoints.write(layout.cursor("wsb", POSTS),
                new Checkpoint("wsb", POSTS, frontier, rows, chunks, chunks, NOW, NOW));
    }

    private static ArchivePost post(long createdUtc) {
        return new ArchivePost("p" + createdUtc, "wsb", "title " + createdUtc, "", 1, createdUtc,
                "/r/wsb/comments/p" + createdUtc + "/", 1.0, 0);
    }
}
