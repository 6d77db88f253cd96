package de.bsommerfeld.wsbg.archive.ingest;

import de.bsommerfeld.wsbg.archive.core.domain.ArchiveRecord;
import de.bsommerfeld.wsbg.archive.core.domain.ContentType;
import de.bsommerfeld.wsbg.archive.storage.Checkpoint;
import de.bsommerfeld.wsbg.archive.storage.CheckpointStore;
import de.bsommerfeld.wsbg.archive.storage.ColumnarStore;
import de.bsommerfeld.wsbg.archive.storage.OutputLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory buffer of one (subreddit, content type) that spills into
 * numbered chunk files.
 *
 * <h3>Flush</h3>
 * A flush is triggered once the buffer holds {@code chunkSize} rows or its
 * estimated size reaches {@code maxBufferBytes}. It writes the next chunk
 * file and then rewrites the cursor with the cumulative counts and the
 * frontier. Both writes are atomic, so a crash between them leaves one
 * chunk more on disk than the cursor records. A flush in the middle of a
 * page records only the pages before it.
 *
 * <h3>Frontier</h3>
 * The oldest {@code created_utc} appended so far. Records arrive
 * newest-first and a flush always empties the whole buffer, so the frontier
 * written with a cursor never runs ahead of the rows that are on disk.
 */
public class ChunkWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ChunkWriter.class);

    private final ColumnarStore store;
    private final CheckpointStore checkpoints;
    private final OutputLayout layout;
    private final Clock clock;
    private final String subreddit;
    private final ContentType type;
    private final int chunkSize;
    private final long maxBufferBytes;

    private final List<ArchiveRecord> buffer = new ArrayList<>();
    private long bufferBytes;
    private Checkpoint checkpoint;
    private Long frontier;
    private long rowsFlushed;
    private int chunksWritten;
    private int pagesCompleted;
    private long parquetBytesWritten;

    private ChunkWriter(ColumnarStore store, CheckpointStore checkpoints, OutputLayout layout, Clock clock,
            String subreddit, ContentType type, int chunkSize, long maxBufferBytes, Checkpoint checkpoint,
            Long frontier) {
        this.store = store;
        this.checkpoints = checkpoints;
        this.layout = layout;
        this.clock = clock;
        this.subreddit = subreddit;
        this.type = type;
        this.chunkSize = chunkSize;
        this.maxBufferBytes = maxBufferBytes;
        this.checkpoint = checkpoint;
        this.frontier = frontier;
        if (checkpoint != null) {
            this.rowsFlushed = checkpoint.rowsFlushed();
            this.chunksWritten = checkpoint.chunksWritten();
            this.pagesCompleted = checkpoint.pagesCompleted();
        }
    }

    /**
     * A writer without prior chunks.
     *
     * @param seedFrontier upper bound for the first page, or {@code null} to
     *                     start at the newest record
     */
    public static ChunkWriter start(ColumnarStore store, CheckpointStore checkpoints, OutputLayout layout,
            Clock clock, String subreddit, ContentType type, int chunkSize, long maxBufferBytes, Long seedFrontier) {
        return new ChunkWriter(store, checkpoints, layout, clock, subreddit, type, chunkSize, maxBufferBytes,
                null, seedFrontier);
    }

    /** A writer continuing the chunk sequence and counts of {@code checkpoint}. */
    public static ChunkWriter resume(ColumnarStore store, CheckpointStore checkpoints, OutputLayout layout,
            Clock clock, int chunkSize, long maxBufferBytes, Checkpoint checkpoint) {
        return new ChunkWriter(store, checkpoints, layout, clock, checkpoint.subreddit(), checkpoint.contentType(),
                chunkSize, maxBufferBytes, checkpoint, checkpoint.oldestUtcSeen());
    }

    /**
     * Buffers {@code record} and flushes if a threshold is reached.
     *
     * @return {@code true} if the append caused a flush
     */
    public boolean append(ArchiveRecord record) throws IOException {
        buffer.add(record);
        bufferBytes += record.estimatedBytes();
        if (frontier == null || record.createdUtc() < frontier) {
            frontier = record.createdUtc();
        }
        if (buffer.size() >= chunkSize || bufferBytes >= maxBufferBytes) {
            if (buffer.size() < chunkSize) {
                LOG.info("Buffer for {}/{} reached {} bytes, flushing early", subreddit, type, bufferBytes);
            }
            flush();
            return true;
        }
        return false;
    }

    /**
     * Appends the accepted records of one page and counts the page. The page
     * is counted before its last record is buffered, so a flush triggered by
     * that record persists a cursor that already includes the page. An empty
     * page is counted as well.
     */
    public void appendPage(List<? extends ArchiveRecord> records) throws IOException {
        int last = records.size() - 1;
        for (int i = 0; i < last; i++) {
            append(records.get(i));
        }
        pagesCompleted++;
        if (last >= 0) {
            append(records.get(last));
        }
    }

    public int pagesCompleted() {
        return pagesCompleted;
    }

    /**
     * Writes the buffered rows as the next chunk and persists the cursor.
     * An empty buffer is a no-op.
     *
     * @return bytes written to the chunk file
     */
    public long flush() throws IOException {
        if (buffer.isEmpty()) {
            return 0;
        }
        Path chunk = layout.chunk(subreddit, type, chunksWritten);
        long bytes = store.writeChunk(chunk, type, buffer);

        int rows = buffer.size();
        rowsFlushed += rows;
        chunksWritten++;
        parquetBytesWritten += bytes;
        buffer.clear();
        bufferBytes = 0;

        if (checkpoint == null) {
            checkpoint = new Checkpoint(subreddit, type, frontier, rowsFlushed, chunksWritten, pagesCompleted,
                    clock.instant(), clock.instant());
        } else {
            checkpoint = checkpoint.advance(frontier, rowsFlushed, chunksWritten, pagesCompleted, clock.instant());
        }
        checkpoints.write(layout.cursor(subreddit, type), checkpoint);
        LOG.info("Flushed {} rows to {} ({} rows total)", rows, chunk.getFileName(), rowsFlushed);
        return bytes;
    }

    /** Rows flushed over the cursor's lifetime plus rows still buffered. */
    public long totalRows() {
        return rowsFlushed + buffer.size();
    }

    public Long frontier() {
        return frontier;
    }

    public int chunksWritten() {
        return chunksWritten;
    }

    public long parquetBytesWritten() {
        return parquetBytesWritten;
    }
}
