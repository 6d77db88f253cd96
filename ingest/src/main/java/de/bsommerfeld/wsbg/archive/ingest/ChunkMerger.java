package de.bsommerfeld.wsbg.archive.ingest;

import de.bsommerfeld.wsbg.archive.core.domain.ContentType;
import de.bsommerfeld.wsbg.archive.storage.AtomicWriter;
import de.bsommerfeld.wsbg.archive.storage.Checkpoint;
import de.bsommerfeld.wsbg.archive.storage.CheckpointStore;
import de.bsommerfeld.wsbg.archive.storage.ColumnarStore;
import de.bsommerfeld.wsbg.archive.storage.OutputLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Turns the chunk set of one (subreddit, content type) into its
 * consolidated file, and repairs whatever an interrupted run left behind.
 *
 * <h3>Merge sequence</h3>
 * <ol>
 * <li>If a consolidated file exists, rename it to
 * {@code chunk_existing}; it is merged first since it holds the newer
 * records.</li>
 * <li>Merge all inputs in order into {@code {prefix}.merging.parquet}.</li>
 * <li>Delete the cursor. From here on the merged file is authoritative.</li>
 * <li>Rename the merged file to the consolidated name.</li>
 * <li>Delete the inputs.</li>
 * </ol>
 * A failure in step 2 restores the renamed consolidated file and leaves
 * chunks and cursor untouched.
 *
 * <h3>Recovery</h3>
 * {@link #recover} runs before a content type is processed and rolls every
 * interruption point of the sequence above forward or back, then drops a
 * cursor and chunk set that disagree with each other.
 */
public class ChunkMerger {

    private static final Logger LOG = LoggerFactory.getLogger(ChunkMerger.class);

    private final ColumnarStore store;
    private final CheckpointStore checkpoints;
    private final OutputLayout layout;
    private final AtomicWriter atomicWriter;

    public ChunkMerger(ColumnarStore store, CheckpointStore checkpoints, OutputLayout layout,
            AtomicWriter atomicWriter) {
        this.store = store;
        this.checkpoints = checkpoints;
        this.layout = layout;
        this.atomicWriter = atomicWriter;
    }

    /**
     * Merges the chunk set into the consolidated file.
     *
     * @return rows in the new consolidated file, or empty if there were no
     *         chunks to merge (the consolidated file is left as it is)
     */
    public Optional<Long> merge(String subreddit, ContentType type) throws IOException {
        Path consolidated = layout.consolidated(subreddit, type);
        Path cursor = layout.cursor(subreddit, type);
        List<Path> chunks = layout.numberedChunks(subreddit, type);
        if (chunks.isEmpty()) {
            checkpoints.delete(cursor);
            return Optional.empty();
        }

        Path existing = layout.existingChunk(subreddit, type);
        boolean renamedExisting = false;
        if (Files.exists(consolidated)) {
            atomicWriter.move(consolidated, existing);
            renamedExisting = true;
        }

        List<Path> inputs = layout.mergeInputs(subreddit, type);
        Path merging = layout.merging(subreddit, type);
        long rows;
        try {
            rows = store.merge(inputs, type, merging);
        } catch (IOException e) {
            if (renamedExisting) {
                atomicWriter.move(existing, consolidated);
            }
            throw e;
        }

        checkpoints.delete(cursor);
        atomicWriter.move(merging, consolidated);
        for (Path input : inputs) {
            Files.deleteIfExists(input);
        }
        LOG.info("Merged {} files into {} ({} rows)", inputs.size(), consolidated.getFileName(), rows);
        return Optional.of(rows);
    }

    /**
     * Repairs leftovers of an interrupted run and returns the cursor to
     * resume from, if the cursor and chunk set agree.
     */
    public Optional<Checkpoint> recover(String subreddit, ContentType type) throws IOException {
        Path consolidated = layout.consolidated(subreddit, type);
        Path cursor = layout.cursor(subreddit, type);
        Path merging = layout.merging(subreddit, type);
        Path existing = layout.existingChunk(subreddit, type);

        if (Files.exists(merging)) {
            if (Files.exists(cursor)) {
                // merge never committed, chunks are still authoritative
                Files.delete(merging);
            } else {
                atomicWriter.move(merging, consolidated);
                for (Path chunk : layout.numberedChunks(subreddit, type)) {
                    Files.deleteIfExists(chunk);
                }
                Files.deleteIfExists(existing);
                LOG.warn("Completed interrupted merge of {}/{} ({} rows)",
                        subreddit, type, store.countRows(consolidated));
            }
        }

        if (Files.exists(existing)) {
            if (Files.exists(consolidated)) {
                Files.delete(existing);
            } else {
                LOG.warn("Restoring {} from an interrupted refresh", consolidated.getFileName());
                atomicWriter.move(existing, consolidated);
            }
        }

        Optional<Checkpoint> checkpoint = checkpoints.read(cursor);
        List<Path> chunks = layout.numberedChunks(subreddit, type);
        if (checkpoint.isPresent() && isConsistent(checkpoint.get(), chunks, subreddit, type)) {
            return checkpoint;
        }
        if (checkpoint.isPresent() || !chunks.isEmpty() || Files.exists(cursor)) {
            LOG.warn("Inconsistent state for {}/{} (cursor: {}, chunks on disk: {}), starting clean",
                    subreddit, type,
                    checkpoint.map(c -> c.chunksWritten() + " chunks").orElse("absent"), chunks.size());
            for (Path chunk : chunks) {
                Files.deleteIfExists(chunk);
            }
            checkpoints.delete(cursor);
        }
        return Optional.empty();
    }

    private boolean isConsistent(Checkpoint checkpoint, List<Path> chunks, String subreddit, ContentType type) {
        if (chunks.isEmpty() || checkpoint.chunksWritten() != chunks.size()) {
            return false;
        }
        for (int i = 0; i < chunks.size(); i++) {
            if (!chunks.get(i).equals(layout.chunk(subreddit, type, i))) {
                return false;
            }
        }
        return true;
    }
}
