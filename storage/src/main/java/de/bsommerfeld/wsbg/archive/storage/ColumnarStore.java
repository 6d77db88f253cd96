package de.bsommerfeld.wsbg.archive.storage;

import de.bsommerfeld.wsbg.archive.core.domain.ArchiveRecord;
import de.bsommerfeld.wsbg.archive.core.domain.ContentType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

/**
 * Reads and writes the immutable columnar files that hold archived records.
 * All writes are atomic: a target is either absent, the previous version,
 * or the complete new file.
 */
public interface ColumnarStore {

    /**
     * Writes {@code records} in the given order as a new file at {@code target}.
     *
     * @return size of the written file in bytes
     */
    long writeChunk(Path target, ContentType type, List<? extends ArchiveRecord> records) throws IOException;

    /**
     * Concatenates {@code inputs} in list order into a new file at
     * {@code target}. The inputs are left untouched.
     *
     * @return number of rows in the merged file
     */
    long merge(List<Path> inputs, ContentType type, Path target) throws IOException;

    /** Smallest {@code created_utc} in the file, empty for a file without rows. */
    OptionalLong oldestCreatedUtc(Path file) throws IOException;

    long countRows(Path file) throws IOException;
}
