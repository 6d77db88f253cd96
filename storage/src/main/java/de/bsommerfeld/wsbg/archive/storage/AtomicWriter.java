package de.bsommerfeld.wsbg.archive.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Replaces files so that readers only ever observe the old content or the
 * complete new content. Every durable artifact of a run (chunk, consolidated
 * file, cursor, dead-letter ledger) goes through this seam.
 */
public interface AtomicWriter {

    /**
     * Lets {@code content} fill a temporary sibling of {@code target}, then
     * renames it over {@code target}. If {@code content} throws, the target is
     * untouched and the temporary file is removed.
     */
    void write(Path target, ContentWriter content) throws IOException;

    /** Renames {@code source} to {@code target}, replacing any existing file. */
    void move(Path source, Path target) throws IOException;

    default void writeString(Path target, String content) throws IOException {
        write(target, temp -> Files.writeString(temp, content, StandardCharsets.UTF_8));
    }

    @FunctionalInterface
    interface ContentWriter {
        void writeTo(Path temp) throws IOException;
    }
}
