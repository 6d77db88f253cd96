package de.bsommerfeld.wsbg.archive.storage;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * {@link AtomicWriter} backed by a {@code .tmp} sibling and
 * {@link StandardCopyOption#ATOMIC_MOVE}. The sibling lives in the same
 * directory, so the rename never crosses a file store.
 */
@Singleton
public class FilesystemAtomicWriter implements AtomicWriter {

    private static final Logger LOG = LoggerFactory.getLogger(FilesystemAtomicWriter.class);

    @Override
    public void write(Path target, ContentWriter content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.deleteIfExists(temp);
        try {
            content.writeTo(temp);
            move(temp, target);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    @Override
    public void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move unsupported for {}, falling back to plain replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
