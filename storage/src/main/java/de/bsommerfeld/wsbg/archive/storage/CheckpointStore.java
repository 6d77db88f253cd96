package de.bsommerfeld.wsbg.archive.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.inject.Singleton;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and atomically rewrites {@code *.cursor.json} files. A cursor that
 * cannot be parsed is reported and treated as absent; the caller's
 * consistency check then discards the chunks it described.
 */
@Singleton
public class CheckpointStore {

    private static final Logger LOG = LoggerFactory.getLogger(CheckpointStore.class);

    private final AtomicWriter atomicWriter;
    private final ObjectMapper mapper;

    @Inject
    public CheckpointStore(AtomicWriter atomicWriter) {
        this.atomicWriter = atomicWriter;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Optional<Checkpoint> read(Path cursorFile) {
        try {
            String json = Files.readString(cursorFile);
            return Optional.of(mapper.readValue(json, Checkpoint.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (JsonProcessingException e) {
            LOG.warn("Corrupt cursor {}, ignoring it: {}", cursorFile.getFileName(), e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            LOG.warn("Unreadable cursor {}, ignoring it: {}", cursorFile.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    public void write(Path cursorFile, Checkpoint checkpoint) throws IOException {
        atomicWriter.writeString(cursorFile, mapper.writeValueAsString(checkpoint));
    }

    public void delete(Path cursorFile) throws IOException {
        Files.deleteIfExists(cursorFile);
    }
}
