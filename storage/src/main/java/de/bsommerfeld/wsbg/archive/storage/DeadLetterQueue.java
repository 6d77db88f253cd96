package de.bsommerfeld.wsbg.archive.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-subreddit failure ledger in JSON Lines format.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 * <li>First failure: a new entry with {@code attempts = 1} is appended to
 * {@code dead_letter/{sub}.jsonl}.</li>
 * <li>Repeat failure: the entry's attempt count and {@code last_failed_at}
 * are bumped.</li>
 * <li>Once attempts reach the ceiling the entry moves to
 * {@code dead_letter/{sub}_permanent.jsonl}; a transient file left without
 * entries is deleted.</li>
 * <li>Success: {@link #clear(String)} drops the transient entry.</li>
 * </ol>
 * Every rewrite goes through the {@link AtomicWriter}. Lines that fail to
 * parse are skipped with a warning, so one damaged line never hides the
 * rest of the ledger.
 */
public class DeadLetterQueue {

    private static final Logger LOG = LoggerFactory.getLogger(DeadLetterQueue.class);

    private final OutputLayout layout;
    private final AtomicWriter atomicWriter;
    private final int maxAttempts;
    private final Clock clock;
    private final ObjectMapper mapper;

    public DeadLetterQueue(OutputLayout layout, AtomicWriter atomicWriter, int maxAttempts, Clock clock) {
        this.layout = layout;
        this.atomicWriter = atomicWriter;
        this.maxAttempts = maxAttempts;
        this.clock = clock;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /** Result of {@link #recordFailure}: the updated entry and where it now lives. */
    public record FailureRecord(DeadLetterEntry entry, boolean promoted) {
    }

    public FailureRecord recordFailure(String subreddit, String reason, Long oldestUtcSeen, long rowsDownloaded)
            throws IOException {
        Path transientFile = layout.deadLetter(subreddit);
        List<DeadLetterEntry> entries = readEntries(transientFile);

        DeadLetterEntry updated = null;
        int index = -1;
        for (int i = 0; i < entries.size(); i++) {
            if (subreddit.equals(entries.get(i).subreddit())) {
                index = i;
                updated = entries.get(i).retried(reason, oldestUtcSeen, rowsDownloaded, clock.instant());
                break;
            }
        }
        if (updated == null) {
            updated = DeadLetterEntry.first(subreddit, reason, oldestUtcSeen, rowsDownloaded, clock.instant());
            entries.add(updated);
        } else {
            entries.set(index, updated);
        }

        boolean promoted = updated.attempts() >= maxAttempts;
        if (promoted) {
            Path permanentFile = layout.permanentDeadLetter(subreddit);
            List<DeadLetterEntry> permanent = readEntries(permanentFile);
            permanent.add(updated);
            writeEntries(permanentFile, permanent);
            entries.remove(updated);
            LOG.warn("Subreddit {} exceeded {} dead-letter attempts, moved to {}",
                    subreddit, maxAttempts, permanentFile.getFileName());
        }
        writeEntries(transientFile, entries);
        return new FailureRecord(updated, promoted);
    }

    /**
     * Drops the transient entry of {@code subreddit}, if any.
     *
     * @return {@code true} if an entry was removed
     */
    public boolean clear(String subreddit) throws IOException {
        Path transientFile = layout.deadLetter(subreddit);
        if (!Files.exists(transientFile)) {
            return false;
        }
        List<DeadLetterEntry> entries = readEntries(transientFile);
        boolean removed = entries.removeIf(e -> subreddit.equals(e.subreddit()));
        if (removed) {
            writeEntries(transientFile, entries);
            LOG.info("Cleared dead-letter entry for {}", subreddit);
        }
        return removed;
    }

    public List<DeadLetterEntry> pending(String subreddit) throws IOException {
        return readEntries(layout.deadLetter(subreddit));
    }

    public List<DeadLetterEntry> permanent(String subreddit) throws IOException {
        return readEntries(layout.permanentDeadLetter(subreddit));
    }

    private List<DeadLetterEntry> readEntries(Path file) throws IOException {
        List<DeadLetterEntry> entries = new ArrayList<>();
        if (!Files.exists(file)) {
            return entries;
        }
        for (String line : Files.readAllLines(file)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(mapper.readValue(line, DeadLetterEntry.class));
            } catch (JsonProcessingException e) {
                LOG.warn("Skipping corrupt line in {}: {}", file.getFileName(), e.getOriginalMessage());
            }
        }
        return entries;
    }

    private void writeEntries(Path file, List<DeadLetterEntry> entries) throws IOException {
        if (entries.isEmpty()) {
            Files.deleteIfExists(file);
            return;
        }
        StringBuilder sb = new StringBuilder();
        for (DeadLetterEntry entry : entries) {
            sb.append(mapper.writeValueAsString(entry)).append('\n');
        }
        atomicWriter.writeString(file, sb.toString());
    }
}
