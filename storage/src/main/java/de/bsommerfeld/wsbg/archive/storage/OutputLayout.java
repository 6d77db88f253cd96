package de.bsommerfeld.wsbg.archive.storage;

import de.bsommerfeld.wsbg.archive.core.domain.ContentType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File naming inside the output directory. All names derive from a
 * {@code {subreddit}_{contentType}} prefix, except the per-subreddit lock and
 * the dead-letter ledgers.
 *
 * <pre>
 * {sub}_{type}.parquet                consolidated output
 * {sub}_{type}.chunk_0000.parquet     numbered chunk, merged in sequence order
 * {sub}_{type}.chunk_existing.parquet previous output during a stale refresh
 * {sub}_{type}.merging.parquet        completed merge awaiting commit
 * {sub}_{type}.cursor.json            resumable pagination state
 * {sub}.lock                          worker lock
 * dead_letter/{sub}.jsonl             transient failure ledger
 * dead_letter/{sub}_permanent.jsonl   entries past the attempt ceiling
 * </pre>
 */
public final class OutputLayout {

    private static final String EXISTING_SUFFIX = ".chunk_existing.parquet";

    private final Path outputDir;
    private final Path deadLetterDir;

    public OutputLayout(Path outputDir, Path deadLetterDir) {
        this.outputDir = outputDir;
        this.deadLetterDir = deadLetterDir;
    }

    public OutputLayout(Path outputDir) {
        this(outputDir, outputDir.resolve("dead_letter"));
    }

    public Path outputDir() {
        return outputDir;
    }

    public Path deadLetterDir() {
        return deadLetterDir;
    }

    public static String prefix(String subreddit, ContentType type) {
        return subreddit + "_" + type.apiName();
    }

    public Path consolidated(String subreddit, ContentType type) {
        return outputDir.resolve(prefix(subreddit, type) + ".parquet");
    }

    public Path chunk(String subreddit, ContentType type, int sequence) {
        return outputDir.resolve(String.format("%s.chunk_%04d.parquet", prefix(subreddit, type), sequence));
    }

    public Path existingChunk(String subreddit, ContentType type) {
        return outputDir.resolve(prefix(subreddit, type) + EXISTING_SUFFIX);
    }

    public Path merging(String subreddit, ContentType type) {
        return outputDir.resolve(prefix(subreddit, type) + ".merging.parquet");
    }

    public Path cursor(String subreddit, ContentType type) {
        return outputDir.resolve(prefix(subreddit, type) + ".cursor.json");
    }

    public Path lock(String subreddit) {
        return outputDir.resolve(subreddit + ".lock");
    }

    public Path deadLetter(String subreddit) {
        return deadLetterDir.resolve(subreddit + ".jsonl");
    }

    public Path permanentDeadLetter(String subreddit) {
        return deadLetterDir.resolve(subreddit + "_permanent.jsonl");
    }

    /**
     * Numbered chunk files in ascending sequence order. Sequence numbers
     * longer than nine digits do not fit an int and belong to no writer, so
     * such files are ignored.
     */
    public List<Path> numberedChunks(String subreddit, ContentType type) throws IOException {
        if (!Files.isDirectory(outputDir)) {
            return List.of();
        }
        Pattern pattern = Pattern.compile(
                Pattern.quote(prefix(subreddit, type)) + "\\.chunk_(\\d{1,9})\\.parquet");
        List<NumberedChunk> found = new ArrayList<>();
        try (Stream<Path> files = Files.list(outputDir)) {
            files.forEach(file -> {
                Matcher m = pattern.matcher(file.getFileName().toString());
                if (m.matches()) {
                    found.add(new NumberedChunk(Integer.parseInt(m.group(1)), file));
                }
            });
        }
        found.sort(Comparator.comparingInt(NumberedChunk::sequence));
        return found.stream().map(NumberedChunk::path).toList();
    }

    /**
     * Every input of a merge: the renamed previous output first (it holds
     * the newer records), then the numbered chunks.
     */
    public List<Path> mergeInputs(String subreddit, ContentType type) throws IOException {
        List<Path> inputs = new ArrayList<>();
        existing(subreddit, type).ifPresent(inputs::add);
        inputs.addAll(numberedChunks(subreddit, type));
        return inputs;
    }

    public Optional<Path> existing(String subreddit, ContentType type) {
        Path existing = existingChunk(subreddit, type);
        return Files.exists(existing) ? Optional.of(existing) : Optional.empty();
    }

    private record NumberedChunk(int sequence, Path path) {
    }
}
