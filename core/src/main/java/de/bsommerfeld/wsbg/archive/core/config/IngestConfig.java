package de.bsommerfeld.wsbg.archive.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.wsbg.archive.core.domain.ContentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Job parameters for one ingestion run: which subreddits to pull, how far
 * back, and the ceilings that keep a run bounded. Values are read from
 * {@code config.toml}; the command line may override the subreddit list,
 * the lower date bound and the content types.
 */
public class IngestConfig {

    private static final Logger LOG = LoggerFactory.getLogger(IngestConfig.class);

    public static final String DEFAULT_AFTER = "2023-01-01";

    @JsonProperty("subreddits")
    private List<String> subreddits = new ArrayList<>(List.of("wallstreetbetsGER"));

    @JsonProperty("content-types")
    private List<String> contentTypes = new ArrayList<>(List.of("posts", "comments"));

    /** Lower time bound (UTC date, inclusive) fixed for the whole run. */
    @JsonProperty("after")
    private String after = DEFAULT_AFTER;

    @JsonProperty("max-rows-per-subreddit")
    private long maxRowsPerSubreddit = 50_000;

    @JsonProperty("chunk-size")
    private int chunkSize = 500;

    /** Force-flush guard against a few huge records filling the heap. */
    @JsonProperty("max-buffer-bytes")
    private long maxBufferBytes = 50_000_000L;

    @JsonProperty("max-retries")
    private int maxRetries = 3;

    @JsonProperty("circuit-breaker-threshold")
    private int circuitBreakerThreshold = 3;

    @JsonProperty("max-total-requests")
    private long maxTotalRequests = 5_000;

    @JsonProperty("max-duration-seconds")
    private long maxDurationSeconds = 600;

    /** Age in days after which a consolidated file is refreshed. 0 always refreshes. */
    @JsonProperty("stale-days")
    private double staleDays = 7;

    @JsonProperty("max-dlq-attempts")
    private int maxDlqAttempts = 5;

    public List<String> getSubreddits() {
        return subreddits;
    }

    public void setSubreddits(List<String> subreddits) {
        this.subreddits = new ArrayList<>(subreddits);
    }

    public List<String> getContentTypes() {
        return contentTypes;
    }

    public void setContentTypes(List<String> contentTypes) {
        this.contentTypes = new ArrayList<>(contentTypes);
    }

    /**
     * Content types in processing order (posts before comments), regardless
     * of the order they were configured in.
     */
    public Set<ContentType> resolveContentTypes() {
        Set<ContentType> resolved = EnumSet.noneOf(ContentType.class);
        for (String name : contentTypes) {
            resolved.add(ContentType.fromApiName(name));
        }
        return resolved;
    }

    public String getAfter() {
        return after;
    }

    public void setAfter(String after) {
        this.after = after;
    }

    /**
     * The lower bound as epoch seconds at UTC midnight. An unparseable date
     * falls back to {@value #DEFAULT_AFTER} so a typo never widens a run to
     * the beginning of time.
     */
    public long afterEpochSecond() {
        try {
            return LocalDate.parse(after).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        } catch (DateTimeParseException | NullPointerException e) {
            LOG.warn("Invalid 'after' date '{}', using {}", after, DEFAULT_AFTER);
            return LocalDate.parse(DEFAULT_AFTER).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        }
    }

    public long getMaxRowsPerSubreddit() {
        return maxRowsPerSubreddit;
    }

    public void setMaxRowsPerSubreddit(long maxRowsPerSubreddit) {
        this.maxRowsPerSubreddit = maxRowsPerSubreddit;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public long getMaxBufferBytes() {
        return maxBufferBytes;
    }

    public void setMaxBufferBytes(long maxBufferBytes) {
        this.maxBufferBytes = maxBufferBytes;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getCircuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    public void setCircuitBreakerThreshold(int circuitBreakerThreshold) {
        this.circuitBreakerThreshold = circuitBreakerThreshold;
    }

    public long getMaxTotalRequests() {
        return maxTotalRequests;
    }

    public void setMaxTotalRequests(long maxTotalRequests) {
        this.maxTotalRequests = maxTotalRequests;
    }

    public long getMaxDurationSeconds() {
        return maxDurationSeconds;
    }

    public void setMaxDurationSeconds(long maxDurationSeconds) {
        this.maxDurationSeconds = maxDurationSeconds;
    }

    public Duration maxDuration() {
        return Duration.ofSeconds(maxDurationSeconds);
    }

    public double getStaleDays() {
        return staleDays;
    }

    public void setStaleDays(double staleDays) {
        this.staleDays = staleDays;
    }

    public int getMaxDlqAttempts() {
        return maxDlqAttempts;
    }

    public void setMaxDlqAttempts(int maxDlqAttempts) {
        this.maxDlqAttempts = maxDlqAttempts;
    }

    void validate() {
        if (subreddits == null) {
            throw new IllegalStateException("ingest.subreddits must be a list");
        }
        if (contentTypes == null || contentTypes.isEmpty()) {
            throw new IllegalStateException("ingest.content-types must name at least one of posts, comments");
        }
        try {
            resolveContentTypes();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("ingest.content-types: " + e.getMessage(), e);
        }
        requirePositive("ingest.chunk-size", chunkSize);
        requirePositive("ingest.max-rows-per-subreddit", maxRowsPerSubreddit);
        requirePositive("ingest.max-buffer-bytes", maxBufferBytes);
        requirePositive("ingest.circuit-breaker-threshold", circuitBreakerThreshold);
        requirePositive("ingest.max-total-requests", maxTotalRequests);
        requirePositive("ingest.max-duration-seconds", maxDurationSeconds);
        requirePositive("ingest.max-dlq-attempts", maxDlqAttempts);
        if (maxRetries < 0) {
            throw new IllegalStateException("ingest.max-retries must not be negative");
        }
        if (staleDays < 0) {
            throw new IllegalStateException("ingest.stale-days must not be negative");
        }
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalStateException(key + " must be positive, was " + value);
        }
    }
}
