package de.bsommerfeld.wsbg.archive.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.BadRequest;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.EmptyPage;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.NotFound;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.PermanentFailure;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.RetryableError;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.Success;
import de.bsommerfeld.wsbg.archive.core.config.IngestConfig;
import de.bsommerfeld.wsbg.archive.core.domain.ArchiveRecord;
import de.bsommerfeld.wsbg.archive.core.util.Sleeper;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches one page and classifies it into a {@link FetchOutcome}.
 *
 * <h3>Retry state machine</h3>
 * A page gets {@code maxRetries + 1} attempts. Each attempt is reported to
 * the {@link RequestTracker} before it is sent. A {@link RetryableError}
 * waits {@code 2^(attempt+1)} seconds (2s, 4s, 8s, ...) through the
 * {@link Sleeper} and tries again; the last one becomes a
 * {@link PermanentFailure}. Every other outcome ends the loop at once.
 *
 * <p>
 * An interrupt while waiting, or while the request is in flight, restores
 * the interrupt flag and is reported as a {@link PermanentFailure}.
 */
public class PageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(PageFetcher.class);

    private final ArchiveClient client;
    private final Sleeper sleeper;
    private final int maxRetries;
    private final ObjectMapper mapper;

    @Inject
    public PageFetcher(ArchiveClient client, Sleeper sleeper, IngestConfig config) {
        this(client, sleeper, config.getMaxRetries());
    }

    public PageFetcher(ArchiveClient client, Sleeper sleeper, int maxRetries) {
        this.client = client;
        this.sleeper = sleeper;
        this.maxRetries = maxRetries;
        this.mapper = new ObjectMapper();
    }

    public FetchOutcome fetch(SearchQuery query, RequestTracker tracker) {
        String lastError = "no attempt made";
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            tracker.requestIssued();
            FetchOutcome outcome;
            try {
                outcome = classify(query, client.search(query), tracker);
            } catch (IOException e) {
                outcome = new RetryableError(e.getClass().getSimpleName()
                        + (e.getMessage() != null ? ": " + e.getMessage() : ""));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new PermanentFailure("interrupted");
            }

            if (!(outcome instanceof RetryableError retryable)) {
                return outcome;
            }
            lastError = retryable.reason();
            if (attempt < maxRetries) {
                long wait = 1L << (attempt + 1);
                LOG.info("Retry {}/{} for {}/{} ({}), waiting {}s",
                        attempt + 1, maxRetries, query.subreddit(), query.contentType(), lastError, wait);
                try {
                    sleeper.sleep(Duration.ofSeconds(wait));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return new PermanentFailure("interrupted");
                }
            }
        }
        LOG.error("Failed to fetch {}/{} after {} retries: {}",
                query.subreddit(), query.contentType(), maxRetries, lastError);
        return new PermanentFailure(lastError + " after " + maxRetries + " retries");
    }

    FetchOutcome classify(SearchQuery query, ArchiveResponse response, RequestTracker tracker) {
        int status = response.status();
        if (status == 200) {
            tracker.bytesReceived(response.body().getBytes(StandardCharsets.UTF_8).length);
            return parseBody(query, response.body());
        }
        if (status == 404) {
            LOG.warn("Subreddit {} not found in archive (404)", query.subreddit());
            return new NotFound();
        }
        if (status == 429 || status >= 500) {
            return new RetryableError("HTTP " + status);
        }
        LOG.warn("Non-retryable HTTP {} for {}/{}: {}",
                status, query.subreddit(), query.contentType(), abbreviate(response.body()));
        return new BadRequest(status, abbreviate(response.body()));
    }

    private FetchOutcome parseBody(SearchQuery query, String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            LOG.error("Invalid JSON from {}/{}", query.subreddit(), query.contentType());
            return new PermanentFailure("invalid JSON");
        }
        if (root == null || !root.isObject()) {
            LOG.error("Unexpected response shape from {}/{}", query.subreddit(), query.contentType());
            return new PermanentFailure("invalid JSON");
        }
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            String message = error.isValueNode() ? error.asText() : error.toString();
            LOG.error("Archive reported an error for {}/{}: {}", query.subreddit(), query.contentType(), message);
            return new PermanentFailure("archive error: " + message);
        }

        JsonNode data = root.get("data");
        if (data == null || !data.isArray() || data.isEmpty()) {
            return new EmptyPage();
        }

        List<ArchiveRecord> records = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            RecordParser.parse(item, query.contentType(), query.subreddit()).ifPresent(records::add);
        }
        return new Success(records, data.size());
    }

    private static String abbreviate(String body) {
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
