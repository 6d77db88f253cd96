package de.bsommerfeld.wsbg.archive.client;

import com.google.inject.Singleton;
import de.bsommerfeld.wsbg.archive.core.config.ArchiveConfig;
import de.bsommerfeld.wsbg.archive.core.util.Sleeper;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Talks to the Arctic Shift search API with a standard {@link HttpClient}.
 * The API is public, so no credentials are sent.
 *
 * <h3>Rate limiting</h3>
 * The archive returns {@code X-RateLimit-Remaining} and
 * {@code X-RateLimit-Reset} headers. When fewer than 2 requests remain in
 * the current window, the client pauses for the reset window plus 1 second
 * before returning, so the next request does not run into a 429. A single
 * pause never exceeds {@value #MAX_PAUSE_SECONDS} seconds.
 *
 * <h3>User-Agent</h3>
 * Every request carries the configured {@code archive.user-agent}.
 *
 * @see TestArchiveClient
 */
@Singleton
public class HttpArchiveClient implements ArchiveClient {

    private static final Logger LOG = LoggerFactory.getLogger(HttpArchiveClient.class);

    /** Upper bound for a single rate-limit pause, whatever the header claims. */
    private static final long MAX_PAUSE_SECONDS = 300;

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String userAgent;
    private final Duration requestTimeout;
    private final Sleeper sleeper;

    @Inject
    public HttpArchiveClient(ArchiveConfig config, Sleeper sleeper) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.getConnectTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.baseUrl = config.getBaseUrl();
        this.userAgent = config.getUserAgent();
        this.requestTimeout = Duration.ofSeconds(config.getRequestTimeoutSeconds());
        this.sleeper = sleeper;
    }

    @Override
    public ArchiveResponse search(SearchQuery query) throws IOException, InterruptedException {
        URI uri = query.toUri(baseUrl);
        LOG.debug("GET {}", uri);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("User-Agent", userAgent)
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        checkRateLimit(response);
        return new ArchiveResponse(response.statusCode(), response.body());
    }

    /**
     * Pauses when the archive reports fewer than 2 remaining requests.
     * Malformed header values are ignored.
     */
    private void checkRateLimit(HttpResponse<?> response) throws InterruptedException {
        Optional<Long> wait = rateLimitPause(
                response.headers().firstValue("X-RateLimit-Remaining").orElse(null),
                response.headers().firstValue("X-RateLimit-Reset").orElse(null));
        if (wait.isPresent()) {
            LOG.warn("Archive rate limit near. Sleeping for {}s", wait.get());
            sleeper.sleep(Duration.ofSeconds(wait.get()));
        }
    }

    /** Seconds to pause for the given header values, if any. */
    static Optional<Long> rateLimitPause(String remaining, String reset) {
        if (remaining == null || reset == null) {
            return Optional.empty();
        }
        try {
            if (Double.parseDouble(remaining) >= 2.0) {
                return Optional.empty();
            }
            long seconds = (long) Double.parseDouble(reset) + 1;
            return Optional.of(Math.max(1, Math.min(seconds, MAX_PAUSE_SECONDS)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
