package de.bsommerfeld.wsbg.archive.client;

import de.bsommerfeld.wsbg.archive.client.FetchOutcome.BadRequest;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.EmptyPage;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.NotFound;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.PermanentFailure;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.Success;
import de.bsommerfeld.wsbg.archive.core.domain.ContentType;
import de.bsommerfeld.wsbg.archive.core.util.Sleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Exercises outcome classification and the retry loop against a mocked
 * {@link ArchiveClient}. Sleeps are recorded, never performed.
 */
@ExtendWith(MockitoExtension.class)
class PageFetcherTest {

    private static final SearchQuery QUERY = new SearchQuery("wsb", ContentType.POSTS, 100, 0L, null);

    @Mock
    private ArchiveClient client;

    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper sleeper = sleeps::add;
    private final CountingTracker tracker = new CountingTracker();
    private PageFetcher fetcher;

    @BeforeEach
    void setUp() {
        fetcher = new PageFetcher(client, sleeper, 3);
    }

    // -- Classification --

    @Test
    void fetch_shouldReturnSuccessWithValidRecordsOnly() throws Exception {
        when(client.search(any())).thenReturn(new ArchiveResponse(200, """
                {"data": [
                  {"id": "a", "created_utc": 300},
                  {"created_utc": 200},
                  {"id": "c", "created_utc": 100}
                ]}
                """));

        FetchOutcome outcome = fetcher.fetch(QUERY, tracker);

        Success success = assertInstanceOf(Success.class, outcome);
        assertEquals(2, success.records().size());
        assertEquals(3, success.itemsReceived());
        assertEquals(1, tracker.requests);
        assertTrue(tracker.bytes > 0);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void fetch_shouldTreatEmptyOrMissingDataAsEndOfData() throws Exception {
        when(client.search(any()))
                .thenReturn(new ArchiveResponse(200, "{\"data\": []}"))
                .thenReturn(new ArchiveResponse(200, "{}"));

        assertInstanceOf(EmptyPage.class, fetcher.fetch(QUERY, tracker));
        assertInstanceOf(EmptyPage.class, fetcher.fetch(QUERY, tracker));
    }

    @Test
    void fetch_shouldReportNotFoundWithoutRetry() throws Exception {
        when(client.search(any())).thenReturn(new ArchiveResponse(404, ""));

        assertInstanceOf(NotFound.class, fetcher.fetch(QUERY, tracker));
        assertEquals(1, tracker.requests);
    }

    @Test
    void fetch_shouldReportBadRequestForOther4xx() throws Exception {
        when(client.search(any()))
                .thenReturn(new ArchiveResponse(400, "bad subreddit"))
                .thenReturn(new ArchiveResponse(403, "forbidden"));

        assertEquals(400, assertInstanceOf(BadRequest.class, fetcher.fetch(QUERY, tracker)).status());
        assertEquals(403, assertInstanceOf(BadRequest.class, fetcher.fetch(QUERY, tracker)).status());
        assertEquals(2, tracker.requests);
    }

    @Test
    void fetch_shouldFailOnInvalidJsonWithoutRetry() throws Exception {
        when(client.search(any())).thenReturn(new ArchiveResponse(200, "<html>oops</html>"));

        PermanentFailure failure = assertInstanceOf(PermanentFailure.class, fetcher.fetch(QUERY, tracker));
        assertEquals("invalid JSON", failure.reason());
        assertEquals(1, tracker.requests);
    }

    @Test
    void fetch_shouldFailOnErrorField() throws Exception {
        when(client.search(any())).thenReturn(new ArchiveResponse(200, "{\"error\": \"timeout\", \"data\": []}"));

        PermanentFailure failure = assertInstanceOf(PermanentFailure.class, fetcher.fetch(QUERY, tracker));
        assertTrue(failure.reason().contains("timeout"));
    }

    // -- Retry --

    @Test
    void fetch_shouldRetryWithExponentialBackoffThenFail() throws Exception {
        when(client.search(any())).thenReturn(new ArchiveResponse(503, ""));

        FetchOutcome outcome = fetcher.fetch(QUERY, tracker);

        assertInstanceOf(PermanentFailure.class, outcome);
        assertEquals(4, tracker.requests);
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8)), sleeps);
        verify(client, times(4)).search(QUERY);
    }

    @Test
    void fetch_shouldSucceedAfterRetry() throws Exception {
        when(client.search(any()))
                .thenReturn(new ArchiveResponse(429, ""))
                .thenReturn(new ArchiveResponse(200, "{\"data\": [{\"id\": \"a\", \"created_utc\": 1}]}"));

        assertInstanceOf(Success.class, fetcher.fetch(QUERY, tracker));
        assertEquals(2, tracker.requests);
        assertEquals(List.of(Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void fetch_shouldRetryTransportErrors() throws Exception {
        when(client.search(any()))
                .thenThrow(new HttpTimeoutException("request timed out"))
                .thenReturn(new ArchiveResponse(200, "{\"data\": []}"));

        assertInstanceOf(EmptyPage.class, fetcher.fetch(QUERY, tracker));
        assertEquals(2, tracker.requests);
    }

    @Test
    void fetch_shouldGiveUpImmediatelyWithZeroRetries() throws Exception {
        fetcher = new PageFetcher(client, sleeper, 0);
        when(client.search(any())).thenReturn(new ArchiveResponse(500, ""));

        assertInstanceOf(PermanentFailure.class, fetcher.fetch(QUERY, tracker));
        assertEquals(1, tracker.requests);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void fetch_shouldStopOnInterruptDuringBackoff() throws Exception {
        fetcher = new PageFetcher(client, duration -> {
            throw new InterruptedException();
        }, 3);
        when(client.search(any())).thenReturn(new ArchiveResponse(500, ""));

        try {
            PermanentFailure failure = assertInstanceOf(PermanentFailure.class, fetcher.fetch(QUERY, tracker));
            assertEquals("interrupted", failure.reason());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    private static final class CountingTracker implements RequestTracker {
        int requests;
        long bytes;

        @Override
        public void requestIssued() {
            requests++;
        }

        @Override
        public void bytesReceived(long received) {
            bytes += received;
        }
    }
}
