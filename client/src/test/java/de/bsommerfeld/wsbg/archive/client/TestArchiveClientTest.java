package de.bsommerfeld.wsbg.archive.client;

import de.bsommerfeld.wsbg.archive.client.FetchOutcome.EmptyPage;
import de.bsommerfeld.wsbg.archive.client.FetchOutcome.Success;
import de.bsommerfeld.wsbg.archive.core.domain.ArchiveRecord;
import de.bsommerfeld.wsbg.archive.core.domain.ContentType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TestArchiveClientTest {

    private final TestArchiveClient client = new TestArchiveClient();
    private final PageFetcher fetcher = new PageFetcher(client, duration -> {
    }, 0);

    @Test
    void search_shouldServeNewestFirstPagesOfRequestedSize() {
        var query = new SearchQuery("wsb", ContentType.POSTS, 100, 0L, null);

        Success page = assertInstanceOf(Success.class, fetcher.fetch(query, RequestTracker.NONE));

        List<ArchiveRecord> records = page.records();
        assertEquals(100, records.size());
        assertEquals(TestArchiveClient.ANCHOR_UTC, records.get(0).createdUtc());
        for (int i = 1; i < records.size(); i++) {
            assertTrue(records.get(i).createdUtc() < records.get(i - 1).createdUtc());
        }
    }

    @Test
    void search_shouldContinueStrictlyBelowBefore() {
        var first = new SearchQuery("wsb", ContentType.COMMENTS, 50, 0L, null);
        Success page1 = assertInstanceOf(Success.class, fetcher.fetch(first, RequestTracker.NONE));
        long frontier = page1.records().get(49).createdUtc();

        Success page2 = assertInstanceOf(Success.class,
                fetcher.fetch(first.withBefore(frontier), RequestTracker.NONE));

        assertEquals(frontier - TestArchiveClient.COMMENT_SPACING_SECONDS, page2.records().get(0).createdUtc());
    }

    @Test
    void search_shouldRespectAfterBound() {
        long after = TestArchiveClient.ANCHOR_UTC - 10 * TestArchiveClient.POST_SPACING_SECONDS;
        var query = new SearchQuery("wsb", ContentType.POSTS, 100, after, null);

        Success page = assertInstanceOf(Success.class, fetcher.fetch(query, RequestTracker.NONE));

        assertEquals(11, page.records().size());
    }

    @Test
    void search_shouldEndWhenArchiveIsExhausted() {
        long beyond = TestArchiveClient.ANCHOR_UTC
                - TestArchiveClient.POSTS_PER_SUBREDDIT * TestArchiveClient.POST_SPACING_SECONDS;
        var query = new SearchQuery("wsb", ContentType.POSTS, 100, 0L, beyond);

        assertInstanceOf(EmptyPage.class, fetcher.fetch(query, RequestTracker.NONE));
        assertEquals(1, client.requestCount());
    }

    @Test
    void firstIndexBefore_shouldSkipItemsAtOrAboveBound() {
        long s = TestArchiveClient.POST_SPACING_SECONDS;
        assertEquals(0, TestArchiveClient.firstIndexBefore(null, s));
        assertEquals(1, TestArchiveClient.firstIndexBefore(TestArchiveClient.ANCHOR_UTC, s));
        assertEquals(2, TestArchiveClient.firstIndexBefore(TestArchiveClient.ANCHOR_UTC - s, s));
        assertEquals(0, TestArchiveClient.firstIndexBefore(TestArchiveClient.ANCHOR_UTC + 1, s));
    }
}
