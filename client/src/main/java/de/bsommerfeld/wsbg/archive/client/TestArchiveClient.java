package de.bsommerfeld.wsbg.archive.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.wsbg.archive.core.domain.ArchiveComment;
import de.bsommerfeld.wsbg.archive.core.domain.ArchivePost;
import de.bsommerfeld.wsbg.archive.core.domain.ContentType;
import de.bsommerfeld.wsbg.archive.core.util.TestDataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Offline stand-in for {@link HttpArchiveClient}, selected in TEST mode
 * ({@code --test} or {@code APP_MODE=TEST}).
 *
 * <h3>No network access</h3>
 * Every response is rendered locally from {@link TestDataGenerator} into the
 * same JSON shape the real archive returns, so parsing, paging, chunking and
 * merging all run exactly as in production.
 *
 * <h3>Simulated archive</h3>
 * Each subreddit holds {@value #POSTS_PER_SUBREDDIT} posts, one every
 * {@value #POST_SPACING_SECONDS} seconds, and {@value #COMMENTS_PER_SUBREDDIT}
 * comments, one every {@value #COMMENT_SPACING_SECONDS} seconds, counting
 * back from a fixed anchor. Item {@code i} always has the same content and
 * timestamp, so an interrupted TEST run resumes onto the same data.
 */
@Singleton
public class TestArchiveClient implements ArchiveClient {

    private static final Logger LOG = LoggerFactory.getLogger(TestArchiveClient.class);

    /** 2024-06-01T00:00:00Z, newest item of every simulated subreddit. */
    static final long ANCHOR_UTC = 1_717_200_000L;

    static final int POSTS_PER_SUBREDDIT = 1_200;
    static final long POST_SPACING_SECONDS = 3_600;
    static final int COMMENTS_PER_SUBREDDIT = 3_000;
    static final long COMMENT_SPACING_SECONDS = 600;

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicLong requests = new AtomicLong();

    public TestArchiveClient() {
        LOG.info("TEST mode: serving synthetic archive data, no network access");
    }

    @Override
    public ArchiveResponse search(SearchQuery query) throws IOException {
        requests.incrementAndGet();
        boolean posts = query.contentType() == ContentType.POSTS;
        int count = posts ? POSTS_PER_SUBREDDIT : COMMENTS_PER_SUBREDDIT;
        long spacing = posts ? POST_SPACING_SECONDS : COMMENT_SPACING_SECONDS;

        int index = firstIndexBefore(query.before(), spacing);
        ObjectNode root = mapper.createObjectNode();
        ArrayNode data = root.putArray("data");
        while (index < count && data.size() < query.limit()) {
            long created = ANCHOR_UTC - index * spacing;
            if (created < query.after()) {
                break;
            }
            data.add(posts
                    ? postNode(TestDataGenerator.generatePost(query.subreddit(), index, created))
                    : commentNode(TestDataGenerator.generateComment(query.subreddit(), index, created)));
            index++;
        }

        LOG.debug("Synthetic page for {}/{} before={}: {} items",
                query.subreddit(), query.contentType(), query.before(), data.size());
        try {
            return new ArchiveResponse(200, mapper.writeValueAsString(root));
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to render synthetic page", e);
        }
    }

    public long requestCount() {
        return requests.get();
    }

    /** Smallest item index whose timestamp is strictly below {@code before}. */
    static int firstIndexBefore(Long before, long spacing) {
        if (before == null) {
            return 0;
        }
        long index = Math.floorDiv(ANCHOR_UTC - before, spacing) + 1;
        return (int) Math.max(0, Math.min(index, Integer.MAX_VALUE));
    }

    private ObjectNode postNode(ArchivePost post) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", post.id());
        node.put("subreddit", post.subreddit());
        node.put("author", "synthetic_user");
        node.put("title", post.title());
        node.put("selftext", post.selftext());
        node.put("score", post.score());
        node.put("created_utc", post.createdUtc());
        node.put("permalink", post.permalink());
        node.put("upvote_ratio", post.upvoteRatio());
        node.put("num_comments", post.numComments());
        return node;
    }

    private ObjectNode commentNode(ArchiveComment comment) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", comment.id());
        node.put("subreddit", comment.subreddit());
        node.put("author", "synthetic_user");
        node.put("body", comment.body());
        node.put("score", comment.score());
        node.put("created_utc", comment.createdUtc());
        node.put("permalink", comment.permalink());
        node.put("link_id", comment.linkId());
        node.put("parent_id", comment.parentId());
        return node;
    }
}
