package de.bsommerfeld.wsbg.archive.client;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.wsbg.archive.core.domain.ArchiveComment;
import de.bsommerfeld.wsbg.archive.core.domain.ArchivePost;
import de.bsommerfeld.wsbg.archive.core.domain.ArchiveRecord;
import de.bsommerfeld.wsbg.archive.core.domain.ContentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Turns one item of a search response's {@code data} array into a typed
 * record. Only the archived columns are read; everything else the API
 * returns (author, flair, awards, ...) is dropped.
 *
 * <p>
 * An item without an {@code id} or without a numeric {@code created_utc}
 * is rejected for good: retrying would return the same item. Missing text
 * fields become {@code ""}, missing counts {@code 0}, a missing ratio
 * {@code 0.0}.
 */
public final class RecordParser {

    private static final Logger LOG = LoggerFactory.getLogger(RecordParser.class);

    private RecordParser() {
    }

    /**
     * @param fallbackSubreddit used when the item does not name its subreddit
     * @return the record, or empty if the item is unusable
     */
    public static Optional<ArchiveRecord> parse(JsonNode item, ContentType type, String fallbackSubreddit) {
        if (item == null || !item.isObject()) {
            LOG.debug("Skipping non-object item in {}/{}", fallbackSubreddit, type);
            return Optional.empty();
        }
        String id = text(item, "id");
        if (id.isEmpty()) {
            LOG.debug("Skipping item without id in {}/{}", fallbackSubreddit, type);
            return Optional.empty();
        }
        OptionalLong created = epochSeconds(item.get("created_utc"));
        if (created.isEmpty()) {
            LOG.debug("Skipping item {} without numeric created_utc in {}/{}", id, fallbackSubreddit, type);
            return Optional.empty();
        }

        String subreddit = text(item, "subreddit");
        if (subreddit.isEmpty()) {
            subreddit = fallbackSubreddit;
        }

        if (type == ContentType.POSTS) {
            return Optional.of(new ArchivePost(
                    id,
                    subreddit,
                    text(item, "title"),
                    text(item, "selftext"),
                    integer(item.get("score")),
                    created.getAsLong(),
                    text(item, "permalink"),
                    decimal(item.get("upvote_ratio")),
                    integer(item.get("num_comments"))));
        }
        return Optional.of(new ArchiveComment(
                id,
                subreddit,
                text(item, "body"),
                integer(item.get("score")),
                created.getAsLong(),
                text(item, "permalink"),
                text(item, "link_id"),
                text(item, "parent_id")));
    }

    /** Accepts integral and fractional numbers as well as numeric strings. */
    static OptionalLong epochSeconds(JsonNode node) {
        if (node == null || node.isNull()) {
            return OptionalLong.empty();
        }
        if (node.isNumber()) {
            return OptionalLong.of(node.asLong());
        }
        if (node.isTextual()) {
            try {
                return OptionalLong.of((long) Double.parseDouble(node.asText().trim()));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    private static String text(JsonNode item, String field) {
        JsonNode node = item.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static long integer(JsonNode node) {
        if (node == null || node.isNull()) {
            return 0L;
        }
        return node.asLong(0L);
    }

    private static double decimal(JsonNode node) {
        if (node == null || node.isNull()) {
            return 0.0;
        }
        return node.asDouble(0.0);
    }
}
