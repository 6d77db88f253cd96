package de.bsommerfeld.wsbg.archive.core.domain;

import java.util.Objects;

/**
 * Archived top-level submission. Author identity is intentionally not
 * part of the record.
 *
 * @param id          bare Reddit ID (e.g. {@code 1abc23})
 * @param subreddit   subreddit name without {@code r/} prefix
 * @param title       submission title
 * @param selftext    self-text body, empty for link posts
 * @param score       net upvotes at archive time
 * @param createdUtc  creation timestamp in epoch seconds
 * @param permalink   relative permalink path
 * @param upvoteRatio upvote ratio as a 0.0–1.0 fraction
 * @param numComments comment count at archive time
 */
public record ArchivePost(
        String id,
        String subreddit,
        String title,
        String selftext,
        long score,
        long createdUtc,
        String permalink,
        double upvoteRatio,
        long numComments) implements ArchiveRecord {

    public ArchivePost {
        Objects.requireNonNull(id, "id");
        title = title != null ? title : "";
        selftext = selftext != null ? selftext : "";
        permalink = permalink != null ? permalink : "";
        subreddit = subreddit != null ? subreddit : "";
    }

    @Override
    public ContentType contentType() {
        return ContentType.POSTS;
    }

    @Override
    public long estimatedBytes() {
        return 96L + 2L * (id.length() + subreddit.length() + title.length()
                + selftext.length() + permalink.length());
    }
}
