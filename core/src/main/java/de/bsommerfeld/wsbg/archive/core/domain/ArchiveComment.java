package de.bsommerfeld.wsbg.archive.core.domain;

import java.util.Objects;

/**
 * Archived comment. {@code linkId} references the root submission
 * ({@code t3_...}), {@code parentId} the direct parent (submission or
 * comment).
 */
public record ArchiveComment(
        String id,
        String subreddit,
        String body,
        long score,
        long createdUtc,
        String permalink,
        String linkId,
        String parentId) implements ArchiveRecord {

    public ArchiveComment {
        Objects.requireNonNull(id, "id");
        subreddit = subreddit != null ? subreddit : "";
        body = body != null ? body : "";
        permalink = permalink != null ? permalink : "";
        linkId = linkId != null ? linkId : "";
        parentId = parentId != null ? parentId : "";
    }

    @Override
    public ContentType contentType() {
        return ContentType.COMMENTS;
    }

    @Override
    public long estimatedBytes() {
        return 80L + 2L * (id.length() + subreddit.length() + body.length()
                + permalink.length() + linkId.length() + parentId.length());
    }
}
