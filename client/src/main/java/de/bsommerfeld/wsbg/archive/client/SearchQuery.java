package de.bsommerfeld.wsbg.archive.client;

import de.bsommerfeld.wsbg.archive.core.domain.ContentType;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * One page request against {@code /api/{posts|comments}/search}, always
 * sorted newest first by {@code created_utc}.
 *
 * @param subreddit   subreddit name without prefix
 * @param contentType which endpoint to query
 * @param limit       maximum items per page
 * @param after       lower time bound in epoch seconds, fixed for a run
 * @param before      upper time bound (the pagination frontier), or
 *                    {@code null} for the first page
 */
public record SearchQuery(String subreddit, ContentType contentType, int limit, long after, Long before) {

    /** Same query moved to a new frontier. */
    public SearchQuery withBefore(Long newBefore) {
        return new SearchQuery(subreddit, contentType, limit, after, newBefore);
    }

    public URI toUri(String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        StringBuilder sb = new StringBuilder(base)
                .append("/api/").append(contentType.apiName()).append("/search")
                .append("?subreddit=").append(URLEncoder.encode(subreddit, StandardCharsets.UTF_8))
                .append("&limit=").append(limit)
                .append("&sort=desc")
                .append("&sort_type=created_utc")
                .append("&after=").append(after);
        if (before != null) {
            sb.append("&before=").append(before);
        }
        return URI.create(sb.toString());
    }
}
