package de.bsommerfeld.wsbg.archive.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The two record shapes archived per subreddit. Each is paginated, cursored
 * and consolidated independently.
 */
public enum ContentType {

    POSTS("posts"),
    COMMENTS("comments");

    private final String apiName;

    ContentType(String apiName) {
        this.apiName = apiName;
    }

    /** Path segment of the search endpoint and suffix of every output file. */
    @JsonValue
    public String apiName() {
        return apiName;
    }

    @JsonCreator
    public static ContentType fromApiName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (ContentType type : values()) {
                if (type.apiName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown content type: " + name);
    }

    @Override
    public String toString() {
        return apiName;
    }
}
