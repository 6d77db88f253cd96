package de.bsommerfeld.wsbg.archive.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection settings for the Arctic Shift search API. The API is public
 * and unauthenticated; the User-Agent only identifies the tool.
 */
public class ArchiveConfig {

    @JsonProperty("base-url")
    private String baseUrl = "https://arctic-shift.photon-reddit.com";

    @JsonProperty("user-agent")
    private String userAgent = "wsbg-archive/1.0";

    /** Items per search request. 100 is the largest page the API serves. */
    @JsonProperty("page-size")
    private int pageSize = 100;

    @JsonProperty("connect-timeout-seconds")
    private long connectTimeoutSeconds = 10;

    @JsonProperty("request-timeout-seconds")
    private long requestTimeoutSeconds = 30;

    /** Politeness delay after every successful page. */
    @JsonProperty("page-delay-millis")
    private long pageDelayMillis = 500;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public int getPageSize() {
        return pageSize;
    }

    public long getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public long getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public long getPageDelayMillis() {
        return pageDelayMillis;
    }

    public void setPageDelayMillis(long pageDelayMillis) {
        this.pageDelayMillis = pageDelayMillis;
    }

    void validate() {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("archive.base-url must not be empty");
        }
        if (pageSize < 1 || pageSize > 100) {
            throw new IllegalStateException("archive.page-size must be between 1 and 100, was " + pageSize);
        }
        if (pageDelayMillis < 0) {
            throw new IllegalStateException("archive.page-delay-millis must not be negative");
        }
    }
}
