package de.bsommerfeld.wsbg.archive.client;

/**
 * Status code and body of one search response.
 */
public record ArchiveResponse(int status, String body) {

    public ArchiveResponse {
        body = body != null ? body : "";
    }
}
