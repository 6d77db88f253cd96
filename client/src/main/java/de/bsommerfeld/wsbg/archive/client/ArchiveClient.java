package de.bsommerfeld.wsbg.archive.client;

import java.io.IOException;

/**
 * Raw transport to the archive's search endpoint. Implementations return
 * whatever status and body the server produced; classifying the result is
 * the {@link PageFetcher}'s job.
 *
 * @see HttpArchiveClient
 * @see TestArchiveClient
 */
public interface ArchiveClient {

    /**
     * Issues exactly one search request.
     *
     * @throws IOException          on connect, read or timeout failures
     * @throws InterruptedException if the calling thread is interrupted while
     *                              waiting for the response or a rate-limit
     *                              pause
     */
    ArchiveResponse search(SearchQuery query) throws IOException, InterruptedException;
}
