package de.bsommerfeld.wsbg.archive.core.domain;

/**
 * One archived item. Instances are only created for items that carry an
 * identifier and a numeric creation timestamp; anything else is dropped
 * while parsing.
 */
public sealed interface ArchiveRecord permits ArchivePost, ArchiveComment {

    String id();

    String subreddit();

    /** Creation time in epoch seconds (UTC). */
    long createdUtc();

    String permalink();

    ContentType contentType();

    /**
     * Rough heap footprint, used to force a flush before a buffer of
     * unusually large records grows without bound.
     */
    long estimatedBytes();
}
