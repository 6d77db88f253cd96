/**
 * The ingestion run: per-subreddit orchestration, the page loop with
 * chunked spilling, merging and crash recovery, and the job-level safety
 * valves (circuit breaker, resource caps).
 */
package de.bsommerfeld.wsbg.archive.ingest;
