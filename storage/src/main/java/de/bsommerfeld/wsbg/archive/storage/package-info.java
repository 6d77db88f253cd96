/**
 * Durable state of an ingestion run. Everything here is a file in the
 * output directory; there is no database between runs.
 *
 * <h2>Artifacts</h2>
 *
 * <pre>
 *   ColumnarStore ── DuckDbColumnarStore   chunk + consolidated Parquet files
 *   CheckpointStore                        {sub}_{type}.cursor.json
 *   DeadLetterQueue                        dead_letter/{sub}.jsonl (+ _permanent)
 *   FileLock ── NioFileLock                {sub}.lock
 *        │
 *        ▼
 *   AtomicWriter ── FilesystemAtomicWriter write .tmp sibling, rename
 * </pre>
 *
 * Names are resolved by {@link de.bsommerfeld.wsbg.archive.storage.OutputLayout}.
 *
 * <h2>Consistency</h2>
 * A cursor exists exactly while unmerged chunks exist for the same
 * (subreddit, content type). Chunks are written before the cursor that
 * counts them, and the cursor is deleted only after the merge that consumed
 * them, so a crash at any point leaves either a consistent resumable state
 * or a mismatch the next run detects and discards.
 *
 * <h2>SQL File Inventory</h2>
 * DuckDB statements are externalized to {@code sql/*.sql}, loaded via
 * {@link de.bsommerfeld.wsbg.archive.storage.SqlLoader}:
 * <ul>
 * <li>{@code create-posts-table.sql}, {@code create-comments-table.sql} -
 * staging table per content type</li>
 * <li>{@code insert-post.sql}, {@code insert-comment.sql} - batched row
 * insert</li>
 * <li>{@code append-posts-from-parquet.sql},
 * {@code append-comments-from-parquet.sql} - merge input</li>
 * <li>{@code copy-to-parquet.sql} - staging table to Parquet</li>
 * <li>{@code select-posts-from-parquet.sql},
 * {@code select-comments-from-parquet.sql} - read back</li>
 * <li>{@code count-rows.sql}, {@code count-parquet-rows.sql},
 * {@code select-oldest-created-utc.sql} - scalar queries</li>
 * </ul>
 */
package de.bsommerfeld.wsbg.archive.storage;
