package de.bsommerfeld.wsbg.archive.storage;

import com.google.inject.Singleton;
import de.bsommerfeld.wsbg.archive.core.domain.ArchiveComment;
import de.bsommerfeld.wsbg.archive.core.domain.ArchivePost;
import de.bsommerfeld.wsbg.archive.core.domain.ArchiveRecord;
import de.bsommerfeld.wsbg.archive.core.domain.ContentType;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * {@link ColumnarStore} that writes Parquet through an embedded, in-memory
 * DuckDB instance.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 *
 * <h3>Connection strategy</h3>
 * A new in-memory {@link Connection} is opened per operation and closed
 * immediately after. Nothing is kept between calls: the Parquet files on
 * disk are the only state, and the staging table {@code archive_rows} dies
 * with its connection.
 *
 * <h3>Write path</h3>
 * Rows are batch-inserted into the staging table, then {@code COPY ... TO}
 * writes the Parquet file into the temporary sibling handed out by the
 * {@link AtomicWriter}. DuckDB preserves insertion order on {@code COPY}, so
 * records keep the order they were fetched in (newest first) and merged
 * files keep chunk order.
 *
 * <h3>Columns</h3>
 * <ul>
 * <li>posts: {@code id, subreddit, title, selftext, score, created_utc,
 * permalink, upvote_ratio, num_comments}</li>
 * <li>comments: {@code id, subreddit, body, score, created_utc, permalink,
 * link_id, parent_id}</li>
 * </ul>
 * No author column is written.
 */
@Singleton
public class DuckDbColumnarStore implements ColumnarStore {

    private static final Logger LOG = LoggerFactory.getLogger(DuckDbColumnarStore.class);
    private static final String DB_URL = "jdbc:duckdb:";

    private final AtomicWriter atomicWriter;

    @Inject
    public DuckDbColumnarStore(AtomicWriter atomicWriter) {
        this.atomicWriter = atomicWriter;
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(DB_URL);
    }

    // =====================================================================
    // Writes
    // =====================================================================

    @Override
    public long writeChunk(Path target, ContentType type, List<? extends ArchiveRecord> records)
            throws IOException {
        atomicWriter.write(target, temp -> {
            try (Connection conn = getConnection(); Statement stmt = conn.createStatement()) {
                stmt.execute(SqlLoader.load(createTableSql(type)));
                insertRecords(conn, type, records);
                stmt.execute(SqlLoader.format("copy-to-parquet", temp));
            } catch (SQLException e) {
                throw new IOException("Failed to write Parquet file " + target.getFileName(), e);
            }
        });
        long size = Files.size(target);
        LOG.debug("Wrote {} {} rows to {} ({} bytes)", records.size(), type, target.getFileName(), size);
        return size;
    }

    @Override
    public long merge(List<Path> inputs, ContentType type, Path target) throws IOException {
        long[] rows = new long[1];
        atomicWriter.write(target, temp -> {
            try (Connection conn = getConnection(); Statement stmt = conn.createStatement()) {
                stmt.execute(SqlLoader.load(createTableSql(type)));
                String append = type == ContentType.POSTS
                        ? "append-posts-from-parquet"
                        : "append-comments-from-parquet";
                for (Path input : inputs) {
                    stmt.execute(SqlLoader.format(append, input));
                }
                rows[0] = queryLong(stmt, SqlLoader.load("count-rows"));
                stmt.execute(SqlLoader.format("copy-to-parquet", temp));
            } catch (SQLException e) {
                throw new IOException("Failed to merge " + inputs.size() + " files into "
                        + target.getFileName(), e);
            }
        });
        return rows[0];
    }

    private void insertRecords(Connection conn, ContentType type, List<? extends ArchiveRecord> records)
            throws SQLException {
        if (records.isEmpty()) {
            return;
        }
        String sql = SqlLoader.load(type == ContentType.POSTS ? "insert-post" : "insert-comment");
        conn.setAutoCommit(false);
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (ArchiveRecord record : records) {
                if (record instanceof ArchivePost post) {
                    bindPost(ps, post);
                } else if (record instanceof ArchiveComment comment) {
                    bindComment(ps, comment);
                }
                ps.addBatch();
            }
            ps.executeBatch();
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private static void bindPost(PreparedStatement ps, ArchivePost post) throws SQLException {
        ps.setString(1, post.id());
        ps.setString(2, post.subreddit());
        ps.setString(3, post.title());
        ps.setString(4, post.selftext());
        ps.setLong(5, post.score());
        ps.setLong(6, post.createdUtc());
        ps.setString(7, post.permalink());
        ps.setDouble(8, post.upvoteRatio());
        ps.setLong(9, post.numComments());
    }

    private static void bindComment(PreparedStatement ps, ArchiveComment comment) throws SQLException {
        ps.setString(1, comment.id());
        ps.setString(2, comment.subreddit());
        ps.setString(3, comment.body());
        ps.setLong(4, comment.score());
        ps.setLong(5, comment.createdUtc());
        ps.setString(6, comment.permalink());
        ps.setString(7, comment.linkId());
        ps.setString(8, comment.parentId());
    }

    // =====================================================================
    // Reads
    // =====================================================================

    @Override
    public OptionalLong oldestCreatedUtc(Path file) throws IOException {
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(SqlLoader.format("select-oldest-created-utc", file))) {
            if (rs.next()) {
                long value = rs.getLong(1);
                if (!rs.wasNull()) {
                    return OptionalLong.of(value);
                }
            }
            return OptionalLong.empty();
        } catch (SQLException e) {
            throw new IOException("Failed to read created_utc from " + file.getFileName(), e);
        }
    }

    @Override
    public long countRows(Path file) throws IOException {
        try (Connection conn = getConnection(); Statement stmt = conn.createStatement()) {
            return queryLong(stmt, SqlLoader.format("count-parquet-rows", file));
        } catch (SQLException e) {
            throw new IOException("Failed to count rows in " + file.getFileName(), e);
        }
    }

    /** Reads every row of a written file back in file order. */
    public List<ArchiveRecord> readAll(Path file, ContentType type) throws IOException {
        String sql = SqlLoader.format(type == ContentType.POSTS
                ? "select-posts-from-parquet"
                : "select-comments-from-parquet", file);
        List<ArchiveRecord> records = new ArrayList<>();
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                records.add(type == ContentType.POSTS ? mapPost(rs) : mapComment(rs));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read " + file.getFileName(), e);
        }
        return records;
    }

    private static ArchivePost mapPost(ResultSet rs) throws SQLException {
        return new ArchivePost(
                rs.getString("id"),
                rs.getString("subreddit"),
                rs.getString("title"),
                rs.getString("selftext"),
                rs.getLong("score"),
                rs.getLong("created_utc"),
                rs.getString("permalink"),
                rs.getDouble("upvote_ratio"),
                rs.getLong("num_comments"));
    }

    private static ArchiveComment mapComment(ResultSet rs) throws SQLException {
        return new ArchiveComment(
                rs.getString("id"),
                rs.getString("subreddit"),
                rs.getString("body"),
                rs.getLong("score"),
                rs.getLong("created_utc"),
                rs.getString("permalink"),
                rs.getString("link_id"),
                rs.getString("parent_id"));
    }

    private static long queryLong(Statement stmt, String sql) throws SQLException {
        try (ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private static String createTableSql(ContentType type) {
        return type == ContentType.POSTS ? "create-posts-table" : "create-comments-table";
    }
}
