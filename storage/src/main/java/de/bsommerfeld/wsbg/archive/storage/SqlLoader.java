package de.bsommerfeld.wsbg.archive.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath resource files under
 * {@code sql/}.
 *
 * <p>
 * Each file is read exactly once and cached for the lifetime of the JVM.
 * The naming convention is {@code sql/<operation>-<entity>.sql},
 * e.g. {@code insert-post.sql}, {@code select-oldest-created-utc.sql}.
 *
 * <p>
 * DuckDB table functions such as {@code read_parquet} and the {@code COPY}
 * target do not accept bind parameters, so statements that reference a file
 * carry a {@code %s} placeholder which {@link #format(String, java.nio.file.Path...)}
 * fills with a quoted path literal.
 *
 * @see DuckDbColumnarStore
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the SQL statement from {@code sql/<name>.sql} on the classpath.
     * The result is trimmed and cached.
     *
     * @param name the file stem without path prefix or extension
     * @return the SQL string, ready for {@link java.sql.PreparedStatement} use
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /**
     * Loads {@code name} and substitutes each {@code %s} with the matching
     * path as an escaped SQL string literal.
     */
    public static String format(String name, java.nio.file.Path... files) {
        Object[] literals = new Object[files.length];
        for (int i = 0; i < files.length; i++) {
            literals[i] = quoteLiteral(files[i].toAbsolutePath().toString());
        }
        return String.format(load(name), literals);
    }

    static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
