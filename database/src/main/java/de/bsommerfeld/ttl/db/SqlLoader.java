package de.bsommerfeld.ttl.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL from classpath resources.
 *
 * <p>
 * Statements live one per file under {@code sql/}, named
 * {@code <operation>-<entity>.sql}, e.g. {@code insert-token.sql} or
 * {@code select-linked-tokens.sql}. The DDL lives in {@code schema.sql} at
 * the classpath root and is read with {@link #script(String)}.
 *
 * @see SqlCorpusStore
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement in {@code sql/<name>.sql}, trimmed. Each file is
     * read once per JVM.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, n -> readResource("sql/" + n + ".sql"));
    }

    /**
     * Returns the statements of a multi-statement script at the classpath
     * root, split on semicolons that end a line. Blank chunks are dropped.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static List<String> script(String resource) {
        List<String> statements = new ArrayList<>();
        for (String sql : readResource(resource).split(";\\s*(\\r?\\n|$)")) {
            if (!sql.isBlank())
                statements.add(sql.trim());
        }
        return statements;
    }

    private static String readResource(String path) {
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
