/**
 * Persistence layer for corpus annotations. SQLite-backed for real corpora,
 * in-memory in MEMORY mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Converters / ChunkedImporter]
 *        │
 *        ▼
 *   CorpusStore        ← interface (PERSISTENT ↔ MEMORY swap via Guice)
 *    ┌───┴────────┐
 *    │            │
 *  SqlStore   InMemoryStore
 *    └───┬────────┘
 *        ▼
 *   IntegrityChecks    ← shared reference and uniqueness rules
 * </pre>
 *
 * <h2>Hierarchy</h2>
 *
 * <pre>
 * corpus ──┬── meta_cor (by corpus name)
 *          └── document ──┬── meta_doc (by document name)
 *                         └── sentence ──┬── token ──┐
 *                                        ├── concept ┼── cwl (sid, cid, wid)
 *                                        └── tag (wid nullable)
 * meta (global)
 * </pre>
 *
 * The file keeps the column names other corpus tools read ({@code corpusID},
 * {@code docID}, {@code sid}, {@code wid}, {@code cid}, {@code clemma}). The
 * DDL declares foreign keys but SQLite's {@code foreign_keys} pragma stays off:
 * every cascade is issued explicitly, leaves first, inside the transaction of
 * the delete that caused it.
 *
 * <h2>Transactions</h2>
 * <ul>
 * <li>One JDBC connection per operation. Writers hold a JVM lock and open an
 * {@code IMMEDIATE} transaction; readers run {@code DEFERRED} against the
 * last committed WAL snapshot.</li>
 * <li>{@code SQLITE_BUSY} and {@code SQLITE_LOCKED} surface as
 * {@link TransactionConflictException}. Nothing is retried.</li>
 * <li>Multi-row writes ({@code importTokens}, {@code linkAll},
 * {@code saveSentence}, {@code saveSentences}) are all-or-nothing.</li>
 * </ul>
 *
 * <h2>SQL File Inventory</h2>
 * All statements are externalized to {@code sql/*.sql} and loaded via
 * {@link SqlLoader}. The files are named {@code <verb>-<table>[-for-<parent>]},
 * e.g. {@code delete-links-for-document.sql} or
 * {@code select-tokens-for-sentence.sql}. {@code schema.sql} is applied on
 * every open and only uses {@code IF NOT EXISTS}.
 */
package de.bsommerfeld.ttl.db;
