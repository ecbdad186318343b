package de.bsommerfeld.ttl.db;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.ttl.core.config.StoreConfig;
import de.bsommerfeld.ttl.core.domain.AnnotatedSentence;
import de.bsommerfeld.ttl.core.domain.Concept;
import de.bsommerfeld.ttl.core.domain.ConceptWordLink;
import de.bsommerfeld.ttl.core.domain.Corpus;
import de.bsommerfeld.ttl.core.domain.Document;
import de.bsommerfeld.ttl.core.domain.LexiconEntry;
import de.bsommerfeld.ttl.core.domain.MetaEntry;
import de.bsommerfeld.ttl.core.domain.MetaScope;
import de.bsommerfeld.ttl.core.domain.NewConcept;
import de.bsommerfeld.ttl.core.domain.NewTag;
import de.bsommerfeld.ttl.core.domain.NewToken;
import de.bsommerfeld.ttl.core.domain.Sentence;
import de.bsommerfeld.ttl.core.domain.SentenceDraft;
import de.bsommerfeld.ttl.core.domain.SentenceTags;
import de.bsommerfeld.ttl.core.domain.StoreStatistics;
import de.bsommerfeld.ttl.core.domain.Tag;
import de.bsommerfeld.ttl.core.domain.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * SQLite-backed {@link CorpusStore}: the single-file corpus artifact.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} whenever the store is opened;
 * every DDL statement uses {@code IF NOT EXISTS}, so existing corpus files
 * are opened as they are.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. Writers additionally hold a JVM-wide lock, so at most one write
 * transaction of this process is open at a time. The file runs in WAL
 * journal mode by default: readers keep seeing the last committed state
 * while a writer is busy.
 *
 * <h3>Transaction boundaries</h3>
 * Every public method is one transaction. Writes start it with
 * {@code BEGIN IMMEDIATE} and roll back on any failure, including the
 * integrity checks. Reads run in a deferred transaction, so multi-query
 * reads such as {@link #getAnnotatedSentence} see one snapshot.
 *
 * <h3>Integrity</h3>
 * {@code PRAGMA foreign_keys} stays off. The declared foreign keys document
 * the layout for other tools; references and cascades are enforced here,
 * explicitly and in dependency order.
 *
 * @see SqlLoader
 */
@Singleton
public class SqlCorpusStore implements CorpusStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlCorpusStore.class);

    private final String dbUrl;
    private final StoreConfig config;
    private final ReentrantLock writeLock = new ReentrantLock();

    @Inject
    public SqlCorpusStore(StoreConfig config) {
        this.config = config;
        Path file = config.getDatabasePath().toAbsolutePath();
        try {
            Path parent = file.getParent();
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new CorpusStoreException("Failed to create directory for " + file, e);
        }
        this.dbUrl = config.getJdbcUrl();
        initialize();
    }

    Connection getConnection(boolean writer) throws SQLException {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(false);
        sqlite.setBusyTimeout(config.getBusyTimeoutMs());
        sqlite.setJournalMode(SQLiteConfig.JournalMode.valueOf(
                config.getJournalMode().toUpperCase(Locale.ROOT)));
        sqlite.setTransactionMode(writer
                ? SQLiteConfig.TransactionMode.IMMEDIATE
                : SQLiteConfig.TransactionMode.DEFERRED);
        return DriverManager.getConnection(dbUrl, sqlite.toProperties());
    }

    private void initialize() {
        LOG.info("Opening corpus store at {}", dbUrl);
        write("apply schema", conn -> {
            applySchema(conn);
            return null;
        });
    }

    private void applySchema(Connection conn) throws SQLException {
        List<String> statements = SqlLoader.script("schema.sql");
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements)
                stmt.execute(sql);
        }
        LOG.info("Corpus schema applied ({} statements).", statements.size());
    }

    // =====================================================================
    // Corpus
    // =====================================================================

    @Override
    public Corpus createCorpus(String name, String title) {
        IntegrityChecks.checkName(name);
        return write("create corpus '" + name + "'", conn -> insertCorpus(conn, name, title));
    }

    @Override
    public Corpus ensureCorpus(String name, String title) {
        IntegrityChecks.checkName(name);
        return write("ensure corpus '" + name + "'", conn -> {
            Optional<Corpus> existing = findCorpus(conn, name);
            return existing.isPresent() ? existing.get() : insertCorpus(conn, name, title);
        });
    }

    @Override
    public Optional<Corpus> getCorpus(String name) {
        return read("get corpus '" + name + "'", conn -> findCorpus(conn, name));
    }

    @Override
    public Optional<Corpus> getCorpusById(long id) {
        return read("get corpus #" + id, conn -> findCorpus(conn, id));
    }

    @Override
    public List<Corpus> listCorpora() {
        return read("list corpora", conn -> queryList(conn, "select-all-corpora", SqlCorpusStore::mapCorpus));
    }

    @Override
    public Corpus updateCorpus(long id, String name, String title) {
        IntegrityChecks.checkName(name);
        return write("update corpus #" + id, conn -> {
            Corpus current = require(findCorpus(conn, id), "Corpus", id);
            boolean renamed = !current.name().equals(name);
            if (renamed && findCorpus(conn, name).isPresent())
                throw new DuplicateKeyException("Corpus '" + name + "' already exists");
            update(conn, "update-corpus", name, title, id);
            if (renamed)
                update(conn, "rename-corpus-meta", name, current.name());
            return new Corpus(id, name, title);
        });
    }

    @Override
    public void deleteCorpus(long id) {
        write("delete corpus #" + id, conn -> {
            Corpus corpus = require(findCorpus(conn, id), "Corpus", id);
            List<Document> documents = queryList(conn, "select-documents-for-corpus",
                    SqlCorpusStore::mapDocument, id);
            for (Document d : documents)
                deleteDocumentCascade(conn, d);
            update(conn, "delete-corpus-meta-for-name", corpus.name());
            update(conn, "delete-corpus", id);
            LOG.info("[DB] Deleted corpus '{}' with {} documents.", corpus.name(), documents.size());
            return null;
        });
    }

    private Corpus insertCorpus(Connection conn, String name, String title) throws SQLException {
        if (findCorpus(conn, name).isPresent())
            throw new DuplicateKeyException("Corpus '" + name + "' already exists");
        long id = insert(conn, "insert-corpus", name, title);
        LOG.debug("[DB] Created corpus '{}' (#{})", name, id);
        return new Corpus(id, name, title);
    }

    private Optional<Corpus> findCorpus(Connection conn, String name) throws SQLException {
        return querySingle(conn, "select-corpus-by-name", SqlCorpusStore::mapCorpus, name);
    }

    private Optional<Corpus> findCorpus(Connection conn, long id) throws SQLException {
        return querySingle(conn, "select-corpus-by-id", SqlCorpusStore::mapCorpus, id);
    }

    // =====================================================================
    // Document
    // =====================================================================

    @Override
    public Document createDocument(long corpusId, String name, String title, String lang) {
        IntegrityChecks.checkName(name);
        return write("create document '" + name + "'", conn -> insertDocument(conn, corpusId, name, title, lang));
    }

    @Override
    public Document ensureDocument(long corpusId, String name, String title, String lang) {
        IntegrityChecks.checkName(name);
        return write("ensure document '" + name + "'", conn -> {
            Optional<Document> existing = findDocument(conn, name);
            return existing.isPresent() ? existing.get() : insertDocument(conn, corpusId, name, title, lang);
        });
    }

    @Override
    public Optional<Document> getDocument(String name) {
        return read("get document '" + name + "'", conn -> findDocument(conn, name));
    }

    @Override
    public Optional<Document> getDocumentById(long id) {
        return read("get document #" + id, conn -> findDocument(conn, id));
    }

    @Override
    public List<Document> listDocuments(long corpusId) {
        return read("list documents of corpus #" + corpusId, conn -> {
            require(findCorpus(conn, corpusId), "Corpus", corpusId);
            return queryList(conn, "select-documents-for-corpus", SqlCorpusStore::mapDocument, corpusId);
        });
    }

    @Override
    public Document updateDocument(long id, String name, String title, String lang) {
        IntegrityChecks.checkName(name);
        return write("update document #" + id, conn -> {
            Document current = require(findDocument(conn, id), "Document", id);
            boolean renamed = !current.name().equals(name);
            if (renamed && findDocument(conn, name).isPresent())
                throw new DuplicateKeyException("Document '" + name + "' already exists");
            update(conn, "update-document", name, title, lang, id);
            if (renamed)
                update(conn, "rename-document-meta", name, current.name());
            return new Document(id, name, title, lang, current.corpusId());
        });
    }

    @Override
    public void deleteDocument(long id) {
        write("delete document #" + id, conn -> {
            Document document = require(findDocument(conn, id), "Document", id);
            deleteDocumentCascade(conn, document);
            LOG.info("[DB] Deleted document '{}'.", document.name());
            return null;
        });
    }

    private Document insertDocument(Connection conn, long corpusId, String name, String title, String lang)
            throws SQLException {
        reference(findCorpus(conn, corpusId), "Corpus", corpusId);
        if (findDocument(conn, name).isPresent())
            throw new DuplicateKeyException("Document '" + name + "' already exists");
        long id = insert(conn, "insert-document", name, title, lang, corpusId);
        LOG.debug("[DB] Created document '{}' (#{}) in corpus #{}", name, id, corpusId);
        return new Document(id, name, title, lang, corpusId);
    }

    /**
     * Removes everything beneath a document, leaves first: links → tags →
     * tokens → concepts → sentences → metadata → the document itself.
     */
    private void deleteDocumentCascade(Connection conn, Document document) throws SQLException {
        long id = document.id();
        update(conn, "delete-links-for-document", id);
        update(conn, "delete-tags-for-document", id);
        update(conn, "delete-tokens-for-document", id);
        update(conn, "delete-concepts-for-document", id);
        int sentences = update(conn, "delete-sentences-for-document", id);
        update(conn, "delete-document-meta-for-name", document.name());
        update(conn, "delete-document", id);
        LOG.debug("[DB] Cascade removed document '{}' with {} sentences", document.name(), sentences);
    }

    private Optional<Document> findDocument(Connection conn, String name) throws SQLException {
        return querySingle(conn, "select-document-by-name", SqlCorpusStore::mapDocument, name);
    }

    private Optional<Document> findDocument(Connection conn, long id) throws SQLException {
        return querySingle(conn, "select-document-by-id", SqlCorpusStore::mapDocument, id);
    }

    // =====================================================================
    // Sentence
    // =====================================================================

    @Override
    public Sentence createSentence(long docId, String ident, String text, Integer flag, String comment) {
        return write("create sentence in document #" + docId, conn -> {
            reference(findDocument(conn, docId), "Document", docId);
            return insertSentence(conn, docId, ident, text, flag, comment);
        });
    }

    @Override
    public Optional<Sentence> getSentence(long id) {
        return read("get sentence #" + id, conn -> findSentence(conn, id));
    }

    @Override
    public List<Sentence> listSentences(long docId) {
        return read("list sentences of document #" + docId, conn -> {
            require(findDocument(conn, docId), "Document", docId);
            return queryList(conn, "select-sentences-for-document", SqlCorpusStore::mapSentence, docId);
        });
    }

    @Override
    public List<Sentence> findSentencesByIdent(String ident) {
        return read("find sentences by ident '" + ident + "'",
                conn -> queryList(conn, "select-sentences-by-ident", SqlCorpusStore::mapSentence, ident));
    }

    @Override
    public Sentence updateSentence(long id, String text, Integer flag, String comment) {
        return write("update sentence #" + id, conn -> {
            Sentence current = require(findSentence(conn, id), "Sentence", id);
            update(conn, "update-sentence", text, flag, comment, id);
            return new Sentence(id, current.ident(), text, current.docId(), flag, comment);
        });
    }

    @Override
    public void deleteSentence(long id) {
        write("delete sentence #" + id, conn -> {
            require(findSentence(conn, id), "Sentence", id);
            update(conn, "delete-links-for-sentence", id);
            update(conn, "delete-tags-for-sentence", id);
            update(conn, "delete-tokens-for-sentence", id);
            update(conn, "delete-concepts-for-sentence", id);
            update(conn, "delete-sentence", id);
            LOG.debug("[DB] Deleted sentence #{}", id);
            return null;
        });
    }

    private Sentence insertSentence(Connection conn, long docId, String ident, String text, Integer flag,
            String comment) throws SQLException {
        long id = insert(conn, "insert-sentence", ident, text, docId, flag, comment);
        return new Sentence(id, ident, text, docId, flag, comment);
    }

    private Optional<Sentence> findSentence(Connection conn, long id) throws SQLException {
        return querySingle(conn, "select-sentence-by-id", SqlCorpusStore::mapSentence, id);
    }

    // =====================================================================
    // Token
    // =====================================================================

    @Override
    public List<Token> importTokens(long sentenceId, List<NewToken> tokens) {
        checkNotNull(tokens, "tokens");
        return write("import tokens into sentence #" + sentenceId, conn -> {
            reference(findSentence(conn, sentenceId), "Sentence", sentenceId);
            List<Token> stored = insertTokens(conn, sentenceId, tokens);
            if (stored.size() > 1) {
                LOG.info("[DB] Imported {} tokens into sentence #{}.", stored.size(), sentenceId);
            } else {
                LOG.debug("[DB] Imported {} token(s) into sentence #{}", stored.size(), sentenceId);
            }
            return ImmutableList.copyOf(stored);
        });
    }

    @Override
    public Optional<Token> getToken(long id) {
        return read("get token #" + id, conn -> findToken(conn, id));
    }

    @Override
    public List<Token> getTokens(long sentenceId) {
        return read("get tokens of sentence #" + sentenceId, conn -> {
            require(findSentence(conn, sentenceId), "Sentence", sentenceId);
            return queryList(conn, "select-tokens-for-sentence", SqlCorpusStore::mapToken, sentenceId);
        });
    }

    @Override
    public int countTokens(long sentenceId) {
        return read("count tokens of sentence #" + sentenceId, conn -> {
            require(findSentence(conn, sentenceId), "Sentence", sentenceId);
            return querySingle(conn, "count-tokens-for-sentence", rs -> rs.getInt(1), sentenceId).orElse(0);
        });
    }

    @Override
    public Token updateToken(long id, String text, String lemma, String pos) {
        checkNotNull(text, "token text");
        return write("update token #" + id, conn -> {
            Token t = require(findToken(conn, id), "Token", id);
            update(conn, "update-token", text, lemma, pos, id);
            return new Token(id, t.sentenceId(), t.widx(), t.cfrom(), t.cto(), text, lemma, pos, t.comment());
        });
    }

    @Override
    public void deleteToken(long id) {
        write("delete token #" + id, conn -> {
            require(findToken(conn, id), "Token", id);
            update(conn, "delete-links-for-token", id);
            update(conn, "delete-tags-for-token", id);
            update(conn, "delete-token", id);
            return null;
        });
    }

    @Override
    public List<LexiconEntry> lexicon(int limit) {
        return read("lexicon", conn -> queryList(conn, "select-lexicon",
                rs -> new LexiconEntry(rs.getString("text"), rs.getInt("freq")),
                limit > 0 ? limit : -1));
    }

    /**
     * Inserts a batch of tokens after resolving their positions against the
     * ones already stored. Returns the rows in input order.
     */
    private List<Token> insertTokens(Connection conn, long sentenceId, List<NewToken> tokens) throws SQLException {
        List<Integer> used = queryList(conn, "select-widx-for-sentence", rs -> rs.getInt(1), sentenceId);
        int[] positions = IntegrityChecks.assignPositions(sentenceId, tokens, used);

        List<Token> stored = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            NewToken t = tokens.get(i);
            long id = insert(conn, "insert-token", sentenceId, positions[i], t.cfrom(), t.cto(),
                    t.text(), t.lemma(), t.pos(), t.comment());
            stored.add(new Token(id, sentenceId, positions[i], t.cfrom(), t.cto(),
                    t.text(), t.lemma(), t.pos(), t.comment()));
        }
        return stored;
    }

    private Optional<Token> findToken(Connection conn, long id) throws SQLException {
        return querySingle(conn, "select-token-by-id", SqlCorpusStore::mapToken, id);
    }

    // =====================================================================
    // Concept & Link
    // =====================================================================

    @Override
    public Concept createConcept(long sentenceId, NewConcept concept) {
        checkNotNull(concept, "concept");
        return write("create concept in sentence #" + sentenceId, conn -> {
            reference(findSentence(conn, sentenceId), "Sentence", sentenceId);
            return insertConcept(conn, sentenceId, concept);
        });
    }

    @Override
    public Optional<Concept> getConcept(long id) {
        return read("get concept #" + id, conn -> findConcept(conn, id));
    }

    @Override
    public List<Concept> getConcepts(long sentenceId) {
        return read("get concepts of sentence #" + sentenceId, conn -> {
            require(findSentence(conn, sentenceId), "Sentence", sentenceId);
            return queryList(conn, "select-concepts-for-sentence", SqlCorpusStore::mapConcept, sentenceId);
        });
    }

    @Override
    public Concept updateConcept(long id, String lemma, String tag, String flag, String comment) {
        return write("update concept #" + id, conn -> {
            Concept c = require(findConcept(conn, id), "Concept", id);
            update(conn, "update-concept", lemma, tag, flag, comment, id);
            return new Concept(id, c.sentenceId(), c.cidx(), lemma, tag, flag, comment);
        });
    }

    @Override
    public void deleteConcept(long id) {
        write("delete concept #" + id, conn -> {
            require(findConcept(conn, id), "Concept", id);
            update(conn, "delete-links-for-concept", id);
            update(conn, "delete-concept", id);
            return null;
        });
    }

    @Override
    public ConceptWordLink link(long conceptId, long tokenId) {
        return write("link concept #" + conceptId + " to token #" + tokenId,
                conn -> insertLink(conn, conceptId, tokenId));
    }

    @Override
    public List<ConceptWordLink> linkAll(long conceptId, List<Long> tokenIds) {
        checkNotNull(tokenIds, "tokenIds");
        IntegrityChecks.checkDistinct(conceptId, tokenIds);
        return write("link concept #" + conceptId + " to " + tokenIds.size() + " tokens", conn -> {
            List<ConceptWordLink> links = new ArrayList<>(tokenIds.size());
            for (Long tokenId : tokenIds)
                links.add(insertLink(conn, conceptId, tokenId));
            return ImmutableList.copyOf(links);
        });
    }

    @Override
    public void unlink(long conceptId, long tokenId) {
        write("unlink concept #" + conceptId + " from token #" + tokenId, conn -> {
            if (update(conn, "delete-link", conceptId, tokenId) == 0)
                throw new NotFoundException("Concept #" + conceptId + " is not linked to token #" + tokenId);
            return null;
        });
    }

    @Override
    public List<Token> getLinkedTokens(long conceptId) {
        return read("get tokens of concept #" + conceptId, conn -> {
            require(findConcept(conn, conceptId), "Concept", conceptId);
            return queryList(conn, "select-linked-tokens", SqlCorpusStore::mapToken, conceptId);
        });
    }

    @Override
    public List<Concept> getCoveringConcepts(long tokenId) {
        return read("get concepts of token #" + tokenId, conn -> {
            require(findToken(conn, tokenId), "Token", tokenId);
            return queryList(conn, "select-covering-concepts", SqlCorpusStore::mapConcept, tokenId);
        });
    }

    @Override
    public List<ConceptWordLink> getLinks(long sentenceId) {
        return read("get links of sentence #" + sentenceId, conn -> {
            require(findSentence(conn, sentenceId), "Sentence", sentenceId);
            return queryList(conn, "select-links-for-sentence", SqlCorpusStore::mapLink, sentenceId);
        });
    }

    private Concept insertConcept(Connection conn, long sentenceId, NewConcept c) throws SQLException {
        long id = insert(conn, "insert-concept", sentenceId, c.cidx(), c.lemma(), c.tag(), c.flag(), c.comment());
        return new Concept(id, sentenceId, c.cidx(), c.lemma(), c.tag(), c.flag(), c.comment());
    }

    /**
     * Validates and inserts one link. The link's sentence is the concept's
     * sentence, which must also be the token's.
     */
    private ConceptWordLink insertLink(Connection conn, long conceptId, long tokenId) throws SQLException {
        Long conceptSentence = findConcept(conn, conceptId).map(Concept::sentenceId).orElse(null);
        Long tokenSentence = findToken(conn, tokenId).map(Token::sentenceId).orElse(null);
        long sentenceId = IntegrityChecks.checkLinkTargets(conceptId, conceptSentence, tokenId, tokenSentence);
        return insertLink(conn, sentenceId, conceptId, tokenId);
    }

    private ConceptWordLink insertLink(Connection conn, long sentenceId, long conceptId, long tokenId)
            throws SQLException {
        if (querySingle(conn, "select-link-exists", rs -> Boolean.TRUE, sentenceId, conceptId, tokenId).isPresent())
            throw new DuplicateKeyException("Concept #" + conceptId + " is already linked to token #" + tokenId);
        update(conn, "insert-link", sentenceId, conceptId, tokenId);
        return new ConceptWordLink(sentenceId, conceptId, tokenId);
    }

    private Optional<Concept> findConcept(Connection conn, long id) throws SQLException {
        return querySingle(conn, "select-concept-by-id", SqlCorpusStore::mapConcept, id);
    }

    // =====================================================================
    // Tag
    // =====================================================================

    @Override
    public Tag createTag(long sentenceId, NewTag tag) {
        checkNotNull(tag, "tag");
        return write("create tag in sentence #" + sentenceId, conn -> {
            reference(findSentence(conn, sentenceId), "Sentence", sentenceId);
            if (tag.tokenId() != null) {
                Optional<Token> token = findToken(conn, tag.tokenId());
                if (token.isEmpty() || token.get().sentenceId() != sentenceId) {
                    throw new DanglingReferenceException(
                            "Token #" + tag.tokenId() + " does not exist in sentence #" + sentenceId);
                }
            }
            return insertTag(conn, sentenceId, tag);
        });
    }

    @Override
    public SentenceTags getTags(long sentenceId) {
        return read("get tags of sentence #" + sentenceId, conn -> {
            require(findSentence(conn, sentenceId), "Sentence", sentenceId);
            return SentenceTags.partition(
                    queryList(conn, "select-tags-for-sentence", SqlCorpusStore::mapTag, sentenceId));
        });
    }

    @Override
    public List<Tag> getTokenTags(long tokenId) {
        return read("get tags of token #" + tokenId, conn -> {
            require(findToken(conn, tokenId), "Token", tokenId);
            return queryList(conn, "select-tags-for-token", SqlCorpusStore::mapTag, tokenId);
        });
    }

    @Override
    public void deleteTag(long id) {
        write("delete tag #" + id, conn -> {
            require(querySingle(conn, "select-tag-by-id", SqlCorpusStore::mapTag, id), "Tag", id);
            update(conn, "delete-tag", id);
            return null;
        });
    }

    private Tag insertTag(Connection conn, long sentenceId, NewTag t) throws SQLException {
        long id = insert(conn, "insert-tag", sentenceId, t.tokenId(), t.cfrom(), t.cto(),
                t.label(), t.source(), t.tagType());
        return new Tag(id, sentenceId, t.tokenId(), t.cfrom(), t.cto(), t.label(), t.source(), t.tagType());
    }

    // =====================================================================
    // Sentence Graph
    // =====================================================================

    @Override
    public AnnotatedSentence saveSentence(long docId, SentenceDraft draft) {
        checkNotNull(draft, "draft");
        return write("save sentence into document #" + docId, conn -> {
            reference(findDocument(conn, docId), "Document", docId);
            return insertDraft(conn, docId, draft);
        });
    }

    @Override
    public List<AnnotatedSentence> saveSentences(long docId, List<SentenceDraft> drafts) {
        checkNotNull(drafts, "drafts");
        return write("save " + drafts.size() + " sentences into document #" + docId, conn -> {
            reference(findDocument(conn, docId), "Document", docId);
            List<AnnotatedSentence> saved = new ArrayList<>(drafts.size());
            for (SentenceDraft draft : drafts)
                saved.add(insertDraft(conn, docId, draft));
            LOG.info("[DB] Batch saved {} sentences into document #{}.", saved.size(), docId);
            return ImmutableList.copyOf(saved);
        });
    }

    @Override
    public Optional<AnnotatedSentence> getAnnotatedSentence(long sentenceId) {
        return read("get annotated sentence #" + sentenceId, conn -> {
            Optional<Sentence> sentence = findSentence(conn, sentenceId);
            if (sentence.isEmpty())
                return Optional.empty();
            return Optional.of(new AnnotatedSentence(
                    sentence.get(),
                    queryList(conn, "select-tokens-for-sentence", SqlCorpusStore::mapToken, sentenceId),
                    queryList(conn, "select-concepts-for-sentence", SqlCorpusStore::mapConcept, sentenceId),
                    queryList(conn, "select-links-for-sentence", SqlCorpusStore::mapLink, sentenceId),
                    SentenceTags.partition(
                            queryList(conn, "select-tags-for-sentence", SqlCorpusStore::mapTag, sentenceId))));
        });
    }

    /**
     * Writes one draft: sentence → tokens (positions 0..n-1) → sentence tags →
     * token tags → concepts with their links.
     */
    private AnnotatedSentence insertDraft(Connection conn, long docId, SentenceDraft draft) throws SQLException {
        IntegrityChecks.checkDraft(draft);
        Sentence sentence = insertSentence(conn, docId, draft.ident(), draft.text(), draft.flag(), draft.comment());
        long sid = sentence.id();

        List<NewToken> positioned = new ArrayList<>(draft.tokens().size());
        for (int i = 0; i < draft.tokens().size(); i++)
            positioned.add(draft.tokens().get(i).at(i));
        List<Token> tokens = insertTokens(conn, sid, positioned);

        List<Tag> tags = new ArrayList<>();
        for (NewTag tag : draft.sentenceTags())
            tags.add(insertTag(conn, sid, tag.onToken(null)));
        for (Map.Entry<Integer, List<NewTag>> entry : draft.tokenTags().entrySet()) {
            long tokenId = tokens.get(entry.getKey()).id();
            for (NewTag tag : entry.getValue())
                tags.add(insertTag(conn, sid, tag.onToken(tokenId)));
        }

        List<Concept> concepts = new ArrayList<>();
        List<ConceptWordLink> links = new ArrayList<>();
        for (SentenceDraft.ConceptDraft cd : draft.concepts()) {
            Concept concept = insertConcept(conn, sid, cd.concept());
            concepts.add(concept);
            for (Integer widx : cd.tokenIndexes())
                links.add(insertLink(conn, sid, concept.id(), tokens.get(widx).id()));
        }
        concepts.sort(Comparator.comparingInt(Concept::cidx).thenComparingLong(Concept::id));
        links.sort(Comparator.comparingLong(ConceptWordLink::conceptId).thenComparingLong(ConceptWordLink::tokenId));

        return new AnnotatedSentence(sentence, tokens, concepts, links, SentenceTags.partition(tags));
    }

    // =====================================================================
    // Metadata
    // =====================================================================

    @Override
    public void setMeta(MetaScope scope, String owner, String key, String value) {
        IntegrityChecks.checkOwner(scope, owner);
        checkArgument(key != null, "key");
        checkArgument(value != null, "value");
        write("set " + IntegrityChecks.describe(scope, owner, key), conn -> {
            switch (scope) {
                case GLOBAL -> update(conn, "upsert-meta", key, value);
                case DOCUMENT -> {
                    if (findDocument(conn, owner).isEmpty())
                        throw new DanglingReferenceException("Document '" + owner + "' does not exist");
                    update(conn, "upsert-document-meta", owner, key, value);
                }
                case CORPUS -> {
                    if (findCorpus(conn, owner).isEmpty())
                        throw new DanglingReferenceException("Corpus '" + owner + "' does not exist");
                    update(conn, "upsert-corpus-meta", owner, key, value);
                }
            }
            return null;
        });
    }

    @Override
    public String getMeta(MetaScope scope, String owner, String key) {
        return findMeta(scope, owner, key).orElseThrow(() -> new NotFoundException(
                IntegrityChecks.describe(scope, owner, key) + " does not exist"));
    }

    @Override
    public Optional<String> findMeta(MetaScope scope, String owner, String key) {
        IntegrityChecks.checkOwner(scope, owner);
        return read("get " + IntegrityChecks.describe(scope, owner, key), conn -> switch (scope) {
            case GLOBAL -> querySingle(conn, "select-meta", SqlCorpusStore::mapMetaValue, key);
            case DOCUMENT -> querySingle(conn, "select-document-meta", SqlCorpusStore::mapMetaValue, owner, key);
            case CORPUS -> querySingle(conn, "select-corpus-meta", SqlCorpusStore::mapMetaValue, owner, key);
        });
    }

    @Override
    public List<MetaEntry> listMeta(MetaScope scope, String owner) {
        IntegrityChecks.checkOwner(scope, owner);
        return read("list " + scope.name().toLowerCase(Locale.ROOT) + " metadata", conn -> {
            switch (scope) {
                case DOCUMENT -> {
                    if (findDocument(conn, owner).isEmpty())
                        throw new NotFoundException("Document '" + owner + "' does not exist");
                    return queryList(conn, "select-document-meta-for-name", rs -> mapMeta(rs, scope, owner), owner);
                }
                case CORPUS -> {
                    if (findCorpus(conn, owner).isEmpty())
                        throw new NotFoundException("Corpus '" + owner + "' does not exist");
                    return queryList(conn, "select-corpus-meta-for-name", rs -> mapMeta(rs, scope, owner), owner);
                }
                default -> {
                    return queryList(conn, "select-all-meta", rs -> mapMeta(rs, scope, null));
                }
            }
        });
    }

    @Override
    public void deleteMeta(MetaScope scope, String owner, String key) {
        IntegrityChecks.checkOwner(scope, owner);
        String what = IntegrityChecks.describe(scope, owner, key);
        write("delete " + what, conn -> {
            int rows = switch (scope) {
                case GLOBAL -> update(conn, "delete-meta", key);
                case DOCUMENT -> update(conn, "delete-document-meta", owner, key);
                case CORPUS -> update(conn, "delete-corpus-meta", owner, key);
            };
            if (rows == 0)
                throw new NotFoundException(what + " does not exist");
            return null;
        });
    }

    // =====================================================================
    // Diagnostics
    // =====================================================================

    @Override
    public StoreStatistics statistics() {
        return read("statistics", conn -> querySingle(conn, "select-row-counts", rs -> new StoreStatistics(
                rs.getLong("corpora"), rs.getLong("documents"), rs.getLong("sentences"),
                rs.getLong("tokens"), rs.getLong("concepts"), rs.getLong("tags"),
                rs.getLong("links"), rs.getLong("document_meta"), rs.getLong("corpus_meta")))
                .orElseThrow());
    }

    // =====================================================================
    // Transactions
    // =====================================================================

    @FunctionalInterface
    interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    @FunctionalInterface
    interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /**
     * Runs {@code work} in one write transaction. Any exception rolls the
     * transaction back before it propagates.
     */
    private <T> T write(String operation, SqlWork<T> work) {
        writeLock.lock();
        try (Connection conn = getConnection(true)) {
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw translate(operation, e);
        } finally {
            writeLock.unlock();
        }
    }

    /** Runs {@code work} in one deferred (snapshot) read transaction. */
    private <T> T read(String operation, SqlWork<T> work) {
        try (Connection conn = getConnection(false)) {
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw translate(operation, e);
        }
    }

    /** Rolls back; a failing rollback is attached to {@code cause}. */
    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            LOG.warn("[DB] Rollback failed: {}", e.getMessage());
            cause.addSuppressed(e);
        }
    }

    /**
     * Maps a JDBC failure to the store's error taxonomy. Lock contention with
     * another process becomes {@link TransactionConflictException}; a unique
     * or primary key hit that slipped past the checks (another process wrote
     * in between) becomes {@link DuplicateKeyException}.
     */
    CorpusStoreException translate(String operation, SQLException e) {
        int code = e.getErrorCode();
        if (code == SQLiteErrorCode.SQLITE_BUSY.code || code == SQLiteErrorCode.SQLITE_LOCKED.code) {
            LOG.warn("[DB] {} collided with a concurrent writer: {}", operation, e.getMessage());
            return new TransactionConflictException("Failed to " + operation + ": corpus file is locked", e);
        }
        if (isKeyViolation(e)) {
            LOG.warn("[DB] {} violated a key: {}", operation, e.getMessage());
            return new DuplicateKeyException("Failed to " + operation + ": " + e.getMessage(), e);
        }
        LOG.error("[DB] Failed to {}", operation, e);
        return new CorpusStoreException("Failed to " + operation, e);
    }

    private static boolean isKeyViolation(SQLException e) {
        if (e.getErrorCode() != SQLiteErrorCode.SQLITE_CONSTRAINT.code)
            return false;
        if (e instanceof SQLiteException sqlite) {
            SQLiteErrorCode result = sqlite.getResultCode();
            if (result == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE
                    || result == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY)
                return true;
            if (result != SQLiteErrorCode.SQLITE_CONSTRAINT)
                return false;
        }
        // without extended result codes only the message tells the constraint kind
        String message = String.valueOf(e.getMessage());
        return message.contains("UNIQUE constraint failed") || message.contains("PRIMARY KEY");
    }

    private static <T> T require(Optional<T> row, String what, long id) {
        return row.orElseThrow(() -> new NotFoundException(what + " #" + id + " does not exist"));
    }

    private static <T> T reference(Optional<T> row, String what, long id) {
        return row.orElseThrow(() -> new DanglingReferenceException(what + " #" + id + " does not exist"));
    }

    // =====================================================================
    // Statement Helpers
    // =====================================================================

    private static <T> List<T> queryList(Connection conn, String sqlName, RowMapper<T> mapper, Object... params)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                ImmutableList.Builder<T> result = ImmutableList.builder();
                while (rs.next())
                    result.add(mapper.map(rs));
                return result.build();
            }
        }
    }

    private static <T> Optional<T> querySingle(Connection conn, String sqlName, RowMapper<T> mapper,
            Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(mapper.map(rs)) : Optional.empty();
            }
        }
    }

    private static int update(Connection conn, String sqlName, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            bind(ps, params);
            return ps.executeUpdate();
        }
    }

    /** Executes an INSERT and returns the rowid it assigned. */
    private static long insert(Connection conn, String sqlName, Object... params) throws SQLException {
        update(conn, sqlName, params);
        return querySingle(conn, "select-last-insert-id", rs -> rs.getLong(1)).orElseThrow();
    }

    private static void bind(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            if (params[i] == null)
                ps.setNull(i + 1, Types.NULL);
            else
                ps.setObject(i + 1, params[i]);
        }
    }

    // =====================================================================
    // ResultSet → Domain Mapping
    // =====================================================================

    private static Corpus mapCorpus(ResultSet rs) throws SQLException {
        return new Corpus(rs.getLong("ID"), rs.getString("name"), rs.getString("title"));
    }

    private static Document mapDocument(ResultSet rs) throws SQLException {
        return new Document(rs.getLong("ID"), rs.getString("name"), rs.getString("title"),
                rs.getString("lang"), rs.getLong("corpusID"));
    }

    private static Sentence mapSentence(ResultSet rs) throws SQLException {
        return new Sentence(rs.getLong("ID"), rs.getString("ident"), rs.getString("text"),
                rs.getLong("docID"), getInteger(rs, "flag"), rs.getString("comment"));
    }

    private static Token mapToken(ResultSet rs) throws SQLException {
        return new Token(rs.getLong("ID"), rs.getLong("sid"), rs.getInt("widx"),
                getInteger(rs, "cfrom"), getInteger(rs, "cto"),
                rs.getString("text"), rs.getString("lemma"), rs.getString("pos"), rs.getString("comment"));
    }

    private static Concept mapConcept(ResultSet rs) throws SQLException {
        return new Concept(rs.getLong("ID"), rs.getLong("sid"), rs.getInt("cidx"),
                rs.getString("clemma"), rs.getString("tag"), rs.getString("flag"), rs.getString("comment"));
    }

    private static ConceptWordLink mapLink(ResultSet rs) throws SQLException {
        return new ConceptWordLink(rs.getLong("sid"), rs.getLong("cid"), rs.getLong("wid"));
    }

    private static Tag mapTag(ResultSet rs) throws SQLException {
        long wid = rs.getLong("wid");
        Long tokenId = rs.wasNull() ? null : wid;
        return new Tag(rs.getLong("ID"), rs.getLong("sid"), tokenId,
                getInteger(rs, "cfrom"), getInteger(rs, "cto"),
                rs.getString("label"), rs.getString("source"), rs.getString("tagtype"));
    }

    private static String mapMetaValue(ResultSet rs) throws SQLException {
        return rs.getString("value");
    }

    private static MetaEntry mapMeta(ResultSet rs, MetaScope scope, String owner) throws SQLException {
        return new MetaEntry(scope, owner, rs.getString("key"), rs.getString("value"));
    }

    private static Integer getInteger(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
