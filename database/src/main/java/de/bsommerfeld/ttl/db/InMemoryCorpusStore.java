package de.bsommerfeld.ttl.db;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.TreeMultimap;
import com.google.inject.Singleton;
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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Heap-only {@link CorpusStore} for MEMORY mode: no file, no SQLite. Bound by
 * Guice when the store mode is {@code MEMORY}; tests use it directly.
 *
 * <p>
 * Enforces the same integrity rules as {@link SqlCorpusStore}. Atomicity is
 * achieved by validating a whole operation against the current state before
 * the first mutation, so a failed call never leaves partial rows behind.
 * Ids are assigned from per-table counters starting at 1 and are never
 * reused, matching SQLite's rowid behavior for tables that are only
 * appended to.
 *
 * <p>
 * Every foreign key has a multimap index from parent id to child ids, and
 * corpus and document names are indexed, so lookups and cascades never scan
 * whole tables.
 *
 * <p>
 * A {@link ReentrantReadWriteLock} gives the single-writer, multi-reader
 * discipline: reads hold the read lock for their whole duration and
 * therefore see one committed state.
 */
@Singleton
public class InMemoryCorpusStore implements CorpusStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryCorpusStore.class);

    private static final Comparator<Concept> CONCEPT_ORDER = Comparator.comparingInt(Concept::cidx)
            .thenComparingLong(Concept::id);
    private static final Comparator<ConceptWordLink> LINK_ORDER = Comparator
            .comparingLong(ConceptWordLink::conceptId)
            .thenComparingLong(ConceptWordLink::tokenId);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final TreeMap<Long, Corpus> corpora = new TreeMap<>();
    private final TreeMap<Long, Document> documents = new TreeMap<>();
    private final TreeMap<Long, Sentence> sentences = new TreeMap<>();
    private final TreeMap<Long, Token> tokens = new TreeMap<>();
    private final TreeMap<Long, Concept> concepts = new TreeMap<>();
    private final TreeMap<Long, Tag> tags = new TreeMap<>();

    private final Map<String, Long> corpusByName = new HashMap<>();
    private final Map<String, Long> documentByName = new HashMap<>();
    private final SetMultimap<Long, Long> documentsByCorpus = TreeMultimap.create();
    private final SetMultimap<Long, Long> sentencesByDocument = TreeMultimap.create();
    private final SetMultimap<String, Long> sentencesByIdent = TreeMultimap.create();
    private final SetMultimap<Long, Long> tokensBySentence = TreeMultimap.create();
    private final SetMultimap<Long, Long> conceptsBySentence = TreeMultimap.create();
    private final SetMultimap<Long, Long> tagsBySentence = TreeMultimap.create();
    private final SetMultimap<Long, Long> tagsByToken = TreeMultimap.create();

    // cwl rows exist only as index entries
    private final SetMultimap<Long, ConceptWordLink> linksBySentence = LinkedHashMultimap.create();
    private final SetMultimap<Long, ConceptWordLink> linksByConcept = LinkedHashMultimap.create();
    private final SetMultimap<Long, ConceptWordLink> linksByToken = LinkedHashMultimap.create();

    private final TreeMap<String, String> globalMeta = new TreeMap<>();
    private final Map<String, TreeMap<String, String>> documentMeta = new HashMap<>();
    private final Map<String, TreeMap<String, String>> corpusMeta = new HashMap<>();

    private long nextCorpusId = 1;
    private long nextDocumentId = 1;
    private long nextSentenceId = 1;
    private long nextTokenId = 1;
    private long nextConceptId = 1;
    private long nextTagId = 1;

    public InMemoryCorpusStore() {
        LOG.warn("#########################################################");
        LOG.warn("#  MEMORY MODE ENABLED: corpus data is NOT persisted    #");
        LOG.warn("#########################################################");
    }

    // =====================================================================
    // Corpus
    // =====================================================================

    @Override
    public Corpus createCorpus(String name, String title) {
        IntegrityChecks.checkName(name);
        return write(() -> insertCorpus(name, title));
    }

    @Override
    public Corpus ensureCorpus(String name, String title) {
        IntegrityChecks.checkName(name);
        return write(() -> findCorpus(name).orElseGet(() -> insertCorpus(name, title)));
    }

    @Override
    public Optional<Corpus> getCorpus(String name) {
        return read(() -> findCorpus(name));
    }

    @Override
    public Optional<Corpus> getCorpusById(long id) {
        return read(() -> Optional.ofNullable(corpora.get(id)));
    }

    @Override
    public List<Corpus> listCorpora() {
        return read(() -> ImmutableList.copyOf(corpora.values()));
    }

    @Override
    public Corpus updateCorpus(long id, String name, String title) {
        IntegrityChecks.checkName(name);
        return write(() -> {
            Corpus current = IntegrityChecks.require(corpora, id, "Corpus");
            boolean renamed = !current.name().equals(name);
            if (renamed && findCorpus(name).isPresent())
                throw new DuplicateKeyException("Corpus '" + name + "' already exists");
            Corpus updated = new Corpus(id, name, title);
            corpora.put(id, updated);
            if (renamed) {
                corpusByName.remove(current.name());
                corpusByName.put(name, id);
                moveMeta(corpusMeta, current.name(), name);
            }
            return updated;
        });
    }

    @Override
    public void deleteCorpus(long id) {
        write(() -> {
            Corpus corpus = IntegrityChecks.require(corpora, id, "Corpus");
            List<Document> owned = documentsOf(id);
            owned.forEach(this::removeDocument);
            corpusMeta.remove(corpus.name());
            corpusByName.remove(corpus.name());
            corpora.remove(id);
            LOG.info("[DB] Deleted corpus '{}' with {} documents.", corpus.name(), owned.size());
            return null;
        });
    }

    private Corpus insertCorpus(String name, String title) {
        if (findCorpus(name).isPresent())
            throw new DuplicateKeyException("Corpus '" + name + "' already exists");
        Corpus corpus = new Corpus(nextCorpusId++, name, title);
        corpora.put(corpus.id(), corpus);
        corpusByName.put(name, corpus.id());
        return corpus;
    }

    private Optional<Corpus> findCorpus(String name) {
        return Optional.ofNullable(corpusByName.get(name)).map(corpora::get);
    }

    // =====================================================================
    // Document
    // =====================================================================

    @Override
    public Document createDocument(long corpusId, String name, String title, String lang) {
        IntegrityChecks.checkName(name);
        return write(() -> insertDocument(corpusId, name, title, lang));
    }

    @Override
    public Document ensureDocument(long corpusId, String name, String title, String lang) {
        IntegrityChecks.checkName(name);
        return write(() -> findDocument(name).orElseGet(() -> insertDocument(corpusId, name, title, lang)));
    }

    @Override
    public Optional<Document> getDocument(String name) {
        return read(() -> findDocument(name));
    }

    @Override
    public Optional<Document> getDocumentById(long id) {
        return read(() -> Optional.ofNullable(documents.get(id)));
    }

    @Override
    public List<Document> listDocuments(long corpusId) {
        return read(() -> {
            IntegrityChecks.require(corpora, corpusId, "Corpus");
            return documentsOf(corpusId);
        });
    }

    @Override
    public Document updateDocument(long id, String name, String title, String lang) {
        IntegrityChecks.checkName(name);
        return write(() -> {
            Document current = IntegrityChecks.require(documents, id, "Document");
            boolean renamed = !current.name().equals(name);
            if (renamed && findDocument(name).isPresent())
                throw new DuplicateKeyException("Document '" + name + "' already exists");
            Document updated = new Document(id, name, title, lang, current.corpusId());
            documents.put(id, updated);
            if (renamed) {
                documentByName.remove(current.name());
                documentByName.put(name, id);
                moveMeta(documentMeta, current.name(), name);
            }
            return updated;
        });
    }

    @Override
    public void deleteDocument(long id) {
        write(() -> {
            Document document = IntegrityChecks.require(documents, id, "Document");
            removeDocument(document);
            LOG.info("[DB] Deleted document '{}'.", document.name());
            return null;
        });
    }

    private Document insertDocument(long corpusId, String name, String title, String lang) {
        IntegrityChecks.reference(corpora, corpusId, "Corpus");
        if (findDocument(name).isPresent())
            throw new DuplicateKeyException("Document '" + name + "' already exists");
        Document document = new Document(nextDocumentId++, name, title, lang, corpusId);
        documents.put(document.id(), document);
        documentByName.put(name, document.id());
        documentsByCorpus.put(corpusId, document.id());
        return document;
    }

    private void removeDocument(Document document) {
        sentencesOf(document.id()).forEach(s -> removeSentence(s.id()));
        documentMeta.remove(document.name());
        documentByName.remove(document.name());
        documentsByCorpus.remove(document.corpusId(), document.id());
        documents.remove(document.id());
    }

    private Optional<Document> findDocument(String name) {
        return Optional.ofNullable(documentByName.get(name)).map(documents::get);
    }

    private List<Document> documentsOf(long corpusId) {
        return documentsByCorpus.get(corpusId).stream()
                .map(documents::get)
                .collect(ImmutableList.toImmutableList());
    }

    // =====================================================================
    // Sentence
    // =====================================================================

    @Override
    public Sentence createSentence(long docId, String ident, String text, Integer flag, String comment) {
        return write(() -> {
            IntegrityChecks.reference(documents, docId, "Document");
            return insertSentence(docId, ident, text, flag, comment);
        });
    }

    @Override
    public Optional<Sentence> getSentence(long id) {
        return read(() -> Optional.ofNullable(sentences.get(id)));
    }

    @Override
    public List<Sentence> listSentences(long docId) {
        return read(() -> {
            IntegrityChecks.require(documents, docId, "Document");
            return sentencesOf(docId);
        });
    }

    @Override
    public List<Sentence> findSentencesByIdent(String ident) {
        if (ident == null)
            return ImmutableList.of();
        return read(() -> sentencesByIdent.get(ident).stream()
                .map(sentences::get)
                .collect(ImmutableList.toImmutableList()));
    }

    @Override
    public Sentence updateSentence(long id, String text, Integer flag, String comment) {
        return write(() -> {
            Sentence current = IntegrityChecks.require(sentences, id, "Sentence");
            Sentence updated = new Sentence(id, current.ident(), text, current.docId(), flag, comment);
            sentences.put(id, updated);
            return updated;
        });
    }

    @Override
    public void deleteSentence(long id) {
        write(() -> {
            IntegrityChecks.require(sentences, id, "Sentence");
            removeSentence(id);
            return null;
        });
    }

    private Sentence insertSentence(long docId, String ident, String text, Integer flag, String comment) {
        Sentence sentence = new Sentence(nextSentenceId++, ident, text, docId, flag, comment);
        sentences.put(sentence.id(), sentence);
        sentencesByDocument.put(docId, sentence.id());
        if (ident != null)
            sentencesByIdent.put(ident, sentence.id());
        return sentence;
    }

    /**
     * Removes a sentence, leaves first: links → tags → tokens → concepts →
     * the sentence row.
     */
    private void removeSentence(long id) {
        ImmutableList.copyOf(linksBySentence.get(id)).forEach(this::removeLink);
        for (Long tagId : tagsBySentence.removeAll(id)) {
            Tag tag = tags.remove(tagId);
            if (tag.tokenId() != null)
                tagsByToken.remove(tag.tokenId(), tagId);
        }
        tokensBySentence.removeAll(id).forEach(tokens::remove);
        conceptsBySentence.removeAll(id).forEach(concepts::remove);
        Sentence sentence = sentences.remove(id);
        sentencesByDocument.remove(sentence.docId(), id);
        if (sentence.ident() != null)
            sentencesByIdent.remove(sentence.ident(), id);
    }

    private List<Sentence> sentencesOf(long docId) {
        return sentencesByDocument.get(docId).stream()
                .map(sentences::get)
                .collect(ImmutableList.toImmutableList());
    }

    // =====================================================================
    // Token
    // =====================================================================

    @Override
    public List<Token> importTokens(long sentenceId, List<NewToken> batch) {
        checkNotNull(batch, "tokens");
        return write(() -> {
            IntegrityChecks.reference(sentences, sentenceId, "Sentence");
            return ImmutableList.copyOf(insertTokens(sentenceId, batch));
        });
    }

    @Override
    public Optional<Token> getToken(long id) {
        return read(() -> Optional.ofNullable(tokens.get(id)));
    }

    @Override
    public List<Token> getTokens(long sentenceId) {
        return read(() -> {
            IntegrityChecks.require(sentences, sentenceId, "Sentence");
            return tokensOf(sentenceId);
        });
    }

    @Override
    public int countTokens(long sentenceId) {
        return read(() -> {
            IntegrityChecks.require(sentences, sentenceId, "Sentence");
            return tokensBySentence.get(sentenceId).size();
        });
    }

    @Override
    public Token updateToken(long id, String text, String lemma, String pos) {
        checkNotNull(text, "token text");
        return write(() -> {
            Token t = IntegrityChecks.require(tokens, id, "Token");
            Token updated = new Token(id, t.sentenceId(), t.widx(), t.cfrom(), t.cto(), text, lemma, pos,
                    t.comment());
            tokens.put(id, updated);
            return updated;
        });
    }

    @Override
    public void deleteToken(long id) {
        write(() -> {
            Token token = IntegrityChecks.require(tokens, id, "Token");
            ImmutableList.copyOf(linksByToken.get(id)).forEach(this::removeLink);
            for (Long tagId : tagsByToken.removeAll(id)) {
                tags.remove(tagId);
                tagsBySentence.remove(token.sentenceId(), tagId);
            }
            tokensBySentence.remove(token.sentenceId(), id);
            tokens.remove(id);
            return null;
        });
    }

    @Override
    public List<LexiconEntry> lexicon(int limit) {
        return read(() -> {
            Map<String, Long> counts = tokens.values().stream()
                    .collect(Collectors.groupingBy(Token::text, Collectors.counting()));
            return counts.entrySet().stream()
                    .map(e -> new LexiconEntry(e.getKey(), e.getValue().intValue()))
                    .sorted(Comparator.comparingInt(LexiconEntry::count).reversed()
                            .thenComparing(LexiconEntry::text))
                    .limit(limit > 0 ? limit : Long.MAX_VALUE)
                    .collect(ImmutableList.toImmutableList());
        });
    }

    private List<Token> insertTokens(long sentenceId, List<NewToken> batch) {
        List<Integer> used = tokensOf(sentenceId).stream().map(Token::widx).collect(Collectors.toList());
        int[] positions = IntegrityChecks.assignPositions(sentenceId, batch, used);

        List<Token> stored = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            NewToken t = batch.get(i);
            Token token = new Token(nextTokenId++, sentenceId, positions[i], t.cfrom(), t.cto(),
                    t.text(), t.lemma(), t.pos(), t.comment());
            tokens.put(token.id(), token);
            tokensBySentence.put(sentenceId, token.id());
            stored.add(token);
        }
        return stored;
    }

    private List<Token> tokensOf(long sentenceId) {
        return tokensBySentence.get(sentenceId).stream()
                .map(tokens::get)
                .sorted(Comparator.comparingInt(Token::widx))
                .collect(ImmutableList.toImmutableList());
    }

    // =====================================================================
    // Concept & Link
    // =====================================================================

    @Override
    public Concept createConcept(long sentenceId, NewConcept concept) {
        checkNotNull(concept, "concept");
        return write(() -> {
            IntegrityChecks.reference(sentences, sentenceId, "Sentence");
            return insertConcept(sentenceId, concept);
        });
    }

    @Override
    public Optional<Concept> getConcept(long id) {
        return read(() -> Optional.ofNullable(concepts.get(id)));
    }

    @Override
    public List<Concept> getConcepts(long sentenceId) {
        return read(() -> {
            IntegrityChecks.require(sentences, sentenceId, "Sentence");
            return conceptsOf(sentenceId);
        });
    }

    @Override
    public Concept updateConcept(long id, String lemma, String tag, String flag, String comment) {
        return write(() -> {
            Concept c = IntegrityChecks.require(concepts, id, "Concept");
            Concept updated = new Concept(id, c.sentenceId(), c.cidx(), lemma, tag, flag, comment);
            concepts.put(id, updated);
            return updated;
        });
    }

    @Override
    public void deleteConcept(long id) {
        write(() -> {
            Concept concept = IntegrityChecks.require(concepts, id, "Concept");
            ImmutableList.copyOf(linksByConcept.get(id)).forEach(this::removeLink);
            conceptsBySentence.remove(concept.sentenceId(), id);
            concepts.remove(id);
            return null;
        });
    }

    @Override
    public ConceptWordLink link(long conceptId, long tokenId) {
        return write(() -> {
            ConceptWordLink link = checkLink(conceptId, tokenId);
            addLink(link);
            return link;
        });
    }

    @Override
    public List<ConceptWordLink> linkAll(long conceptId, List<Long> tokenIds) {
        checkNotNull(tokenIds, "tokenIds");
        IntegrityChecks.checkDistinct(conceptId, tokenIds);
        return write(() -> {
            List<ConceptWordLink> checked = new ArrayList<>(tokenIds.size());
            for (Long tokenId : tokenIds)
                checked.add(checkLink(conceptId, tokenId));
            checked.forEach(this::addLink);
            return ImmutableList.copyOf(checked);
        });
    }

    @Override
    public void unlink(long conceptId, long tokenId) {
        write(() -> {
            ConceptWordLink link = linksByConcept.get(conceptId).stream()
                    .filter(l -> l.tokenId() == tokenId)
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException(
                            "Concept #" + conceptId + " is not linked to token #" + tokenId));
            removeLink(link);
            return null;
        });
    }

    @Override
    public List<Token> getLinkedTokens(long conceptId) {
        return read(() -> {
            IntegrityChecks.require(concepts, conceptId, "Concept");
            return linksByConcept.get(conceptId).stream()
                    .map(l -> tokens.get(l.tokenId()))
                    .sorted(Comparator.comparingInt(Token::widx))
                    .collect(ImmutableList.toImmutableList());
        });
    }

    @Override
    public List<Concept> getCoveringConcepts(long tokenId) {
        return read(() -> {
            IntegrityChecks.require(tokens, tokenId, "Token");
            return linksByToken.get(tokenId).stream()
                    .map(l -> concepts.get(l.conceptId()))
                    .sorted(CONCEPT_ORDER)
                    .collect(ImmutableList.toImmutableList());
        });
    }

    @Override
    public List<ConceptWordLink> getLinks(long sentenceId) {
        return read(() -> {
            IntegrityChecks.require(sentences, sentenceId, "Sentence");
            return linksOf(sentenceId);
        });
    }

    private Concept insertConcept(long sentenceId, NewConcept c) {
        Concept concept = new Concept(nextConceptId++, sentenceId, c.cidx(), c.lemma(), c.tag(), c.flag(),
                c.comment());
        concepts.put(concept.id(), concept);
        conceptsBySentence.put(sentenceId, concept.id());
        return concept;
    }

    private ConceptWordLink checkLink(long conceptId, long tokenId) {
        Concept concept = concepts.get(conceptId);
        Token token = tokens.get(tokenId);
        long sentenceId = IntegrityChecks.checkLinkTargets(
                conceptId, concept == null ? null : concept.sentenceId(),
                tokenId, token == null ? null : token.sentenceId());
        ConceptWordLink link = new ConceptWordLink(sentenceId, conceptId, tokenId);
        if (linksByConcept.containsEntry(conceptId, link))
            throw new DuplicateKeyException("Concept #" + conceptId + " is already linked to token #" + tokenId);
        return link;
    }

    private List<Concept> conceptsOf(long sentenceId) {
        return conceptsBySentence.get(sentenceId).stream()
                .map(concepts::get)
                .sorted(CONCEPT_ORDER)
                .collect(ImmutableList.toImmutableList());
    }

    private List<ConceptWordLink> linksOf(long sentenceId) {
        return linksBySentence.get(sentenceId).stream()
                .sorted(LINK_ORDER)
                .collect(ImmutableList.toImmutableList());
    }

    private void addLink(ConceptWordLink link) {
        linksBySentence.put(link.sentenceId(), link);
        linksByConcept.put(link.conceptId(), link);
        linksByToken.put(link.tokenId(), link);
    }

    private void removeLink(ConceptWordLink link) {
        linksBySentence.remove(link.sentenceId(), link);
        linksByConcept.remove(link.conceptId(), link);
        linksByToken.remove(link.tokenId(), link);
    }

    // =====================================================================
    // Tag
    // =====================================================================

    @Override
    public Tag createTag(long sentenceId, NewTag tag) {
        checkNotNull(tag, "tag");
        return write(() -> {
            IntegrityChecks.reference(sentences, sentenceId, "Sentence");
            if (tag.tokenId() != null) {
                Token token = tokens.get(tag.tokenId());
                if (token == null || token.sentenceId() != sentenceId) {
                    throw new DanglingReferenceException(
                            "Token #" + tag.tokenId() + " does not exist in sentence #" + sentenceId);
                }
            }
            return insertTag(sentenceId, tag);
        });
    }

    @Override
    public SentenceTags getTags(long sentenceId) {
        return read(() -> {
            IntegrityChecks.require(sentences, sentenceId, "Sentence");
            return SentenceTags.partition(tagsOf(sentenceId));
        });
    }

    @Override
    public List<Tag> getTokenTags(long tokenId) {
        return read(() -> {
            IntegrityChecks.require(tokens, tokenId, "Token");
            return tagsByToken.get(tokenId).stream()
                    .map(tags::get)
                    .collect(ImmutableList.toImmutableList());
        });
    }

    @Override
    public void deleteTag(long id) {
        write(() -> {
            Tag tag = IntegrityChecks.require(tags, id, "Tag");
            tagsBySentence.remove(tag.sentenceId(), id);
            if (tag.tokenId() != null)
                tagsByToken.remove(tag.tokenId(), id);
            tags.remove(id);
            return null;
        });
    }

    private Tag insertTag(long sentenceId, NewTag t) {
        Tag tag = new Tag(nextTagId++, sentenceId, t.tokenId(), t.cfrom(), t.cto(), t.label(), t.source(),
                t.tagType());
        tags.put(tag.id(), tag);
        tagsBySentence.put(sentenceId, tag.id());
        if (tag.tokenId() != null)
            tagsByToken.put(tag.tokenId(), tag.id());
        return tag;
    }

    private List<Tag> tagsOf(long sentenceId) {
        return tagsBySentence.get(sentenceId).stream()
                .map(tags::get)
                .collect(ImmutableList.toImmutableList());
    }

    // =====================================================================
    // Sentence Graph
    // =====================================================================

    @Override
    public AnnotatedSentence saveSentence(long docId, SentenceDraft draft) {
        checkNotNull(draft, "draft");
        return write(() -> {
            IntegrityChecks.reference(documents, docId, "Document");
            IntegrityChecks.checkDraft(draft);
            return insertDraft(docId, draft);
        });
    }

    @Override
    public List<AnnotatedSentence> saveSentences(long docId, List<SentenceDraft> drafts) {
        checkNotNull(drafts, "drafts");
        return write(() -> {
            IntegrityChecks.reference(documents, docId, "Document");
            drafts.forEach(IntegrityChecks::checkDraft);
            List<AnnotatedSentence> saved = new ArrayList<>(drafts.size());
            for (SentenceDraft draft : drafts)
                saved.add(insertDraft(docId, draft));
            LOG.info("[DB] Batch saved {} sentences into document #{}.", saved.size(), docId);
            return ImmutableList.copyOf(saved);
        });
    }

    @Override
    public Optional<AnnotatedSentence> getAnnotatedSentence(long sentenceId) {
        return read(() -> Optional.ofNullable(sentences.get(sentenceId)).map(s -> new AnnotatedSentence(
                s,
                tokensOf(sentenceId),
                conceptsOf(sentenceId),
                linksOf(sentenceId),
                SentenceTags.partition(tagsOf(sentenceId)))));
    }

    /**
     * Writes a draft that already passed {@link IntegrityChecks#checkDraft}.
     * Nothing in here can fail, so no partial graph is ever left behind.
     */
    private AnnotatedSentence insertDraft(long docId, SentenceDraft draft) {
        Sentence sentence = insertSentence(docId, draft.ident(), draft.text(), draft.flag(), draft.comment());
        long sid = sentence.id();

        List<NewToken> positioned = new ArrayList<>(draft.tokens().size());
        for (int i = 0; i < draft.tokens().size(); i++)
            positioned.add(draft.tokens().get(i).at(i));
        List<Token> stored = insertTokens(sid, positioned);

        List<Tag> storedTags = new ArrayList<>();
        for (NewTag tag : draft.sentenceTags())
            storedTags.add(insertTag(sid, tag.onToken(null)));
        draft.tokenTags().forEach((widx, list) -> {
            long tokenId = stored.get(widx).id();
            list.forEach(tag -> storedTags.add(insertTag(sid, tag.onToken(tokenId))));
        });

        List<Concept> storedConcepts = new ArrayList<>();
        List<ConceptWordLink> storedLinks = new ArrayList<>();
        for (SentenceDraft.ConceptDraft cd : draft.concepts()) {
            Concept concept = insertConcept(sid, cd.concept());
            storedConcepts.add(concept);
            for (Integer widx : cd.tokenIndexes()) {
                ConceptWordLink link = new ConceptWordLink(sid, concept.id(), stored.get(widx).id());
                addLink(link);
                storedLinks.add(link);
            }
        }
        storedConcepts.sort(CONCEPT_ORDER);
        storedLinks.sort(LINK_ORDER);

        return new AnnotatedSentence(sentence, stored, storedConcepts, storedLinks,
                SentenceTags.partition(storedTags));
    }

    // =====================================================================
    // Metadata
    // =====================================================================

    @Override
    public void setMeta(MetaScope scope, String owner, String key, String value) {
        IntegrityChecks.checkOwner(scope, owner);
        checkArgument(key != null, "key");
        checkArgument(value != null, "value");
        write(() -> {
            switch (scope) {
                case GLOBAL -> globalMeta.put(key, value);
                case DOCUMENT -> {
                    if (findDocument(owner).isEmpty())
                        throw new DanglingReferenceException("Document '" + owner + "' does not exist");
                    documentMeta.computeIfAbsent(owner, k -> new TreeMap<>()).put(key, value);
                }
                case CORPUS -> {
                    if (findCorpus(owner).isEmpty())
                        throw new DanglingReferenceException("Corpus '" + owner + "' does not exist");
                    corpusMeta.computeIfAbsent(owner, k -> new TreeMap<>()).put(key, value);
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
        return read(() -> Optional.ofNullable(pairsOf(scope, owner).get(key)));
    }

    @Override
    public List<MetaEntry> listMeta(MetaScope scope, String owner) {
        IntegrityChecks.checkOwner(scope, owner);
        return read(() -> {
            if (scope == MetaScope.DOCUMENT && findDocument(owner).isEmpty())
                throw new NotFoundException("Document '" + owner + "' does not exist");
            if (scope == MetaScope.CORPUS && findCorpus(owner).isEmpty())
                throw new NotFoundException("Corpus '" + owner + "' does not exist");
            String entryOwner = scope.hasOwner() ? owner : null;
            return pairsOf(scope, owner).entrySet().stream()
                    .map(e -> new MetaEntry(scope, entryOwner, e.getKey(), e.getValue()))
                    .collect(ImmutableList.toImmutableList());
        });
    }

    @Override
    public void deleteMeta(MetaScope scope, String owner, String key) {
        IntegrityChecks.checkOwner(scope, owner);
        write(() -> {
            Map<String, String> pairs = pairsOf(scope, owner);
            if (!pairs.containsKey(key))
                throw new NotFoundException(IntegrityChecks.describe(scope, owner, key) + " does not exist");
            pairs.remove(key);
            return null;
        });
    }

    private Map<String, String> pairsOf(MetaScope scope, String owner) {
        return switch (scope) {
            case GLOBAL -> globalMeta;
            case DOCUMENT -> documentMeta.getOrDefault(owner, new TreeMap<>());
            case CORPUS -> corpusMeta.getOrDefault(owner, new TreeMap<>());
        };
    }

    private static void moveMeta(Map<String, TreeMap<String, String>> meta, String from, String to) {
        TreeMap<String, String> pairs = meta.remove(from);
        if (pairs != null)
            meta.put(to, pairs);
    }

    // =====================================================================
    // Diagnostics
    // =====================================================================

    @Override
    public StoreStatistics statistics() {
        return read(() -> new StoreStatistics(
                corpora.size(), documents.size(), sentences.size(),
                tokens.size(), concepts.size(), tags.size(), linksBySentence.size(),
                documentMeta.values().stream().mapToLong(Map::size).sum(),
                corpusMeta.values().stream().mapToLong(Map::size).sum()));
    }

    // =====================================================================
    // Locking
    // =====================================================================

    private <T> T read(Supplier<T> work) {
        lock.readLock().lock();
        try {
            return work.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> work) {
        lock.writeLock().lock();
        try {
            return work.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
