package de.bsommerfeld.ttl.db;

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

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for corpus annotations: corpus → document → sentence
 * → {token, concept, tag}, the concept-token link layer, and key-value
 * metadata at global, document and corpus scope.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlCorpusStore}: the SQLite corpus file exchanged between
 * tools</li>
 * <li>{@link InMemoryCorpusStore}: heap-only store with the same integrity
 * rules, for tests and throwaway processing</li>
 * </ul>
 *
 * <h3>Integrity</h3>
 * Every write that introduces a reference checks the target exists and
 * throws {@link DanglingReferenceException} otherwise. Every write under a
 * uniqueness constraint checks for a collision first and throws
 * {@link DuplicateKeyException}. Updates and deletes of absent rows, and
 * reads whose target is absent, throw {@link NotFoundException}; plain
 * lookups return {@link Optional#empty()} instead.
 *
 * <h3>Atomicity</h3>
 * Each method is one unit of work. A method that throws leaves the store
 * exactly as it was before the call. Deletes cascade to everything beneath
 * the deleted row, including its metadata.
 *
 * <h3>Threading</h3>
 * Implementations are thread-safe with a single-writer, multi-reader
 * discipline: writes are serialized, reads never block each other and see a
 * committed state.
 */
public interface CorpusStore {

    // -- Corpus --

    /**
     * @throws DuplicateKeyException if a corpus with this name exists
     */
    Corpus createCorpus(String name, String title);

    /**
     * Returns the corpus with this name, creating it if absent. The title is
     * only used on creation.
     */
    Corpus ensureCorpus(String name, String title);

    Optional<Corpus> getCorpus(String name);

    Optional<Corpus> getCorpusById(long id);

    /** All corpora ordered by id. */
    List<Corpus> listCorpora();

    /**
     * Renames and/or retitles a corpus. Corpus metadata follows a rename.
     *
     * @throws NotFoundException     if the corpus does not exist
     * @throws DuplicateKeyException if another corpus already has the name
     */
    Corpus updateCorpus(long id, String name, String title);

    /**
     * Deletes the corpus with its documents, their sentences and every
     * annotation beneath them, plus corpus and document metadata.
     *
     * @throws NotFoundException if the corpus does not exist
     */
    void deleteCorpus(long id);

    // -- Document --

    /**
     * @throws DanglingReferenceException if the corpus does not exist
     * @throws DuplicateKeyException      if a document with this name exists
     *                                    in any corpus
     */
    Document createDocument(long corpusId, String name, String title, String lang);

    /**
     * Returns the document with this name, creating it under {@code corpusId}
     * if absent. An existing document is returned as-is, whatever corpus it
     * lives in.
     *
     * @throws DanglingReferenceException if it has to be created and the
     *                                    corpus does not exist
     */
    Document ensureDocument(long corpusId, String name, String title, String lang);

    Optional<Document> getDocument(String name);

    Optional<Document> getDocumentById(long id);

    /**
     * Documents of a corpus ordered by id.
     *
     * @throws NotFoundException if the corpus does not exist
     */
    List<Document> listDocuments(long corpusId);

    /**
     * Renames, retitles or relabels the language of a document. Document
     * metadata follows a rename.
     *
     * @throws NotFoundException     if the document does not exist
     * @throws DuplicateKeyException if another document already has the name
     */
    Document updateDocument(long id, String name, String title, String lang);

    /**
     * Deletes the document, its sentences with all annotations, and its
     * metadata.
     *
     * @throws NotFoundException if the document does not exist
     */
    void deleteDocument(long id);

    // -- Sentence --

    /**
     * @throws DanglingReferenceException if the document does not exist
     */
    Sentence createSentence(long docId, String ident, String text, Integer flag, String comment);

    Optional<Sentence> getSentence(long id);

    /**
     * Sentences of a document in insertion order.
     *
     * @throws NotFoundException if the document does not exist
     */
    List<Sentence> listSentences(long docId);

    /** Sentences carrying this external identifier, across all documents. */
    List<Sentence> findSentencesByIdent(String ident);

    /**
     * @throws NotFoundException if the sentence does not exist
     */
    Sentence updateSentence(long id, String text, Integer flag, String comment);

    /**
     * Deletes the sentence with its tokens, concepts, tags and links.
     *
     * @throws NotFoundException if the sentence does not exist
     */
    void deleteSentence(long id);

    // -- Token --

    /**
     * Imports tokens into a sentence, all or nothing. Tokens without an
     * explicit {@code widx} are numbered consecutively after the highest
     * position already used in the sentence (from 0 for an empty sentence).
     *
     * @return the stored tokens in input order
     * @throws DanglingReferenceException if the sentence does not exist
     * @throws DuplicateKeyException      if a position is used twice, inside
     *                                    the batch or against stored tokens
     */
    List<Token> importTokens(long sentenceId, List<NewToken> tokens);

    Optional<Token> getToken(long id);

    /**
     * Tokens of a sentence ordered by {@code widx}.
     *
     * @throws NotFoundException if the sentence does not exist
     */
    List<Token> getTokens(long sentenceId);

    /**
     * @throws NotFoundException if the sentence does not exist
     */
    int countTokens(long sentenceId);

    /**
     * Replaces surface text, lemma and part of speech. Position and span stay.
     *
     * @throws NotFoundException if the token does not exist
     */
    Token updateToken(long id, String text, String lemma, String pos);

    /**
     * Deletes a token together with its links and token-level tags. The
     * remaining positions are not renumbered.
     *
     * @throws NotFoundException if the token does not exist
     */
    void deleteToken(long id);

    /**
     * Surface forms by frequency across the whole store, most frequent first,
     * ties ordered by text.
     *
     * @param limit maximum entries; {@code <= 0} returns all
     */
    List<LexiconEntry> lexicon(int limit);

    // -- Concept & Link --

    /**
     * @throws DanglingReferenceException if the sentence does not exist
     */
    Concept createConcept(long sentenceId, NewConcept concept);

    Optional<Concept> getConcept(long id);

    /**
     * Concepts of a sentence ordered by {@code cidx}.
     *
     * @throws NotFoundException if the sentence does not exist
     */
    List<Concept> getConcepts(long sentenceId);

    /**
     * @throws NotFoundException if the concept does not exist
     */
    Concept updateConcept(long id, String lemma, String tag, String flag, String comment);

    /**
     * Deletes a concept and its links. The linked tokens stay.
     *
     * @throws NotFoundException if the concept does not exist
     */
    void deleteConcept(long id);

    /**
     * Links a concept to a token of the same sentence.
     *
     * @throws DanglingReferenceException if concept or token does not exist, or
     *                                    they belong to different sentences
     * @throws DuplicateKeyException      if the link exists already
     */
    ConceptWordLink link(long conceptId, long tokenId);

    /**
     * Links a concept to several tokens, all or nothing. Same failures as
     * {@link #link}, including a token id listed twice.
     */
    List<ConceptWordLink> linkAll(long conceptId, List<Long> tokenIds);

    /**
     * @throws NotFoundException if the link does not exist
     */
    void unlink(long conceptId, long tokenId);

    /**
     * Tokens covered by a concept, ordered by {@code widx}.
     *
     * @throws NotFoundException if the concept does not exist
     */
    List<Token> getLinkedTokens(long conceptId);

    /**
     * Concepts covering a token, ordered by {@code cidx}.
     *
     * @throws NotFoundException if the token does not exist
     */
    List<Concept> getCoveringConcepts(long tokenId);

    /**
     * @throws NotFoundException if the sentence does not exist
     */
    List<ConceptWordLink> getLinks(long sentenceId);

    // -- Tag --

    /**
     * Creates a sentence-level tag if {@link NewTag#tokenId()} is
     * {@code null}, a token-level tag otherwise.
     *
     * @throws DanglingReferenceException if the sentence does not exist, or the
     *                                    token does not exist in that sentence
     */
    Tag createTag(long sentenceId, NewTag tag);

    /**
     * Tags of a sentence split into sentence-level and token-level, each in
     * insertion order.
     *
     * @throws NotFoundException if the sentence does not exist
     */
    SentenceTags getTags(long sentenceId);

    /**
     * @throws NotFoundException if the token does not exist
     */
    List<Tag> getTokenTags(long tokenId);

    /**
     * @throws NotFoundException if the tag does not exist
     */
    void deleteTag(long id);

    // -- Sentence graph --

    /**
     * Stores a complete sentence with tokens, tags, concepts and links in one
     * unit of work.
     *
     * @throws DanglingReferenceException if the document does not exist, or a
     *                                    tag or concept points at a token
     *                                    position the draft does not have
     * @throws DuplicateKeyException      if a concept lists a token position
     *                                    twice
     */
    AnnotatedSentence saveSentence(long docId, SentenceDraft draft);

    /**
     * Stores several sentences in one unit of work. Same failures as
     * {@link #saveSentence}; any failure discards the whole list.
     */
    List<AnnotatedSentence> saveSentences(long docId, List<SentenceDraft> drafts);

    /**
     * Reads a sentence with all of its layers from one consistent state.
     */
    Optional<AnnotatedSentence> getAnnotatedSentence(long sentenceId);

    // -- Metadata --

    /**
     * Sets a value, replacing any existing value of the key.
     *
     * @param owner document or corpus name; ignored for
     *              {@link MetaScope#GLOBAL}
     * @throws DanglingReferenceException if the owner does not exist
     */
    void setMeta(MetaScope scope, String owner, String key, String value);

    /**
     * @throws NotFoundException if the owner or the key does not exist
     */
    String getMeta(MetaScope scope, String owner, String key);

    Optional<String> findMeta(MetaScope scope, String owner, String key);

    /**
     * All pairs of one owner ordered by key.
     *
     * @throws NotFoundException if the owner does not exist
     */
    List<MetaEntry> listMeta(MetaScope scope, String owner);

    /**
     * @throws NotFoundException if the pair does not exist
     */
    void deleteMeta(MetaScope scope, String owner, String key);

    // -- Diagnostics --

    StoreStatistics statistics();
}
