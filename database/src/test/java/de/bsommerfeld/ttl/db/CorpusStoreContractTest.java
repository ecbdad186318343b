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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior every {@link CorpusStore} implementation must show. Subclasses
 * provide a fresh, empty store per test.
 */
abstract class CorpusStoreContractTest {

    protected CorpusStore store;

    protected abstract CorpusStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    // -- Hierarchy --

    @Test
    void createCorpus_shouldRejectDuplicateName() {
        store.createCorpus("c1", "First");
        assertThrows(DuplicateKeyException.class, () -> store.createCorpus("c1", "Again"));
        assertEquals(1, store.listCorpora().size());
    }

    @Test
    void createDocument_shouldRejectMissingCorpus() {
        assertThrows(DanglingReferenceException.class, () -> store.createDocument(42, "d1", "Doc", "eng"));
        assertTrue(store.getDocument("d1").isEmpty());
    }

    @Test
    void createDocument_shouldRejectNameUsedInOtherCorpus() {
        Corpus a = store.createCorpus("a", null);
        Corpus b = store.createCorpus("b", null);
        store.createDocument(a.id(), "d1", null, null);
        assertThrows(DuplicateKeyException.class, () -> store.createDocument(b.id(), "d1", null, null));
    }

    @Test
    void ensureCorpus_shouldReturnExistingRow() {
        Corpus first = store.ensureCorpus("c1", "Title");
        Corpus second = store.ensureCorpus("c1", "Ignored");
        assertEquals(first, second);
        assertEquals("Title", second.title());
    }

    @Test
    void ensureDocument_shouldCreateOnceAndReturnExisting() {
        Corpus corpus = store.createCorpus("c1", null);
        Document created = store.ensureDocument(corpus.id(), "d1", "Doc", "eng");
        Document again = store.ensureDocument(corpus.id(), "d1", "Other", "deu");
        assertEquals(created, again);
        assertEquals(1, store.listDocuments(corpus.id()).size());
    }

    @Test
    void getCorpus_shouldFindByNameAndId() {
        Corpus corpus = store.createCorpus("c1", "Title");
        assertEquals(corpus, store.getCorpus("c1").orElseThrow());
        assertEquals(corpus, store.getCorpusById(corpus.id()).orElseThrow());
        assertTrue(store.getCorpus("missing").isEmpty());
    }

    @Test
    void createCorpus_shouldRejectBlankName() {
        assertThrows(IllegalArgumentException.class, () -> store.createCorpus(" ", null));
    }

    @Test
    void updateCorpus_shouldCarryMetadataAcrossRename() {
        Corpus corpus = store.createCorpus("old", "Title");
        store.setMeta(MetaScope.CORPUS, "old", "license", "CC-BY");

        Corpus renamed = store.updateCorpus(corpus.id(), "new", "New Title");

        assertEquals("new", renamed.name());
        assertEquals("CC-BY", store.getMeta(MetaScope.CORPUS, "new", "license"));
        assertTrue(store.getCorpus("old").isEmpty());
        assertEquals("New Title", store.getCorpus("new").orElseThrow().title());
    }

    @Test
    void updateCorpus_shouldRejectNameOfOtherCorpus() {
        store.createCorpus("a", null);
        Corpus b = store.createCorpus("b", null);
        assertThrows(DuplicateKeyException.class, () -> store.updateCorpus(b.id(), "a", null));
        assertEquals("b", store.getCorpusById(b.id()).orElseThrow().name());
    }

    @Test
    void updateDocument_shouldCarryMetadataAcrossRename() {
        Corpus corpus = store.createCorpus("c1", null);
        Document doc = store.createDocument(corpus.id(), "d1", null, "eng");
        store.setMeta(MetaScope.DOCUMENT, "d1", "author", "X");

        Document updated = store.updateDocument(doc.id(), "d2", "Title", "deu");

        assertEquals(corpus.id(), updated.corpusId());
        assertEquals("deu", store.getDocument("d2").orElseThrow().lang());
        assertEquals("X", store.getMeta(MetaScope.DOCUMENT, "d2", "author"));
        assertTrue(store.findMeta(MetaScope.DOCUMENT, "d1", "author").isEmpty());
    }

    @Test
    void updateCorpus_shouldFailForMissingRow() {
        assertThrows(NotFoundException.class, () -> store.updateCorpus(99, "x", null));
        assertThrows(NotFoundException.class, () -> store.deleteDocument(99));
    }

    @Test
    void deleteCorpus_shouldRemoveEverythingBeneath() {
        Sentence sentence = sentenceWithTokens();
        List<Token> tokens = store.getTokens(sentence.id());
        Concept concept = store.createConcept(sentence.id(), NewConcept.of(0, "self"));
        store.linkAll(concept.id(), List.of(tokens.get(0).id(), tokens.get(1).id()));
        store.createTag(sentence.id(), NewTag.sentenceLevel("declarative", "mood"));
        store.createTag(sentence.id(), NewTag.forToken(tokens.get(0).id(), "PRP", "pos"));
        store.setMeta(MetaScope.DOCUMENT, "d1", "author", "X");
        store.setMeta(MetaScope.CORPUS, "c1", "license", "CC-BY");

        Corpus other = store.createCorpus("c2", null);
        Document kept = store.createDocument(other.id(), "d2", null, null);
        store.createSentence(kept.id(), null, "Kept.", null, null);

        store.deleteCorpus(store.getCorpus("c1").orElseThrow().id());

        assertEquals(new StoreStatistics(1, 1, 1, 0, 0, 0, 0, 0, 0), store.statistics());
        assertTrue(store.getSentence(sentence.id()).isEmpty());
        assertTrue(store.getToken(tokens.get(0).id()).isEmpty());
        assertTrue(store.getConcept(concept.id()).isEmpty());
    }

    @Test
    void deleteCorpus_shouldLeaveEmptyStore() {
        sentenceWithTokens();
        store.deleteCorpus(store.getCorpus("c1").orElseThrow().id());
        assertTrue(store.statistics().isEmpty());
    }

    @Test
    void deleteDocument_shouldCascadeToSentencesAndMetadata() {
        Sentence sentence = sentenceWithTokens();
        store.setMeta(MetaScope.DOCUMENT, "d1", "author", "X");

        store.deleteDocument(sentence.docId());

        StoreStatistics stats = store.statistics();
        assertEquals(1, stats.corpora());
        assertEquals(0, stats.documents());
        assertEquals(0, stats.sentences());
        assertEquals(0, stats.tokens());
        assertEquals(0, stats.documentMeta());
    }

    @Test
    void listDocuments_shouldFailForMissingCorpus() {
        assertThrows(NotFoundException.class, () -> store.listDocuments(7));
    }

    // -- Sentence & Token --

    @Test
    void importTokens_shouldStoreTokensInSurfaceOrder() {
        Sentence sentence = sentenceWithTokens();

        assertEquals(5, store.countTokens(sentence.id()));
        List<Token> tokens = store.getTokens(sentence.id());
        assertEquals(List.of(0, 1, 2, 3, 4), tokens.stream().map(Token::widx).collect(Collectors.toList()));
        assertEquals(List.of("I", "am", "a", "sentence", "."),
                tokens.stream().map(Token::text).collect(Collectors.toList()));
    }

    @Test
    void importTokens_shouldContinueAfterHighestPosition() {
        Sentence sentence = sentenceWithTokens();
        List<Token> more = store.importTokens(sentence.id(), List.of(NewToken.of("Really"), NewToken.of("!")));
        assertEquals(5, more.get(0).widx());
        assertEquals(6, more.get(1).widx());
    }

    @Test
    void importTokens_shouldRejectWholeBatchOnPositionClash() {
        Sentence sentence = emptySentence();
        store.importTokens(sentence.id(), List.of(NewToken.of("one").at(0)));

        List<NewToken> batch = List.of(NewToken.of("two").at(1), NewToken.of("clash").at(0));
        assertThrows(DuplicateKeyException.class, () -> store.importTokens(sentence.id(), batch));

        assertEquals(1, store.countTokens(sentence.id()));
    }

    @Test
    void importTokens_shouldRejectPositionPastIntegerRange() {
        Sentence sentence = emptySentence();
        List<NewToken> batch = List.of(NewToken.of("last").at(Integer.MAX_VALUE), NewToken.of("after"));

        assertThrows(IllegalArgumentException.class, () -> store.importTokens(sentence.id(), batch));
        assertEquals(0, store.countTokens(sentence.id()));

        store.importTokens(sentence.id(), List.of(NewToken.of("last").at(Integer.MAX_VALUE)));
        assertThrows(IllegalArgumentException.class,
                () -> store.importTokens(sentence.id(), List.of(NewToken.of("after"))));
        assertEquals(List.of(Integer.MAX_VALUE),
                store.getTokens(sentence.id()).stream().map(Token::widx).collect(Collectors.toList()));

        Token gap = store.importTokens(sentence.id(), List.of(NewToken.of("first").at(0))).get(0);
        assertEquals(0, gap.widx());
    }

    @Test
    void importTokens_shouldRejectMissingSentence() {
        assertThrows(DanglingReferenceException.class,
                () -> store.importTokens(404, List.of(NewToken.of("x"))));
    }

    @Test
    void importTokens_shouldKeepSpansAndAnalysis() {
        Sentence sentence = emptySentence();
        Token stored = store.importTokens(sentence.id(),
                List.of(NewToken.of("I", 0, 1).withAnalysis("I", "PRP"))).get(0);

        Token loaded = store.getToken(stored.id()).orElseThrow();
        assertEquals(0, loaded.cfrom());
        assertEquals(1, loaded.cto());
        assertEquals("PRP", loaded.pos());
        assertNull(store.getTokens(sentence.id()).get(0).comment());
    }

    @Test
    void updateToken_shouldKeepPositionAndSpan() {
        Sentence sentence = emptySentence();
        Token token = store.importTokens(sentence.id(), List.of(NewToken.of("Dogs", 0, 4))).get(0);

        store.updateToken(token.id(), "Dogs", "dog", "NNS");

        Token loaded = store.getToken(token.id()).orElseThrow();
        assertEquals("dog", loaded.lemma());
        assertEquals("NNS", loaded.pos());
        assertEquals(0, loaded.widx());
        assertEquals(4, loaded.cto());
    }

    @Test
    void updateSentence_shouldReplaceTextFlagAndComment() {
        Sentence sentence = emptySentence();
        store.updateSentence(sentence.id(), "Edited.", 2, "checked");

        Sentence loaded = store.getSentence(sentence.id()).orElseThrow();
        assertEquals("Edited.", loaded.text());
        assertEquals(2, loaded.flag());
        assertEquals("checked", loaded.comment());
        assertEquals(sentence.ident(), loaded.ident());
    }

    @Test
    void findSentencesByIdent_shouldSearchAcrossDocuments() {
        Corpus corpus = store.createCorpus("c1", null);
        Document d1 = store.createDocument(corpus.id(), "d1", null, null);
        Document d2 = store.createDocument(corpus.id(), "d2", null, null);
        store.createSentence(d1.id(), "s-1", "One.", null, null);
        store.createSentence(d2.id(), "s-1", "Uno.", null, null);
        store.createSentence(d2.id(), "s-2", "Two.", null, null);

        List<Sentence> found = store.findSentencesByIdent("s-1");
        assertEquals(List.of("One.", "Uno."), found.stream().map(Sentence::text).collect(Collectors.toList()));
        assertEquals(2, store.listSentences(d2.id()).size());
    }

    @Test
    void findSentencesByIdent_shouldForgetDeletedSentences() {
        Corpus corpus = store.createCorpus("c1", null);
        Document d1 = store.createDocument(corpus.id(), "d1", null, null);
        Document d2 = store.createDocument(corpus.id(), "d2", null, null);
        Sentence gone = store.createSentence(d1.id(), "s-1", "One.", null, null);
        store.createSentence(d2.id(), "s-1", "Uno.", null, null);
        store.createSentence(d2.id(), null, "No ident.", null, null);

        store.deleteSentence(gone.id());
        assertEquals(List.of("Uno."),
                store.findSentencesByIdent("s-1").stream().map(Sentence::text).collect(Collectors.toList()));

        store.deleteDocument(d2.id());
        assertTrue(store.findSentencesByIdent("s-1").isEmpty());
    }

    @Test
    void deleteSentence_shouldCascadeToAllLayers() {
        Sentence sentence = sentenceWithTokens();
        Token first = store.getTokens(sentence.id()).get(0);
        Concept concept = store.createConcept(sentence.id(), NewConcept.of(0, "self"));
        store.link(concept.id(), first.id());
        store.createTag(sentence.id(), NewTag.forToken(first.id(), "PRP", "pos"));

        store.deleteSentence(sentence.id());

        StoreStatistics stats = store.statistics();
        assertEquals(0, stats.sentences());
        assertEquals(0, stats.tokens());
        assertEquals(0, stats.concepts());
        assertEquals(0, stats.tags());
        assertEquals(0, stats.links());
        assertEquals(1, stats.documents());
    }

    @Test
    void deleteToken_shouldDropItsLinksAndTags() {
        Sentence sentence = sentenceWithTokens();
        List<Token> tokens = store.getTokens(sentence.id());
        Concept concept = store.createConcept(sentence.id(), NewConcept.of(0, "self"));
        store.linkAll(concept.id(), List.of(tokens.get(0).id(), tokens.get(1).id()));
        store.createTag(sentence.id(), NewTag.forToken(tokens.get(0).id(), "PRP", "pos"));

        store.deleteToken(tokens.get(0).id());

        assertEquals(List.of(tokens.get(1)), store.getLinkedTokens(concept.id()));
        assertTrue(store.getTags(sentence.id()).isEmpty());
        assertEquals(List.of(1, 2, 3, 4),
                store.getTokens(sentence.id()).stream().map(Token::widx).collect(Collectors.toList()));
    }

    @Test
    void lexicon_shouldOrderByFrequencyThenText() {
        Sentence s1 = sentenceWithTokens();
        Sentence s2 = store.createSentence(s1.docId(), null, "a sentence", null, null);
        store.importTokens(s2.id(), List.of(NewToken.of("a"), NewToken.of("sentence")));

        List<LexiconEntry> lexicon = store.lexicon(3);

        assertEquals(List.of(
                new LexiconEntry("a", 2),
                new LexiconEntry("sentence", 2),
                new LexiconEntry(".", 1)), lexicon);
        assertEquals(5, store.lexicon(0).size());
    }

    // -- Concept & Link --

    @Test
    void getLinkedTokens_shouldReturnLinkedTokensByPosition() {
        Sentence sentence = sentenceWithTokens();
        List<Token> tokens = store.getTokens(sentence.id());
        Concept concept = store.createConcept(sentence.id(), NewConcept.of(0, "I am"));

        store.link(concept.id(), tokens.get(1).id());
        store.link(concept.id(), tokens.get(0).id());

        assertEquals(List.of(tokens.get(0), tokens.get(1)), store.getLinkedTokens(concept.id()));
        assertEquals(List.of(concept), store.getCoveringConcepts(tokens.get(0).id()));
        assertTrue(store.getCoveringConcepts(tokens.get(2).id()).isEmpty());
    }

    @Test
    void link_shouldRejectDuplicateTripleAndKeepOriginal() {
        Sentence sentence = sentenceWithTokens();
        Token token = store.getTokens(sentence.id()).get(0);
        Concept concept = store.createConcept(sentence.id(), NewConcept.of(0, "self"));
        ConceptWordLink original = store.link(concept.id(), token.id());

        assertThrows(DuplicateKeyException.class, () -> store.link(concept.id(), token.id()));

        assertEquals(List.of(original), store.getLinks(sentence.id()));
    }

    @Test
    void link_shouldRejectTokenOfOtherSentence() {
        Sentence sentence = sentenceWithTokens();
        Sentence other = store.createSentence(sentence.docId(), null, "Other.", null, null);
        Token foreign = store.importTokens(other.id(), List.of(NewToken.of("Other"))).get(0);
        Concept concept = store.createConcept(sentence.id(), NewConcept.of(0, "x"));

        assertThrows(DanglingReferenceException.class, () -> store.link(concept.id(), foreign.id()));
        assertThrows(DanglingReferenceException.class, () -> store.link(concept.id(), 9999));
        assertThrows(DanglingReferenceException.class, () -> store.link(9999, foreign.id()));
        assertEquals(0, store.statistics().links());
    }

    @Test
    void linkAll_shouldLinkNothingWhenOneTargetFails() {
        Sentence sentence = sentenceWithTokens();
        List<Token> tokens = store.getTokens(sentence.id());
        Concept concept = store.createConcept(sentence.id(), NewConcept.of(0, "x"));
        store.link(concept.id(), tokens.get(2).id());

        List<Long> batch = List.of(tokens.get(0).id(), tokens.get(1).id(), tokens.get(2).id());
        assertThrows(DuplicateKeyException.class, () -> store.linkAll(concept.id(), batch));

        assertEquals(List.of(tokens.get(2)), store.getLinkedTokens(concept.id()));
    }

    @Test
    void linkAll_shouldRejectTokenListedTwice() {
        Sentence sentence = sentenceWithTokens();
        Token token = store.getTokens(sentence.id()).get(0);
        Concept concept = store.createConcept(sentence.id(), NewConcept.of(0, "x"));

        assertThrows(DuplicateKeyException.class,
                () -> store.linkAll(concept.id(), List.of(token.id(), token.id())));
        assertEquals(0, store.statistics().links());
    }

    @Test
    void unlink_shouldRemoveLinkOrReportMissing() {
        Sentence sentence = sentenceWithTokens();
        Token token = store.getTokens(sentence.id()).get(0);
        Concept concept = store.createConcept(sentence.id(), NewConcept.of(0, "x"));
        store.link(concept.id(), token.id());

        store.unlink(concept.id(), token.id());

        assertTrue(store.getLinks(sentence.id()).isEmpty());
        assertThrows(NotFoundException.class, () -> store.unlink(concept.id(), token.id()));
    }

    @Test
    void deleteConcept_shouldKeepTokens() {
        Sentence sentence = sentenceWithTokens();
        Concept concept = store.createConcept(sentence.id(), NewConcept.of(0, "x"));
        store.link(concept.id(), store.getTokens(sentence.id()).get(0).id());

        store.deleteConcept(concept.id());

        assertEquals(5, store.countTokens(sentence.id()));
        assertEquals(0, store.statistics().links());
        assertThrows(NotFoundException.class, () -> store.getLinkedTokens(concept.id()));
    }

    @Test
    void getConcepts_shouldOrderByIndex() {
        Sentence sentence = emptySentence();
        store.createConcept(sentence.id(), NewConcept.of(2, "c"));
        store.createConcept(sentence.id(), NewConcept.of(0, "a", "noun"));
        Concept b = store.createConcept(sentence.id(), NewConcept.of(1, "b"));
        store.updateConcept(b.id(), "b2", "verb", "E", "edited");

        List<Concept> concepts = store.getConcepts(sentence.id());

        assertEquals(List.of("a", "b2", "c"), concepts.stream().map(Concept::lemma).collect(Collectors.toList()));
        assertEquals("verb", concepts.get(1).tag());
        assertEquals("E", concepts.get(1).flag());
    }

    // -- Tag --

    @Test
    void getTags_shouldPartitionByTokenReference() {
        Sentence sentence = sentenceWithTokens();
        Token token = store.getTokens(sentence.id()).get(3);
        Tag sentenceTag = store.createTag(sentence.id(), NewTag.sentenceLevel("declarative", "mood"));
        Tag tokenTag = store.createTag(sentence.id(), NewTag.forToken(token.id(), "NN", "pos"));

        SentenceTags tags = store.getTags(sentence.id());

        assertEquals(List.of(sentenceTag), tags.sentenceLevel());
        assertEquals(List.of(tokenTag), tags.tokenLevel());
        assertEquals(List.of(tokenTag), store.getTokenTags(token.id()));
    }

    @Test
    void createTag_shouldNormaliseLegacyMarkers() {
        Sentence sentence = emptySentence();
        Tag tag = store.createTag(sentence.id(), new NewTag(null, -1, -1, "x", "", "t"));

        Tag loaded = store.getTags(sentence.id()).sentenceLevel().get(0);
        assertEquals(tag, loaded);
        assertNull(loaded.cfrom());
        assertNull(loaded.cto());
        assertNull(loaded.source());
    }

    @Test
    void createTag_shouldRejectTokenOfOtherSentence() {
        Sentence sentence = sentenceWithTokens();
        Sentence other = store.createSentence(sentence.docId(), null, "Other.", null, null);
        Token token = store.getTokens(sentence.id()).get(0);

        assertThrows(DanglingReferenceException.class,
                () -> store.createTag(other.id(), NewTag.forToken(token.id(), "x", "t")));
        assertThrows(DanglingReferenceException.class,
                () -> store.createTag(12345, NewTag.sentenceLevel("x", "t")));
    }

    @Test
    void deleteTag_shouldRemoveOnlyThatTag() {
        Sentence sentence = emptySentence();
        Tag first = store.createTag(sentence.id(), NewTag.sentenceLevel("a", "t").withSpan(0, 4));
        Tag second = store.createTag(sentence.id(), NewTag.sentenceLevel("b", "t").withSource("manual"));

        store.deleteTag(first.id());

        assertEquals(List.of(second), store.getTags(sentence.id()).all());
        assertThrows(NotFoundException.class, () -> store.deleteTag(first.id()));
    }

    // -- Sentence Graph --

    @Test
    void saveSentence_shouldStoreWholeGraph() {
        Document doc = document();
        SentenceDraft draft = SentenceDraft.of("I am a sentence.", List.of(
                        NewToken.of("I", 0, 1), NewToken.of("am", 2, 4), NewToken.of("a", 5, 6),
                        NewToken.of("sentence", 7, 15), NewToken.of(".", 15, 16)))
                .withIdent("s-1")
                .withTag(NewTag.sentenceLevel("declarative", "mood"))
                .withTokenTag(3, NewTag.sentenceLevel("NN", "pos"))
                .withConcept(NewConcept.of(0, "be"), 1)
                .withConcept(NewConcept.of(1, "I am"), 0, 1);

        AnnotatedSentence saved = store.saveSentence(doc.id(), draft);

        assertEquals("I am a sentence .", saved.surface());
        assertEquals(5, saved.tokens().size());
        assertEquals(2, saved.concepts().size());
        assertEquals(3, saved.links().size());
        assertEquals(1, saved.tags().sentenceLevel().size());
        Tag tokenTag = saved.tags().tokenLevel().get(0);
        assertEquals(saved.tokens().get(3).id(), tokenTag.tokenId());

        Concept iAm = saved.concepts().get(1);
        assertEquals(List.of(saved.tokens().get(0), saved.tokens().get(1)), saved.tokensOf(iAm));

        assertEquals(saved, store.getAnnotatedSentence(saved.sentence().id()).orElseThrow());
    }

    @Test
    void saveSentence_shouldRejectConceptOnMissingPosition() {
        Document doc = document();
        SentenceDraft draft = SentenceDraft.of("Hi", List.of(NewToken.of("Hi")))
                .withConcept(NewConcept.of(0, "hi"), 0, 3);

        assertThrows(DanglingReferenceException.class, () -> store.saveSentence(doc.id(), draft));
        assertEquals(0, store.statistics().sentences());
    }

    @Test
    void saveSentences_shouldDiscardWholeBatchOnFailure() {
        Document doc = document();
        List<SentenceDraft> drafts = List.of(
                SentenceDraft.of("Fine.", List.of(NewToken.of("Fine"), NewToken.of("."))),
                SentenceDraft.of("Broken", List.of(NewToken.of("Broken")))
                        .withTokenTag(5, NewTag.sentenceLevel("x", "t")));

        assertThrows(DanglingReferenceException.class, () -> store.saveSentences(doc.id(), drafts));

        assertTrue(store.listSentences(doc.id()).isEmpty());
        assertEquals(0, store.statistics().tokens());
    }

    @Test
    void saveSentences_shouldKeepInputOrder() {
        Document doc = document();
        List<AnnotatedSentence> saved = store.saveSentences(doc.id(), List.of(
                SentenceDraft.of("One."), SentenceDraft.of("Two."), SentenceDraft.of("Three.")));

        assertEquals(3, saved.size());
        assertEquals(List.of("One.", "Two.", "Three."),
                store.listSentences(doc.id()).stream().map(Sentence::text).collect(Collectors.toList()));
    }

    @Test
    void getAnnotatedSentence_shouldBeEmptyForMissingSentence() {
        assertTrue(store.getAnnotatedSentence(77).isEmpty());
    }

    // -- Metadata --

    @Test
    void setMeta_shouldUpsertDocumentPair() {
        document();
        store.setMeta(MetaScope.DOCUMENT, "d1", "author", "X");
        store.setMeta(MetaScope.DOCUMENT, "d1", "author", "Y");

        assertEquals(List.of(new MetaEntry(MetaScope.DOCUMENT, "d1", "author", "Y")),
                store.listMeta(MetaScope.DOCUMENT, "d1"));
        assertEquals(1, store.statistics().documentMeta());
    }

    @Test
    void setMeta_shouldRejectMissingOwner() {
        assertThrows(DanglingReferenceException.class,
                () -> store.setMeta(MetaScope.DOCUMENT, "nope", "k", "v"));
        assertThrows(DanglingReferenceException.class,
                () -> store.setMeta(MetaScope.CORPUS, "nope", "k", "v"));
        assertThrows(IllegalArgumentException.class,
                () -> store.setMeta(MetaScope.CORPUS, null, "k", "v"));
    }

    @Test
    void globalMeta_shouldListByKey() {
        store.setMeta(MetaScope.GLOBAL, null, "version", "2");
        store.setMeta(MetaScope.GLOBAL, null, "author", "team");

        assertEquals(List.of("author", "version"), store.listMeta(MetaScope.GLOBAL, null).stream()
                .map(MetaEntry::key).collect(Collectors.toList()));
        assertEquals("2", store.getMeta(MetaScope.GLOBAL, null, "version"));
    }

    @Test
    void getMeta_shouldReportMissingKey() {
        document();
        assertThrows(NotFoundException.class, () -> store.getMeta(MetaScope.DOCUMENT, "d1", "none"));
        assertTrue(store.findMeta(MetaScope.GLOBAL, null, "none").isEmpty());
        assertThrows(NotFoundException.class, () -> store.listMeta(MetaScope.CORPUS, "nope"));
    }

    @Test
    void deleteMeta_shouldRemovePairOrReportMissing() {
        Corpus corpus = store.createCorpus("c1", null);
        store.setMeta(MetaScope.CORPUS, corpus.name(), "license", "CC-BY");

        store.deleteMeta(MetaScope.CORPUS, corpus.name(), "license");

        assertTrue(store.listMeta(MetaScope.CORPUS, corpus.name()).isEmpty());
        assertThrows(NotFoundException.class, () -> store.deleteMeta(MetaScope.CORPUS, corpus.name(), "license"));
    }

    // -- Helpers --

    protected Document document() {
        Corpus corpus = store.createCorpus("c1", "Corpus");
        return store.createDocument(corpus.id(), "d1", "Document", "eng");
    }

    protected Sentence emptySentence() {
        return store.createSentence(document().id(), "s-1", "I am a sentence.", null, null);
    }

    protected Sentence sentenceWithTokens() {
        Sentence sentence = emptySentence();
        store.importTokens(sentence.id(), List.of(
                NewToken.of("I"), NewToken.of("am"), NewToken.of("a"), NewToken.of("sentence"), NewToken.of(".")));
        return sentence;
    }
}
