package de.bsommerfeld.ttl.core.domain;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A complete sentence graph as produced by an importer: the sentence, its
 * tokens, tags and concepts, stored by the engine in one unit of work.
 *
 * <p>
 * Inside a draft, tokens are addressed by their position in {@link #tokens}
 * (which becomes their {@code widx}); any explicit {@code widx} on the
 * tokens is ignored. Token ids carried by {@link #sentenceTags} are ignored
 * too, those tags are always stored sentence-level.
 *
 * @param ident        external identifier, may be {@code null}
 * @param text         raw sentence text
 * @param flag         opaque status flag
 * @param comment      free-form comment
 * @param tokens       tokens in surface order
 * @param sentenceTags tags on the whole sentence
 * @param tokenTags    tags per token position
 * @param concepts     concepts with the token positions they cover
 */
public record SentenceDraft(
        String ident,
        String text,
        Integer flag,
        String comment,
        List<NewToken> tokens,
        List<NewTag> sentenceTags,
        Map<Integer, List<NewTag>> tokenTags,
        List<ConceptDraft> concepts) {

    public SentenceDraft {
        checkNotNull(text, "sentence text");
        tokens = ImmutableList.copyOf(tokens);
        sentenceTags = ImmutableList.copyOf(sentenceTags);
        ImmutableMap.Builder<Integer, List<NewTag>> copy = ImmutableMap.builder();
        tokenTags.forEach((k, v) -> copy.put(k, ImmutableList.copyOf(v)));
        tokenTags = copy.build();
        concepts = ImmutableList.copyOf(concepts);
    }

    public static SentenceDraft of(String text, List<NewToken> tokens) {
        return new SentenceDraft(null, text, null, null, tokens, List.of(), Map.of(), List.of());
    }

    public static SentenceDraft of(String text) {
        return of(text, List.of());
    }

    public SentenceDraft withIdent(String ident) {
        return new SentenceDraft(ident, text, flag, comment, tokens, sentenceTags, tokenTags, concepts);
    }

    public SentenceDraft withComment(String comment) {
        return new SentenceDraft(ident, text, flag, comment, tokens, sentenceTags, tokenTags, concepts);
    }

    public SentenceDraft withTag(NewTag tag) {
        List<NewTag> tags = ImmutableList.<NewTag>builder().addAll(sentenceTags).add(tag).build();
        return new SentenceDraft(ident, text, flag, comment, tokens, tags, tokenTags, concepts);
    }

    public SentenceDraft withTokenTag(int widx, NewTag tag) {
        Map<Integer, List<NewTag>> tags = new LinkedHashMap<>(tokenTags);
        tags.put(widx, ImmutableList.<NewTag>builder()
                .addAll(tokenTags.getOrDefault(widx, List.of()))
                .add(tag)
                .build());
        return new SentenceDraft(ident, text, flag, comment, tokens, sentenceTags, tags, concepts);
    }

    public SentenceDraft withConcept(NewConcept concept, Integer... widx) {
        List<ConceptDraft> all = ImmutableList.<ConceptDraft>builder()
                .addAll(concepts)
                .add(new ConceptDraft(concept, Arrays.asList(widx)))
                .build();
        return new SentenceDraft(ident, text, flag, comment, tokens, sentenceTags, tokenTags, all);
    }

    /**
     * Concept of a draft with the positions of the tokens it covers.
     */
    public record ConceptDraft(NewConcept concept, List<Integer> tokenIndexes) {

        public ConceptDraft {
            checkNotNull(concept, "concept");
            tokenIndexes = ImmutableList.copyOf(tokenIndexes);
        }
    }
}
