package de.bsommerfeld.ttl.core.domain;

/**
 * Span-level semantic annotation of a sentence. The tokens it covers are
 * recorded as {@link ConceptWordLink} rows.
 *
 * @param id         surrogate key assigned by the store
 * @param sentenceId owning sentence
 * @param cidx       sequence index among the sentence's concepts
 * @param lemma      concept lemma label
 * @param tag        sense tag or other label
 * @param flag       opaque flag, stored as-is
 * @param comment    free-form comment
 */
public record Concept(
        long id,
        long sentenceId,
        int cidx,
        String lemma,
        String tag,
        String flag,
        String comment) {
}
