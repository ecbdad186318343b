package de.bsommerfeld.ttl.core.domain;

/**
 * A stored surface unit of a sentence.
 *
 * @param id         surrogate key assigned by the store
 * @param sentenceId owning sentence
 * @param widx       position in the sentence, unique per sentence and dense
 *                   from 0 for imported sequences
 * @param cfrom      start offset in the sentence text, may be {@code null}
 * @param cto        end offset (exclusive), may be {@code null}
 * @param text       surface form
 * @param lemma      lemma, may be {@code null}
 * @param pos        part-of-speech label, may be {@code null}
 * @param comment    free-form comment
 */
public record Token(
        long id,
        long sentenceId,
        int widx,
        Integer cfrom,
        Integer cto,
        String text,
        String lemma,
        String pos,
        String comment) implements CharSpan {
}
