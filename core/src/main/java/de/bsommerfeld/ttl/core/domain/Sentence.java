package de.bsommerfeld.ttl.core.domain;

/**
 * A unit of text within a document. The sentence owns the token sequence
 * that every annotation layer (concepts, tags) refers into.
 *
 * @param id      surrogate key assigned by the store
 * @param ident   external identifier from the source material, may be
 *                {@code null}
 * @param text    raw sentence text
 * @param docId   owning document
 * @param flag    status flag, opaque to the store
 * @param comment free-form comment
 */
public record Sentence(long id, String ident, String text, long docId, Integer flag, String comment) {
}
