package de.bsommerfeld.ttl.core.domain;

/**
 * Association of one concept with one token of the same sentence. The
 * triple is unique.
 */
public record ConceptWordLink(long sentenceId, long conceptId, long tokenId) {
}
