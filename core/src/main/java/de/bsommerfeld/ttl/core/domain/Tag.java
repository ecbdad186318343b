package de.bsommerfeld.ttl.core.domain;

/**
 * Generic labeled span. A tag without a token reference annotates the whole
 * sentence; with a token reference it annotates that token. The character
 * span is independent of the token reference.
 *
 * @param id         surrogate key assigned by the store
 * @param sentenceId owning sentence
 * @param tokenId    annotated token, {@code null} for sentence-level tags
 * @param cfrom      start offset, may be {@code null}
 * @param cto        end offset, may be {@code null}
 * @param label      the tag value
 * @param source     provenance, may be {@code null}
 * @param tagType    discriminator, opaque to the store
 */
public record Tag(
        long id,
        long sentenceId,
        Long tokenId,
        Integer cfrom,
        Integer cto,
        String label,
        String source,
        String tagType) implements CharSpan {

    public boolean isSentenceLevel() {
        return tokenId == null;
    }
}
