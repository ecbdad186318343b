package de.bsommerfeld.ttl.core.domain;

/**
 * Anything that may point at a character range of its sentence text.
 * Either bound may be absent.
 */
public interface CharSpan {

    Integer cfrom();

    Integer cto();

    default boolean hasSpan() {
        return cfrom() != null && cto() != null;
    }
}
