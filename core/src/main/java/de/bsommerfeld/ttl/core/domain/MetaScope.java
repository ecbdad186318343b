package de.bsommerfeld.ttl.core.domain;

/**
 * Attachment level of a metadata pair. Document and corpus metadata are
 * keyed by the owner's <em>name</em>, global metadata has no owner.
 */
public enum MetaScope {

    GLOBAL,
    DOCUMENT,
    CORPUS;

    public boolean hasOwner() {
        return this != GLOBAL;
    }
}
