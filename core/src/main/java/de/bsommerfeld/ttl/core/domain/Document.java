package de.bsommerfeld.ttl.core.domain;

/**
 * Named unit of text inside exactly one {@link Corpus}.
 *
 * @param id       surrogate key assigned by the store
 * @param name     globally unique document name (not only unique per corpus)
 * @param title    human-readable title, may be {@code null}
 * @param lang     language code as supplied by the importer, e.g. {@code en}
 * @param corpusId owning corpus
 */
public record Document(long id, String name, String title, String lang, long corpusId) {
}
