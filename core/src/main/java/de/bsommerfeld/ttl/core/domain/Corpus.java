package de.bsommerfeld.ttl.core.domain;

/**
 * Top-level named collection of documents.
 *
 * @param id    surrogate key assigned by the store
 * @param name  globally unique corpus name
 * @param title human-readable title, {@code null} if never set
 */
public record Corpus(long id, String name, String title) {
}
