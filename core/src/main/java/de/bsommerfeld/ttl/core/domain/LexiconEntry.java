package de.bsommerfeld.ttl.core.domain;

/** Surface form with its number of occurrences across the whole store. */
public record LexiconEntry(String text, int count) {
}
