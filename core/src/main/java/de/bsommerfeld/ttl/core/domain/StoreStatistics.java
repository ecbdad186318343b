package de.bsommerfeld.ttl.core.domain;

/**
 * Row counts per table. Global metadata is not counted.
 */
public record StoreStatistics(
        long corpora,
        long documents,
        long sentences,
        long tokens,
        long concepts,
        long tags,
        long links,
        long documentMeta,
        long corpusMeta) {

    public boolean isEmpty() {
        return corpora + documents + sentences + tokens + concepts + tags + links
                + documentMeta + corpusMeta == 0;
    }
}
