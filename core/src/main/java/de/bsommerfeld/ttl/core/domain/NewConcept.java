package de.bsommerfeld.ttl.core.domain;

import static com.google.common.base.Preconditions.checkArgument;

/** Concept to be created under a sentence. */
public record NewConcept(int cidx, String lemma, String tag, String flag, String comment) {

    public NewConcept {
        checkArgument(cidx >= 0, "cidx must not be negative: %s", cidx);
    }

    public static NewConcept of(int cidx, String lemma) {
        return new NewConcept(cidx, lemma, null, null, null);
    }

    public static NewConcept of(int cidx, String lemma, String tag) {
        return new NewConcept(cidx, lemma, tag, null, null);
    }
}
