package de.bsommerfeld.ttl.core.domain;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Token to be imported. A {@code null} {@code widx} lets the store assign the
 * next free position of the sentence.
 */
public record NewToken(
        Integer widx,
        String text,
        String lemma,
        String pos,
        Integer cfrom,
        Integer cto,
        String comment) implements CharSpan {

    public NewToken {
        checkNotNull(text, "token text");
        checkArgument(widx == null || widx >= 0, "widx must not be negative: %s", widx);
        checkArgument(cfrom == null || cto == null || cfrom <= cto,
                "cfrom (%s) must not exceed cto (%s)", cfrom, cto);
    }

    public static NewToken of(String text) {
        return new NewToken(null, text, null, null, null, null, null);
    }

    public static NewToken of(String text, int cfrom, int cto) {
        return new NewToken(null, text, null, null, cfrom, cto, null);
    }

    public NewToken withAnalysis(String lemma, String pos) {
        return new NewToken(widx, text, lemma, pos, cfrom, cto, comment);
    }

    public NewToken at(int index) {
        return new NewToken(index, text, lemma, pos, cfrom, cto, comment);
    }
}
