package de.bsommerfeld.ttl.core.util;

import com.google.common.collect.ImmutableList;
import de.bsommerfeld.ttl.core.domain.CharSpan;
import de.bsommerfeld.ttl.core.domain.NewToken;

import java.util.List;

/**
 * Caller-side helpers for token character spans.
 *
 * <p>
 * The store only rejects a span whose start lies after its end. Whether
 * spans of one sentence may overlap or appear out of surface order is left
 * to the importer; those that want the stricter discipline run
 * {@link #inspect} or {@link #requireWellFormed} before importing.
 */
public final class TokenSpans {

    public enum Problem {
        OUT_OF_BOUNDS,
        OUT_OF_ORDER,
        OVERLAP
    }

    /**
     * A span that breaks the strict discipline.
     *
     * @param index   position of the offending span in the inspected list
     * @param problem what is wrong with it
     */
    public record Issue(int index, Problem problem) {
    }

    private TokenSpans() {
    }

    /**
     * Builds tokens for the given surface forms, locating each one in
     * {@code text} after the end of the previous match.
     *
     * @throws IllegalArgumentException if a surface form cannot be found
     */
    public static List<NewToken> align(String text, List<String> surfaces) {
        ImmutableList.Builder<NewToken> tokens = ImmutableList.builder();
        int cursor = 0;
        for (String surface : surfaces) {
            int start = text.indexOf(surface, cursor);
            if (start < 0) {
                throw new IllegalArgumentException(String.format(
                        "Token '%s' not found in '%s' after offset %d", surface, text, cursor));
            }
            int end = start + surface.length();
            tokens.add(NewToken.of(surface, start, end));
            cursor = end;
        }
        return tokens.build();
    }

    /**
     * Reports spans outside {@code text}, spans starting before their
     * predecessor, and spans starting inside their predecessor. Entries
     * without a complete span are skipped.
     */
    public static List<Issue> inspect(String text, List<? extends CharSpan> spans) {
        ImmutableList.Builder<Issue> issues = ImmutableList.builder();
        CharSpan previous = null;
        for (int i = 0; i < spans.size(); i++) {
            CharSpan span = spans.get(i);
            if (!span.hasSpan())
                continue;
            if (span.cfrom() < 0 || span.cto() > text.length()) {
                issues.add(new Issue(i, Problem.OUT_OF_BOUNDS));
            }
            if (previous != null) {
                if (span.cfrom() < previous.cfrom()) {
                    issues.add(new Issue(i, Problem.OUT_OF_ORDER));
                } else if (span.cfrom() < previous.cto()) {
                    issues.add(new Issue(i, Problem.OVERLAP));
                }
            }
            previous = span;
        }
        return issues.build();
    }

    /**
     * @throws IllegalArgumentException naming the first issue found by
     *                                  {@link #inspect}
     */
    public static void requireWellFormed(String text, List<? extends CharSpan> spans) {
        List<Issue> issues = inspect(text, spans);
        if (!issues.isEmpty()) {
            Issue first = issues.get(0);
            throw new IllegalArgumentException(String.format("Span #%d of '%s' is %s (%d issue(s) total)",
                    first.index(), text, first.problem(), issues.size()));
        }
    }
}
