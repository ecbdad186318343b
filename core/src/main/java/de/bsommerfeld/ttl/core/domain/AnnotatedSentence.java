package de.bsommerfeld.ttl.core.domain;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A sentence together with every annotation layer stored under it, read in
 * one consistent snapshot.
 *
 * @param sentence the sentence row
 * @param tokens   tokens ordered by {@code widx}
 * @param concepts concepts ordered by {@code cidx}
 * @param links    concept-token links of this sentence
 * @param tags     sentence- and token-level tags
 */
public record AnnotatedSentence(
        Sentence sentence,
        List<Token> tokens,
        List<Concept> concepts,
        List<ConceptWordLink> links,
        SentenceTags tags) {

    public AnnotatedSentence {
        tokens = ImmutableList.copyOf(tokens);
        concepts = ImmutableList.copyOf(concepts);
        links = ImmutableList.copyOf(links);
    }

    /**
     * Resolves the tokens a concept covers, ordered by {@code widx}.
     */
    public List<Token> tokensOf(Concept concept) {
        Map<Long, Token> byId = tokens.stream()
                .collect(Collectors.toMap(Token::id, Function.identity()));
        return links.stream()
                .filter(l -> l.conceptId() == concept.id())
                .map(l -> byId.get(l.tokenId()))
                .sorted((a, b) -> Integer.compare(a.widx(), b.widx()))
                .collect(ImmutableList.toImmutableList());
    }

    public String surface() {
        return tokens.stream().map(Token::text).collect(Collectors.joining(" "));
    }
}
