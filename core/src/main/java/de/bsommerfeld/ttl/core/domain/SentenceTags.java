package de.bsommerfeld.ttl.core.domain;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Tags of one sentence, split by the presence of a token reference.
 */
public record SentenceTags(List<Tag> sentenceLevel, List<Tag> tokenLevel) {

    public SentenceTags {
        sentenceLevel = ImmutableList.copyOf(sentenceLevel);
        tokenLevel = ImmutableList.copyOf(tokenLevel);
    }

    /**
     * Partitions tags in their given order.
     */
    public static SentenceTags partition(List<Tag> tags) {
        ImmutableList.Builder<Tag> sentence = ImmutableList.builder();
        ImmutableList.Builder<Tag> token = ImmutableList.builder();
        for (Tag t : tags) {
            if (t.isSentenceLevel())
                sentence.add(t);
            else
                token.add(t);
        }
        return new SentenceTags(sentence.build(), token.build());
    }

    public List<Tag> all() {
        return ImmutableList.<Tag>builder().addAll(sentenceLevel).addAll(tokenLevel).build();
    }

    public List<Tag> forToken(long tokenId) {
        return tokenLevel.stream()
                .filter(t -> t.tokenId() == tokenId)
                .collect(ImmutableList.toImmutableList());
    }

    public boolean isEmpty() {
        return sentenceLevel.isEmpty() && tokenLevel.isEmpty();
    }
}
