package de.bsommerfeld.ttl.core.domain;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Tag to be created under a sentence. A span bound of {@code -1} is the
 * legacy "no offset" marker and is normalised to {@code null}, an empty
 * source likewise.
 */
public record NewTag(
        Long tokenId,
        Integer cfrom,
        Integer cto,
        String label,
        String source,
        String tagType) implements CharSpan {

    public NewTag {
        if (cfrom != null && cfrom == -1)
            cfrom = null;
        if (cto != null && cto == -1)
            cto = null;
        if (source != null && source.isEmpty())
            source = null;
        checkArgument(cfrom == null || cto == null || cfrom <= cto,
                "cfrom (%s) must not exceed cto (%s)", cfrom, cto);
    }

    public static NewTag sentenceLevel(String label, String tagType) {
        return new NewTag(null, null, null, label, null, tagType);
    }

    public static NewTag forToken(long tokenId, String label, String tagType) {
        return new NewTag(tokenId, null, null, label, null, tagType);
    }

    public NewTag withSource(String source) {
        return new NewTag(tokenId, cfrom, cto, label, source, tagType);
    }

    public NewTag withSpan(int cfrom, int cto) {
        return new NewTag(tokenId, cfrom, cto, label, source, tagType);
    }

    public NewTag onToken(Long tokenId) {
        return new NewTag(tokenId, cfrom, cto, label, source, tagType);
    }
}
