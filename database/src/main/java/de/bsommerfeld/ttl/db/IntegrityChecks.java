package de.bsommerfeld.ttl.db;

import de.bsommerfeld.ttl.core.domain.MetaScope;
import de.bsommerfeld.ttl.core.domain.NewToken;
import de.bsommerfeld.ttl.core.domain.SentenceDraft;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Checks shared by both store implementations. Everything here runs before
 * the first row is written, so a failing check never needs a rollback.
 */
final class IntegrityChecks {

    private IntegrityChecks() {
    }

    /**
     * Resolves the position of every token of an import batch. Explicit
     * positions are kept, missing ones continue after the highest position
     * seen so far.
     *
     * @param used positions already stored in the sentence
     * @return one position per token, in input order
     * @throws DuplicateKeyException   if a position is taken twice
     * @throws IllegalArgumentException if a position would have to follow
     *                                  {@link Integer#MAX_VALUE}
     */
    static int[] assignPositions(long sentenceId, List<NewToken> tokens, Collection<Integer> used) {
        Set<Integer> taken = new HashSet<>(used);
        long next = used.stream().mapToLong(Integer::longValue).max().orElse(-1L) + 1;
        int[] positions = new int[tokens.size()];
        for (int i = 0; i < tokens.size(); i++) {
            Integer explicit = tokens.get(i).widx();
            checkArgument(explicit != null || next <= Integer.MAX_VALUE,
                    "Sentence #%s has no token position left after widx %s", sentenceId, Integer.MAX_VALUE);
            int widx = explicit != null ? explicit : (int) next;
            if (!taken.add(widx)) {
                throw new DuplicateKeyException(
                        "Sentence #" + sentenceId + " already has a token at widx " + widx);
            }
            next = Math.max(next, widx + 1L);
            positions[i] = widx;
        }
        return positions;
    }

    /**
     * Validates the token positions a draft's tags and concepts refer to.
     */
    static void checkDraft(SentenceDraft draft) {
        int size = draft.tokens().size();
        for (Integer widx : draft.tokenTags().keySet()) {
            if (widx < 0 || widx >= size) {
                throw new DanglingReferenceException(String.format(
                        "Tag on token position %d, sentence '%s' has %d tokens", widx, draft.text(), size));
            }
        }
        for (SentenceDraft.ConceptDraft concept : draft.concepts()) {
            Set<Integer> seen = new HashSet<>();
            for (Integer widx : concept.tokenIndexes()) {
                if (widx < 0 || widx >= size) {
                    throw new DanglingReferenceException(String.format(
                            "Concept '%s' covers token position %d, sentence '%s' has %d tokens",
                            concept.concept().lemma(), widx, draft.text(), size));
                }
                if (!seen.add(widx)) {
                    throw new DuplicateKeyException(String.format(
                            "Concept '%s' covers token position %d twice", concept.concept().lemma(), widx));
                }
            }
        }
    }

    /**
     * @param conceptSentence sentence of the concept, {@code null} if the
     *                        concept does not exist
     * @param tokenSentence   sentence of the token, {@code null} if the token
     *                        does not exist
     * @return the sentence shared by concept and token
     */
    static long checkLinkTargets(long conceptId, Long conceptSentence, long tokenId, Long tokenSentence) {
        if (conceptSentence == null)
            throw new DanglingReferenceException("Concept #" + conceptId + " does not exist");
        if (tokenSentence == null)
            throw new DanglingReferenceException("Token #" + tokenId + " does not exist");
        if (!conceptSentence.equals(tokenSentence)) {
            throw new DanglingReferenceException(String.format(
                    "Concept #%d (sentence #%d) and token #%d (sentence #%d) belong to different sentences",
                    conceptId, conceptSentence, tokenId, tokenSentence));
        }
        return conceptSentence;
    }

    static void checkDistinct(long conceptId, List<Long> tokenIds) {
        Set<Long> seen = new HashSet<>();
        for (Long id : tokenIds) {
            if (!seen.add(id))
                throw new DuplicateKeyException("Token #" + id + " listed twice for concept #" + conceptId);
        }
    }

    static void checkOwner(MetaScope scope, String owner) {
        checkArgument(scope != null, "scope");
        checkArgument(!scope.hasOwner() || owner != null, "%s metadata needs an owner name", scope);
    }

    static void checkName(String name) {
        checkArgument(name != null && !name.isBlank(), "name must not be blank");
    }

    static String describe(MetaScope scope, String owner, String key) {
        return scope.hasOwner()
                ? String.format("%s metadata '%s' of '%s'", scope.name().toLowerCase(Locale.ROOT), key, owner)
                : String.format("global metadata '%s'", key);
    }

    static <K, V> V require(Map<K, V> rows, K id, String what) {
        V row = rows.get(id);
        if (row == null)
            throw new NotFoundException(what + " #" + id + " does not exist");
        return row;
    }

    static <K, V> V reference(Map<K, V> rows, K id, String what) {
        V row = rows.get(id);
        if (row == null)
            throw new DanglingReferenceException(what + " #" + id + " does not exist");
        return row;
    }
}
