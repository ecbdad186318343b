package de.bsommerfeld.ttl.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NewTokenTest {

    @Test
    void of_shouldLeavePositionToTheStore() {
        assertNull(NewToken.of("word").widx());
        assertEquals(3, NewToken.of("word").at(3).widx());
    }

    @Test
    void constructor_shouldValidatePositionAndSpan() {
        assertThrows(IllegalArgumentException.class, () -> NewToken.of("x").at(-1));
        assertThrows(IllegalArgumentException.class, () -> NewToken.of("x", 4, 1));
        assertThrows(NullPointerException.class, () -> NewToken.of(null));
    }

    @Test
    void withAnalysis_shouldKeepSpan() {
        NewToken token = NewToken.of("dogs", 0, 4).withAnalysis("dog", "NNS");
        assertEquals("dog", token.lemma());
        assertEquals("NNS", token.pos());
        assertEquals(0, token.cfrom());
    }
}
