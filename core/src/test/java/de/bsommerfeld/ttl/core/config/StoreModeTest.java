package de.bsommerfeld.ttl.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StoreModeTest {

    @Test
    void get_shouldResolveFromSystemProperty() {
        String original = System.getProperty(StoreMode.PROPERTY);
        try {
            System.setProperty(StoreMode.PROPERTY, "MEMORY");
            assertEquals(StoreMode.MEMORY, StoreMode.get());
        } finally {
            if (original != null)
                System.setProperty(StoreMode.PROPERTY, original);
            else
                System.clearProperty(StoreMode.PROPERTY);
        }
    }

    @Test
    void parse_shouldBeCaseInsensitive() {
        assertEquals(StoreMode.MEMORY, StoreMode.parse(" memory "));
        assertEquals(StoreMode.PERSISTENT, StoreMode.parse("Persistent"));
    }

    @Test
    void parse_shouldDefaultToPersistent() {
        assertEquals(StoreMode.PERSISTENT, StoreMode.parse(null));
        assertEquals(StoreMode.PERSISTENT, StoreMode.parse(""));
        assertEquals(StoreMode.PERSISTENT, StoreMode.parse("INVALID_GARBAGE"));
    }

    @Test
    void isPersistent_shouldOnlyHoldForPersistentMode() {
        assertTrue(StoreMode.PERSISTENT.isPersistent());
        assertFalse(StoreMode.MEMORY.isPersistent());
    }
}
