package de.bsommerfeld.ttl.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Selects the backing implementation of the corpus store. {@code PERSISTENT}
 * writes the SQLite corpus file, {@code MEMORY} keeps everything on the heap
 * and loses it on shutdown.
 */
public enum StoreMode {

    PERSISTENT,
    MEMORY;

    private static final Logger LOG = LoggerFactory.getLogger(StoreMode.class);

    static final String PROPERTY = "ttl.store.mode";
    static final String ENV = "TTL_STORE_MODE";

    /**
     * Resolves the mode from the {@code ttl.store.mode} system property, then
     * the {@code TTL_STORE_MODE} environment variable. Defaults to
     * {@link #PERSISTENT} if neither is set or the value is unknown.
     */
    public static StoreMode get() {
        String mode = System.getProperty(PROPERTY);
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv(ENV);
        }
        return parse(mode);
    }

    static StoreMode parse(String mode) {
        if (mode == null || mode.isBlank()) {
            return PERSISTENT;
        }
        try {
            return StoreMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown store mode '{}'. Defaulting to PERSISTENT.", mode);
            return PERSISTENT;
        }
    }

    public boolean isPersistent() {
        return this == PERSISTENT;
    }
}
