package de.bsommerfeld.ttl.db;

/**
 * Thrown when a write would create a second row under a uniqueness
 * constraint: corpus or document name, token position, or concept-token
 * link.
 */
public class DuplicateKeyException extends CorpusStoreException {

    public DuplicateKeyException(String message) {
        super(message);
    }

    public DuplicateKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
