package de.bsommerfeld.ttl.db;

/**
 * Base type of every failure reported by a {@link CorpusStore}. Used directly
 * for unexpected I/O failures of the backing file, with the JDBC exception as
 * cause.
 */
public class CorpusStoreException extends RuntimeException {

    public CorpusStoreException(String message) {
        super(message);
    }

    public CorpusStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
