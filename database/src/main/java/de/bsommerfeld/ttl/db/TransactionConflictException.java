package de.bsommerfeld.ttl.db;

/**
 * Thrown when another writer holds the corpus file and the busy timeout
 * elapsed. The store never retries; whether to try again is up to the caller.
 */
public class TransactionConflictException extends CorpusStoreException {

    public TransactionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
