package de.bsommerfeld.ttl.db;

/**
 * Thrown when the target of a read, update or delete does not exist.
 */
public class NotFoundException extends CorpusStoreException {

    public NotFoundException(String message) {
        super(message);
    }
}
