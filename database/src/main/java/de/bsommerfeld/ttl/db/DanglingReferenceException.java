package de.bsommerfeld.ttl.db;

/**
 * Thrown when a write references a row that does not exist, or a link whose
 * concept and token do not belong to the same sentence.
 */
public class DanglingReferenceException extends CorpusStoreException {

    public DanglingReferenceException(String message) {
        super(message);
    }
}
