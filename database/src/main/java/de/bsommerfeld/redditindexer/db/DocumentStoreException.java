package de.bsommerfeld.redditindexer.db;

/**
 * Raised when the document store cannot complete an operation at all.
 * Partial bulk insert failures are not exceptions; they are reported through
 * {@link BulkInsertResult}.
 */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
