package de.bsommerfeld.redditindexer.db;

/**
 * Raised when the required indexes of a collection could not be ensured.
 */
public class IndexMaintenanceException extends DocumentStoreException {

    public IndexMaintenanceException(String collection, Throwable cause) {
        super("Failed to ensure indexes on " + collection, cause);
    }
}
