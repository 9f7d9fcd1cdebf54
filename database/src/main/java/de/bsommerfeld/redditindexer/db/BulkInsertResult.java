package de.bsommerfeld.redditindexer.db;

import java.util.List;

/**
 * Outcome of one unordered bulk insert. Rejected documents are listed with
 * their position in the submitted batch; every other document was stored.
 *
 * @param attempted number of documents submitted
 * @param inserted  number of documents the store accepted
 * @param failures  one entry per rejected document
 */
public record BulkInsertResult(int attempted, int inserted, List<Failure> failures) {

    public BulkInsertResult {
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public static BulkInsertResult complete(int inserted) {
        return new BulkInsertResult(inserted, inserted, List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * A single rejected document.
     *
     * @param index   position in the submitted batch
     * @param code    store error code (e.g. 11000 for a duplicate key)
     * @param message store error message
     */
    public record Failure(int index, int code, String message) {
    }
}
