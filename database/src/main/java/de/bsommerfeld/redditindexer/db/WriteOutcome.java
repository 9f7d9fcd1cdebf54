package de.bsommerfeld.redditindexer.db;

/**
 * Summary of one {@link ItemWriter#write} call.
 *
 * @param collection    target collection
 * @param attempted     documents built from the fetched items
 * @param inserted      documents the store accepted
 * @param rejected      documents the store refused
 * @param indexFailure  {@code true} if index maintenance failed and the insert
 *                      was skipped
 */
public record WriteOutcome(String collection, int attempted, int inserted, int rejected, boolean indexFailure) {

    static WriteOutcome skipped(String collection, int attempted) {
        return new WriteOutcome(collection, attempted, 0, attempted, true);
    }

    public boolean isComplete() {
        return !indexFailure && inserted == attempted;
    }
}
