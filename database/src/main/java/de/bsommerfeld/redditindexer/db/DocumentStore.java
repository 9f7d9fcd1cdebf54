package de.bsommerfeld.redditindexer.db;

import org.bson.Document;

import java.util.List;

/**
 * Persistence contract for harvested items. Implementations must be safe for
 * concurrent use: every worker thread writes through the same instance, and
 * the read path queries it from request threads.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link MongoDocumentStore}: production persistence via MongoDB</li>
 * <li>{@link InMemoryDocumentStore}: in-memory store for TEST mode, no
 * network I/O</li>
 * </ul>
 *
 * <p>
 * Switching between implementations is done at the Guice module level
 * ({@link DatabaseModule}). The ingestion pipeline writes exclusively through
 * {@link ItemWriter}.
 */
public interface DocumentStore extends AutoCloseable {

    /**
     * Deletes every document of every item collection and drops their
     * indexes. Collections themselves are kept. System collections are left
     * untouched.
     */
    void eraseAll();

    /**
     * Ensures the two search indexes exist on {@code collection}: ascending
     * {@code timestamp}, and text on {@code word} combined with ascending
     * {@code timestamp}. Idempotent; cheap when the indexes already exist.
     *
     * @throws IndexMaintenanceException if the store refuses or fails
     */
    void ensureIndexes(String collection);

    /**
     * Inserts all documents in one unordered bulk operation. A rejected
     * document does not stop the others from being stored; rejections are
     * reported in the result instead of being thrown.
     *
     * @throws DocumentStoreException if the operation failed as a whole
     */
    BulkInsertResult insertMany(String collection, List<Document> documents);

    /**
     * Returns {@code _id} and {@code body} of every document in
     * {@code collection} matching the query's time range and keyword.
     */
    List<Document> find(String collection, ItemQuery query);

    @Override
    default void close() {
    }
}
