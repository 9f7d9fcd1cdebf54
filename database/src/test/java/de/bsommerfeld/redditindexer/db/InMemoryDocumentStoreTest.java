package de.bsommerfeld.redditindexer.db;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the in-memory store used during TEST mode. Validates insert
 * semantics, partial failures and query translation.
 */
class InMemoryDocumentStoreTest {

    private static final String COLLECTION = "reddit__subm__test";

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
    }

    @Test
    void insertMany_shouldAssignIds() {
        store.insertMany(COLLECTION, List.of(doc("a b", 1)));

        assertNotNull(store.documents(COLLECTION).get(0).get("_id"));
    }

    @Test
    void insertMany_shouldKeepRemainingDocumentsWhenOneIsRejected() {
        store.insertMany(COLLECTION, List.of(doc("existing", 0).append("_id", 2)));

        BulkInsertResult result = store.insertMany(COLLECTION, List.of(
                doc("one", 1).append("_id", 1),
                doc("two", 2).append("_id", 2),
                doc("three", 3).append("_id", 3)));

        assertEquals(3, result.attempted());
        assertEquals(2, result.inserted());
        assertEquals(1, result.failures().size());
        assertEquals(1, result.failures().get(0).index());
        assertEquals(InMemoryDocumentStore.DUPLICATE_KEY, result.failures().get(0).code());

        List<Object> ids = store.documents(COLLECTION).stream().map(d -> d.get("_id")).toList();
        assertEquals(List.of(2, 1, 3), ids);
    }

    @Test
    void insertMany_shouldHandleEmptyBatch() {
        BulkInsertResult result = store.insertMany(COLLECTION, List.of());
        assertEquals(0, result.attempted());
        assertFalse(result.hasFailures());
    }

    @Test
    void find_shouldFilterByInclusiveTimeRange() {
        store.insertMany(COLLECTION, List.of(doc("a", 5), doc("b", 10), doc("c", 15), doc("d", 20)));

        List<Document> found = store.find(COLLECTION, new ItemQuery("test", 10, 15, null));

        assertEquals(List.of("b", "c"), found.stream().map(d -> d.getString("body")).toList());
    }

    @Test
    void find_shouldMatchKeywordCaseInsensitively() {
        store.insertMany(COLLECTION, List.of(doc("hello world", 1), doc("goodbye", 2)));

        List<Document> found = store.find(COLLECTION, new ItemQuery("test", 0, 100, "HELLO"));

        assertEquals(1, found.size());
        assertEquals("hello world", found.get(0).getString("body"));
    }

    @Test
    void find_shouldProjectIdAndBodyOnly() {
        store.insertMany(COLLECTION, List.of(doc("hello", 1)));

        Document found = store.find(COLLECTION, new ItemQuery("test", 0, 100, null)).get(0);

        assertEquals(2, found.size());
        assertTrue(found.containsKey("_id"));
        assertTrue(found.containsKey("body"));
    }

    @Test
    void find_shouldReturnEmptyForUnknownCollection() {
        assertTrue(store.find("reddit__comm__none", new ItemQuery("none", 0, 100, null)).isEmpty());
    }

    @Test
    void eraseAll_shouldRemoveDocumentsAndIndexes() {
        store.ensureIndexes(COLLECTION);
        store.insertMany(COLLECTION, List.of(doc("a", 1)));

        store.eraseAll();

        assertTrue(store.documents(COLLECTION).isEmpty());
        assertTrue(store.indexes(COLLECTION).isEmpty());
    }

    @Test
    void ensureIndexes_shouldBeIdempotent() {
        store.ensureIndexes(COLLECTION);
        store.ensureIndexes(COLLECTION);

        assertEquals(2, store.indexes(COLLECTION).size());
    }

    @Test
    void itemQuery_shouldNormalizeBlankKeyword() {
        assertFalse(new ItemQuery("test", 0, 1, "  ").hasKeyword());
        assertThrows(IllegalArgumentException.class, () -> new ItemQuery(" ", 0, 1, null));
    }

    private static Document doc(String body, long timestamp) {
        return new Document("subreddit", "test")
                .append("body", body)
                .append("timestamp", timestamp)
                .append("word", String.join(" ", body.toLowerCase().split("\\s+")));
    }
}
