package de.bsommerfeld.redditindexer.db;

import com.google.inject.Singleton;
import de.bsommerfeld.redditindexer.core.text.Tokenizer;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link DocumentStore} for TEST mode. Needs no running MongoDB.
 * Bound by Guice when the application starts with {@code "mode": "test"}.
 *
 * <h3>Emulated behavior</h3>
 * <ul>
 * <li>{@code _id} is assigned on insert when absent, like the driver does</li>
 * <li>a document whose {@code _id} already exists in the collection is
 * rejected with code {@value #DUPLICATE_KEY}; the rest of the batch is
 * still stored (unordered insert)</li>
 * <li>keyword queries match when any token of the search term occurs in the
 * token field, mirroring a {@code $text} search with language
 * {@code none}</li>
 * </ul>
 */
@Singleton
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    static final int DUPLICATE_KEY = 11000;

    private static final Set<String> INDEX_NAMES = Set.of(
            ItemSchema.FIELD_TIMESTAMP + "_1",
            ItemSchema.FIELD_TOKENS + "_text_" + ItemSchema.FIELD_TIMESTAMP + "_1");

    private final Map<String, List<Document>> collections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> indexes = new ConcurrentHashMap<>();

    public InMemoryDocumentStore() {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Documents are kept in memory     #");
        LOG.warn("#######################################################");
    }

    @Override
    public void eraseAll() {
        collections.values().forEach(List::clear);
        indexes.clear();
    }

    @Override
    public void ensureIndexes(String collection) {
        indexes.computeIfAbsent(collection, k -> ConcurrentHashMap.newKeySet()).addAll(INDEX_NAMES);
    }

    @Override
    public BulkInsertResult insertMany(String collection, List<Document> documents) {
        if (documents == null || documents.isEmpty())
            return BulkInsertResult.complete(0);

        List<Document> target = collections.computeIfAbsent(collection,
                k -> Collections.synchronizedList(new ArrayList<>()));
        List<BulkInsertResult.Failure> failures = new ArrayList<>();

        synchronized (target) {
            Set<Object> ids = new HashSet<>();
            for (Document existing : target) {
                ids.add(existing.get(ItemSchema.FIELD_ID));
            }
            for (int i = 0; i < documents.size(); i++) {
                Document document = documents.get(i);
                if (!document.containsKey(ItemSchema.FIELD_ID)) {
                    document.put(ItemSchema.FIELD_ID, new ObjectId());
                }
                Object id = document.get(ItemSchema.FIELD_ID);
                if (!ids.add(id)) {
                    failures.add(new BulkInsertResult.Failure(i, DUPLICATE_KEY,
                            "E11000 duplicate key error collection: " + collection + " dup key: { _id: " + id + " }"));
                    continue;
                }
                target.add(document);
            }
        }
        return new BulkInsertResult(documents.size(), documents.size() - failures.size(), failures);
    }

    @Override
    public List<Document> find(String collection, ItemQuery query) {
        List<Document> source = collections.get(collection);
        if (source == null)
            return new ArrayList<>();

        Set<String> terms = query.hasKeyword() ? Tokenizer.tokenize(query.keyword()) : Set.of();
        List<Document> result = new ArrayList<>();
        synchronized (source) {
            for (Document document : source) {
                long timestamp = ((Number) document.get(ItemSchema.FIELD_TIMESTAMP)).longValue();
                if (timestamp < query.fromTimestamp() || timestamp > query.toTimestamp())
                    continue;
                if (query.hasKeyword() && !matchesAny(document, terms))
                    continue;
                result.add(new Document(ItemSchema.FIELD_ID, document.get(ItemSchema.FIELD_ID))
                        .append(ItemSchema.FIELD_BODY, document.get(ItemSchema.FIELD_BODY)));
            }
        }
        return result;
    }

    private boolean matchesAny(Document document, Set<String> terms) {
        String tokenField = document.getString(ItemSchema.FIELD_TOKENS);
        if (tokenField == null || tokenField.isEmpty())
            return false;
        Set<String> tokens = new LinkedHashSet<>(List.of(tokenField.split(Tokenizer.SEPARATOR)));
        for (String term : terms) {
            if (tokens.contains(term))
                return true;
        }
        return false;
    }

    /** Snapshot of the documents stored in {@code collection}. */
    public List<Document> documents(String collection) {
        List<Document> source = collections.get(collection);
        if (source == null)
            return List.of();
        synchronized (source) {
            return new ArrayList<>(source);
        }
    }

    /** Names of the indexes ensured on {@code collection}. */
    public Set<String> indexes(String collection) {
        Set<String> names = indexes.get(collection);
        return names != null ? Set.copyOf(names) : Set.of();
    }
}
