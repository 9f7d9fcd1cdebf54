package de.bsommerfeld.redditindexer.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.redditindexer.core.domain.Item;
import de.bsommerfeld.redditindexer.core.domain.ItemKind;
import de.bsommerfeld.redditindexer.core.text.Tokenizer;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Write path of the ingestion pipeline. The single entry point through which
 * workers persist items. Nothing else writes to the {@link DocumentStore}.
 *
 * <h3>Per call</h3>
 * <ol>
 * <li>build one document per item ({@code subreddit}, {@code body},
 * {@code timestamp}, {@code word})</li>
 * <li>ensure the timestamp and text indexes of the target collection</li>
 * <li>insert all documents in one unordered bulk operation</li>
 * </ol>
 *
 * <h3>Failure isolation</h3>
 * Submissions and comments go through the same code path and get the same
 * treatment: rejected documents are logged and counted, an index failure
 * skips the insert for that collection, and a store failure rejects the
 * batch. None of these escape to the caller, so one bad collection never stops
 * a sweep.
 *
 * <p>
 * There is no retry. Watermarks advance on fetch, not on a confirmed write,
 * so a lost batch is not fetched again.
 */
@Singleton
public class ItemWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ItemWriter.class);

    private final DocumentStore store;

    @Inject
    public ItemWriter(DocumentStore store) {
        this.store = store;
    }

    /**
     * Persists {@code items} of one kind for one channel.
     *
     * @param tokensPerItem token set of each item, same order and size as
     *                      {@code items}
     */
    public WriteOutcome write(String channel, ItemKind kind, List<Item> items, List<Set<String>> tokensPerItem) {
        if (items.size() != tokensPerItem.size()) {
            throw new IllegalArgumentException("Expected " + items.size() + " token sets, got "
                    + tokensPerItem.size());
        }

        String collection = ItemSchema.collectionName(channel, kind);
        List<Document> documents = buildDocuments(channel, items, tokensPerItem);

        try {
            store.ensureIndexes(collection);
        } catch (IndexMaintenanceException e) {
            LOG.error("Skipping write of {} documents to {}", documents.size(), collection, e);
            return WriteOutcome.skipped(collection, documents.size());
        }

        if (documents.isEmpty())
            return new WriteOutcome(collection, 0, 0, 0, false);

        BulkInsertResult result;
        try {
            result = store.insertMany(collection, documents);
        } catch (DocumentStoreException e) {
            LOG.error("Bulk insert of {} documents into {} failed", documents.size(), collection, e);
            return new WriteOutcome(collection, documents.size(), 0, documents.size(), false);
        }

        if (result.hasFailures()) {
            LOG.warn("{}: {} of {} documents rejected", collection, result.failures().size(), result.attempted());
            for (BulkInsertResult.Failure failure : result.failures()) {
                LOG.warn("  #{} rejected (code {}): {}", failure.index(), failure.code(), failure.message());
            }
        }
        LOG.info("{}: inserted {} documents", collection, result.inserted());
        return new WriteOutcome(collection, documents.size(), result.inserted(),
                result.attempted() - result.inserted(), false);
    }

    static List<Document> buildDocuments(String channel, List<Item> items, List<Set<String>> tokensPerItem) {
        List<Document> documents = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Item item = items.get(i);
            documents.add(new Document(ItemSchema.FIELD_CHANNEL, channel)
                    .append(ItemSchema.FIELD_BODY, item.body())
                    .append(ItemSchema.FIELD_TIMESTAMP, item.createdUtc())
                    .append(ItemSchema.FIELD_TOKENS, Tokenizer.join(tokensPerItem.get(i))));
        }
        return documents;
    }
}
