package de.bsommerfeld.redditindexer.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoException;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.InsertManyOptions;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.TextSearchOptions;
import de.bsommerfeld.redditindexer.core.config.MongoConfig;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * MongoDB-backed {@link DocumentStore} for production use.
 *
 * <h3>Connection strategy</h3>
 * A single {@link MongoClient} is shared by every worker. The driver pools
 * connections internally and is documented as thread-safe, so no locking
 * happens on this side.
 *
 * <h3>Bulk inserts</h3>
 * Inserts are sent with {@code ordered=false}: the server keeps going after a
 * rejected document, and the driver reports all rejections together in a
 * {@link MongoBulkWriteException}. That exception is translated into a
 * {@link BulkInsertResult}; only failures of the operation as a whole escape
 * as {@link DocumentStoreException}.
 *
 * <h3>Indexes</h3>
 * {@code createIndex} is a no-op on the server when an identical index
 * already exists, which is what makes {@link #ensureIndexes} safe to call on
 * every write cycle.
 */
@Singleton
public class MongoDocumentStore implements DocumentStore {

    private static final Logger LOG = LoggerFactory.getLogger(MongoDocumentStore.class);

    private final MongoClient client;
    private final MongoDatabase database;

    @Inject
    public MongoDocumentStore(MongoClient client, MongoConfig config) {
        this.client = client;
        this.database = client.getDatabase(config.getDatabase());
        LOG.info("Using MongoDB database '{}' at {}", config.getDatabase(), config.getConnectionString());
    }

    MongoCollection<Document> collection(String name) {
        return database.getCollection(name);
    }

    // =====================================================================
    // Maintenance
    // =====================================================================

    @Override
    public void eraseAll() {
        List<String> names = new ArrayList<>();
        for (String name : database.listCollectionNames()) {
            if (!name.startsWith("system.")) {
                names.add(name);
            }
        }

        for (String name : names) {
            long deleted = collection(name).deleteMany(new Document()).getDeletedCount();
            LOG.info("Erased {} documents from {}", deleted, name);
        }
        for (String name : names) {
            collection(name).dropIndexes();
        }
        LOG.info("Database erased ({} collections).", names.size());
    }

    @Override
    public void ensureIndexes(String collectionName) {
        MongoCollection<Document> collection = collection(collectionName);
        try {
            collection.createIndex(Indexes.ascending(ItemSchema.FIELD_TIMESTAMP));
            collection.createIndex(
                    Indexes.compoundIndex(
                            Indexes.text(ItemSchema.FIELD_TOKENS),
                            Indexes.ascending(ItemSchema.FIELD_TIMESTAMP)),
                    new IndexOptions().defaultLanguage(ItemSchema.TEXT_LANGUAGE));
        } catch (MongoException e) {
            throw new IndexMaintenanceException(collectionName, e);
        }
    }

    // =====================================================================
    // Writes
    // =====================================================================

    @Override
    public BulkInsertResult insertMany(String collectionName, List<Document> documents) {
        if (documents == null || documents.isEmpty())
            return BulkInsertResult.complete(0);

        try {
            collection(collectionName).insertMany(documents, new InsertManyOptions().ordered(false));
            return BulkInsertResult.complete(documents.size());
        } catch (MongoBulkWriteException e) {
            List<BulkInsertResult.Failure> failures = new ArrayList<>();
            for (BulkWriteError error : e.getWriteErrors()) {
                failures.add(new BulkInsertResult.Failure(error.getIndex(), error.getCode(), error.getMessage()));
            }
            if (e.getWriteConcernError() != null) {
                LOG.warn("Write concern error on {}: {}", collectionName, e.getWriteConcernError().getMessage());
            }
            return new BulkInsertResult(documents.size(), documents.size() - failures.size(), failures);
        } catch (MongoException e) {
            throw new DocumentStoreException("Bulk insert into " + collectionName + " failed", e);
        }
    }

    // =====================================================================
    // Reads
    // =====================================================================

    @Override
    public List<Document> find(String collectionName, ItemQuery query) {
        List<Bson> filters = new ArrayList<>();
        filters.add(Filters.gte(ItemSchema.FIELD_TIMESTAMP, query.fromTimestamp()));
        filters.add(Filters.lte(ItemSchema.FIELD_TIMESTAMP, query.toTimestamp()));
        if (query.hasKeyword()) {
            filters.add(Filters.text(query.keyword(),
                    new TextSearchOptions().language(ItemSchema.TEXT_LANGUAGE)));
        }

        try {
            return collection(collectionName)
                    .find(Filters.and(filters))
                    .projection(Projections.include(ItemSchema.FIELD_ID, ItemSchema.FIELD_BODY))
                    .into(new ArrayList<>());
        } catch (MongoException e) {
            throw new DocumentStoreException("Query on " + collectionName + " failed", e);
        }
    }

    @Override
    public void close() {
        LOG.info("Closing MongoDB client...");
        client.close();
    }
}
