package de.bsommerfeld.redditindexer.db;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import de.bsommerfeld.redditindexer.core.config.ApplicationMode;
import de.bsommerfeld.redditindexer.core.config.MongoConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice wiring for the persistence layer. Expects {@link MongoConfig} to be
 * bound by the installing module.
 */
public class DatabaseModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseModule.class);

    private final ApplicationMode mode;

    public DatabaseModule(ApplicationMode mode) {
        this.mode = mode;
    }

    @Override
    protected void configure() {
        if (mode.isTest()) {
            bind(DocumentStore.class).to(InMemoryDocumentStore.class);
        } else {
            bind(DocumentStore.class).to(MongoDocumentStore.class);
        }
    }

    @Provides
    @Singleton
    MongoClient mongoClient(MongoConfig config) {
        LOG.info("Connecting to MongoDB at {}", config.getConnectionString());
        return MongoClients.create(config.getConnectionString());
    }
}
