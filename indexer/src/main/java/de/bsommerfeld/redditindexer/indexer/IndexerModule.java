package de.bsommerfeld.redditindexer.indexer;

import com.google.inject.AbstractModule;
import de.bsommerfeld.redditindexer.core.config.ApiConfig;
import de.bsommerfeld.redditindexer.core.config.ApplicationMode;
import de.bsommerfeld.redditindexer.core.config.IndexerConfig;
import de.bsommerfeld.redditindexer.core.config.IngestionConfig;
import de.bsommerfeld.redditindexer.core.config.MongoConfig;
import de.bsommerfeld.redditindexer.core.config.RedditConfig;
import de.bsommerfeld.redditindexer.db.DatabaseModule;
import de.bsommerfeld.redditindexer.reddit.ContentApi;
import de.bsommerfeld.redditindexer.reddit.RedditContentApi;
import de.bsommerfeld.redditindexer.reddit.TestContentApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice wiring for the ingestion process.
 *
 * <p>
 * The configuration is loaded before the injector exists (a broken file must
 * end the process with a clear message, not a Guice stack trace) and bound
 * here as instances, together with its sections for convenience.
 */
public class IndexerModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(IndexerModule.class);

    private final IndexerConfig config;
    private final ApplicationMode mode;

    public IndexerModule(IndexerConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        bind(IndexerConfig.class).toInstance(config);
        bind(MongoConfig.class).toInstance(config.getMongo());
        bind(RedditConfig.class).toInstance(config.getReddit());
        bind(IngestionConfig.class).toInstance(config.getIngestion());
        bind(ApiConfig.class).toInstance(config.getApi());

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        install(new DatabaseModule(mode));
        if (mode.isTest()) {
            bind(ContentApi.class).to(TestContentApi.class);
        } else {
            bind(ContentApi.class).to(RedditContentApi.class);
        }
    }
}
