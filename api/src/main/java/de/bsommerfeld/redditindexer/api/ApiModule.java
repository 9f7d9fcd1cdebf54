package de.bsommerfeld.redditindexer.api;

import com.google.inject.AbstractModule;
import de.bsommerfeld.redditindexer.core.config.ApplicationMode;
import de.bsommerfeld.redditindexer.core.config.IndexerConfig;
import de.bsommerfeld.redditindexer.core.config.MongoConfig;
import de.bsommerfeld.redditindexer.db.DatabaseModule;

/**
 * Guice wiring for the read path. Shares the configuration file and the
 * store binding with the ingestion process; {@link ApiConfiguration} exposes
 * the resulting services to Spring.
 */
public class ApiModule extends AbstractModule {

    private final IndexerConfig config;
    private final ApplicationMode mode;

    public ApiModule(IndexerConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        bind(IndexerConfig.class).toInstance(config);
        bind(MongoConfig.class).toInstance(config.getMongo());
        install(new DatabaseModule(mode));
    }
}
