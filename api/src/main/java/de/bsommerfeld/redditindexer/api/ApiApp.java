package de.bsommerfeld.redditindexer.api;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.redditindexer.core.config.ConfigLoader;
import de.bsommerfeld.redditindexer.core.config.ConfigurationException;
import de.bsommerfeld.redditindexer.core.config.IndexerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

import java.util.Map;

/**
 * Entry point of the read path. Reads the same {@code config.json} as the
 * indexer and serves {@code /items/} on {@code api.port} until the process is
 * stopped.
 *
 * <p>
 * The MongoDB client comes from {@link ApiModule}, not from Spring Boot's
 * auto-configuration.
 */
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
public class ApiApp {

    private static final Logger LOG = LoggerFactory.getLogger(ApiApp.class);

    public static void main(String[] args) {
        IndexerConfig config;
        try {
            config = ConfigLoader.load(ConfigLoader.resolvePath(args));
            requireSharedStore(config);
        } catch (ConfigurationException e) {
            LOG.error("Cannot start: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        Injector injector = Guice.createInjector(new ApiModule(config, config.getMode()));

        SpringApplication application = new SpringApplication(ApiApp.class);
        application.setDefaultProperties(Map.<String, Object>of("server.port", config.getApi().getPort()));
        application.addInitializers(context -> context.getBeanFactory().registerSingleton("injector", injector));
        application.run(args);
    }

    /**
     * The read path only sees what the indexer process wrote. In test mode
     * both processes keep private in-memory stores, so {@code /items/} could
     * never return anything.
     *
     * @throws ConfigurationException if the configuration selects test mode
     */
    static void requireSharedStore(IndexerConfig config) throws ConfigurationException {
        if (config.getMode().isTest()) {
            throw new ConfigurationException(
                    "mode test keeps items inside the indexer process; the API needs mode prod (MongoDB)");
        }
    }
}
