package de.bsommerfeld.redditindexer.api;

import com.google.inject.Injector;
import de.bsommerfeld.redditindexer.db.DocumentStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Hands the Guice-managed read services to Spring MVC. The {@link Injector}
 * is registered as a bean by {@link ApiApp} before the context refreshes, so
 * the store binding stays the one {@link ApiModule} shares with the indexer.
 */
@Configuration
class ApiConfiguration {

    // closed with the context
    @Bean(destroyMethod = "close")
    DocumentStore documentStore(Injector injector) {
        return injector.getInstance(DocumentStore.class);
    }

    @Bean
    ItemQueryService itemQueryService(Injector injector) {
        return injector.getInstance(ItemQueryService.class);
    }
}
