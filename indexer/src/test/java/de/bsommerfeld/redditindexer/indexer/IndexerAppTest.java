package de.bsommerfeld.redditindexer.indexer;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.redditindexer.core.config.ApplicationMode;
import de.bsommerfeld.redditindexer.core.config.ConfigLoader;
import de.bsommerfeld.redditindexer.core.config.IndexerConfig;
import de.bsommerfeld.redditindexer.db.DocumentStore;
import de.bsommerfeld.redditindexer.db.InMemoryDocumentStore;
import de.bsommerfeld.redditindexer.reddit.ContentApi;
import de.bsommerfeld.redditindexer.reddit.TestContentApi;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wires the application in TEST mode (in-memory store, synthetic listings)
 * and runs it end to end.
 */
@Timeout(value = 20, unit = TimeUnit.SECONDS)
class IndexerAppTest {

    @TempDir
    Path tempDir;

    @Test
    void module_shouldBindTestImplementations() throws Exception {
        Injector injector = injector("""
                { "reddit": { "subreddits": ["java"] } }
                """);

        assertInstanceOf(InMemoryDocumentStore.class, injector.getInstance(DocumentStore.class));
        assertInstanceOf(TestContentApi.class, injector.getInstance(ContentApi.class));
        assertSame(injector.getInstance(CancellationToken.class), injector.getInstance(CancellationToken.class));
    }

    @Test
    void prepare_shouldDedupAndPartition() throws Exception {
        IndexerApp app = injector("""
                { "reddit": { "subreddits": ["java", "rust", "java", "go", "kotlin"] },
                  "ingestion": { "worker-count": 2 } }
                """).getInstance(IndexerApp.class);

        List<WorkerLoop> workers = app.prepare();

        assertEquals(2, workers.size());
        assertEquals(4, workers.stream().mapToInt(w -> w.group().size()).sum());
    }

    @Test
    void prepare_shouldKeepRepeatedEntriesWhenDedupDisabled() throws Exception {
        IndexerApp app = injector("""
                { "reddit": { "subreddits": ["java", "java"] },
                  "ingestion": { "dedup-channels": false, "worker-count": 0 } }
                """).getInstance(IndexerApp.class);

        assertEquals(2, app.prepare().size());
    }

    @Test
    void prepare_shouldEraseDatabaseWhenConfigured() throws Exception {
        Injector injector = injector("""
                { "reddit": { "subreddits": ["java"] },
                  "ingestion": { "erase-database": true } }
                """);
        InMemoryDocumentStore store = (InMemoryDocumentStore) injector.getInstance(DocumentStore.class);
        store.insertMany("reddit__subm__old", List.of(new Document("timestamp", 1L)));

        injector.getInstance(IndexerApp.class).prepare();

        assertTrue(store.documents("reddit__subm__old").isEmpty());
    }

    @Test
    void run_shouldHarvestUntilCancelled() throws Exception {
        Injector injector = injector("""
                { "reddit": { "subreddits": ["java", "rust"] },
                  "ingestion": { "update-interval-millis": 10, "shutdown-poll-millis": 10 } }
                """);
        IndexerApp app = injector.getInstance(IndexerApp.class);
        InMemoryDocumentStore store = (InMemoryDocumentStore) injector.getInstance(DocumentStore.class);

        Thread main = new Thread(app::run, "test-main");
        main.start();
        while (store.documents("reddit__comm__rust").isEmpty()) {
            Thread.sleep(10);
        }
        injector.getInstance(CancellationToken.class).cancel();
        main.join(TimeUnit.SECONDS.toMillis(10));

        assertFalse(main.isAlive());
        assertFalse(store.documents("reddit__subm__java").isEmpty());
        assertFalse(store.documents("reddit__comm__java").isEmpty());
        assertFalse(store.indexes("reddit__subm__rust").isEmpty());
    }

    private Injector injector(String json) throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, json);
        IndexerConfig config = ConfigLoader.load(file);
        return Guice.createInjector(new IndexerModule(config, ApplicationMode.TEST));
    }
}
