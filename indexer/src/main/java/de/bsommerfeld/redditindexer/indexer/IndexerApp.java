package de.bsommerfeld.redditindexer.indexer;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.redditindexer.core.config.ConfigLoader;
import de.bsommerfeld.redditindexer.core.config.ConfigurationException;
import de.bsommerfeld.redditindexer.core.config.IndexerConfig;
import de.bsommerfeld.redditindexer.core.config.IngestionConfig;
import de.bsommerfeld.redditindexer.db.DocumentStore;
import de.bsommerfeld.redditindexer.db.ItemWriter;
import de.bsommerfeld.redditindexer.reddit.ContentApi;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Entry point of the ingestion process.
 *
 * <h3>Startup</h3>
 * <ol>
 * <li>load and validate {@code config.json} (exit code 1 on failure)</li>
 * <li>optionally erase every stored item and index</li>
 * <li>deduplicate the subreddit list (if enabled) and partition it into
 * worker groups</li>
 * <li>start one worker loop per group, then wait for a shutdown signal</li>
 * </ol>
 *
 * <p>
 * The configuration file is taken from the first argument, the
 * {@code indexer.config} system property, or {@code ./config.json}.
 * {@code "mode": "test"} runs against an in-memory store and synthetic
 * listings.
 */
public class IndexerApp {

    private static final Logger LOG = LoggerFactory.getLogger(IndexerApp.class);

    private final IndexerConfig config;
    private final DocumentStore store;
    private final ContentApi contentApi;
    private final ItemWriter writer;
    private final CancellationToken token;
    private final ShutdownCoordinator coordinator;

    @Inject
    public IndexerApp(IndexerConfig config, DocumentStore store, ContentApi contentApi, ItemWriter writer,
            CancellationToken token, ShutdownCoordinator coordinator) {
        this.config = config;
        this.store = store;
        this.contentApi = contentApi;
        this.writer = writer;
        this.token = token;
        this.coordinator = coordinator;
    }

    public static void main(String[] args) {
        Path configPath = ConfigLoader.resolvePath(args);

        IndexerConfig config;
        try {
            config = ConfigLoader.load(configPath);
        } catch (ConfigurationException e) {
            LOG.error("Cannot start: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        Injector injector = Guice.createInjector(new IndexerModule(config, config.getMode()));
        IndexerApp app = injector.getInstance(IndexerApp.class);
        app.coordinator.registerShutdownHook();
        app.run();
    }

    /** Runs the pipeline until shutdown; closes the store on the way out. */
    void run() {
        try {
            List<WorkerLoop> workers = prepare();
            if (workers.isEmpty()) {
                LOG.warn("No subreddits configured, nothing to do.");
                return;
            }
            coordinator.start(workers);
            coordinator.awaitShutdown();
        } finally {
            try {
                store.close();
            } catch (Exception e) {
                LOG.warn("Failed to close document store", e);
            }
            coordinator.markCompleted();
            LOG.info("Indexer stopped.");
        }
    }

    /** Erase (if configured), dedup, partition and build the worker loops. */
    List<WorkerLoop> prepare() {
        IngestionConfig ingestion = config.getIngestion();

        if (ingestion.isEraseDatabase()) {
            LOG.warn("erase-database is set: deleting all stored items and indexes");
            store.eraseAll();
        }

        Collection<String> channels = config.getReddit().getSubreddits();
        if (ingestion.isDedupChannels()) {
            channels = ChannelDeduplicator.dedup(channels);
        }

        List<WorkerGroup> groups = new ChannelPartitioner(ingestion.getStartTimestamp())
                .partition(channels, ingestion.getWorkerCount());
        LOG.info("Harvesting {} subreddit(s) with {} worker(s)", channels.size(), groups.size());

        List<WorkerLoop> workers = new ArrayList<>(groups.size());
        for (WorkerGroup group : groups) {
            workers.add(WorkerLoop.create(group, contentApi, ingestion, writer, token));
        }
        return workers;
    }
}
