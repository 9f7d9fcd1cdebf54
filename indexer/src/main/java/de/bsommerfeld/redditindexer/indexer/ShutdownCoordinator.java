package de.bsommerfeld.redditindexer.indexer;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Singleton;
import de.bsommerfeld.redditindexer.core.config.IngestionConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Owns the worker threads and turns a process signal into an orderly stop.
 *
 * <h3>Sequence</h3>
 * <ol>
 * <li>{@link #start} runs every {@link WorkerLoop} on its own thread
 * ({@code indexer-worker-N})</li>
 * <li>the main thread parks in {@link #awaitShutdown}, checking the
 * {@link CancellationToken} every {@code shutdown-poll-millis}</li>
 * <li>SIGINT/SIGTERM runs the JVM shutdown hook, which sets the token once
 * and then waits for the application to report completion</li>
 * <li>each worker finishes its current sweep, sees the token after its sleep
 * and stops; {@link #awaitShutdown} returns once all have terminated</li>
 * <li>the caller closes its resources and calls {@link #markCompleted},
 * which releases the hook and lets the JVM exit</li>
 * </ol>
 *
 * <p>
 * The hook must not return early: the JVM halts as soon as all hooks are
 * done, which would cut off sweeps and the store shutdown.
 */
@Singleton
public class ShutdownCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(ShutdownCoordinator.class);

    private final CancellationToken token;
    private final long pollMillis;
    private final CountDownLatch completed = new CountDownLatch(1);

    private ExecutorService executor;
    private List<WorkerLoop> workers = List.of();

    @Inject
    public ShutdownCoordinator(CancellationToken token, IngestionConfig config) {
        this(token, config.getShutdownPollMillis());
    }

    ShutdownCoordinator(CancellationToken token, long pollMillis) {
        this.token = token;
        this.pollMillis = pollMillis;
    }

    /** Installs the JVM shutdown hook. Call once, before {@link #start}. */
    public void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::onShutdownSignal, "indexer-shutdown"));
    }

    /**
     * Starts one platform thread per worker loop.
     *
     * @throws IllegalStateException if workers were already started
     */
    public synchronized void start(List<WorkerLoop> loops) {
        if (executor != null)
            throw new IllegalStateException("Workers already started");

        this.workers = List.copyOf(loops);
        ThreadFactory factory = new ThreadFactoryBuilder()
                .setNameFormat("indexer-worker-%d")
                .setUncaughtExceptionHandler((t, e) -> LOG.error("Worker thread {} died", t.getName(), e))
                .build();
        executor = Executors.newFixedThreadPool(Math.max(1, workers.size()), factory);
        for (WorkerLoop worker : workers) {
            executor.execute(worker);
        }
        executor.shutdown();
        LOG.info("Started {} worker(s)", workers.size());
    }

    /**
     * Blocks the calling thread until the token is set and every worker has
     * stopped. Also returns if all workers ended on their own (e.g. after an
     * interrupt), in which case the token is set as well.
     */
    public void awaitShutdown() {
        try {
            while (!token.isCancelled()) {
                if (executor != null && executor.isTerminated()) {
                    LOG.warn("All workers ended without a shutdown request");
                    token.cancel();
                    break;
                }
                Thread.sleep(pollMillis);
            }
            LOG.info("Shutdown requested, waiting for {} worker(s) to finish their sweep...", workers.size());
            awaitWorkers();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            LOG.warn("Interrupted while waiting for shutdown");
        }
    }

    private void awaitWorkers() throws InterruptedException {
        if (executor == null)
            return;
        while (!executor.awaitTermination(pollMillis, TimeUnit.MILLISECONDS)) {
            LOG.debug("Still waiting for workers: {}", describeStates());
        }
        LOG.info("All workers stopped.");
    }

    /** Releases the shutdown hook. Call after resources are closed. */
    public void markCompleted() {
        completed.countDown();
    }

    /** Body of the shutdown hook. */
    void onShutdownSignal() {
        if (token.cancel()) {
            LOG.info("Shutdown signal received");
        }
        try {
            completed.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private String describeStates() {
        StringBuilder sb = new StringBuilder();
        for (WorkerLoop worker : workers) {
            if (sb.length() > 0)
                sb.append(", ");
            sb.append(worker.group().index()).append('=').append(worker.state());
        }
        return sb.toString();
    }
}
