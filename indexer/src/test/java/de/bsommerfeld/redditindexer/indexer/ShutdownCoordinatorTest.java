package de.bsommerfeld.redditindexer.indexer;

import de.bsommerfeld.redditindexer.core.config.IngestionConfig;
import de.bsommerfeld.redditindexer.core.domain.Channel;
import de.bsommerfeld.redditindexer.db.InMemoryDocumentStore;
import de.bsommerfeld.redditindexer.db.ItemWriter;
import de.bsommerfeld.redditindexer.reddit.ChannelRetriever;
import de.bsommerfeld.redditindexer.reddit.ContentApi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class ShutdownCoordinatorTest {

    private ContentApi contentApi;
    private ItemWriter writer;
    private CancellationToken token;
    private ShutdownCoordinator coordinator;

    @BeforeEach
    void setUp() throws Exception {
        contentApi = mock(ContentApi.class);
        when(contentApi.newest(anyString(), any(), anyInt())).thenReturn(List.of());
        writer = new ItemWriter(new InMemoryDocumentStore());
        token = new CancellationToken();
        coordinator = new ShutdownCoordinator(token, 5);
    }

    @Test
    void awaitShutdown_shouldReturnAfterSignalOnceAllWorkersStopped() throws Exception {
        List<WorkerLoop> workers = List.of(worker(0, "a", 5), worker(1, "b", 5), worker(2, "c", 5));
        coordinator.start(workers);

        Thread hook = new Thread(coordinator::onShutdownSignal, "test-hook");
        hook.start();
        coordinator.awaitShutdown();

        assertTrue(token.isCancelled());
        for (WorkerLoop worker : workers) {
            assertEquals(WorkerLoop.State.STOPPED, worker.state());
            assertTrue(worker.sweeps() >= 1);
        }

        // the hook holds the JVM until the application reports completion
        assertTrue(hook.isAlive());
        coordinator.markCompleted();
        hook.join(TimeUnit.SECONDS.toMillis(5));
        assertFalse(hook.isAlive());
    }

    @Test
    void awaitShutdown_shouldReturnWhenAllWorkersEndOnTheirOwn() throws Exception {
        WorkerLoop interrupted = new WorkerLoop(new WorkerGroup(0, List.of(new Channel("a", 0))),
                List.of(new ChannelRetriever(contentApi, new Channel("a", 0), new IngestionConfig())),
                writer, token, 5, millis -> {
                    throw new InterruptedException();
                });
        coordinator.start(List.of(interrupted));

        coordinator.awaitShutdown();

        assertTrue(token.isCancelled());
        assertEquals(WorkerLoop.State.STOPPED, interrupted.state());
    }

    @Test
    void onShutdownSignal_shouldCancelTokenOnce() throws Exception {
        coordinator.markCompleted();

        coordinator.onShutdownSignal();
        coordinator.onShutdownSignal();

        assertTrue(token.isCancelled());
    }

    @Test
    void start_shouldRejectSecondCall() {
        coordinator.start(List.of(worker(0, "a", 5)));
        token.cancel();

        assertThrows(IllegalStateException.class, () -> coordinator.start(List.of()));
        coordinator.awaitShutdown();
    }

    @Test
    void start_shouldNameWorkerThreads() throws Exception {
        String[] threadName = new String[1];
        when(contentApi.newest(anyString(), any(), anyInt())).thenAnswer(inv -> {
            threadName[0] = Thread.currentThread().getName();
            token.cancel();
            return List.of();
        });

        coordinator.start(List.of(worker(0, "a", 5)));
        coordinator.awaitShutdown();

        assertTrue(threadName[0].startsWith("indexer-worker-"));
    }

    private WorkerLoop worker(int index, String channelName, long intervalMillis) {
        Channel channel = new Channel(channelName, 0);
        return new WorkerLoop(new WorkerGroup(index, List.of(channel)),
                List.of(new ChannelRetriever(contentApi, channel, new IngestionConfig())),
                writer, token, intervalMillis);
    }
}
