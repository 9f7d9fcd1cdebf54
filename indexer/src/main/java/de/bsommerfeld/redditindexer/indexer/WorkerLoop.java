package de.bsommerfeld.redditindexer.indexer;

import de.bsommerfeld.redditindexer.core.config.IngestionConfig;
import de.bsommerfeld.redditindexer.core.domain.Channel;
import de.bsommerfeld.redditindexer.core.domain.Item;
import de.bsommerfeld.redditindexer.core.domain.ItemKind;
import de.bsommerfeld.redditindexer.core.text.Tokenizer;
import de.bsommerfeld.redditindexer.db.ItemWriter;
import de.bsommerfeld.redditindexer.db.WriteOutcome;
import de.bsommerfeld.redditindexer.reddit.ChannelRetriever;
import de.bsommerfeld.redditindexer.reddit.ContentApi;
import de.bsommerfeld.redditindexer.reddit.ContentApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Harvests the channels of one {@link WorkerGroup} until shutdown.
 *
 * <h3>States</h3>
 *
 * <pre>
 * RUNNING ──start──▶ SWEEPING ──sweep done──▶ SLEEPING
 *                       ▲                        │
 *                       └──── token clear ───────┤
 *                                                │ token set / interrupted
 *                                                ▼
 *                                             STOPPED
 * </pre>
 *
 * <h3>Sweep</h3>
 * Every channel of the group is visited in fixed order. Per channel,
 * submissions are processed before comments, each as
 * retriever → tokenizer → writer. The cancellation token is only consulted
 * after the sleep that follows a sweep, so a started sweep always completes.
 *
 * <h3>Failure isolation</h3>
 * A failed fetch is logged and the sweep moves on to the next step; the next
 * sweep tries again. Write failures are contained by {@link ItemWriter}.
 * Unexpected runtime exceptions are caught per step as well, so one broken
 * subreddit never takes the worker down.
 */
public class WorkerLoop implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerLoop.class);

    private static final ItemKind[] SWEEP_ORDER = { ItemKind.SUBMISSIONS, ItemKind.COMMENTS };

    public enum State {
        RUNNING, SWEEPING, SLEEPING, STOPPED
    }

    /** Pause between sweeps; replaced in tests. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final WorkerGroup group;
    private final List<ChannelRetriever> retrievers;
    private final ItemWriter writer;
    private final CancellationToken token;
    private final long intervalMillis;
    private final Sleeper sleeper;

    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicLong sweeps = new AtomicLong();
    private volatile State state = State.RUNNING;

    public WorkerLoop(WorkerGroup group, List<ChannelRetriever> retrievers, ItemWriter writer,
            CancellationToken token, long intervalMillis) {
        this(group, retrievers, writer, token, intervalMillis, Thread::sleep);
    }

    WorkerLoop(WorkerGroup group, List<ChannelRetriever> retrievers, ItemWriter writer,
            CancellationToken token, long intervalMillis, Sleeper sleeper) {
        this.group = group;
        this.retrievers = List.copyOf(retrievers);
        this.writer = writer;
        this.token = token;
        this.intervalMillis = intervalMillis;
        this.sleeper = sleeper;
    }

    /**
     * Builds a loop with one {@link ChannelRetriever} per channel of
     * {@code group}.
     */
    public static WorkerLoop create(WorkerGroup group, ContentApi contentApi, IngestionConfig config,
            ItemWriter writer, CancellationToken token) {
        List<ChannelRetriever> retrievers = new ArrayList<>(group.size());
        for (Channel channel : group.channels()) {
            retrievers.add(new ChannelRetriever(contentApi, channel, config));
        }
        return new WorkerLoop(group, retrievers, writer, token, config.getUpdateIntervalMillis());
    }

    @Override
    public void run() {
        LOG.info("Worker {} started with {} channel(s): {}", group.index(), group.size(), channelNames());
        try {
            while (true) {
                state = State.SWEEPING;
                sweep();
                sweeps.incrementAndGet();

                state = State.SLEEPING;
                try {
                    sleeper.sleep(intervalMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Worker {} interrupted while sleeping, stopping", group.index());
                    break;
                }
                if (token.isCancelled())
                    break;
            }
        } finally {
            state = State.STOPPED;
            stopped.countDown();
            LOG.info("Worker {} stopped after {} sweep(s)", group.index(), sweeps.get());
        }
    }

    /** One pass over every channel of the group. */
    void sweep() {
        for (ChannelRetriever retriever : retrievers) {
            for (ItemKind kind : SWEEP_ORDER) {
                harvest(retriever, kind);
            }
        }
    }

    private void harvest(ChannelRetriever retriever, ItemKind kind) {
        String channel = retriever.channel().name();
        try {
            ChannelRetriever.Fetch fetch = retriever.fetchNew(kind);
            List<Item> items = fetch.items();

            List<Set<String>> tokens = new ArrayList<>(items.size());
            for (Item item : items) {
                tokens.add(Tokenizer.tokenize(item.body()));
            }

            WriteOutcome outcome = writer.write(channel, kind, items, tokens);
            LOG.debug("Worker {}: r/{} {} -> {} (watermark {})",
                    group.index(), channel, kind, outcome, fetch.newWatermark());
        } catch (ContentApiException e) {
            LOG.warn("Worker {}: fetching {} of r/{} failed: {}", group.index(), kind, channel, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Worker {}: unexpected failure on {} of r/{}", group.index(), kind, channel, e);
        }
    }

    public State state() {
        return state;
    }

    public WorkerGroup group() {
        return group;
    }

    /** Number of completed sweeps. */
    public long sweeps() {
        return sweeps.get();
    }

    /**
     * Blocks until the loop reached {@link State#STOPPED}.
     *
     * @return {@code false} if the timeout elapsed first
     */
    boolean awaitStopped(long timeout, TimeUnit unit) throws InterruptedException {
        return stopped.await(timeout, unit);
    }

    private List<String> channelNames() {
        List<String> names = new ArrayList<>(group.size());
        for (Channel channel : group.channels()) {
            names.add(channel.name());
        }
        return names;
    }
}
