package de.bsommerfeld.redditindexer.reddit;

import com.google.inject.Singleton;
import de.bsommerfeld.redditindexer.core.domain.Item;
import de.bsommerfeld.redditindexer.core.domain.ItemKind;
import de.bsommerfeld.redditindexer.core.util.TestDataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Offline stub that replaces {@link RedditContentApi} when the application
 * runs in TEST mode ({@code "mode": "test"} in {@code config.json}).
 *
 * <h3>No network access</h3>
 * No HTTP requests are made. Every (subreddit, kind) pair gets a synthetic
 * listing built by {@link TestDataGenerator}, so the whole pipeline
 * (retriever, tokenizer, writer, read path) runs without Reddit access.
 *
 * <h3>Simulated activity</h3>
 * The first request seeds the listing with {@value #SEED_SIZE} items. After
 * that, {@value #BURST_SIZE} newer items appear on every
 * {@value #GENERATION_INTERVAL}th request, which is enough to watch
 * watermarks move. Like a real listing, each response is the newest slice,
 * so items already seen come back and must be filtered by the caller.
 */
@Singleton
public class TestContentApi implements ContentApi {

    private static final Logger LOG = LoggerFactory.getLogger(TestContentApi.class);

    static final int SEED_SIZE = 25;
    static final int BURST_SIZE = 2;
    static final int GENERATION_INTERVAL = 3;

    /** Oldest entries are dropped beyond this size. */
    private static final int MAX_LISTING = 1000;

    private final LongSupplier clock;
    private final Map<String, Listing> listings = new HashMap<>();

    public TestContentApi() {
        this(() -> System.currentTimeMillis() / 1000);
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Reddit access is DISABLED       #");
        LOG.warn("#  Using Dummy Data Generator for listings            #");
        LOG.warn("#######################################################");
    }

    TestContentApi(LongSupplier clock) {
        this.clock = clock;
    }

    @Override
    public synchronized List<Item> newest(String channel, ItemKind kind, int limit) {
        Listing listing = listings.computeIfAbsent(kind.collectionPrefix() + channel, k -> new Listing());
        listing.calls++;

        if (listing.calls == 1) {
            listing.prepend(generate(channel, kind, SEED_SIZE, listing));
        } else if (listing.calls % GENERATION_INTERVAL == 0) {
            listing.prepend(generate(channel, kind, BURST_SIZE, listing));
        }

        LOG.debug("[TEST] r/{} {}: serving {} of {} items", channel, kind, Math.min(limit, listing.items.size()),
                listing.items.size());
        return new ArrayList<>(listing.items.subList(0, Math.min(limit, listing.items.size())));
    }

    private List<Item> generate(String channel, ItemKind kind, int count, Listing listing) {
        // newer than anything already listed, even within the same second
        long now = Math.max(clock.getAsLong(), listing.newest + count + 1);
        List<Item> items = TestDataGenerator.generateItems(channel, kind, count, now, count);
        listing.newest = now;
        return items;
    }

    private static final class Listing {
        private final LinkedList<Item> items = new LinkedList<>();
        private long newest;
        private int calls;

        void prepend(List<Item> newestFirst) {
            items.addAll(0, newestFirst);
            while (items.size() > MAX_LISTING) {
                items.removeLast();
            }
        }
    }
}
