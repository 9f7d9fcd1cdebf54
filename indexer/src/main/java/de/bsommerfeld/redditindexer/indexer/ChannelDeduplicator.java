package de.bsommerfeld.redditindexer.indexer;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collapses a configured subreddit list to its distinct entries.
 * Comparison is exact: {@code "Java"} and {@code "java"} stay separate.
 */
public final class ChannelDeduplicator {

    private ChannelDeduplicator() {
    }

    /** Every distinct entry exactly once. Iteration order is not guaranteed. */
    public static Set<String> dedup(Collection<String> channels) {
        return new LinkedHashSet<>(channels);
    }
}
