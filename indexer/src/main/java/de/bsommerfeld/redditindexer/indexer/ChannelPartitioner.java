package de.bsommerfeld.redditindexer.indexer;

import de.bsommerfeld.redditindexer.core.domain.Channel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Splits the channel list into disjoint {@link WorkerGroup}s.
 *
 * <h3>Distribution</h3>
 * Without a usable worker count (absent, zero or negative), or with at least
 * as many workers as channels, every channel gets a group of its own.
 * Otherwise the channels are shuffled and dealt round-robin: position
 * {@code i} goes to group {@code i mod k}. Group sizes therefore differ by at
 * most one and never exceed {@code ceil(n / k)}. The shuffle spreads busy
 * subreddits that tend to be listed next to each other.
 *
 * <p>
 * Each channel is created here with the configured start timestamp as
 * initial watermark.
 */
public class ChannelPartitioner {

    private final long startTimestamp;
    private final Random random;

    public ChannelPartitioner(long startTimestamp) {
        this(startTimestamp, new Random());
    }

    ChannelPartitioner(long startTimestamp, Random random) {
        this.startTimestamp = startTimestamp;
        this.random = random;
    }

    public List<WorkerGroup> partition(Collection<String> channelNames, Integer targetWorkers) {
        List<String> names = new ArrayList<>(channelNames);
        int n = names.size();
        if (n == 0)
            return List.of();

        int groupCount = (targetWorkers == null || targetWorkers <= 0 || targetWorkers >= n) ? n : targetWorkers;
        if (groupCount < n) {
            Collections.shuffle(names, random);
        }

        List<List<Channel>> buckets = new ArrayList<>(groupCount);
        for (int g = 0; g < groupCount; g++) {
            buckets.add(new ArrayList<>());
        }
        for (int i = 0; i < n; i++) {
            buckets.get(i % groupCount).add(new Channel(names.get(i), startTimestamp));
        }

        List<WorkerGroup> groups = new ArrayList<>(groupCount);
        for (int g = 0; g < groupCount; g++) {
            groups.add(new WorkerGroup(g, buckets.get(g)));
        }
        return groups;
    }
}
