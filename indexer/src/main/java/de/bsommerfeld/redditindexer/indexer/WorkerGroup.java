package de.bsommerfeld.redditindexer.indexer;

import de.bsommerfeld.redditindexer.core.domain.Channel;

import java.util.List;

/**
 * The channels owned by one worker loop, in the order they are swept.
 *
 * @param index    position of the group, used in log output
 * @param channels non-empty list of channels exclusive to this group
 */
public record WorkerGroup(int index, List<Channel> channels) {

    public WorkerGroup {
        channels = List.copyOf(channels);
    }

    public int size() {
        return channels.size();
    }
}
