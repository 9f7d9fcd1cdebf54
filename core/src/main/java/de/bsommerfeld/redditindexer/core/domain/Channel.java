package de.bsommerfeld.redditindexer.core.domain;

import com.google.common.base.Preconditions;

import java.util.EnumMap;
import java.util.Map;

/**
 * A watched subreddit together with its watermarks: the creation timestamp of
 * the newest item ingested so far, tracked separately per {@link ItemKind}.
 *
 * <p>
 * Submissions and comments are fetched with independent limits, so each kind
 * advances its own lower bound. {@link #watermark()} reports the newest of
 * them.
 *
 * <h3>Ownership</h3>
 * A channel belongs to exactly one worker group and is only ever touched by
 * that group's worker thread. The class is therefore not thread-safe.
 *
 * <h3>Lifetime</h3>
 * Watermarks live in memory only. Every process start begins again at the
 * configured start timestamp.
 */
public final class Channel {

    private final String name;
    private final Map<ItemKind, Long> watermarks = new EnumMap<>(ItemKind.class);

    public Channel(String name, long startTimestamp) {
        Preconditions.checkArgument(name != null && !name.isBlank(), "channel name must not be blank");
        Preconditions.checkArgument(startTimestamp >= 0, "start timestamp must not be negative");
        this.name = name;
        for (ItemKind kind : ItemKind.values()) {
            watermarks.put(kind, startTimestamp);
        }
    }

    public String name() {
        return name;
    }

    /** Exclusive lower bound for the next fetch of {@code kind}. */
    public long watermark(ItemKind kind) {
        return watermarks.get(kind);
    }

    /** Newest watermark across both kinds. */
    public long watermark() {
        long max = 0;
        for (long value : watermarks.values()) {
            max = Math.max(max, value);
        }
        return max;
    }

    /**
     * Moves the watermark of {@code kind} forward. Values lower than the
     * current watermark are ignored, so the watermark never decreases.
     *
     * @return the watermark after the call
     */
    public long advance(ItemKind kind, long timestamp) {
        return watermarks.merge(kind, timestamp, Math::max);
    }

    @Override
    public String toString() {
        return "r/" + name + " " + watermarks;
    }
}
