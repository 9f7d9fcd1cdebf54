package de.bsommerfeld.redditindexer.reddit;

import de.bsommerfeld.redditindexer.core.config.IngestionConfig;
import de.bsommerfeld.redditindexer.core.domain.Channel;
import de.bsommerfeld.redditindexer.core.domain.Item;
import de.bsommerfeld.redditindexer.core.domain.ItemKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls the items of one channel that are newer than its watermark.
 *
 * <p>
 * Each call asks the {@link ContentApi} for the newest page of the requested
 * kind (bounded by the configured limit), keeps every item created strictly
 * after the current watermark and advances the watermark to the newest kept
 * timestamp. All returned items are scanned; their order in the listing does
 * not matter.
 *
 * <p>
 * Polling is bounded: when more items than the limit were created since the
 * previous call, the overflow is never seen. A page that consists entirely of
 * new items is logged at debug level as a hint that a gap is likely.
 *
 * <p>
 * Owned by the worker that owns the channel; not thread-safe.
 */
public class ChannelRetriever {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelRetriever.class);

    private final ContentApi contentApi;
    private final Channel channel;
    private final IngestionConfig config;

    public ChannelRetriever(ContentApi contentApi, Channel channel, IngestionConfig config) {
        this.contentApi = contentApi;
        this.channel = channel;
        this.config = config;
    }

    public Channel channel() {
        return channel;
    }

    /**
     * Fetches items of {@code kind} created after the channel's watermark.
     * The watermark is left untouched when the content API fails.
     *
     * @throws ContentApiException if the listing could not be fetched
     */
    public Fetch fetchNew(ItemKind kind) throws ContentApiException {
        int limit = limitFor(kind);
        long watermark = channel.watermark(kind);

        List<Item> listed = contentApi.newest(channel.name(), kind, limit);

        List<Item> fresh = new ArrayList<>();
        long newest = watermark;
        for (Item item : listed) {
            if (item.createdUtc() > watermark) {
                fresh.add(item);
                newest = Math.max(newest, item.createdUtc());
            }
        }

        if (!listed.isEmpty() && listed.size() >= limit && fresh.size() == listed.size()) {
            LOG.debug("r/{} {}: all {} listed items are new, older ones may have been missed",
                    channel.name(), kind, listed.size());
        }

        long advanced = channel.advance(kind, newest);
        LOG.debug("r/{} {}: {} listed, {} new, watermark {} -> {}",
                channel.name(), kind, listed.size(), fresh.size(), watermark, advanced);
        return new Fetch(fresh, advanced);
    }

    int limitFor(ItemKind kind) {
        return kind == ItemKind.SUBMISSIONS ? config.getSubmissionLimit() : config.getCommentLimit();
    }

    /**
     * Result of one {@link #fetchNew} call.
     *
     * @param items        items newer than the previous watermark
     * @param newWatermark watermark after the call
     */
    public record Fetch(List<Item> items, long newWatermark) {

        public Fetch {
            items = List.copyOf(items);
        }
    }
}
