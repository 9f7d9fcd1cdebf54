package de.bsommerfeld.redditindexer.reddit;

import de.bsommerfeld.redditindexer.core.domain.Item;
import de.bsommerfeld.redditindexer.core.domain.ItemKind;

import java.util.List;

/**
 * Source of the most recent items of a subreddit.
 *
 * @see RedditContentApi
 * @see TestContentApi
 */
public interface ContentApi {

    /**
     * Returns up to {@code limit} of the newest items of {@code kind} in
     * {@code channel}, newest first.
     *
     * @throws ContentApiException if the listing cannot be retrieved
     */
    List<Item> newest(String channel, ItemKind kind, int limit) throws ContentApiException;
}
