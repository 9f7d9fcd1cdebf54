package de.bsommerfeld.redditindexer.core.domain;

import java.util.Objects;

/**
 * Immutable snapshot of a submission or comment as returned by the content
 * API. Items are never updated after insertion.
 *
 * @param id         Reddit fullname ({@code t3_...} or {@code t1_...})
 * @param channel    subreddit the item was fetched from
 * @param kind       submission or comment
 * @param body       submission title or comment body
 * @param createdUtc creation timestamp in epoch seconds (UTC)
 */
public record Item(
        String id,
        String channel,
        ItemKind kind,
        String body,
        long createdUtc) {

    /**
     * Canonical constructor. Channel and kind are mandatory, a missing body
     * is normalized to the empty string.
     */
    public Item {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(kind, "kind");
        body = body != null ? body : "";
    }
}
