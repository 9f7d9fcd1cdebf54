package de.bsommerfeld.redditindexer.db;

/**
 * A read-path query: items of one subreddit created within
 * {@code [fromTimestamp, toTimestamp]}, optionally restricted to those whose
 * token field matches {@code keyword}.
 *
 * @param channel       subreddit name
 * @param fromTimestamp inclusive lower bound, epoch seconds
 * @param toTimestamp   inclusive upper bound, epoch seconds
 * @param keyword       full-text search term, {@code null} for none
 */
public record ItemQuery(String channel, long fromTimestamp, long toTimestamp, String keyword) {

    public ItemQuery {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel must not be blank");
        }
        keyword = keyword == null || keyword.isBlank() ? null : keyword;
    }

    public boolean hasKeyword() {
        return keyword != null;
    }
}
