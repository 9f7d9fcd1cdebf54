package de.bsommerfeld.redditindexer.db;

import de.bsommerfeld.redditindexer.core.domain.ItemKind;

/**
 * Naming scheme of the stored corpus: one collection per (subreddit, kind)
 * pair and a fixed document layout shared by both kinds.
 *
 * <pre>
 * reddit__subm__{subreddit}   submissions
 * reddit__comm__{subreddit}   comments
 *
 * { subreddit, body, timestamp, word }
 * </pre>
 *
 * {@code word} holds the space-joined token set and carries the text index.
 */
public final class ItemSchema {

    public static final String COLLECTION_PREFIX = "reddit__";

    public static final String FIELD_ID = "_id";
    public static final String FIELD_CHANNEL = "subreddit";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_TIMESTAMP = "timestamp";
    public static final String FIELD_TOKENS = "word";

    /** Text index language. {@code none} disables stemming and stop words. */
    public static final String TEXT_LANGUAGE = "none";

    private ItemSchema() {
    }

    public static String collectionName(String channel, ItemKind kind) {
        return COLLECTION_PREFIX + kind.collectionPrefix() + channel;
    }
}
