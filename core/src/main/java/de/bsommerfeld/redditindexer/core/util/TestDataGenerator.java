package de.bsommerfeld.redditindexer.core.util;

import de.bsommerfeld.redditindexer.core.domain.Item;
import de.bsommerfeld.redditindexer.core.domain.ItemKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * Generates plausible Reddit items for offline development and TEST mode.
 *
 * <h3>What the output looks like</h3>
 * <ul>
 * <li><strong>Submissions</strong>: three-part titles (subject + verb phrase
 * + qualifier), fullnames prefixed {@code t3_}</li>
 * <li><strong>Comments</strong>: short one-liners with mixed casing and
 * punctuation so tokenization has something to do, fullnames prefixed
 * {@code t1_}</li>
 * <li><strong>Timestamps</strong>: spread over the {@code spreadSeconds}
 * before {@code nowUtc}, returned newest first like a Reddit listing</li>
 * </ul>
 *
 * <p>
 * {@code TestContentApi} uses it to simulate live listings.
 */
public final class TestDataGenerator {

    private static final Random RND = new Random();

    private static final String[] TITLES_PART_1 = { "GME", "Rust vs Java", "The new GPU", "My landlord",
            "Bitcoin", "This sub", "Python 4", "The weather" };
    private static final String[] TITLES_PART_2 = { "is going to the moon", "finally explained",
            "broke again", "ELI5:", "is overrated", "- a retrospective", "just happened" };
    private static final String[] TITLES_PART_3 = { "(Discussion)", "[OC]", "???", "!!1!", "- thoughts?", "" };

    private static final String[] COMMENTS = {
            "This is the way.",
            "Can someone explain what's going on?",
            "I don't think that's how it works.",
            "Source? I'd like to read more.",
            "Underrated comment right here",
            "Hello World, hello again!",
            "Sir, this is a Wendy's.",
            "Came here to say this.",
            "Happy cake day!",
            "It's not a bug, it's a feature"
    };

    private TestDataGenerator() {
    }

    /**
     * Generates {@code count} items of one kind for a channel.
     *
     * @param nowUtc        newest possible creation timestamp (epoch seconds)
     * @param spreadSeconds how far back in time the items may reach
     */
    public static List<Item> generateItems(String channel, ItemKind kind, int count,
            long nowUtc, long spreadSeconds) {
        List<Item> items = new ArrayList<>(count);
        long created = nowUtc;
        long step = count > 0 ? Math.max(1, spreadSeconds / count) : 1;
        for (int i = 0; i < count; i++) {
            items.add(new Item(fullname(kind), channel, kind, body(kind), created));
            created = Math.max(0, created - 1 - RND.nextInt((int) Math.min(Integer.MAX_VALUE, step)));
        }
        return items;
    }

    private static String body(ItemKind kind) {
        if (kind == ItemKind.COMMENTS) {
            return pick(COMMENTS);
        }
        return (pick(TITLES_PART_1) + " " + pick(TITLES_PART_2) + " " + pick(TITLES_PART_3)).trim();
    }

    private static String fullname(ItemKind kind) {
        String prefix = kind == ItemKind.COMMENTS ? "t1_" : "t3_";
        return prefix + UUID.randomUUID().toString().substring(0, 7);
    }

    private static String pick(String[] pool) {
        return pool[RND.nextInt(pool.length)];
    }
}
