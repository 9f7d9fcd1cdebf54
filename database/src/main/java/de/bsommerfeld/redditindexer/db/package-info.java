/**
 * Persistence layer for harvested items: MongoDB in production, in-memory in
 * TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Worker loops]            [Read path]
 *        │                         │
 *        ▼                         │
 *   ItemWriter   ← builds documents, ensures indexes, isolates failures
 *        │                         │
 *        ▼                         ▼
 *   DocumentStore      ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴───┐
 *    │       │
 *  Mongo   InMemory
 * </pre>
 *
 * <h2>Collections</h2>
 * One collection per (subreddit, kind) pair inside the {@code reddit_parser}
 * database, see {@link de.bsommerfeld.redditindexer.db.ItemSchema}:
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ reddit__subm__{subreddit} / reddit__comm__{subreddit}            │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ _id              │ ObjectId assigned by the driver               │
 * │ subreddit        │ e.g. "java"                                   │
 * │ body             │ submission title or comment body              │
 * │ timestamp        │ creation time, epoch seconds                  │
 * │ word             │ distinct lower-case tokens, space separated   │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * Indexes: { timestamp: 1 }
 *          { word: "text", timestamp: 1 }  default_language = none
 * </pre>
 *
 * <h2>Read path</h2>
 * {@link de.bsommerfeld.redditindexer.db.ItemQuery} translates to
 * {@code { timestamp: { $gte, $lte }, $text: { $search, $language: "none" } }}
 * with a projection on {@code _id} and {@code body}.
 */
package de.bsommerfeld.redditindexer.db;
