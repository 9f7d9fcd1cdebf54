package de.bsommerfeld.redditindexer.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

public class IngestionConfig {

    @JsonProperty("submission-limit")
    @JsonPropertyDescription("Maximum submissions requested per subreddit and sweep (default: 300)")
    private int submissionLimit = 300;

    @JsonProperty("comment-limit")
    @JsonPropertyDescription("Maximum comments requested per subreddit and sweep (default: 1000)")
    private int commentLimit = 1000;

    @JsonProperty("update-interval-millis")
    @JsonPropertyDescription("Pause between two sweeps of a worker in milliseconds (default: 2000)")
    private long updateIntervalMillis = 2000;

    @JsonProperty("worker-count")
    @JsonPropertyDescription("Number of worker threads, 0 for one per subreddit (default: 5)")
    private int workerCount = 5;

    @JsonProperty("dedup-channels")
    @JsonPropertyDescription("Drop repeated subreddits before partitioning (default: true)")
    private boolean dedupChannels = true;

    @JsonProperty("erase-database")
    @JsonPropertyDescription("Delete all stored items and indexes on startup (default: false)")
    private boolean eraseDatabase = false;

    @JsonProperty("start-timestamp")
    @JsonPropertyDescription("Initial watermark in epoch seconds (default: 0)")
    private long startTimestamp = 0;

    @JsonProperty("shutdown-poll-millis")
    @JsonPropertyDescription("How often the main thread checks for a shutdown request (default: 5000)")
    private long shutdownPollMillis = 5000;

    public int getSubmissionLimit() {
        return submissionLimit;
    }

    public int getCommentLimit() {
        return commentLimit;
    }

    public long getUpdateIntervalMillis() {
        return updateIntervalMillis;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public boolean isDedupChannels() {
        return dedupChannels;
    }

    public boolean isEraseDatabase() {
        return eraseDatabase;
    }

    public long getStartTimestamp() {
        return startTimestamp;
    }

    public long getShutdownPollMillis() {
        return shutdownPollMillis;
    }
}
