package de.bsommerfeld.redditindexer.core.config;

import com.fasterxml.jackson.annotation.JsonClassDescription;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

@JsonClassDescription("Reddit Indexer - Global Configuration")
public class IndexerConfig {

    @JsonProperty("mode")
    @JsonPropertyDescription("prod (Reddit + MongoDB) or test (synthetic data, in-memory store)")
    private ApplicationMode mode = ApplicationMode.PROD;

    @JsonProperty("mongo")
    @JsonPropertyDescription("Document store connection")
    private MongoConfig mongo = new MongoConfig();

    @JsonProperty("reddit")
    @JsonPropertyDescription("Watched subreddits and API credentials")
    private RedditConfig reddit = new RedditConfig();

    @JsonProperty("ingestion")
    @JsonPropertyDescription("Polling, partitioning and startup behavior")
    private IngestionConfig ingestion = new IngestionConfig();

    @JsonProperty("api")
    @JsonPropertyDescription("Read endpoint settings")
    private ApiConfig api = new ApiConfig();

    public ApplicationMode getMode() {
        return mode;
    }

    void setMode(ApplicationMode mode) {
        this.mode = mode;
    }

    public MongoConfig getMongo() {
        return mongo;
    }

    public RedditConfig getReddit() {
        return reddit;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public ApiConfig getApi() {
        return api;
    }
}
