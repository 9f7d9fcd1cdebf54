package de.bsommerfeld.redditindexer.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Where the document store lives. The database holds one collection per
 * (subreddit, item kind) pair.
 */
public class MongoConfig {

    @JsonProperty("host")
    @JsonPropertyDescription("MongoDB host (default: localhost)")
    private String host = "localhost";

    @JsonProperty("port")
    @JsonPropertyDescription("MongoDB port (default: 27017)")
    private int port = 27017;

    @JsonProperty("database")
    @JsonPropertyDescription("Database holding the item collections (default: reddit_parser)")
    private String database = "reddit_parser";

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getDatabase() {
        return database;
    }

    /** Connection string for the MongoDB driver. */
    public String getConnectionString() {
        return "mongodb://" + host + ":" + port;
    }
}
