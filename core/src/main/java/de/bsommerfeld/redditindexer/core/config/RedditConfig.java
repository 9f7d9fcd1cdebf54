package de.bsommerfeld.redditindexer.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.List;

/**
 * Reddit harvesting parameters. Values are read from config.json at startup
 * and never change afterwards.
 */
public class RedditConfig {

    @JsonProperty("subreddits")
    @JsonPropertyDescription("List of subreddits to harvest")
    private List<String> subreddits = List.of("all");

    @JsonProperty("client-id")
    @JsonPropertyDescription("OAuth client id of a Reddit script app (empty: public endpoints)")
    private String clientId = "";

    @JsonProperty("client-secret")
    @JsonPropertyDescription("OAuth client secret of a Reddit script app")
    private String clientSecret = "";

    @JsonProperty("user-agent")
    @JsonPropertyDescription("User-Agent sent to Reddit (empty: built from the application version)")
    private String userAgent = "";

    public List<String> getSubreddits() {
        return subreddits;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public String getUserAgent() {
        return userAgent;
    }

    /** {@code true} when both OAuth credentials are present. */
    public boolean hasCredentials() {
        return clientId != null && !clientId.isBlank()
                && clientSecret != null && !clientSecret.isBlank();
    }
}
