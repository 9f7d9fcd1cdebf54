package de.bsommerfeld.redditindexer.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

public class ApiConfig {

    @JsonProperty("port")
    @JsonPropertyDescription("Port of the /items/ endpoint (default: 5000)")
    private int port = 5000;

    public int getPort() {
        return port;
    }
}
