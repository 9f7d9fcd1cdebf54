package de.bsommerfeld.redditindexer.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One stored item as returned by {@code /items/}: its document id and its
 * text.
 */
public record ItemView(@JsonProperty("_id") String id, @JsonProperty("body") String body) {
}
