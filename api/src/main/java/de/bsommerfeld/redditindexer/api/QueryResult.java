package de.bsommerfeld.redditindexer.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body of {@code /items/}.
 *
 * @param submissions matching submissions
 * @param comments    matching comments
 * @param time        time spent querying the store, in seconds
 */
public record QueryResult(
        @JsonProperty("submissions") List<ItemView> submissions,
        @JsonProperty("comments") List<ItemView> comments,
        @JsonProperty("time") double time) {
}
