package de.bsommerfeld.redditindexer.api;

import de.bsommerfeld.redditindexer.db.ItemQuery;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * {@code GET /items/?subreddit=..&from=..&to=..[&key=..]}
 *
 * <p>
 * Answers {@code {"submissions": [...], "comments": [...], "time": s}}, each
 * item as {@code {"_id": .., "body": ..}}. {@code from} and {@code to} are
 * inclusive epoch seconds; a blank {@code key} means no keyword filter.
 * Error responses are produced by {@link ApiExceptionHandler}.
 */
@RestController
class ItemsController {

    private final ItemQueryService queryService;

    ItemsController(ItemQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping(path = "/items/", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<QueryResult> items(@RequestParam("subreddit") String subreddit,
            @RequestParam("from") long from,
            @RequestParam("to") long to,
            @RequestParam(name = "key", required = false) String key) {
        return ResponseEntity.ok(queryService.query(new ItemQuery(subreddit, from, to, key)));
    }
}
