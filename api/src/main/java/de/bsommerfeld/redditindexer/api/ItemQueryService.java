package de.bsommerfeld.redditindexer.api;

import com.google.inject.Singleton;
import de.bsommerfeld.redditindexer.core.domain.ItemKind;
import de.bsommerfeld.redditindexer.db.DocumentStore;
import de.bsommerfeld.redditindexer.db.ItemQuery;
import de.bsommerfeld.redditindexer.db.ItemSchema;
import jakarta.inject.Inject;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Looks up stored submissions and comments of one subreddit.
 *
 * <p>
 * Both collections of the subreddit are queried with the same filter: an
 * inclusive timestamp range and, if a keyword is given, a text search on the
 * token field. Comments are queried first, then submissions.
 */
@Singleton
public class ItemQueryService {

    private static final Logger LOG = LoggerFactory.getLogger(ItemQueryService.class);

    private final DocumentStore store;

    @Inject
    public ItemQueryService(DocumentStore store) {
        this.store = store;
    }

    public QueryResult query(ItemQuery query) {
        long start = System.nanoTime();

        List<ItemView> comments = find(query, ItemKind.COMMENTS);
        List<ItemView> submissions = find(query, ItemKind.SUBMISSIONS);

        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        LOG.info("r/{} [{}, {}] key={}: {} submissions, {} comments in {}s", query.channel(),
                query.fromTimestamp(), query.toTimestamp(), query.keyword(), submissions.size(), comments.size(),
                String.format("%.3f", seconds));
        return new QueryResult(submissions, comments, seconds);
    }

    private List<ItemView> find(ItemQuery query, ItemKind kind) {
        List<Document> documents = store.find(ItemSchema.collectionName(query.channel(), kind), query);
        List<ItemView> views = new ArrayList<>(documents.size());
        for (Document document : documents) {
            views.add(new ItemView(idOf(document), document.getString(ItemSchema.FIELD_BODY)));
        }
        return views;
    }

    private static String idOf(Document document) {
        Object id = document.get(ItemSchema.FIELD_ID);
        if (id instanceof ObjectId objectId)
            return objectId.toHexString();
        return id != null ? id.toString() : null;
    }
}
