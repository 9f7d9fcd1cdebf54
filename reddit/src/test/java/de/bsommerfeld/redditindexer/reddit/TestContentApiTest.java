package de.bsommerfeld.redditindexer.reddit;

import de.bsommerfeld.redditindexer.core.domain.Item;
import de.bsommerfeld.redditindexer.core.domain.ItemKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the offline content stub used in TEST mode.
 */
class TestContentApiTest {

    private final TestContentApi api = new TestContentApi(() -> 1_700_000_000L);

    @Test
    void newest_shouldSeedListingOnFirstCall() {
        List<Item> items = api.newest("test", ItemKind.SUBMISSIONS, 300);

        assertEquals(TestContentApi.SEED_SIZE, items.size());
        assertTrue(items.stream().allMatch(i -> i.channel().equals("test")));
        assertTrue(items.stream().allMatch(i -> i.id().startsWith("t3_")));
    }

    @Test
    void newest_shouldRespectLimit() {
        assertEquals(5, api.newest("test", ItemKind.COMMENTS, 5).size());
    }

    @Test
    void newest_shouldAddNewerItemsPeriodically() {
        long seeded = api.newest("test", ItemKind.COMMENTS, 1000).get(0).createdUtc();
        api.newest("test", ItemKind.COMMENTS, 1000);
        List<Item> third = api.newest("test", ItemKind.COMMENTS, 1000);

        assertEquals(TestContentApi.SEED_SIZE + TestContentApi.BURST_SIZE, third.size());
        assertTrue(third.get(0).createdUtc() > seeded);
        assertTrue(third.get(TestContentApi.BURST_SIZE - 1).createdUtc() > seeded);
    }

    @Test
    void newest_shouldKeepListingsSeparatePerKind() {
        api.newest("test", ItemKind.SUBMISSIONS, 10);
        List<Item> comments = api.newest("test", ItemKind.COMMENTS, 10);

        assertTrue(comments.stream().allMatch(i -> i.kind() == ItemKind.COMMENTS));
    }
}
