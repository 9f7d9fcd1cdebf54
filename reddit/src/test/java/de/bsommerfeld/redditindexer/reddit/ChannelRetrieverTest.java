package de.bsommerfeld.redditindexer.reddit;

import de.bsommerfeld.redditindexer.core.config.IngestionConfig;
import de.bsommerfeld.redditindexer.core.domain.Channel;
import de.bsommerfeld.redditindexer.core.domain.Item;
import de.bsommerfeld.redditindexer.core.domain.ItemKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChannelRetrieverTest {

    @Mock
    private ContentApi contentApi;

    private Channel channel;
    private ChannelRetriever retriever;

    @BeforeEach
    void setUp() {
        channel = new Channel("test", 0);
        retriever = new ChannelRetriever(contentApi, channel, new IngestionConfig());
    }

    @Test
    void fetchNew_shouldKeepOnlyItemsAfterWatermark() throws Exception {
        channel.advance(ItemKind.SUBMISSIONS, 10);
        when(contentApi.newest("test", ItemKind.SUBMISSIONS, 300)).thenReturn(items(ItemKind.SUBMISSIONS, 5, 10, 15));

        ChannelRetriever.Fetch fetch = retriever.fetchNew(ItemKind.SUBMISSIONS);

        assertEquals(List.of(15L), fetch.items().stream().map(Item::createdUtc).toList());
        assertEquals(15, fetch.newWatermark());
        assertEquals(15, channel.watermark(ItemKind.SUBMISSIONS));
    }

    @Test
    void fetchNew_shouldScanUnorderedListings() throws Exception {
        when(contentApi.newest(anyString(), eq(ItemKind.COMMENTS), anyInt()))
                .thenReturn(items(ItemKind.COMMENTS, 3, 9, 7));

        ChannelRetriever.Fetch fetch = retriever.fetchNew(ItemKind.COMMENTS);

        assertEquals(3, fetch.items().size());
        assertEquals(9, fetch.newWatermark());
    }

    @Test
    void fetchNew_shouldLeaveWatermarkWhenNothingIsNew() throws Exception {
        channel.advance(ItemKind.SUBMISSIONS, 20);
        when(contentApi.newest(anyString(), any(), anyInt())).thenReturn(items(ItemKind.SUBMISSIONS, 5, 20));

        ChannelRetriever.Fetch fetch = retriever.fetchNew(ItemKind.SUBMISSIONS);

        assertTrue(fetch.items().isEmpty());
        assertEquals(20, fetch.newWatermark());
    }

    @Test
    void fetchNew_shouldHandleEmptyListing() throws Exception {
        when(contentApi.newest(anyString(), any(), anyInt())).thenReturn(List.of());

        ChannelRetriever.Fetch fetch = retriever.fetchNew(ItemKind.COMMENTS);

        assertTrue(fetch.items().isEmpty());
        assertEquals(0, fetch.newWatermark());
    }

    @Test
    void fetchNew_shouldNeverDecreaseWatermark() throws Exception {
        when(contentApi.newest(anyString(), any(), anyInt()))
                .thenReturn(items(ItemKind.SUBMISSIONS, 50))
                .thenReturn(items(ItemKind.SUBMISSIONS, 30, 40))
                .thenReturn(items(ItemKind.SUBMISSIONS, 60));

        long previous = channel.watermark(ItemKind.SUBMISSIONS);
        for (int i = 0; i < 3; i++) {
            long current = retriever.fetchNew(ItemKind.SUBMISSIONS).newWatermark();
            assertTrue(current >= previous);
            previous = current;
        }
        assertEquals(60, previous);
    }

    @Test
    void fetchNew_shouldLeaveWatermarkUntouchedOnFailure() throws Exception {
        channel.advance(ItemKind.COMMENTS, 42);
        when(contentApi.newest(anyString(), any(), anyInt())).thenThrow(new ContentApiException("HTTP 503"));

        assertThrows(ContentApiException.class, () -> retriever.fetchNew(ItemKind.COMMENTS));
        assertEquals(42, channel.watermark(ItemKind.COMMENTS));
    }

    @Test
    void fetchNew_shouldTrackKindsIndependently() throws Exception {
        when(contentApi.newest(anyString(), eq(ItemKind.SUBMISSIONS), anyInt()))
                .thenReturn(items(ItemKind.SUBMISSIONS, 100));
        when(contentApi.newest(anyString(), eq(ItemKind.COMMENTS), anyInt()))
                .thenReturn(items(ItemKind.COMMENTS, 50));

        retriever.fetchNew(ItemKind.SUBMISSIONS);
        ChannelRetriever.Fetch comments = retriever.fetchNew(ItemKind.COMMENTS);

        assertEquals(1, comments.items().size());
        assertEquals(100, channel.watermark(ItemKind.SUBMISSIONS));
        assertEquals(50, channel.watermark(ItemKind.COMMENTS));
        assertEquals(100, channel.watermark());
    }

    @Test
    void limitFor_shouldUseConfiguredLimits() {
        assertEquals(300, retriever.limitFor(ItemKind.SUBMISSIONS));
        assertEquals(1000, retriever.limitFor(ItemKind.COMMENTS));
    }

    private static List<Item> items(ItemKind kind, long... timestamps) {
        return Arrays.stream(timestamps)
                .mapToObj(ts -> new Item("id_" + ts, "test", kind, "body " + ts, ts))
                .toList();
    }
}
