package de.bsommerfeld.redditindexer.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChannelTest {

    @Test
    void constructor_shouldStartEveryKindAtStartTimestamp() {
        Channel channel = new Channel("test", 100);

        assertEquals(100, channel.watermark(ItemKind.SUBMISSIONS));
        assertEquals(100, channel.watermark(ItemKind.COMMENTS));
        assertEquals(100, channel.watermark());
    }

    @Test
    void advance_shouldMoveForward() {
        Channel channel = new Channel("test", 0);

        assertEquals(15, channel.advance(ItemKind.SUBMISSIONS, 15));
        assertEquals(15, channel.watermark(ItemKind.SUBMISSIONS));
    }

    @Test
    void advance_shouldNeverMoveBackwards() {
        Channel channel = new Channel("test", 0);
        channel.advance(ItemKind.COMMENTS, 20);

        assertEquals(20, channel.advance(ItemKind.COMMENTS, 5));
        assertEquals(20, channel.watermark(ItemKind.COMMENTS));
    }

    @Test
    void kinds_shouldAdvanceIndependently() {
        Channel channel = new Channel("test", 0);
        channel.advance(ItemKind.SUBMISSIONS, 7);

        assertEquals(0, channel.watermark(ItemKind.COMMENTS));
        assertEquals(7, channel.watermark());
    }

    @Test
    void constructor_shouldRejectBlankName() {
        assertThrows(IllegalArgumentException.class, () -> new Channel(" ", 0));
        assertThrows(IllegalArgumentException.class, () -> new Channel(null, 0));
    }

    @Test
    void constructor_shouldRejectNegativeStart() {
        assertThrows(IllegalArgumentException.class, () -> new Channel("test", -1));
    }

    @Test
    void item_shouldNormalizeNullBody() {
        Item item = new Item("t3_1", "test", ItemKind.SUBMISSIONS, null, 1);
        assertEquals("", item.body());
    }
}
