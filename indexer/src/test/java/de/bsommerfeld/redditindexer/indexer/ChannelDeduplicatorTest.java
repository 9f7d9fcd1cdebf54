package de.bsommerfeld.redditindexer.indexer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChannelDeduplicatorTest {

    @Test
    void dedup_shouldKeepEachEntryOnce() {
        assertEquals(Set.of("java", "rust"), ChannelDeduplicator.dedup(List.of("java", "rust", "java", "java")));
    }

    @Test
    void dedup_shouldBeCaseSensitive() {
        assertEquals(2, ChannelDeduplicator.dedup(List.of("Java", "java")).size());
    }

    @Test
    void dedup_shouldHandleEmptyInput() {
        assertTrue(ChannelDeduplicator.dedup(List.of()).isEmpty());
    }
}
