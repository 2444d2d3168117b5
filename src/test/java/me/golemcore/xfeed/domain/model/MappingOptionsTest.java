package me.golemcore.xfeed.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MappingOptionsTest {

    @Test
    void shouldClampNegativeQuoteDepth() {
        assertEquals(0, new MappingOptions(-3, false).quoteDepth());
    }

    @Test
    void shouldKeepRawFlagWhenChangingDepth() {
        MappingOptions options = new MappingOptions(1, true).withQuoteDepth(2);

        assertEquals(2, options.quoteDepth());
        assertTrue(options.includeRaw());
    }
}
