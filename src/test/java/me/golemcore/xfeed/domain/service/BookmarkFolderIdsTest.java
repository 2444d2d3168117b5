package me.golemcore.xfeed.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BookmarkFolderIdsTest {

    @Test
    void shouldExtractIdFromFolderUrl() {
        assertEquals("1234567890", BookmarkFolderIds.extract("https://x.com/i/bookmarks/1234567890").orElseThrow());
        assertEquals("987654", BookmarkFolderIds.extract("https://twitter.com/i/bookmarks/987654?s=20").orElseThrow());
    }

    @Test
    void shouldAcceptBareNumericId() {
        assertEquals("12345", BookmarkFolderIds.extract(" 12345 ").orElseThrow());
    }

    @Test
    void shouldRejectShortOrNonNumericInput() {
        assertTrue(BookmarkFolderIds.extract("1234").isEmpty());
        assertTrue(BookmarkFolderIds.extract("folder").isEmpty());
        assertTrue(BookmarkFolderIds.extract("https://x.com/i/bookmarks").isEmpty());
        assertTrue(BookmarkFolderIds.extract(null).isEmpty());
    }
}
