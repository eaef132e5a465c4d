package sitesearch;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PageIndexTest {

    @Test
    void searchIsCaseInsensitive() {
        PageIndex index = new PageIndex();
        index.add("page1", "KEYword here");

        assertEquals(List.of("page1"), index.search("keyword"));
        assertEquals(List.of("page1"), index.search("HERE"));
    }

    @Test
    void searchWithoutMatchReturnsEmptyList() {
        PageIndex index = new PageIndex();
        index.add("page1", "No match here");

        assertEquals(List.of(), index.search("notfound"));
    }

    @Test
    void nullOrEmptyKeywordReturnsEmptyList() {
        PageIndex index = new PageIndex();
        index.add("page1", "something");

        assertEquals(List.of(), index.search(null));
        assertEquals(List.of(), index.search(""));
    }

    @Test
    void resultsFollowInsertionOrderNotAlphabetical() {
        PageIndex index = new PageIndex();
        index.add("https://example.com/zebra", "shared word");
        index.add("https://example.com/apple", "SHARED too");
        index.add("https://example.com/mango", "unrelated");
        index.add("https://example.com/banana", "also Shared");

        assertEquals(List.of(
                "https://example.com/zebra",
                "https://example.com/apple",
                "https://example.com/banana"), index.search("shared"));
    }

    @Test
    void firstInsertionWins() {
        PageIndex index = new PageIndex();

        assertTrue(index.add("page1", "first text"));
        assertFalse(index.add("page1", "second text"));

        assertEquals("first text", index.textOf("page1").orElseThrow());
        assertEquals(1, index.size());
        assertEquals(List.of(), index.search("second text"));
    }

    @Test
    void substringMatchesInsideWords() {
        PageIndex index = new PageIndex();
        index.add("page1", "Testing the crawler");

        assertEquals(List.of("page1"), index.search("test"));
        assertEquals(List.of("page1"), index.search("ing the cr"));
    }

    @Test
    void unknownUrlHasNoText() {
        PageIndex index = new PageIndex();

        assertTrue(index.textOf("missing").isEmpty());
        assertFalse(index.contains("missing"));
        assertTrue(index.isEmpty());
    }
}
