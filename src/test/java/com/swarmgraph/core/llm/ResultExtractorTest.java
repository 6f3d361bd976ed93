package com.swarmgraph.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultExtractorTest {

    private final ResultExtractor extractor = new ResultExtractor();

    @Test
    @DisplayName("strips a json code fence and parses the object")
    void stripsFence() {
        var result = extractor.extract("```json\n{\"a\":1}\n```");

        assertTrue(result.ok());
        assertEquals(Map.of("a", 1), result.payload());
    }

    @Test
    @DisplayName("plain text yields a raw capture instead of throwing")
    void plainTextFallsBack() {
        var result = extractor.extract("not json at all");

        assertFalse(result.ok());
        assertEquals(Map.of("raw", "not json at all"), result.payload());
        assertEquals("not json at all", result.raw());
    }

    @Test
    @DisplayName("raw capture is truncated to 500 characters")
    void rawCaptureTruncated() {
        String longText = "x".repeat(800);

        var result = extractor.extract(longText);

        assertFalse(result.ok());
        assertEquals(500, result.raw().length());
    }

    @Test
    @DisplayName("finds the object inside surrounding prose")
    void objectInsideProse() {
        var result = extractor.extract("Here is my analysis:\n{\"needs_iteration\": true}\nLet me know!");

        assertTrue(result.ok());
        assertTrue(result.bool("needs_iteration", false));
    }

    @Test
    @DisplayName("wraps a top-level array under items")
    void wrapsArray() {
        var result = extractor.extract("[1, 2, 3]");

        assertTrue(result.ok());
        assertEquals(List.of(1, 2, 3), result.list("items"));
    }

    @Test
    @DisplayName("blank and null input are failed extractions")
    void blankInput() {
        assertFalse(extractor.extract("").ok());
        assertFalse(extractor.extract(null).ok());
    }

    @Test
    @DisplayName("truncated JSON falls back to a raw capture")
    void truncatedJson() {
        var result = extractor.extract("```json\n{\"title\": \"Duel\", \"rules\": [\"draw");

        assertFalse(result.ok());
        assertTrue(result.raw().contains("\"title\": \"Duel\""));
    }

    @Test
    @DisplayName("typed getters fall back to defaults on missing or mistyped keys")
    void typedGetterDefaults() {
        var result = extractor.extract("{\"players\": \"4\", \"score\": \"high\", \"flag\": \"true\", \"nested\": {\"k\": \"v\"}}");

        assertEquals(4.0, result.number("players", 2));
        assertEquals(7.0, result.number("score", 7));
        assertTrue(result.bool("flag", false));
        assertEquals("fallback", result.string("missing", "fallback"));
        assertEquals("v", result.section("nested").string("k", ""));
        assertTrue(result.strings("missing").isEmpty());
    }

    @Test
    @DisplayName("integer getter rounds and holds values within range")
    void integerGetterClamps() {
        var result = extractor.extract("{\"huge\": 1e15, \"negative\": -5, \"fraction\": 2.6, \"word\": \"many\"}");

        assertEquals(100, result.integer("huge", 0, 0, 100));
        assertEquals(0, result.integer("negative", 3, 0, 100));
        assertEquals(3, result.integer("fraction", 0, 0, 100));
        assertEquals(7, result.integer("word", 7, 0, 100));
        assertEquals(7, result.integer("missing", 7, 0, 100));
    }
}
