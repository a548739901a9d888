package com.mco.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IndentedBlockParserTest {

    private IndentedBlockParser parser;

    @BeforeEach
    void setUp() {
        parser = new IndentedBlockParser(new ObjectMapper());
    }

    private static List<String> lines(String text) {
        return text.lines().toList();
    }

    @Test
    @DisplayName("parses nested mappings")
    @SuppressWarnings("unchecked")
    void nestedMappings() {
        Object result = parser.parse(lines("""
                  developer:
                    role: "engineer"
                    limits:
                      max_files: 3
                """));

        Map<String, Object> root = (Map<String, Object>) result;
        Map<String, Object> developer = (Map<String, Object>) root.get("developer");
        assertEquals("engineer", developer.get("role"));
        assertEquals(Map.of("max_files", "3"), developer.get("limits"));
    }

    @Test
    @DisplayName("parses a list nested under a key")
    @SuppressWarnings("unchecked")
    void listUnderKey() {
        Object result = parser.parse(lines("""
                  writer:
                    steps:
                      - "Draft the intro"
                      - Review it
                """));

        Map<String, Object> writer = (Map<String, Object>) ((Map<String, Object>) result).get("writer");
        assertEquals(List.of("Draft the intro", "Review it"), writer.get("steps"));
    }

    @Test
    @DisplayName("parses - key: value list items with sibling keys")
    @SuppressWarnings("unchecked")
    void listOfMaps() {
        Object result = parser.parse(lines("""
                  - id: plan
                    task: "Outline"
                  - id: write
                    task: "Write"
                    type: implement
                """));

        List<Object> items = (List<Object>) result;
        assertEquals(2, items.size());
        assertEquals(Map.of("id", "plan", "task", "Outline"), items.get(0));
        assertEquals(Map.of("id", "write", "task", "Write", "type", "implement"), items.get(1));
    }

    @Test
    @DisplayName("appends unstructured deeper lines to the previous value")
    @SuppressWarnings("unchecked")
    void continuationLines() {
        Object result = parser.parse(lines("""
                  intro:
                    summary: first part
                      second part
                """));

        Map<String, Object> intro = (Map<String, Object>) ((Map<String, Object>) result).get("intro");
        assertEquals("first part\nsecond part", intro.get("summary"));
    }

    @Test
    @DisplayName("parses inline JSON values")
    @SuppressWarnings("unchecked")
    void inlineJson() {
        Object result = parser.parse(lines("""
                  step:
                    tags: ["a", "b"]
                """));

        Map<String, Object> step = (Map<String, Object>) ((Map<String, Object>) result).get("step");
        assertEquals(List.of("a", "b"), step.get("tags"));
    }

    @Test
    @DisplayName("resumes key parsing after a list whose last item is a mapping")
    @SuppressWarnings("unchecked")
    void keyAfterListOfMaps() {
        Object result = parser.parse(lines("""
                - task: Plan
                  type: plan
                - task: Build
                notes: keep me
                """));

        Map<String, Object> root = (Map<String, Object>) result;
        assertEquals(List.of(Map.of("task", "Plan", "type", "plan"), Map.of("task", "Build")), root.get("items"));
        assertEquals("keep me", root.get("notes"));
    }

    @Test
    @DisplayName("collects every list run between keys under items")
    @SuppressWarnings("unchecked")
    void alternatingKeysAndLists() {
        Object result = parser.parse(lines("""
                owner: ops
                - id: first
                  task: Check logs
                region: eu
                - second
                """));

        Map<String, Object> root = (Map<String, Object>) result;
        assertEquals("ops", root.get("owner"));
        assertEquals("eu", root.get("region"));
        assertEquals(List.of(Map.of("id", "first", "task", "Check logs"), "second"), root.get("items"));
    }

    @Test
    @DisplayName("keeps a scalar item's same-indent continuation on the item")
    void scalarContinuation() {
        Object result = parser.parse(lines("""
                - first item
                wraps here
                - second
                """));

        assertEquals(List.of("first item wraps here", "second"), result);
    }

    @Test
    @DisplayName("returns an empty map when there is no content")
    void emptyContent() {
        assertEquals(Map.of(), parser.parse(List.of("", "  // only a comment")));
    }
}
