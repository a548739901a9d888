package com.mco.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Helpers for single values found in workflow documents.
 */
final class ScalarValues {

    private ScalarValues() {}

    /** Strips one pair of surrounding double quotes, if present. */
    static String unquote(String raw) {
        if (raw == null) {
            return null;
        }
        String s = raw.strip();
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }

    static boolean looksLikeJson(String text) {
        String s = text.strip();
        return (s.startsWith("{") && s.endsWith("}")) || (s.startsWith("[") && s.endsWith("]"));
    }

    /**
     * Parses an inline value: JSON when it looks like JSON and is valid, otherwise the
     * unquoted string.
     */
    static Object parse(String raw, ObjectMapper mapper) {
        String s = raw.strip();
        if (looksLikeJson(s)) {
            try {
                return mapper.readValue(s, Object.class);
            } catch (JsonProcessingException e) {
                return unquote(s);
            }
        }
        return unquote(s);
    }

    static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    static boolean isListItem(String trimmed) {
        return trimmed.startsWith("-") && !trimmed.startsWith("--");
    }
}
