package com.mco.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a section body that uses nested indentation, such as a step list with per-step
 * properties:
 * <pre>
 * &#64;workflow_steps:
 *   plan:
 *     task: "Outline the report"
 *     type: plan
 *   draft:
 *     task: "Write it"
 *     depends_on:
 *       - plan
 * </pre>
 * Supports mappings, {@code - item} lists and {@code - key: value} list items at any depth.
 * Lines that fit neither shape are appended to the previous value as continuation text.
 * A body that mixes top-level keys and list entries becomes a mapping whose list entries sit
 * under {@code items}.
 */
public class IndentedBlockParser {

    private static final Logger log = LoggerFactory.getLogger(IndentedBlockParser.class);

    private static final Pattern KEY_VALUE = Pattern.compile("^([A-Za-z0-9_][A-Za-z0-9_ .-]*?)\\s*:(?:\\s+(.*)|\\s*)$");

    private final ObjectMapper mapper;

    public IndentedBlockParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param lines raw body lines, indentation intact; blank lines and comments are ignored
     * @return a {@code Map<String, Object>} or {@code List<Object>}
     */
    public Object parse(List<String> lines) {
        List<String> content = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith("//")) {
                content.add(line);
            }
        }
        if (content.isEmpty()) {
            return Map.of();
        }
        int baseIndent = content.stream().mapToInt(ScalarValues::indentOf).min().orElse(0);
        var cursor = new Cursor(content);
        Object result = parseBlock(cursor, baseIndent);
        if (!cursor.hasNext()) {
            return result;
        }
        Map<String, Object> map;
        if (result instanceof Map<?, ?>) {
            @SuppressWarnings("unchecked")
            Map<String, Object> existing = (Map<String, Object>) result;
            map = existing;
        } else {
            map = new LinkedHashMap<>();
            map.put("items", result);
        }
        // alternate between key runs and list runs at the base indent
        while (cursor.hasNext()) {
            if (ScalarValues.isListItem(cursor.peekTrimmed())) {
                addItems(map, parseList(cursor, baseIndent));
            } else {
                parseMap(cursor, baseIndent, map);
            }
        }
        return map;
    }

    @SuppressWarnings("unchecked")
    private static void addItems(Map<String, Object> map, List<Object> items) {
        if (map.get("items") instanceof List<?> existing) {
            ((List<Object>) existing).addAll(items);
        } else {
            map.put("items", items);
        }
    }

    private Object parseBlock(Cursor cursor, int indent) {
        if (ScalarValues.isListItem(cursor.peekTrimmed())) {
            return parseList(cursor, indent);
        }
        return parseMap(cursor, indent, new LinkedHashMap<>());
    }

    private Map<String, Object> parseMap(Cursor cursor, int indent, Map<String, Object> into) {
        String lastKey = null;
        while (cursor.hasNext()) {
            int lineIndent = cursor.peekIndent();
            String trimmed = cursor.peekTrimmed();
            if (lineIndent < indent || (lineIndent == indent && ScalarValues.isListItem(trimmed))) {
                break;
            }
            cursor.advance();

            Matcher m = KEY_VALUE.matcher(trimmed);
            if (lineIndent == indent && m.matches()) {
                String key = m.group(1).strip();
                String rest = m.group(2);
                if (rest == null || rest.isBlank()) {
                    into.put(key, nestedOrEmpty(cursor, indent));
                } else {
                    into.put(key, ScalarValues.parse(rest, mapper));
                }
                lastKey = key;
            } else {
                appendContinuation(into, lastKey, trimmed);
            }
        }
        return into;
    }

    private List<Object> parseList(Cursor cursor, int indent) {
        List<Object> items = new ArrayList<>();
        while (cursor.hasNext()) {
            int lineIndent = cursor.peekIndent();
            String trimmed = cursor.peekTrimmed();
            if (lineIndent < indent) {
                break;
            }
            if (lineIndent > indent || !ScalarValues.isListItem(trimmed)) {
                Object last = items.isEmpty() ? null : items.get(items.size() - 1);
                if (last instanceof String text) {
                    cursor.advance();
                    items.set(items.size() - 1, text + " " + trimmed);
                    continue;
                }
                if (lineIndent == indent) {
                    // a key after the list; the caller picks it up
                    break;
                }
                cursor.advance();
                if (last instanceof Map<?, ?>) {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> item = (Map<String, Object>) last;
                    appendContinuation(item, null, trimmed);
                } else {
                    log.warn("Dropping line with no enclosing list item: '{}'", trimmed);
                }
                continue;
            }
            cursor.advance();
            String content = trimmed.substring(1).strip();
            items.add(parseListItem(cursor, indent, content));
        }
        return items;
    }

    private Object parseListItem(Cursor cursor, int indent, String content) {
        if (content.isEmpty()) {
            return nestedOrEmpty(cursor, indent);
        }
        Matcher m = KEY_VALUE.matcher(content);
        if (!m.matches() || content.startsWith("\"")) {
            return ScalarValues.parse(content, mapper);
        }
        Map<String, Object> item = new LinkedHashMap<>();
        String key = m.group(1).strip();
        String rest = m.group(2);
        if (rest == null || rest.isBlank()) {
            item.put(key, nestedOrEmpty(cursor, indent));
        } else {
            item.put(key, ScalarValues.parse(rest, mapper));
        }
        if (cursor.hasNext() && cursor.peekIndent() > indent && !ScalarValues.isListItem(cursor.peekTrimmed())) {
            parseMap(cursor, cursor.peekIndent(), item);
        }
        return item;
    }

    private Object nestedOrEmpty(Cursor cursor, int indent) {
        if (cursor.hasNext() && cursor.peekIndent() > indent) {
            return parseBlock(cursor, cursor.peekIndent());
        }
        return "";
    }

    @SuppressWarnings("unchecked")
    private static void appendContinuation(Map<String, Object> into, String lastKey, String text) {
        if (lastKey != null && into.get(lastKey) instanceof String previous) {
            into.put(lastKey, previous.isEmpty() ? text : previous + "\n" + text);
            return;
        }
        Object existing = into.get("text");
        if (existing instanceof List<?> list) {
            ((List<Object>) list).add(text);
        } else {
            List<Object> textLines = new ArrayList<>();
            textLines.add(text);
            into.put("text", textLines);
        }
    }

    private static final class Cursor {
        private final List<String> lines;
        private int position;

        Cursor(List<String> lines) {
            this.lines = lines;
        }

        boolean hasNext() {
            return position < lines.size();
        }

        int peekIndent() {
            return ScalarValues.indentOf(lines.get(position));
        }

        String peekTrimmed() {
            return lines.get(position).strip();
        }

        void advance() {
            position++;
        }
    }
}
