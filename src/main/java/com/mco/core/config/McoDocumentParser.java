package com.mco.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
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
 * Line-based parser for the workflow document format.
 * <ul>
 *   <li>{@code @name}, {@code @name:}, {@code @name "value"} open a section</li>
 *   <li>{@code > text} attaches an annotation line to the current section</li>
 *   <li>{@code // text} is a comment</li>
 *   <li>anything else is body content of the current section</li>
 * </ul>
 * Bodies are parsed as JSON, a {@code - item} list, nested indented structure or
 * {@code key: value} pairs, falling back to raw text. A malformed section marker is
 * logged and its lines are skipped; the rest of the document still parses.
 */
public class McoDocumentParser {

    private static final Logger log = LoggerFactory.getLogger(McoDocumentParser.class);

    private static final Pattern SECTION_MARKER = Pattern.compile("^@([A-Za-z_][A-Za-z0-9_.-]*)\\s*:?\\s*(.*)$");

    private final ObjectMapper mapper;
    private final IndentedBlockParser indentedParser;

    public McoDocumentParser(ObjectMapper mapper) {
        this.mapper = mapper;
        this.indentedParser = new IndentedBlockParser(mapper);
    }

    public ParsedDocument parse(String content) {
        List<ParsedSection> sections = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return new ParsedDocument(sections);
        }

        SectionBuilder current = null;
        boolean skipping = false;
        String[] lines = content.split("\\r?\\n", -1);

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String trimmed = line.strip();

            if (trimmed.isEmpty() || trimmed.startsWith("//")) {
                continue;
            }

            if (trimmed.startsWith("@")) {
                if (current != null) {
                    sections.add(current.build());
                }
                Matcher m = SECTION_MARKER.matcher(trimmed);
                if (m.matches()) {
                    String inline = m.group(2).isBlank() ? null : ScalarValues.unquote(m.group(2));
                    current = new SectionBuilder(m.group(1), inline);
                    skipping = false;
                } else {
                    log.warn("Invalid section marker at line {}: '{}' (skipping until next section)", i + 1, trimmed);
                    current = null;
                    skipping = true;
                }
                continue;
            }

            if (skipping) {
                continue;
            }

            if (trimmed.startsWith(">")) {
                if (current == null) {
                    log.debug("Ignoring annotation outside any section at line {}", i + 1);
                } else {
                    current.annotations.add(annotationText(trimmed));
                }
                continue;
            }

            if (current == null) {
                log.debug("Ignoring line {} outside any section", i + 1);
            } else {
                current.bodyLines.add(line);
            }
        }

        if (current != null) {
            sections.add(current.build());
        }
        return new ParsedDocument(sections);
    }

    /**
     * Parses the body lines of one section.
     *
     * @return a map, a list or a string
     */
    Object parseBody(List<String> bodyLines) {
        String joined = String.join("\n", bodyLines).strip();

        if (ScalarValues.looksLikeJson(joined)) {
            try {
                return mapper.readValue(joined, Object.class);
            } catch (JsonProcessingException e) {
                log.debug("Section body looks like JSON but is not ({}); parsing as text", e.getOriginalMessage());
            }
        }

        if (indentDepths(bodyLines) > 1) {
            return indentedParser.parse(bodyLines);
        }

        List<String> listItems = flatListItems(bodyLines);
        if (listItems != null) {
            return listItems;
        }

        Map<String, Object> pairs = keyValuePairs(bodyLines);
        if (pairs.isEmpty() || (pairs.size() == 1 && pairs.containsKey("text"))) {
            return joined;
        }
        return pairs;
    }

    private static String annotationText(String trimmed) {
        String text = trimmed.substring(1).strip();
        if (text.startsWith("NLP ")) {
            text = text.substring(4).strip();
        }
        return ScalarValues.unquote(text);
    }

    private static int indentDepths(List<String> lines) {
        return (int) lines.stream()
                .filter(l -> !l.isBlank())
                .mapToInt(ScalarValues::indentOf)
                .distinct()
                .count();
    }

    /** Returns the items when every line is a {@code - item} entry, otherwise null. */
    private static List<String> flatListItems(List<String> lines) {
        List<String> items = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (!ScalarValues.isListItem(trimmed)) {
                return null;
            }
            items.add(ScalarValues.unquote(trimmed.substring(1).strip()));
        }
        return items.isEmpty() ? null : items;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> keyValuePairs(List<String> lines) {
        Map<String, Object> result = new LinkedHashMap<>();
        String currentKey = null;
        List<String> currentValue = new ArrayList<>();

        for (String line : lines) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }

            if (trimmed.contains(":") && !ScalarValues.isListItem(trimmed)) {
                if (currentKey != null && !currentValue.isEmpty()) {
                    result.put(currentKey, ScalarValues.unquote(String.join("\n", currentValue).strip()));
                }
                currentValue = new ArrayList<>();

                int colon = trimmed.indexOf(':');
                currentKey = trimmed.substring(0, colon).strip();
                String value = trimmed.substring(colon + 1).strip();

                if (value.startsWith("{") || value.startsWith("[")) {
                    Object parsed = ScalarValues.parse(value, mapper);
                    if (!(parsed instanceof String)) {
                        result.put(currentKey, parsed);
                        currentKey = null;
                        continue;
                    }
                }
                if (!value.isEmpty()) {
                    currentValue.add(value);
                }
            } else if (ScalarValues.isListItem(trimmed)) {
                ((List<Object>) result.computeIfAbsent("items", k -> new ArrayList<>()))
                        .add(ScalarValues.unquote(trimmed.substring(1).strip()));
            } else if (currentKey != null) {
                currentValue.add(trimmed);
            } else {
                ((List<Object>) result.computeIfAbsent("text", k -> new ArrayList<>())).add(trimmed);
            }
        }

        if (currentKey != null && !currentValue.isEmpty()) {
            result.put(currentKey, ScalarValues.unquote(String.join("\n", currentValue).strip()));
        }
        return result;
    }

    private final class SectionBuilder {
        private final String name;
        private final String inlineValue;
        private final List<String> bodyLines = new ArrayList<>();
        private final List<String> annotations = new ArrayList<>();

        SectionBuilder(String name, String inlineValue) {
            this.name = name;
            this.inlineValue = inlineValue;
        }

        ParsedSection build() {
            Object body = bodyLines.isEmpty() ? null : parseBody(bodyLines);
            return new ParsedSection(name, inlineValue, body, annotations);
        }
    }
}
