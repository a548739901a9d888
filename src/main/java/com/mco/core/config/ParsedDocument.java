package com.mco.core.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered sections of one parsed workflow document. Section names may repeat
 * (e.g. several {@code @feature} blocks).
 */
public record ParsedDocument(List<ParsedSection> sections) {

    public static final String ANNOTATIONS_KEY = "_nlp";

    public ParsedDocument {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public Optional<ParsedSection> first(String name) {
        return sections.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public List<ParsedSection> all(String name) {
        return sections.stream().filter(s -> s.name().equals(name)).toList();
    }

    public Optional<String> text(String name) {
        return first(name).map(ParsedSection::textValue);
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }

    /**
     * Section name to value, the last occurrence winning. Annotations are carried under
     * {@value #ANNOTATIONS_KEY}: merged into map bodies, or next to a {@code value} entry otherwise.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (ParsedSection section : sections) {
            Object value = section.value();
            if (section.annotations().isEmpty()) {
                result.put(section.name(), value);
                continue;
            }
            Map<String, Object> withNotes = new LinkedHashMap<>();
            if (value instanceof Map<?, ?> map) {
                map.forEach((k, v) -> withNotes.put(String.valueOf(k), v));
            } else if (value != null) {
                withNotes.put("value", value);
            }
            withNotes.put(ANNOTATIONS_KEY, section.annotations());
            result.put(section.name(), withNotes);
        }
        return result;
    }
}
