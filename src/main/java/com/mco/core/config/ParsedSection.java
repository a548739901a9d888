package com.mco.core.config;

import java.util.List;

/**
 * One {@code @name} section of a workflow document.
 *
 * @param name        section name without the marker
 * @param inlineValue quoted value on the marker line ({@code @goal "Ship it"}); nullable
 * @param body        parsed body: a map, a list or a string; null when the section has no body lines
 * @param annotations {@code >} lines attached to the section, in document order
 */
public record ParsedSection(
    String name,
    String inlineValue,
    Object body,
    List<String> annotations
) {

    public ParsedSection {
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    /** The inline value when present, otherwise the body. */
    public Object value() {
        return inlineValue != null ? inlineValue : body;
    }

    /** {@link #value()} rendered as text; maps and lists are not flattened. */
    public String textValue() {
        Object v = value();
        return v instanceof String s ? s : null;
    }
}
