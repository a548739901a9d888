package com.mco.core.config;

import com.mco.core.model.ContextBlock;

import java.util.List;
import java.util.Map;

/**
 * Renders parsed sections and context blocks back into the workflow document format.
 * Section order, titles and annotation order are preserved; comments are not.
 * Pure function, no Spring dependencies.
 */
public final class McoDocumentWriter {

    private McoDocumentWriter() {}

    /**
     * Renders feature or style blocks as repeated {@code @<marker> "Title"} sections.
     *
     * @param marker section name, {@code feature} or {@code style}
     */
    public static String writeBlocks(String marker, List<ContextBlock> blocks) {
        var sb = new StringBuilder();
        for (ContextBlock block : blocks) {
            if (!sb.isEmpty()) {
                sb.append("\n");
            }
            sb.append("@").append(marker).append(" ").append(quote(block.title())).append("\n");
            for (String annotation : block.annotations()) {
                sb.append("> ").append(annotation).append("\n");
            }
            if (block.annotations().isEmpty() && block.guidance() != null && !block.guidance().isBlank()) {
                sb.append(block.guidance().strip()).append("\n");
            }
        }
        return sb.toString();
    }

    public static String write(ParsedDocument document) {
        var sb = new StringBuilder();
        for (ParsedSection section : document.sections()) {
            if (!sb.isEmpty()) {
                sb.append("\n");
            }
            sb.append("@").append(section.name());
            if (section.inlineValue() != null) {
                sb.append(" ").append(quote(section.inlineValue()));
            } else if (section.body() != null) {
                sb.append(":");
            }
            sb.append("\n");
            for (String annotation : section.annotations()) {
                sb.append("> ").append(annotation).append("\n");
            }
            if (section.body() != null) {
                appendBody(sb, section.body(), "  ");
            }
        }
        return sb.toString();
    }

    private static void appendBody(StringBuilder sb, Object body, String indent) {
        if (body instanceof Map<?, ?> map) {
            map.forEach((key, value) -> {
                if (value instanceof Map<?, ?> || value instanceof List<?>) {
                    sb.append(indent).append(key).append(":\n");
                    appendBody(sb, value, indent + "  ");
                } else {
                    sb.append(indent).append(key).append(": ").append(quote(String.valueOf(value))).append("\n");
                }
            });
        } else if (body instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> || item instanceof List<?>) {
                    sb.append(indent).append("-\n");
                    appendBody(sb, item, indent + "  ");
                } else {
                    sb.append(indent).append("- ").append(quote(String.valueOf(item))).append("\n");
                }
            }
        } else {
            for (String line : String.valueOf(body).split("\\r?\\n")) {
                sb.append(indent).append(line).append("\n");
            }
        }
    }

    private static String quote(String value) {
        return "\"" + value + "\"";
    }
}
