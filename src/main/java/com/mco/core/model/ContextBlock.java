package com.mco.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A titled block of optional guidance, as found in the features and styles documents.
 *
 * @param title       block title (the inline value of {@code @feature "..."})
 * @param guidance    guidance text surfaced to the executor
 * @param annotations the block's {@code >} annotation lines, in document order
 */
public record ContextBlock(
    String title,
    String guidance,
    List<String> annotations
) implements Serializable {

    public ContextBlock {
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }
}
