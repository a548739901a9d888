package com.mco.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Ordered style blocks of a workflow. Empty when the styles document is absent.
 */
public record StyleSet(List<ContextBlock> blocks) implements Serializable {

    public StyleSet {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public static StyleSet empty() {
        return new StyleSet(List.of());
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }
}
