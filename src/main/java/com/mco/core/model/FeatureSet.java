package com.mco.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Ordered feature blocks of a workflow. Empty when the features document is absent.
 */
public record FeatureSet(List<ContextBlock> blocks) implements Serializable {

    public FeatureSet {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public static FeatureSet empty() {
        return new FeatureSet(List.of());
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }
}
