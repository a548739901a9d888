package com.mco.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed contents of a workflow's core document.
 *
 * @param name        workflow name
 * @param description free-text description; nullable
 * @param version     declared version; nullable
 * @param data        data-variable mapping declared under {@code @data}; values may be null
 * @param steps       ordered workflow steps
 */
public record CoreConfig(
    String name,
    String description,
    String version,
    Map<String, Object> data,
    List<Step> steps
) implements Serializable {

    public CoreConfig {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
