package com.mco.core.model;

import java.io.Serializable;

/**
 * One ordered unit of a workflow.
 *
 * @param id   unique step identifier (e.g. "plan", "developer_step_2")
 * @param task natural-language task text; may contain {@code {var}} placeholders
 * @param type optional type tag (plan, implement, style, test, document); nullable
 */
public record Step(
    String id,
    String task,
    String type
) implements Serializable {
}
