package com.mco.adapter;

import com.mco.core.model.Directive;

import java.util.List;
import java.util.Map;

/**
 * Converts a Directive into a prompt string an agent can read.
 * Pure function, no Spring dependencies.
 */
public final class DirectiveRenderer {

    private DirectiveRenderer() {}

    public static String render(Directive directive) {
        var sb = new StringBuilder();

        sb.append("# Step ").append(directive.stepIndex() + 1).append(" of ").append(directive.totalSteps())
          .append(": ").append(directive.stepId()).append("\n\n");

        sb.append("## Task\n\n");
        sb.append(directive.instruction()).append("\n\n");

        if (directive.guidance() != null && !directive.guidance().isBlank()) {
            sb.append("## Guidance\n\n");
            sb.append(directive.guidance()).append("\n\n");
        }

        appendBlocks(sb, "## Features", directive.injectedContext().get("features"));
        appendBlocks(sb, "## Styles", directive.injectedContext().get("styles"));

        sb.append("## Reporting\n\n");
        sb.append("- End with a line that starts with the word Success and a colon when the task is done\n");
        sb.append("- If it is not done, start that line with the word Failure and a colon, then give the reason\n");

        return sb.toString();
    }

    private static void appendBlocks(StringBuilder sb, String heading, Object blocks) {
        if (!(blocks instanceof List<?> list) || list.isEmpty()) {
            return;
        }
        sb.append(heading).append("\n\n");
        for (Object block : list) {
            if (block instanceof Map<?, ?> map) {
                sb.append("### ").append(map.get("title")).append("\n\n");
                Object guidance = map.get("guidance");
                if (guidance != null && !String.valueOf(guidance).isBlank()) {
                    sb.append(guidance).append("\n\n");
                }
            } else {
                sb.append("- ").append(block).append("\n");
            }
        }
        sb.append("\n");
    }
}
