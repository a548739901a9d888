package com.mco.core.engine;

import com.mco.core.model.ContextBlock;
import com.mco.core.model.CoreConfig;
import com.mco.core.model.Directive;
import com.mco.core.model.InjectionPlan;
import com.mco.core.model.Step;
import com.mco.core.model.SuccessCriteria;
import com.mco.core.model.WorkflowConfig;
import com.mco.core.planner.StepTypes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the {@link Directive} for one step from the workflow config, the injection plan
 * and the orchestration's variables. Pure function, no Spring dependencies.
 */
public final class DirectiveBuilder {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_.-]+)}");

    private DirectiveBuilder() {}

    public static Directive build(WorkflowConfig config, InjectionPlan plan, int stepIndex,
                                  Map<String, Object> variables) {
        Step step = config.steps().get(stepIndex);
        return new Directive(
                step.id(),
                step.type(),
                substitute(step.task(), variables, config.core().data()),
                guidance(config.successCriteria(), StepTypes.resolve(step)),
                stepIndex,
                config.totalSteps(),
                persistentContext(config),
                injectedContext(config, plan, stepIndex));
    }

    /**
     * Replaces {@code {name}} placeholders with orchestration variables, falling back to the
     * workflow's {@code @data} values. Unknown placeholders are left as written.
     */
    public static String substitute(String text, Map<String, Object> variables, Map<String, Object> data) {
        if (text == null || text.isEmpty()) {
            return text == null ? "" : text;
        }
        Matcher m = PLACEHOLDER.matcher(text);
        var sb = new StringBuilder();
        while (m.find()) {
            String name = m.group(1);
            Object value = variables.containsKey(name) ? variables.get(name) : data.get(name);
            String replacement = value != null ? String.valueOf(value) : m.group(0);
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Core and success-criteria data attached to every directive.
     */
    public static Map<String, Object> persistentContext(WorkflowConfig config) {
        CoreConfig core = config.core();
        Map<String, Object> coreMap = new LinkedHashMap<>();
        coreMap.put("name", core.name());
        putIfPresent(coreMap, "description", core.description());
        putIfPresent(coreMap, "version", core.version());
        coreMap.put("data", core.data());

        SuccessCriteria sc = config.successCriteria();
        Map<String, Object> criteriaMap = new LinkedHashMap<>();
        criteriaMap.put("goal", sc.goal());
        criteriaMap.put("criteria", sc.criteria());
        putIfPresent(criteriaMap, "target_audience", sc.targetAudience());
        putIfPresent(criteriaMap, "developer_vision", sc.developerVision());

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("core", coreMap);
        context.put("success_criteria", criteriaMap);
        return context;
    }

    /**
     * Feature and style blocks planned for {@code stepIndex}. A category with no blocks is
     * omitted even at a planned step.
     */
    static Map<String, Object> injectedContext(WorkflowConfig config, InjectionPlan plan, int stepIndex) {
        Map<String, Object> injected = new LinkedHashMap<>();
        if (plan.injectsFeaturesAt(stepIndex) && !config.features().isEmpty()) {
            injected.put("features", blockMaps(config.features().blocks()));
        }
        if (plan.injectsStylesAt(stepIndex) && !config.styles().isEmpty()) {
            injected.put("styles", blockMaps(config.styles().blocks()));
        }
        return injected;
    }

    static String guidance(SuccessCriteria sc, String stepType) {
        List<String> parts = new ArrayList<>();
        if (sc.goal() != null && !sc.goal().isBlank()) {
            parts.add("Goal: " + sc.goal());
        }
        if (sc.targetAudience() != null && !sc.targetAudience().isBlank()) {
            parts.add("Target Audience: " + sc.targetAudience());
        }
        if (sc.developerVision() != null && !sc.developerVision().isBlank()) {
            parts.add("Developer Vision: " + sc.developerVision());
        }
        if (!sc.criteria().isEmpty()) {
            var criteria = new StringBuilder("Success Criteria:");
            for (String item : sc.criteria()) {
                criteria.append("\n- ").append(item);
            }
            parts.add(criteria.toString());
        }
        parts.add(focusFor(stepType));
        return String.join("\n\n", parts);
    }

    private static String focusFor(String stepType) {
        return switch (stepType) {
            case StepTypes.PLAN -> "Focus on planning and architecture. Consider the overall structure and design.";
            case StepTypes.IMPLEMENT -> "Focus on implementation details. Write code and build functionality.";
            case StepTypes.STYLE -> "Focus on styling and presentation. Ensure the output is well-formatted and visually appealing.";
            case StepTypes.TEST -> "Focus on testing and validation. Ensure the implementation meets requirements.";
            case StepTypes.DOCUMENT -> "Focus on documentation. Explain how the implementation works and how to use it.";
            default -> "Complete the task according to the requirements.";
        };
    }

    private static List<Map<String, Object>> blockMaps(List<ContextBlock> blocks) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (ContextBlock block : blocks) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("title", block.title());
            map.put("guidance", block.guidance());
            result.add(map);
        }
        return result;
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (value != null && !value.isBlank()) {
            map.put(key, value);
        }
    }
}
