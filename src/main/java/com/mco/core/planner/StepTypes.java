package com.mco.core.planner;

import com.mco.core.model.Step;

import java.util.List;
import java.util.Locale;

/**
 * Resolves a step's type tag: the declared tag when present, otherwise one inferred
 * from keywords in the task text. Matching is case-insensitive.
 */
public final class StepTypes {

    public static final String IMPLEMENT = "implement";
    public static final String STYLE = "style";
    public static final String PLAN = "plan";
    public static final String TEST = "test";
    public static final String DOCUMENT = "document";

    private record TypePattern(String type, List<String> keywords) {}

    // first match wins
    private static final List<TypePattern> PATTERNS = List.of(
            new TypePattern(IMPLEMENT, List.of("implement", "develop", "code", "build")),
            new TypePattern(STYLE, List.of("style", "format", "design", "present")),
            new TypePattern(PLAN, List.of("plan", "architect", "outline")),
            new TypePattern(TEST, List.of("test", "validate", "verify")),
            new TypePattern(DOCUMENT, List.of("document", "report"))
    );

    private StepTypes() {} // utility class

    public static String resolve(Step step) {
        if (step.type() != null && !step.type().isBlank()) {
            return step.type().strip().toLowerCase(Locale.ROOT);
        }
        return infer(step.task());
    }

    /**
     * @return the inferred type, {@link #IMPLEMENT} when nothing matches
     */
    public static String infer(String task) {
        if (task == null || task.isBlank()) {
            return IMPLEMENT;
        }
        String lower = task.toLowerCase(Locale.ROOT);
        for (TypePattern pattern : PATTERNS) {
            for (String keyword : pattern.keywords()) {
                if (lower.contains(keyword)) {
                    return pattern.type();
                }
            }
        }
        return IMPLEMENT;
    }
}
