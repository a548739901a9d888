package com.mco.core.planner;

import com.mco.core.model.InjectionPlan;
import com.mco.core.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides at which steps the optional feature and style blocks are surfaced.
 * <p>
 * A step's task text is matched case-insensitively against two vocabularies:
 * implementation words select feature injection, presentation words select style
 * injection. A category with no keyword match gets one synthetic injection point,
 * {@code floor(n/3)} for features and {@code floor(2n/3)} for styles, clamped to
 * {@code [1, n-1]} so every category is surfaced at least once.
 */
@Component
public class ContextInjectionPlanner {

    private static final Logger log = LoggerFactory.getLogger(ContextInjectionPlanner.class);

    static final List<String> IMPLEMENTATION_KEYWORDS = List.of("implement", "develop", "create", "build");
    static final List<String> PRESENTATION_KEYWORDS = List.of("style", "format", "present", "design");

    public InjectionPlan plan(List<Step> steps) {
        int total = steps.size();
        if (total == 0) {
            return InjectionPlan.empty();
        }

        Set<Integer> featureSteps = new TreeSet<>();
        Set<Integer> styleSteps = new TreeSet<>();
        for (int i = 0; i < total; i++) {
            String task = steps.get(i).task();
            if (matchesAny(task, IMPLEMENTATION_KEYWORDS)) {
                featureSteps.add(i);
            }
            if (matchesAny(task, PRESENTATION_KEYWORDS)) {
                styleSteps.add(i);
            }
        }

        if (featureSteps.isEmpty()) {
            featureSteps.add(fallbackIndex(total / 3, total));
        }
        if (styleSteps.isEmpty()) {
            styleSteps.add(fallbackIndex(2 * total / 3, total));
        }

        log.debug("Injection plan for {} steps: features at {}, styles at {}", total, featureSteps, styleSteps);
        return new InjectionPlan(featureSteps, styleSteps);
    }

    /** Clamps to [1, total-1]; a single-step workflow injects at index 0. */
    static int fallbackIndex(int candidate, int total) {
        int upper = total - 1;
        return Math.max(Math.min(1, upper), Math.min(candidate, upper));
    }

    private static boolean matchesAny(String text, List<String> keywords) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
