package com.mco.core.evaluator;

import com.mco.core.model.Evaluation;
import com.mco.core.model.StepResult;
import com.mco.core.model.SuccessCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Heuristic pass/fail scoring of executor output. This is approximate phrase and
 * substring matching, not semantic grading.
 * <p>
 * Precedence:
 * <ol>
 *   <li>a result reported with status ERROR fails</li>
 *   <li>a failure phrase in the output fails, with the rest of that line as feedback</li>
 *   <li>a success phrase in the output passes, with the rest of that line as feedback</li>
 *   <li>at least half of the declared criteria appearing in the output passes</li>
 *   <li>otherwise the step passes</li>
 * </ol>
 * The last rule favours forward progress. Evaluation never throws.
 */
@Component
public class SuccessEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SuccessEvaluator.class);

    static final List<String> FAILURE_INDICATORS = List.of("failure:", "failed to", "criteria not met", "unsuccessful");
    static final List<String> SUCCESS_INDICATORS = List.of("success:", "completed successfully", "task complete", "criteria met");

    static final String DEFAULT_SUCCESS_FEEDBACK = "Success: Task completed without explicit failure indicators";

    public Evaluation evaluate(String stepId, StepResult result, SuccessCriteria criteria, StepContext stepCtx) {
        double progress = stepCtx.progress();
        Map<String, Object> context = contextEcho(criteria);

        if (result == null) {
            return new Evaluation(false, "Error: No result reported", progress, context);
        }

        if (result.failed()) {
            String error = result.error() == null || result.error().isBlank() ? "Unknown error" : result.error();
            log.debug("Step {} failed: executor reported error", stepId);
            return new Evaluation(false, "Error: " + error, progress, context);
        }

        String output = result.output() == null ? "" : result.output();
        String failure = trailingText(output, FAILURE_INDICATORS);
        if (failure != null) {
            log.debug("Step {} failed: failure phrase in output", stepId);
            return new Evaluation(false, failure.isEmpty() ? "Failure detected in output" : failure, progress, context);
        }

        String success = trailingText(output, SUCCESS_INDICATORS);
        if (success != null) {
            log.debug("Step {} passed: success phrase in output", stepId);
            return new Evaluation(true, success.isEmpty() ? "Success detected in output" : success, progress, context);
        }

        List<String> items = criteria == null ? List.of() : criteria.criteria().stream()
                .filter(c -> c != null && !c.isBlank())
                .toList();
        if (!items.isEmpty()) {
            String lower = output.toLowerCase(Locale.ROOT);
            long met = items.stream()
                    .filter(c -> lower.contains(c.toLowerCase(Locale.ROOT)))
                    .count();
            if (met * 2 >= items.size()) {
                log.debug("Step {} passed: {} of {} criteria found in output", stepId, met, items.size());
                return new Evaluation(true,
                        "Success: " + met + " out of " + items.size() + " criteria met", progress, context);
            }
        }

        log.debug("Step {} passed by default", stepId);
        return new Evaluation(true, DEFAULT_SUCCESS_FEEDBACK, progress, context);
    }

    /**
     * Finds the first indicator (in list order) present in the output and returns the text
     * following it up to the end of that line, or null if no indicator is present.
     */
    private static String trailingText(String output, List<String> indicators) {
        for (String indicator : indicators) {
            int at = indexOfIgnoreCase(output, indicator);
            if (at >= 0) {
                int from = at + indicator.length();
                int eol = output.indexOf('\n', from);
                String trailing = (eol < 0 ? output.substring(from) : output.substring(from, eol)).strip();
                return trailing.startsWith(":") ? trailing.substring(1).strip() : trailing;
            }
        }
        return null;
    }

    private static int indexOfIgnoreCase(String text, String phrase) {
        for (int i = 0; i + phrase.length() <= text.length(); i++) {
            if (text.regionMatches(true, i, phrase, 0, phrase.length())) {
                return i;
            }
        }
        return -1;
    }

    private static Map<String, Object> contextEcho(SuccessCriteria criteria) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("goal", criteria == null || criteria.goal() == null ? "" : criteria.goal());
        context.put("target_audience", criteria == null || criteria.targetAudience() == null ? "" : criteria.targetAudience());
        context.put("developer_vision", criteria == null || criteria.developerVision() == null ? "" : criteria.developerVision());
        return context;
    }
}
