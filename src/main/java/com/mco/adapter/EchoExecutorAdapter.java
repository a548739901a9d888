package com.mco.adapter;

import com.mco.core.model.Directive;
import com.mco.core.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Placeholder adapter that logs the rendered directive and reports the step complete.
 * Used for local smoke runs and tests. The prompt itself is not echoed into the output
 * because task text may contain evaluation phrases.
 */
@Component
public class EchoExecutorAdapter implements ExecutorAdapter {

    private static final Logger log = LoggerFactory.getLogger(EchoExecutorAdapter.class);

    public static final String NAME = "echo";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StepResult execute(Directive directive) {
        String prompt = DirectiveRenderer.render(directive);
        log.debug("Echo adapter received step {}:\n{}", directive.stepId(), prompt);
        return StepResult.success("Task complete: " + directive.stepId());
    }
}
