package com.mco.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of asking an orchestration for its next unit of work.
 *
 * @param type      what kind of answer this is
 * @param directive the directive to run; only set for {@link DirectiveType#EXECUTE}
 * @param message   human-readable note for COMPLETE and ERROR answers
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DirectiveEnvelope(
    DirectiveType type,
    Directive directive,
    String message
) {

    public static DirectiveEnvelope execute(Directive directive) {
        return new DirectiveEnvelope(DirectiveType.EXECUTE, directive, null);
    }

    public static DirectiveEnvelope complete(String message) {
        return new DirectiveEnvelope(DirectiveType.COMPLETE, null, message);
    }

    public static DirectiveEnvelope error(String message) {
        return new DirectiveEnvelope(DirectiveType.ERROR, null, message);
    }
}
