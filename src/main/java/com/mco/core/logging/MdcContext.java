package com.mco.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing orchestration MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setOrchestration(String orchestrationId) {
        MDC.put("orchestrationId", orchestrationId);
    }

    public static void setStep(String orchestrationId, String stepId) {
        MDC.put("orchestrationId", orchestrationId);
        MDC.put("stepId", stepId);
    }

    public static void setAdapter(String orchestrationId, String stepId, String adapter) {
        setStep(orchestrationId, stepId);
        MDC.put("adapter", adapter);
    }

    public static void clear() {
        MDC.remove("orchestrationId");
        MDC.remove("stepId");
        MDC.remove("adapter");
    }
}
