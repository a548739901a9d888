package com.mco.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/orchestrations.
 *
 * @param configDir        workflow directory containing mco.core and mco.sc
 * @param adapter          registered adapter name; nullable for caller-driven execution
 * @param initialVariables variables for {@code {var}} substitution; nullable
 */
public record StartOrchestrationRequest(
    @JsonProperty("config_dir") String configDir,
    String adapter,
    @JsonProperty("initial_variables") Map<String, Object> initialVariables
) {}
