package com.mco.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/workflows/validate.
 */
public record ValidateWorkflowRequest(
    @JsonProperty("config_dir") String configDir
) {}
