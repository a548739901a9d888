package com.mco.dispatch.api;

/**
 * Inbound JSON body for PUT /api/v1/orchestrations/{id}/variables/{key}.
 */
public record VariableRequest(Object value) {}
