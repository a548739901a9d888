package com.mco.core.model;

/**
 * Outcome status an executor reports alongside its output.
 */
public enum ResultStatus {
    SUCCESS,
    ERROR
}
