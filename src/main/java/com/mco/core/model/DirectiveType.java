package com.mco.core.model;

/**
 * Kind of answer returned by a next-directive request.
 */
public enum DirectiveType {
    /** A directive is ready to run. */
    EXECUTE,
    /** Every step has passed; nothing left to issue. */
    COMPLETE,
    /** The orchestration could not produce a directive (e.g. unknown id). */
    ERROR
}
