package com.mapper.oas;

/**
 * How the lowering engine reacts to a failing property.
 */
public enum ErrorMode {
    /** Stop at the first failure. */
    FAIL_FAST,
    /** Keep lowering the remaining siblings and report every failure together. */
    COLLECT
}
