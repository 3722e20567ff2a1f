package com.mapper.oas;

/**
 * What to do with an object node that declares both {@code properties} and {@code additionalProperties}.
 */
public enum MixedObjectPolicy {
    /** Lower it as a single nested object and ignore the additional-properties overlay. */
    PROPERTIES_WIN,
    /** Fail with a schema error. */
    REJECT
}
