package com.mapper.oas;

import com.mapper.model.AttributeKind;
import java.util.Locale;

/**
 * The generated construct an attribute tree is built for. Both targets share one traversal and
 * differ only in what a leaf may carry.
 */
public enum OutputTarget {

    RESOURCE(true, true),
    DATA_SOURCE(false, false);

    private final boolean supportsDefaults;
    private final boolean includesWriteOnly;

    OutputTarget(boolean supportsDefaults, boolean includesWriteOnly) {
        this.supportsDefaults = supportsDefaults;
        this.includesWriteOnly = includesWriteOnly;
    }

    /**
     * @return {@code true} when leaves may carry a static default taken from the schema.
     */
    public boolean supportsDefaults() {
        return supportsDefaults;
    }

    /**
     * @return {@code false} when {@code writeOnly} properties are left out, since they can never be read back.
     */
    public boolean includesWriteOnly() {
        return includesWriteOnly;
    }

    public boolean allows(AttributeKind kind, LoweringPolicy policy) {
        return this != DATA_SOURCE || !policy.getDataSourceDisallowedKinds().contains(kind);
    }

    /**
     * Parses {@code resource}, {@code data-source} or {@code data_source}, ignoring case.
     */
    public static OutputTarget fromString(String value) {
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        if ("DATASOURCE".equals(normalized)) {
            return DATA_SOURCE;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown target '" + value + "', expected 'resource' or 'data-source'", e);
        }
    }
}
