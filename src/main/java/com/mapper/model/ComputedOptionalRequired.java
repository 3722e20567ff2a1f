package com.mapper.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Whether a practitioner must set an attribute, may set it, or only reads it back from the provider.
 */
public enum ComputedOptionalRequired {

    REQUIRED,
    OPTIONAL,
    COMPUTED,
    COMPUTED_OPTIONAL;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses either the JSON form ({@code computed_optional}) or the constant name, ignoring case.
     *
     * @param value The textual status.
     * @return The matching status.
     * @throws IllegalArgumentException if the value names no status.
     */
    @JsonCreator
    public static ComputedOptionalRequired fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Computability must not be null");
        }
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
