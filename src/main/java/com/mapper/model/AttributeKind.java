package com.mapper.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * The shape an OpenAPI schema node lowers to in the provider attribute tree.
 * <p>
 * Every node classifies to exactly one kind. Scalar kinds become leaves, collection kinds carry an
 * {@link ElementType}, and nested kinds carry an ordered list of child {@link Attribute}s.
 */
public enum AttributeKind {

    STRING,
    INT64,
    FLOAT64,
    BOOL,
    NUMBER,
    LIST,
    SET,
    MAP,
    SINGLE_NESTED,
    LIST_NESTED,
    SET_NESTED,
    MAP_NESTED;

    /**
     * @return {@code true} for leaf kinds that hold a single primitive value.
     */
    public boolean isScalar() {
        return this == STRING || this == INT64 || this == FLOAT64 || this == BOOL || this == NUMBER;
    }

    /**
     * @return {@code true} for list, set and map kinds whose elements are described by an element type.
     */
    public boolean isCollection() {
        return this == LIST || this == SET || this == MAP;
    }

    /**
     * @return {@code true} for kinds that carry a nested object made of child attributes.
     */
    public boolean isNested() {
        return this == SINGLE_NESTED || this == LIST_NESTED || this == SET_NESTED || this == MAP_NESTED;
    }

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
