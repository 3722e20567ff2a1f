package com.mapper.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Describes the elements of a plain list, set or map attribute.
 * <p>
 * An element type is either a scalar, or a list/set/map whose own elements are described by a
 * further element type. Structural objects are never element types; they lower to the nested
 * attribute kinds instead.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ElementType {

    AttributeKind kind;

    /**
     * The element type of a collection element, {@code null} for scalars.
     */
    @JsonProperty("element_type")
    ElementType elementType;

    public static ElementType scalar(AttributeKind kind) {
        if (!kind.isScalar()) {
            throw new IllegalArgumentException("Not a scalar kind: " + kind);
        }
        return new ElementType(kind, null);
    }

    public static ElementType collection(AttributeKind kind, ElementType elementType) {
        if (!kind.isCollection()) {
            throw new IllegalArgumentException("Not a collection kind: " + kind);
        }
        if (elementType == null) {
            throw new IllegalArgumentException("A " + kind.jsonName() + " element type needs its own element type");
        }
        return new ElementType(kind, elementType);
    }

    public static ElementType listOf(ElementType elementType) {
        return collection(AttributeKind.LIST, elementType);
    }

    public static ElementType setOf(ElementType elementType) {
        return collection(AttributeKind.SET, elementType);
    }

    public static ElementType mapOf(ElementType elementType) {
        return collection(AttributeKind.MAP, elementType);
    }

    @Override
    public String toString() {
        return elementType == null ? kind.jsonName() : kind.jsonName() + "<" + elementType + ">";
    }
}
