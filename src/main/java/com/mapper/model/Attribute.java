package com.mapper.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.With;

/**
 * One node of the provider attribute tree handed to the code rendering stage.
 * <p>
 * The {@link #kind} decides which of the variant fields is populated: scalar leaves may carry
 * {@code sensitive} (strings only) and {@code defaultValue}; plain collections carry an
 * {@code elementType}; nested kinds carry the ordered child {@code attributes}. Instances are
 * immutable and compare by value, so two lowerings of the same schema are equal.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Attribute {

    String name;

    AttributeKind kind;

    @JsonProperty("computed_optional_required")
    ComputedOptionalRequired computability;

    String description;

    Boolean sensitive;

    @JsonProperty("element_type")
    ElementType elementType;

    List<Attribute> attributes;

    /**
     * Static default applied by resources when the practitioner leaves the attribute unset.
     */
    @With
    @JsonProperty("default")
    Object defaultValue;

    @With
    @JsonProperty("deprecation_message")
    String deprecationMessage;

    /**
     * Creates a scalar leaf.
     *
     * @param sensitive Only meaningful for {@link AttributeKind#STRING}; ignored for other kinds.
     */
    public static Attribute scalar(String name, AttributeKind kind, ComputedOptionalRequired computability,
                                   String description, boolean sensitive) {
        if (!kind.isScalar()) {
            throw new IllegalArgumentException("Not a scalar kind: " + kind);
        }
        Boolean sensitiveFlag = kind == AttributeKind.STRING && sensitive ? Boolean.TRUE : null;
        return new Attribute(name, kind, computability, description, sensitiveFlag, null, null, null, null);
    }

    /**
     * Creates a list, set or map attribute whose values are described by {@code elementType}.
     */
    public static Attribute collection(String name, AttributeKind kind, ComputedOptionalRequired computability,
                                       String description, ElementType elementType) {
        if (!kind.isCollection()) {
            throw new IllegalArgumentException("Not a collection kind: " + kind);
        }
        if (elementType == null) {
            throw new IllegalArgumentException("Collection attribute '" + name + "' needs an element type");
        }
        return new Attribute(name, kind, computability, description, null, elementType, null, null, null);
    }

    /**
     * Creates a nested attribute. For single nested kinds the children are the object's own fields;
     * for list, set and map nested kinds they describe the nested object stored in each element.
     */
    public static Attribute nested(String name, AttributeKind kind, ComputedOptionalRequired computability,
                                   String description, List<Attribute> attributes) {
        if (!kind.isNested()) {
            throw new IllegalArgumentException("Not a nested kind: " + kind);
        }
        return new Attribute(name, kind, computability, description, null, null, List.copyOf(attributes), null, null);
    }
}
