package com.mapper.oas;

import static com.mapper.oas.OasSchema.TYPE_ARRAY;
import static com.mapper.oas.OasSchema.TYPE_BOOLEAN;
import static com.mapper.oas.OasSchema.TYPE_INTEGER;
import static com.mapper.oas.OasSchema.TYPE_NUMBER;
import static com.mapper.oas.OasSchema.TYPE_OBJECT;
import static com.mapper.oas.OasSchema.TYPE_STRING;

import com.mapper.exception.RecursionLimitException;
import com.mapper.exception.SchemaException;
import com.mapper.exception.UnsupportedSchemaException;
import com.mapper.model.AttributeKind;
import com.mapper.model.AttributePath;
import com.mapper.model.ElementType;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides which {@link AttributeKind} a schema node lowers to.
 * <p>
 * The decision only looks at the node itself and, for arrays and maps, at whether the element node is
 * an object with properties. Rules are tried in order and the first match wins:
 * <ol>
 *   <li>a scalar type tag without structure, or no type tag at all, is a scalar picked by (type, format);</li>
 *   <li>an array with items is a list (or a set for unique items), nested when the items are objects;</li>
 *   <li>an object with only additional properties is a map, nested when the values are objects;</li>
 *   <li>an object with properties is a single nested object;</li>
 *   <li>anything else is unsupported.</li>
 * </ol>
 */
@Slf4j
public class SchemaClassifier {

    private static final String FORMAT_INT32 = "int32";
    private static final String FORMAT_INT64 = "int64";
    private static final String FORMAT_FLOAT = "float";
    private static final String FORMAT_DOUBLE = "double";

    private final LoweringPolicy policy;

    public SchemaClassifier(LoweringPolicy policy) {
        this.policy = policy;
    }

    /**
     * Classifies a node.
     *
     * @param node The node to classify.
     * @param path The attribute the node becomes, used in error messages.
     * @return The kind the node lowers to.
     * @throws SchemaException            if the node is malformed.
     * @throws UnsupportedSchemaException if no rule matches.
     */
    public AttributeKind classify(OasSchema node, AttributePath path) {
        String type = node.getType(path);
        Optional<OasSchema> additionalProperties = node.getAdditionalProperties(path);
        Optional<OasSchema> items = node.getItems();
        boolean structured = node.hasProperties() || additionalProperties.isPresent() || items.isPresent();

        if (type == null) {
            if (!structured) {
                return scalarFromFormat(node.getFormat());
            }
            type = items.isPresent() && !node.hasProperties() && additionalProperties.isEmpty() ? TYPE_ARRAY : TYPE_OBJECT;
            log.debug("{}: untyped node with structure treated as '{}'", path, type);
        }

        switch (type) {
            case TYPE_STRING:
            case TYPE_INTEGER:
            case TYPE_NUMBER:
            case TYPE_BOOLEAN:
                if (structured) {
                    throw new UnsupportedSchemaException(path, "scalar type '" + type + "' cannot declare properties, additionalProperties or items");
                }
                return scalarKind(type, node.getFormat(), path);
            case TYPE_ARRAY:
                return classifyArray(node, items, path);
            case TYPE_OBJECT:
                return classifyObject(node, additionalProperties, path);
            default:
                throw unsupported(node, path);
        }
    }

    /**
     * Builds the element type of a plain list, set or map from the node holding its elements.
     * Collections of collections are described recursively; objects are rejected since only the nested
     * attribute kinds can hold them.
     *
     * @param node  The {@code items} or {@code additionalProperties} node.
     * @param path  The collection attribute, used in error messages.
     * @param depth Current nesting depth, checked against the policy's ceiling.
     */
    public ElementType elementType(OasSchema node, AttributePath path, int depth) {
        if (depth > policy.getMaxDepth()) {
            throw new RecursionLimitException(path, "element type nesting exceeds the maximum depth of " + policy.getMaxDepth());
        }
        AttributeKind kind = classify(node, path);
        if (kind.isScalar()) {
            return ElementType.scalar(kind);
        }
        switch (kind) {
            case LIST:
            case SET:
                return ElementType.collection(kind, elementType(node.getItems().orElseThrow(), path, depth + 1));
            case MAP:
                return ElementType.mapOf(elementType(node.getAdditionalProperties(path).orElseThrow(), path, depth + 1));
            default:
                throw new UnsupportedSchemaException(path, "collections of " + kind.jsonName() + " elements cannot be nested inside another collection");
        }
    }

    private AttributeKind classifyArray(OasSchema node, Optional<OasSchema> items, AttributePath path) {
        if (items.isEmpty()) {
            throw new SchemaException(path, "array type declares no items");
        }
        boolean asSet = node.isUniqueItems() && policy.isUniqueItemsAsSet();
        if (items.get().isObjectWithProperties()) {
            return asSet ? AttributeKind.SET_NESTED : AttributeKind.LIST_NESTED;
        }
        return asSet ? AttributeKind.SET : AttributeKind.LIST;
    }

    private AttributeKind classifyObject(OasSchema node, Optional<OasSchema> additionalProperties, AttributePath path) {
        if (node.hasProperties()) {
            if (additionalProperties.isPresent()) {
                if (policy.getMixedObjectPolicy() == MixedObjectPolicy.REJECT) {
                    throw new SchemaException(path, "object declares both properties and additionalProperties");
                }
                log.warn("{}: object declares both properties and additionalProperties, ignoring additionalProperties", path);
            }
            return AttributeKind.SINGLE_NESTED;
        }
        if (additionalProperties.isPresent()) {
            return additionalProperties.get().isObjectWithProperties() ? AttributeKind.MAP_NESTED : AttributeKind.MAP;
        }
        throw unsupported(node, path);
    }

    private AttributeKind scalarKind(String type, String format, AttributePath path) {
        switch (type) {
            case TYPE_INTEGER:
                return AttributeKind.INT64;
            case TYPE_NUMBER:
                if (FORMAT_FLOAT.equals(format)) {
                    log.debug("{}: float format widened to float64", path);
                    return AttributeKind.FLOAT64;
                }
                return FORMAT_DOUBLE.equals(format) ? AttributeKind.FLOAT64 : AttributeKind.NUMBER;
            case TYPE_BOOLEAN:
                return AttributeKind.BOOL;
            default:
                return AttributeKind.STRING;
        }
    }

    private AttributeKind scalarFromFormat(String format) {
        if (FORMAT_INT32.equals(format) || FORMAT_INT64.equals(format)) {
            return AttributeKind.INT64;
        }
        if (FORMAT_FLOAT.equals(format) || FORMAT_DOUBLE.equals(format)) {
            return AttributeKind.FLOAT64;
        }
        return AttributeKind.STRING;
    }

    private UnsupportedSchemaException unsupported(OasSchema node, AttributePath path) {
        return new UnsupportedSchemaException(path, "no attribute shape matches schema with types " + node.getTypes()
                + (node.getFormat() != null ? " and format '" + node.getFormat() + "'" : ""));
    }
}
