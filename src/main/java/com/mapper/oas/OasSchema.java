package com.mapper.oas;

import com.mapper.exception.SchemaException;
import com.mapper.model.AttributePath;
import io.swagger.v3.oas.models.media.Schema;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view over a swagger-models {@link Schema} that exposes the normalized facts the lowering
 * engine needs.
 * <p>
 * The wrapped schema is expected to be fully reference-resolved already; this class never follows
 * {@code $ref} and never mutates the document. Accessors that can only fail on a malformed node take
 * the {@link AttributePath} of the attribute being built so the error names its location.
 */
public final class OasSchema {

    public static final String TYPE_OBJECT = "object";
    public static final String TYPE_ARRAY = "array";
    public static final String TYPE_STRING = "string";
    public static final String TYPE_INTEGER = "integer";
    public static final String TYPE_NUMBER = "number";
    public static final String TYPE_BOOLEAN = "boolean";

    private static final String TYPE_NULL = "null";

    private final Schema<?> schema;

    public OasSchema(Schema<?> schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    /**
     * Declared type tags, merging the OpenAPI 3.1 {@code types} array with the 3.0 {@code type} field.
     * The {@code "null"} tag is not a shape and is dropped.
     */
    public Set<String> getTypes() {
        Set<String> types = new LinkedHashSet<>();
        if (schema.getTypes() != null) {
            types.addAll(schema.getTypes());
        }
        if (schema.getType() != null) {
            types.add(schema.getType());
        }
        types.remove(TYPE_NULL);
        return Collections.unmodifiableSet(types);
    }

    /**
     * @return The single declared type tag, or {@code null} when the node declares none.
     * @throws SchemaException if more than one non-null tag is declared.
     */
    public String getType(AttributePath path) {
        Set<String> types = getTypes();
        if (types.size() > 1) {
            throw new SchemaException(path, "conflicting type tags " + types + ", expected exactly one non-null type");
        }
        return types.isEmpty() ? null : types.iterator().next();
    }

    public String getFormat() {
        return schema.getFormat();
    }

    public Optional<String> getDescription() {
        String description = schema.getDescription();
        return description == null || description.isBlank() ? Optional.empty() : Optional.of(description);
    }

    /**
     * @return Child schemas keyed by property name, in declaration order. Empty when none are declared.
     */
    public Map<String, OasSchema> getProperties() {
        if (!hasProperties()) {
            return Collections.emptyMap();
        }
        Map<String, OasSchema> children = new LinkedHashMap<>();
        schema.getProperties().forEach((name, child) -> children.put(name, new OasSchema(child)));
        return Collections.unmodifiableMap(children);
    }

    public boolean hasProperties() {
        return schema.getProperties() != null && !schema.getProperties().isEmpty();
    }

    /**
     * @return The {@code additionalProperties} schema; absent when unset or given as a boolean.
     * @throws SchemaException if a schema is given on a node whose declared types exclude {@code object}.
     */
    public Optional<OasSchema> getAdditionalProperties(AttributePath path) {
        if (!(schema.getAdditionalProperties() instanceof Schema)) {
            return Optional.empty();
        }
        Set<String> types = getTypes();
        if (!types.isEmpty() && !types.contains(TYPE_OBJECT)) {
            throw new SchemaException(path, "additionalProperties declared on a node of type " + types);
        }
        return Optional.of(new OasSchema((Schema<?>) schema.getAdditionalProperties()));
    }

    /**
     * @return The {@code items} schema; always absent on a node typed {@code object}.
     */
    public Optional<OasSchema> getItems() {
        if (schema.getItems() == null || getTypes().contains(TYPE_OBJECT)) {
            return Optional.empty();
        }
        return Optional.of(new OasSchema(schema.getItems()));
    }

    public Set<String> getRequiredNames() {
        List<String> required = schema.getRequired();
        return required == null ? Collections.emptySet() : Set.copyOf(required);
    }

    public boolean isReadOnly() {
        return Boolean.TRUE.equals(schema.getReadOnly());
    }

    public boolean isWriteOnly() {
        return Boolean.TRUE.equals(schema.getWriteOnly());
    }

    public boolean isUniqueItems() {
        return Boolean.TRUE.equals(schema.getUniqueItems());
    }

    public boolean isDeprecated() {
        return Boolean.TRUE.equals(schema.getDeprecated());
    }

    public Object getDefault() {
        return schema.getDefault();
    }

    /**
     * @return {@code true} when the node is an object (declared or implied) that has its own properties.
     *         Does not look below this node.
     */
    public boolean isObjectWithProperties() {
        Set<String> types = getTypes();
        return hasProperties() && (types.isEmpty() || types.contains(TYPE_OBJECT));
    }

    @Override
    public String toString() {
        return "OasSchema{types=" + getTypes() + ", format=" + getFormat() + "}";
    }
}
