package com.mapper.oas;

import com.mapper.exception.AggregateMapperException;
import com.mapper.exception.MapperException;
import com.mapper.exception.NameCollisionException;
import com.mapper.exception.RecursionLimitException;
import com.mapper.exception.SchemaException;
import com.mapper.exception.UnsupportedSchemaException;
import com.mapper.model.Attribute;
import com.mapper.model.AttributeKind;
import com.mapper.model.AttributeOverride;
import com.mapper.model.AttributePath;
import com.mapper.model.ComputedOptionalRequired;
import com.mapper.model.ElementType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Lowers OpenAPI object schemas into ordered provider attribute trees.
 * <p>
 * Resources and data sources share a single recursive traversal parameterized by {@link OutputTarget}.
 * For every property of an object node, in declaration order, the engine resolves its status against
 * the parent's required names, classifies it and builds the matching attribute, recursing into nested
 * objects, map values and list items. Recursion depth is tracked explicitly and capped by
 * {@link LoweringPolicy#getMaxDepth()}. The engine holds no mutable state, so one instance may lower
 * resource and data source trees concurrently.
 */
@Slf4j
public class SchemaLowering {

    private static final String DEPRECATION_MESSAGE = "This attribute is deprecated.";

    private final LoweringPolicy policy;
    private final SchemaClassifier classifier;
    private final ComputabilityResolver computabilityResolver;

    public SchemaLowering(LoweringPolicy policy) {
        this.policy = policy;
        this.classifier = new SchemaClassifier(policy);
        this.computabilityResolver = new ComputabilityResolver(policy);
    }

    /**
     * Lowers the properties of an object schema into sibling resource attributes.
     *
     * @param node An object schema.
     * @return One attribute per property, in declaration order.
     * @throws MapperException if any property cannot be lowered; the message names its dotted path.
     */
    public List<Attribute> lowerForResource(OasSchema node) {
        return lower(node, OutputTarget.RESOURCE);
    }

    /**
     * Lowers the properties of an object schema into sibling data source attributes.
     *
     * @see #lowerForResource(OasSchema)
     */
    public List<Attribute> lowerForDataSource(OasSchema node) {
        return lower(node, OutputTarget.DATA_SOURCE);
    }

    public List<Attribute> lower(OasSchema node, OutputTarget target) {
        return lowerProperties(node, target, AttributePath.root(), null, 0);
    }

    /**
     * Lowers an object schema that is itself one property of a parent into a single nested resource
     * attribute.
     *
     * @param name          Attribute name, used as given.
     * @param node          An object schema with properties.
     * @param computability Status the caller resolved for the attribute.
     */
    public Attribute lowerSingleNestedForResource(String name, OasSchema node, ComputedOptionalRequired computability) {
        return lowerSingleNested(name, node, computability, OutputTarget.RESOURCE);
    }

    /**
     * @see #lowerSingleNestedForResource(String, OasSchema, ComputedOptionalRequired)
     */
    public Attribute lowerSingleNestedForDataSource(String name, OasSchema node, ComputedOptionalRequired computability) {
        return lowerSingleNested(name, node, computability, OutputTarget.DATA_SOURCE);
    }

    public Attribute lowerSingleNested(String name, OasSchema node, ComputedOptionalRequired computability, OutputTarget target) {
        AttributePath path = AttributePath.of(name);
        AttributeKind kind = classifier.classify(node, path);
        if (kind != AttributeKind.SINGLE_NESTED) {
            throw new SchemaException(path, "expected an object with properties but the schema lowers to " + kind.jsonName());
        }
        List<Attribute> attributes = lowerProperties(node, target, path, computability, 1);
        return Attribute.nested(name, kind, computability, node.getDescription().orElse(null), attributes);
    }

    private List<Attribute> lowerProperties(OasSchema node, OutputTarget target, AttributePath path,
                                            ComputedOptionalRequired parentComputability, int depth) {
        if (depth > policy.getMaxDepth()) {
            throw new RecursionLimitException(path, "schema nesting exceeds the maximum depth of " + policy.getMaxDepth());
        }

        List<Attribute> attributes = new ArrayList<>();
        List<MapperException> errors = new ArrayList<>();
        Map<String, String> propertyNamesByAttribute = new HashMap<>();

        for (Map.Entry<String, OasSchema> property : node.getProperties().entrySet()) {
            String propertyName = property.getKey();
            OasSchema child = property.getValue();
            try {
                String name = AttributeNames.normalize(propertyName, path);
                AttributePath childPath = path.child(name);
                if (!target.includesWriteOnly() && child.isWriteOnly()) {
                    log.debug("{}: skipping write-only property for {}", childPath, target);
                    continue;
                }
                String previous = propertyNamesByAttribute.putIfAbsent(name, propertyName);
                if (previous != null) {
                    throw new NameCollisionException(childPath,
                            "properties '" + previous + "' and '" + propertyName + "' both map to attribute '" + name + "'");
                }
                ComputedOptionalRequired computability = computabilityResolver.resolve(
                        node.getRequiredNames(), propertyName, parentComputability, child, childPath);
                attributes.add(lowerAttribute(name, child, computability, target, childPath, depth));
            } catch (MapperException e) {
                if (policy.getErrorMode() == ErrorMode.FAIL_FAST) {
                    throw e;
                }
                collect(errors, e);
            }
        }

        if (!errors.isEmpty()) {
            throw new AggregateMapperException(errors);
        }
        return attributes;
    }

    private Attribute lowerAttribute(String name, OasSchema node, ComputedOptionalRequired computability,
                                     OutputTarget target, AttributePath path, int depth) {
        AttributeKind kind = classifier.classify(node, path);
        log.debug("{}: classified as {} ({})", path, kind.jsonName(), computability.jsonName());
        if (!target.allows(kind, policy)) {
            throw new UnsupportedSchemaException(path, kind.jsonName() + " attributes are not allowed in data sources");
        }

        String description = node.getDescription().orElse(null);
        Attribute attribute;
        switch (kind) {
            case STRING:
            case INT64:
            case FLOAT64:
            case BOOL:
            case NUMBER:
                attribute = lowerScalar(name, kind, node, computability, description, target, path);
                break;
            case LIST:
            case SET:
                attribute = Attribute.collection(name, kind, computability, description,
                        classifier.elementType(node.getItems().orElseThrow(), path, depth + 1));
                break;
            case MAP:
                attribute = Attribute.collection(name, kind, computability, description,
                        classifier.elementType(node.getAdditionalProperties(path).orElseThrow(), path, depth + 1));
                break;
            case SINGLE_NESTED:
                attribute = Attribute.nested(name, kind, computability, description,
                        lowerProperties(node, target, path, computability, depth + 1));
                break;
            case LIST_NESTED:
            case SET_NESTED:
                attribute = Attribute.nested(name, kind, computability, description,
                        lowerElementObject(node.getItems().orElseThrow(), target, path, computability, depth + 1));
                break;
            case MAP_NESTED:
                attribute = Attribute.nested(name, kind, computability, description,
                        lowerElementObject(node.getAdditionalProperties(path).orElseThrow(), target, path, computability, depth + 1));
                break;
            default:
                throw new UnsupportedSchemaException(path, "unhandled attribute kind " + kind);
        }

        return node.isDeprecated() ? attribute.withDeprecationMessage(DEPRECATION_MESSAGE) : attribute;
    }

    /**
     * Lowers the object stored in each element of a nested list, set or map. The element goes through the
     * same classification as a property so malformed objects fail at the collection's path.
     */
    private List<Attribute> lowerElementObject(OasSchema element, OutputTarget target, AttributePath path,
                                               ComputedOptionalRequired computability, int depth) {
        AttributeKind elementKind = classifier.classify(element, path);
        if (elementKind != AttributeKind.SINGLE_NESTED) {
            throw new SchemaException(path, "expected element objects with properties but they lower to " + elementKind.jsonName());
        }
        return lowerProperties(element, target, path, computability, depth);
    }

    private Attribute lowerScalar(String name, AttributeKind kind, OasSchema node, ComputedOptionalRequired computability,
                                  String description, OutputTarget target, AttributePath path) {
        boolean sensitive = kind == AttributeKind.STRING && "password".equals(node.getFormat());
        Optional<Boolean> forcedSensitive = policy.overrideFor(path).map(AttributeOverride::sensitive);
        if (forcedSensitive.isPresent()) {
            if (kind == AttributeKind.STRING) {
                sensitive = forcedSensitive.get();
            } else {
                log.warn("{}: sensitive override ignored on {} attribute", path, kind.jsonName());
            }
        }

        Attribute attribute = Attribute.scalar(name, kind, computability, description, sensitive);
        if (target.supportsDefaults() && node.getDefault() != null) {
            if (computability == ComputedOptionalRequired.COMPUTED_OPTIONAL) {
                return attribute.withDefaultValue(defaultValue(kind, node.getDefault(), path));
            }
            log.debug("{}: default ignored on {} attribute", path, computability.jsonName());
        }
        return attribute;
    }

    private Object defaultValue(AttributeKind kind, Object value, AttributePath path) {
        try {
            switch (kind) {
                case INT64:
                    return new BigDecimal(value.toString()).longValueExact();
                case FLOAT64:
                    return new BigDecimal(value.toString()).doubleValue();
                case NUMBER:
                    return new BigDecimal(value.toString());
                case BOOL:
                    if (value instanceof Boolean) {
                        return value;
                    }
                    if ("true".equalsIgnoreCase(value.toString()) || "false".equalsIgnoreCase(value.toString())) {
                        return Boolean.valueOf(value.toString());
                    }
                    throw new NumberFormatException(value.toString());
                default:
                    return value.toString();
            }
        } catch (NumberFormatException | ArithmeticException e) {
            throw new SchemaException(path, "default value '" + value + "' is not a valid " + kind.jsonName());
        }
    }

    private static void collect(List<MapperException> errors, MapperException e) {
        if (e instanceof AggregateMapperException) {
            errors.addAll(((AggregateMapperException) e).getErrors());
        } else {
            errors.add(e);
        }
    }
}
