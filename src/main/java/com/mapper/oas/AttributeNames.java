package com.mapper.oas;

import com.mapper.exception.SchemaException;
import com.mapper.model.AttributePath;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns OpenAPI property names into provider attribute names: lower snake case, letters, digits and
 * underscores only ({@code fooBar} and {@code foo-bar} both become {@code foo_bar}).
 */
public final class AttributeNames {

    private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern INVALID = Pattern.compile("[^a-z0-9]+");

    private AttributeNames() {
    }

    /**
     * @param propertyName The raw property name.
     * @param parent       Path of the object holding the property, used in error messages.
     * @throws SchemaException if nothing usable is left of the name.
     */
    public static String normalize(String propertyName, AttributePath parent) {
        String name = ACRONYM_BOUNDARY.matcher(propertyName).replaceAll("$1_$2");
        name = CAMEL_BOUNDARY.matcher(name).replaceAll("$1_$2");
        name = INVALID.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("_");
        name = name.replaceAll("^_+|_+$", "");
        if (name.isEmpty()) {
            throw new SchemaException(parent, "property name '" + propertyName + "' cannot be turned into an attribute name");
        }
        return name;
    }
}
