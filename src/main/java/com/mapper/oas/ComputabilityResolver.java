package com.mapper.oas;

import com.mapper.model.AttributeOverride;
import com.mapper.model.AttributePath;
import com.mapper.model.ComputedOptionalRequired;
import java.util.Optional;
import java.util.Set;

/**
 * Works out whether a property becomes a required, optional, computed or computed-optional attribute.
 * <p>
 * A property its parent lists as required is always {@link ComputedOptionalRequired#REQUIRED}. Every
 * other property falls back to the policy default unless an override, a computed parent or a
 * {@code readOnly} flag says otherwise.
 */
public class ComputabilityResolver {

    private final LoweringPolicy policy;

    public ComputabilityResolver(LoweringPolicy policy) {
        this.policy = policy;
    }

    /**
     * Resolves a status from the parent's required names alone.
     *
     * @param requiredNames         Names the parent schema lists as required.
     * @param childName             The raw property name.
     * @param parentIsFullyComputed Whether the parent attribute is computed, making its fields computed too.
     */
    public ComputedOptionalRequired resolve(Set<String> requiredNames, String childName, boolean parentIsFullyComputed) {
        if (requiredNames.contains(childName)) {
            return ComputedOptionalRequired.REQUIRED;
        }
        if (parentIsFullyComputed) {
            return ComputedOptionalRequired.COMPUTED;
        }
        return policy.getDefaultComputability();
    }

    /**
     * Resolves a status, also consulting the override configured for {@code path} and the child's own
     * {@code readOnly} flag.
     *
     * @param parentComputability Status of the parent attribute, {@code null} at the top level.
     */
    public ComputedOptionalRequired resolve(Set<String> requiredNames, String childName,
                                            ComputedOptionalRequired parentComputability,
                                            OasSchema child, AttributePath path) {
        if (requiredNames.contains(childName)) {
            return ComputedOptionalRequired.REQUIRED;
        }
        Optional<ComputedOptionalRequired> forced = policy.overrideFor(path).map(AttributeOverride::computability);
        if (forced.isPresent()) {
            return forced.get();
        }
        if (child.isReadOnly()) {
            return ComputedOptionalRequired.COMPUTED;
        }
        return resolve(requiredNames, childName, parentComputability == ComputedOptionalRequired.COMPUTED);
    }
}
