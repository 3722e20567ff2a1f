package com.mapper.oas;

import com.mapper.model.AttributeKind;
import com.mapper.model.AttributeOverride;
import com.mapper.model.AttributePath;
import com.mapper.model.ComputedOptionalRequired;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Every product decision the lowering engine does not derive from the schema itself, passed explicitly
 * through each recursive call.
 */
@Value
@Builder(toBuilder = true)
public class LoweringPolicy {

    public static final int DEFAULT_MAX_DEPTH = 32;

    /**
     * Deepest nesting level that may be lowered before failing with a recursion limit error.
     */
    @Builder.Default
    int maxDepth = DEFAULT_MAX_DEPTH;

    /**
     * Status given to properties the schema does not mark as required. OpenAPI has no notion of a
     * computed value, so the conservative default is computed-optional.
     */
    @Builder.Default
    ComputedOptionalRequired defaultComputability = ComputedOptionalRequired.COMPUTED_OPTIONAL;

    @Builder.Default
    ErrorMode errorMode = ErrorMode.FAIL_FAST;

    @Builder.Default
    MixedObjectPolicy mixedObjectPolicy = MixedObjectPolicy.PROPERTIES_WIN;

    /**
     * Whether arrays with {@code uniqueItems: true} lower to sets instead of lists.
     */
    @Builder.Default
    boolean uniqueItemsAsSet = true;

    @Builder.Default
    Set<AttributeKind> dataSourceDisallowedKinds = Set.of();

    /**
     * Overrides keyed by dotted attribute path, e.g. {@code nested_map_prop.obj.f}.
     */
    @Builder.Default
    Map<String, AttributeOverride> overrides = Map.of();

    public static LoweringPolicy defaults() {
        return builder().build();
    }

    public Optional<AttributeOverride> overrideFor(AttributePath path) {
        return Optional.ofNullable(overrides.get(path.toString()));
    }
}
