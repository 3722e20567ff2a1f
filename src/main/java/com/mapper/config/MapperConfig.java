package com.mapper.config;

import com.mapper.model.AttributeKind;
import com.mapper.model.ComputedOptionalRequired;
import com.mapper.oas.ErrorMode;
import com.mapper.oas.LoweringPolicy;
import com.mapper.oas.MixedObjectPolicy;
import com.mapper.oas.SchemaLowering;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the {@link LoweringPolicy} from {@code mapper.*} properties and exposes the lowering engine.
 */
@Configuration
@Slf4j
public class MapperConfig {

    @Bean
    public LoweringPolicy loweringPolicy(
            @Value("${mapper.max-depth:32}") int maxDepth,
            @Value("${mapper.default-computability:computed_optional}") String defaultComputability,
            @Value("${mapper.error-mode:FAIL_FAST}") ErrorMode errorMode,
            @Value("${mapper.mixed-object-policy:PROPERTIES_WIN}") MixedObjectPolicy mixedObjectPolicy,
            @Value("${mapper.unique-items-as-set:true}") boolean uniqueItemsAsSet,
            @Value("${mapper.data-source-disallowed-kinds:}") String dataSourceDisallowedKinds,
            @Value("${mapper.overrides-file:}") String overridesFile,
            OverrideLoader overrideLoader) {
        LoweringPolicy policy = LoweringPolicy.builder()
                .maxDepth(maxDepth)
                .defaultComputability(ComputedOptionalRequired.fromString(defaultComputability))
                .errorMode(errorMode)
                .mixedObjectPolicy(mixedObjectPolicy)
                .uniqueItemsAsSet(uniqueItemsAsSet)
                .dataSourceDisallowedKinds(parseKinds(dataSourceDisallowedKinds))
                .overrides(overrideLoader.load(overridesFile))
                .build();
        log.debug("Using lowering policy {}", policy);
        return policy;
    }

    @Bean
    public SchemaLowering schemaLowering(LoweringPolicy loweringPolicy) {
        return new SchemaLowering(loweringPolicy);
    }

    static Set<AttributeKind> parseKinds(String kinds) {
        EnumSet<AttributeKind> parsed = EnumSet.noneOf(AttributeKind.class);
        Arrays.stream(kinds.split(","))
                .map(String::trim)
                .filter(kind -> !kind.isEmpty())
                .map(kind -> AttributeKind.valueOf(kind.replace('-', '_').toUpperCase(Locale.ROOT)))
                .forEach(parsed::add);
        return parsed;
    }
}
