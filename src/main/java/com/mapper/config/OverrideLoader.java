package com.mapper.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mapper.exception.MapperException;
import com.mapper.model.AttributeOverride;
import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads per-attribute overrides from a JSON file of the form
 * <pre>{"nested_map_prop.obj.f": {"computability": "computed", "sensitive": true}}</pre>
 * Keys are dotted attribute paths as produced by the lowering engine.
 */
@Component
@Slf4j
public class OverrideLoader {

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @param location Path of the overrides file; blank means no overrides.
     * @return The overrides keyed by dotted path, in file order.
     * @throws MapperException if the file is missing or cannot be parsed.
     */
    public Map<String, AttributeOverride> load(String location) {
        if (location == null || location.isBlank()) {
            return Collections.emptyMap();
        }
        File file = new File(location);
        if (!file.isFile()) {
            throw new MapperException("Overrides file not found: " + file.getAbsolutePath());
        }
        try {
            TypeReference<LinkedHashMap<String, AttributeOverride>> typeRef = new TypeReference<>() {};
            Map<String, AttributeOverride> overrides = objectMapper.readValue(file, typeRef);
            log.info("Loaded {} attribute overrides from {}", overrides.size(), file.getAbsolutePath());
            return overrides;
        } catch (IOException e) {
            throw new MapperException("Failed to read overrides file " + file.getAbsolutePath() + ": " + e.getMessage(), e);
        }
    }
}
