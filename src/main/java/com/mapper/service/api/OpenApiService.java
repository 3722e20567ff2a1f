package com.mapper.service.api;

import com.mapper.oas.OasSchema;
import java.util.Map;

public interface OpenApiService {
    /**
     * Loads an OpenAPI document from a URL or file path and returns its component schemas with every
     * {@code $ref} resolved.
     * @param source The URL or local file path of the OpenAPI document.
     * @return Component schemas keyed by name, in document order.
     */
    Map<String, OasSchema> loadSchemas(String source);
}
