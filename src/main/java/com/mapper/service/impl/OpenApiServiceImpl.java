package com.mapper.service.impl;

import com.mapper.exception.MapperException;
import com.mapper.oas.OasSchema;
import com.mapper.service.api.OpenApiService;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class OpenApiServiceImpl implements OpenApiService {

    /**
     * {@inheritDoc}
     * This implementation uses the swagger-parser library with full resolution enabled, so the
     * returned schemas contain no {@code $ref} nodes and can be lowered without looking anything up.
     */
    @Override
    public Map<String, OasSchema> loadSchemas(String source) {
        log.info("Loading OpenAPI document from: {}", source);
        OpenAPI openAPI = parse(source);

        if (openAPI.getComponents() == null || openAPI.getComponents().getSchemas() == null) {
            log.warn("OpenAPI document at {} declares no component schemas.", source);
            return Collections.emptyMap();
        }

        Map<String, OasSchema> schemas = new LinkedHashMap<>();
        openAPI.getComponents().getSchemas().forEach((name, schema) -> schemas.put(name, new OasSchema(schema)));
        log.info("Successfully loaded {} component schemas.", schemas.size());
        return schemas;
    }

    private OpenAPI parse(String source) {
        ParseOptions options = new ParseOptions();
        options.setResolve(true);
        options.setResolveFully(true);

        SwaggerParseResult result;
        try {
            result = new OpenAPIV3Parser().readLocation(source, null, options);
        } catch (RuntimeException e) {
            throw new MapperException("Failed to read the OpenAPI document from the source: " + source, e);
        }

        if (result == null || result.getOpenAPI() == null) {
            List<String> messages = result == null ? null : result.getMessages();
            String reason = messages == null || messages.isEmpty() ? "" : " (" + String.join("; ", messages) + ")";
            throw new MapperException("Failed to load or parse the OpenAPI document from the source: " + source + reason);
        }
        if (result.getMessages() != null) {
            result.getMessages().forEach(message -> log.debug("Parser message for {}: {}", source, message));
        }
        return result.getOpenAPI();
    }
}
