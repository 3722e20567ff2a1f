package com.mapper.service.impl;

import com.mapper.exception.MapperException;
import com.mapper.model.Attribute;
import com.mapper.oas.OasSchema;
import com.mapper.oas.OutputTarget;
import com.mapper.oas.SchemaLowering;
import com.mapper.service.api.AttributeMappingService;
import com.mapper.service.api.OpenApiService;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ties document loading to the lowering engine: finds the requested component schema and lowers it for
 * the requested target.
 */
@Service
@Slf4j
public class AttributeMappingServiceImpl implements AttributeMappingService {

    private final OpenApiService openApiService;
    private final SchemaLowering schemaLowering;

    public AttributeMappingServiceImpl(OpenApiService openApiService, SchemaLowering schemaLowering) {
        this.openApiService = openApiService;
        this.schemaLowering = schemaLowering;
    }

    @Override
    public List<Attribute> map(String source, String schemaName, OutputTarget target) {
        Map<String, OasSchema> schemas = openApiService.loadSchemas(source);
        OasSchema schema = schemas.get(schemaName);
        if (schema == null) {
            throw new MapperException("Schema '" + schemaName + "' not found in " + source
                    + ". Available schemas: " + String.join(", ", schemas.keySet()));
        }

        List<Attribute> attributes = schemaLowering.lower(schema, target);
        log.info("Lowered schema '{}' into {} {} attributes.", schemaName, attributes.size(),
                target == OutputTarget.RESOURCE ? "resource" : "data source");
        return attributes;
    }
}
