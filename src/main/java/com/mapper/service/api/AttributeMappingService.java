package com.mapper.service.api;

import com.mapper.model.Attribute;
import com.mapper.oas.OutputTarget;
import java.util.List;

public interface AttributeMappingService {
    /**
     * Lowers one component schema of an OpenAPI document into provider attributes.
     * @param source     The URL or local file path of the OpenAPI document.
     * @param schemaName The name of the component schema to lower.
     * @param target     Whether the attributes are built for a resource or a data source.
     * @return The attributes, one per property of the schema, in declaration order.
     */
    List<Attribute> map(String source, String schemaName, OutputTarget target);
}
