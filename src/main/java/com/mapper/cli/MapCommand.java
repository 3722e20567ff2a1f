package com.mapper.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mapper.dto.response.CommandResponse;
import com.mapper.model.Attribute;
import com.mapper.oas.OasSchema;
import com.mapper.oas.OutputTarget;
import com.mapper.service.api.AttributeMappingService;
import com.mapper.service.api.OpenApiService;
import java.util.List;
import java.util.Map;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Spring Shell commands for inspecting an OpenAPI document and lowering its component schemas into
 * provider attributes.
 */
@ShellComponent
public class MapCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_PURPLE = "\u001B[35m";

    private final OpenApiService openApiService;
    private final AttributeMappingService attributeMappingService;
    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public MapCommand(OpenApiService openApiService, AttributeMappingService attributeMappingService) {
        this.openApiService = openApiService;
        this.attributeMappingService = attributeMappingService;
    }

    /**
     * Lists the component schemas of a document together with their declared types.
     *
     * @param source The URL or file path of the OpenAPI document.
     */
    @ShellMethod(key = "schemas", value = "List the component schemas of an OpenAPI document.")
    public String schemas(@ShellOption(value = {"--source", "-s"}, help = "The URL or file path of the OpenAPI document.") String source) {
        try {
            Map<String, OasSchema> schemas = openApiService.loadSchemas(source);
            if (schemas.isEmpty()) {
                return ANSI_YELLOW + "No component schemas found in '" + source + "'." + ANSI_RESET;
            }
            StringBuilder out = new StringBuilder(ANSI_CYAN + "Component schemas in " + ANSI_YELLOW + source + ANSI_RESET);
            schemas.forEach((name, schema) -> out.append("\n  - ").append(name).append(' ').append(schema.getTypes()));
            return out.toString();
        } catch (Exception e) {
            return CommandResponse.failure("Failed to load schemas: " + e.getMessage()).toAnsiString();
        }
    }

    /**
     * Lowers one component schema and prints the attribute tree as JSON.
     *
     * @param source  The URL or file path of the OpenAPI document.
     * @param schema  The component schema to lower.
     * @param target  {@code resource} or {@code data-source}.
     * @param verbose If true, enables debug logging for the duration of the command.
     */
    @ShellMethod(key = "map", value = "Lower an OpenAPI component schema into provider attributes.")
    public String map(
            @ShellOption(value = {"--source", "-s"}, help = "The URL or file path of the OpenAPI document.") String source,
            @ShellOption(value = {"--schema", "-n"}, help = "The name of the component schema.") String schema,
            @ShellOption(value = {"--target", "-t"}, help = "resource or data-source.", defaultValue = "resource") String target,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
            System.out.println(ANSI_PURPLE + "-- Verbose mode enabled --" + ANSI_RESET);
        }

        try {
            List<Attribute> attributes = attributeMappingService.map(source, schema, OutputTarget.fromString(target));
            return jsonMapper.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            return CommandResponse.failure("Could not format attributes: " + e.getOriginalMessage()).toAnsiString();
        } catch (Exception e) {
            return CommandResponse.failure("Failed to map schema '" + schema + "': " + e.getMessage()).toAnsiString();
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
                System.out.println(ANSI_PURPLE + "-- Verbose mode disabled --" + ANSI_RESET);
            }
        }
    }
}
