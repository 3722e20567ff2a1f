package com.mapper.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Reports every failure found while lowering a schema in collect mode, instead of stopping at the first.
 * Each collected failure keeps its own path-qualified message.
 */
public class AggregateMapperException extends MapperException {

    private final transient List<MapperException> errors;

    public AggregateMapperException(List<MapperException> errors) {
        super(buildMessage(errors));
        this.errors = List.copyOf(errors);
        errors.forEach(this::addSuppressed);
    }

    public List<MapperException> getErrors() {
        return errors;
    }

    private static String buildMessage(List<MapperException> errors) {
        return errors.size() + " schema error(s):" + errors.stream()
                .map(e -> "\n  - " + e.getMessage())
                .collect(Collectors.joining());
    }
}
