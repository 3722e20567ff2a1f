package com.mapper.exception;

import com.mapper.model.AttributePath;

/**
 * The schema node is malformed for the shape it was asked for, e.g. conflicting type tags or an
 * {@code additionalProperties} schema on a node that is not an object.
 */
public class SchemaException extends MapperException {

    public SchemaException(AttributePath path, String message) {
        super(path, message);
    }
}
