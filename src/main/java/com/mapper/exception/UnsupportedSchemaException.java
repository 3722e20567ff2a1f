package com.mapper.exception;

import com.mapper.model.AttributePath;

/**
 * The schema node is well formed but matches no attribute shape the generator can produce.
 */
public class UnsupportedSchemaException extends MapperException {

    public UnsupportedSchemaException(AttributePath path, String message) {
        super(path, message);
    }
}
