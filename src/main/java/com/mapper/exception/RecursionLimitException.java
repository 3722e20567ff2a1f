package com.mapper.exception;

import com.mapper.model.AttributePath;

/**
 * Schema nesting went deeper than the configured ceiling.
 */
public class RecursionLimitException extends MapperException {

    public RecursionLimitException(AttributePath path, String message) {
        super(path, message);
    }
}
