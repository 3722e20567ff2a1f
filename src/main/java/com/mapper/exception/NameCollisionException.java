package com.mapper.exception;

import com.mapper.model.AttributePath;

/**
 * Two sibling properties normalize to the same attribute name.
 */
public class NameCollisionException extends MapperException {

    public NameCollisionException(AttributePath path, String message) {
        super(path, message);
    }
}
