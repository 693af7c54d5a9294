package com.issuelake.pipeline.validate;

/**
 * A record that does not fit its source's schema. The record is dropped and counted.
 */
public class ValidationException extends Exception {

    public ValidationException(String message) {
        super(message);
    }
}
