package com.adlanda.perema.exception;

/**
 * A request that is well-formed but cannot be applied, e.g. a relationship
 * pointing at a contact that does not exist. Converted to HTTP 400.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
