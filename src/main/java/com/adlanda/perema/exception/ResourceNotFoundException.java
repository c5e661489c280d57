package com.adlanda.perema.exception;

/**
 * Thrown when a requested contact, reminder, note, activity or relationship does not exist.
 *
 * <p>Converted to HTTP 404 by {@link GlobalExceptionHandler}.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException contact() {
        return new ResourceNotFoundException("Contact not found");
    }
}
