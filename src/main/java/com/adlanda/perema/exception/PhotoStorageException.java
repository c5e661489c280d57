package com.adlanda.perema.exception;

/**
 * Writing an uploaded photo to disk failed. Converted to HTTP 500.
 */
public class PhotoStorageException extends RuntimeException {

    public PhotoStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
