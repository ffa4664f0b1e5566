package com.jsprinter.json;

/**
 * Exception thrown when JSON serialization or deserialization fails.
 */
public class DocumentJsonException extends RuntimeException {

    public DocumentJsonException(String message) {
        super(message);
    }

    public DocumentJsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public DocumentJsonException(Throwable cause) {
        super(cause);
    }
}
