package com.jsprinter.printer;

/**
 * Thrown when the document tree breaks an invariant the printer relies on. This signals a bug in
 * an earlier compiler stage, not a problem in the user's component.
 */
public class PrintException extends RuntimeException {

    public PrintException(String message) {
        super(message);
    }

    public PrintException(String message, Throwable cause) {
        super(message, cause);
    }
}
