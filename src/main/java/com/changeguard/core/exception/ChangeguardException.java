package com.changeguard.core.exception;

/**
 * Base type for every failure the change pipeline reports.
 */
public class ChangeguardException extends RuntimeException {

    public ChangeguardException(String message) {
        super(message);
    }

    public ChangeguardException(String message, Throwable cause) {
        super(message, cause);
    }
}
