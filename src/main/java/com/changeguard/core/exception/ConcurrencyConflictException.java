package com.changeguard.core.exception;

/**
 * Another operation holds the change or the file path and did not release it in time.
 */
public class ConcurrencyConflictException extends ChangeguardException {

    public ConcurrencyConflictException(String message) {
        super(message);
    }
}
