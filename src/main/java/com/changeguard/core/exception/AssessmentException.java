package com.changeguard.core.exception;

/**
 * The change handed to the risk assessor is malformed.
 */
public class AssessmentException extends ChangeguardException {

    public AssessmentException(String message) {
        super(message);
    }
}
