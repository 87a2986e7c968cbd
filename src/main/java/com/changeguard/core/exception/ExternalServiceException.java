package com.changeguard.core.exception;

/**
 * A call to the code-generation model, git, or the review host failed.
 */
public class ExternalServiceException extends ChangeguardException {

    private final String service;

    public ExternalServiceException(String service, String message) {
        super(service + ": " + message);
        this.service = service;
    }

    public ExternalServiceException(String service, String message, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
