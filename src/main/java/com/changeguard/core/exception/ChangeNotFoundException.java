package com.changeguard.core.exception;

public class ChangeNotFoundException extends ChangeguardException {

    public ChangeNotFoundException(String changeId) {
        super("Change not found: " + changeId);
    }
}
