package com.changeguard.core.exception;

/**
 * Rollback was requested for a change that has no backup attached.
 */
public class NoBackupAvailableException extends ChangeguardException {

    public NoBackupAvailableException(String changeId) {
        super("No backup available for change " + changeId);
    }
}
