package com.changeguard.core.exception;

import java.nio.file.Path;

/**
 * A read or write on the working tree or the backup area failed.
 */
public class FileAccessException extends ChangeguardException {

    private final String path;

    public FileAccessException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path.toString();
    }

    public String getPath() {
        return path;
    }
}
