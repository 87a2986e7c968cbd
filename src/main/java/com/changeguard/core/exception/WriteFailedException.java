package com.changeguard.core.exception;

import com.changeguard.core.model.BackupRecord;

import java.nio.file.Path;

/**
 * Writing a change failed after its backup was taken. The original content has already been
 * restored from {@link #getBackup()} when this is thrown.
 */
public class WriteFailedException extends FileAccessException {

    private final BackupRecord backup;

    public WriteFailedException(Path path, BackupRecord backup, Throwable cause) {
        super(path, "Write failed, original content restored", cause);
        this.backup = backup;
    }

    public BackupRecord getBackup() {
        return backup;
    }
}
