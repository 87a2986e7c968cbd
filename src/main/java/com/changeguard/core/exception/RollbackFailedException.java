package com.changeguard.core.exception;

/**
 * A write failed and restoring the backup failed too. The file may now hold neither the
 * original nor the new content and needs manual repair from {@link #getBackupPath()}.
 * <p>
 * The write error is the cause; the rollback error is attached as suppressed.
 */
public class RollbackFailedException extends ChangeguardException {

    private final String backupPath;

    public RollbackFailedException(String filePath, String backupPath, Throwable writeError, Throwable rollbackError) {
        super("Write to %s failed (%s) and rollback from %s also failed (%s); manual intervention required"
                .formatted(filePath, writeError.getMessage(), backupPath, rollbackError.getMessage()), writeError);
        this.backupPath = backupPath;
        addSuppressed(rollbackError);
    }

    /** Recovery after a failed multi-file operation left files unrestored; {@code message} names them. */
    public RollbackFailedException(String message, String backupPath) {
        super(message);
        this.backupPath = backupPath;
    }

    public String getBackupPath() {
        return backupPath;
    }
}
