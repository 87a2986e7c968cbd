package com.changeguard.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Reference to the durable pre-write copy of a file.
 * <p>
 * When the target did not exist before the write ({@code originalExisted == false}) there is
 * no backup file; restoring such a backup removes whatever was written.
 *
 * @param originalPath    absolute path of the file that was backed up
 * @param backupPath      absolute path of the backup copy, {@code null} if the original did not exist
 * @param createdAt       when the backup was taken
 * @param originalExisted whether the target existed at backup time
 * @param sizeBytes       size of the backed-up content
 * @param sha256          hex SHA-256 of the backed-up content, {@code null} if the original did not exist
 */
public record BackupRecord(
    String originalPath,
    String backupPath,
    Instant createdAt,
    boolean originalExisted,
    long sizeBytes,
    String sha256
) implements Serializable {}
