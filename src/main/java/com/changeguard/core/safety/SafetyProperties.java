package com.changeguard.core.safety;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "changeguard.safety")
public class SafetyProperties {

    /** Backup directory; relative paths resolve against {@code changeguard.root}. */
    private String backupDir = ".changeguard/backups";

    /** Turning this off is the only way a write may happen without a backup. */
    private boolean backupsEnabled = true;

    /** Default age in days for the retention sweep. */
    private int retentionDays = 30;

    public String getBackupDir() {
        return backupDir;
    }

    public void setBackupDir(String backupDir) {
        this.backupDir = backupDir;
    }

    public boolean isBackupsEnabled() {
        return backupsEnabled;
    }

    public void setBackupsEnabled(boolean backupsEnabled) {
        this.backupsEnabled = backupsEnabled;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }
}
