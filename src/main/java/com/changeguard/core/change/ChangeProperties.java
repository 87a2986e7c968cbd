package com.changeguard.core.change;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "changeguard.change")
public class ChangeProperties {

    /** "file" keeps the audit trail in {@link #storePath}; "memory" keeps it for the process lifetime. */
    private String store = "file";

    /** JSON audit file; relative paths resolve against {@code changeguard.root}. */
    private String storePath = ".changeguard/changes.json";

    /** Approve changes whose assessment recommends auto-apply as soon as they are proposed. */
    private boolean autoApprove = true;

    private int lockTimeoutSeconds = 30;

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public String getStorePath() {
        return storePath;
    }

    public void setStorePath(String storePath) {
        this.storePath = storePath;
    }

    public boolean isAutoApprove() {
        return autoApprove;
    }

    public void setAutoApprove(boolean autoApprove) {
        this.autoApprove = autoApprove;
    }

    public int getLockTimeoutSeconds() {
        return lockTimeoutSeconds;
    }

    public void setLockTimeoutSeconds(int lockTimeoutSeconds) {
        this.lockTimeoutSeconds = lockTimeoutSeconds;
    }
}
