package com.changeguard.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Changeguard-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setChange(String changeId, String filePath) {
        MDC.put("changeId", changeId);
        MDC.put("filePath", filePath);
    }

    public static void setBranch(String branch) {
        MDC.put("branch", branch);
    }

    public static void clear() {
        MDC.remove("changeId");
        MDC.remove("filePath");
        MDC.remove("branch");
    }
}
