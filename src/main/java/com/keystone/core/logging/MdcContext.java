package com.keystone.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Keystone-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPack(String packId) {
        MDC.put("packId", packId);
    }

    public static void setProject(String packId, String projectName) {
        MDC.put("packId", packId);
        if (projectName != null) {
            MDC.put("project", projectName);
        }
    }

    public static void clear() {
        MDC.remove("packId");
        MDC.remove("project");
    }
}
