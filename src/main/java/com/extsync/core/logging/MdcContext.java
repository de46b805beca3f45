package com.extsync.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing extsync-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setExtension(String handle) {
        MDC.put("extension", handle);
    }

    public static void setBatch(String path) {
        MDC.put("batchPath", path);
    }

    public static void clearExtension() {
        MDC.remove("extension");
    }

    public static void clear() {
        MDC.remove("extension");
        MDC.remove("batchPath");
    }
}
