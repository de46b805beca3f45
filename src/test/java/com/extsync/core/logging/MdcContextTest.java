package com.extsync.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setExtension puts extension handle in MDC")
    void setExtension() {
        MdcContext.setExtension("checkout-ui");
        assertEquals("checkout-ui", MDC.get("extension"));
    }

    @Test
    @DisplayName("setBatch puts batchPath in MDC")
    void setBatch() {
        MdcContext.setBatch("/app/extensions/checkout-ui/src/index.js");
        assertEquals("/app/extensions/checkout-ui/src/index.js", MDC.get("batchPath"));
    }

    @Test
    @DisplayName("clearExtension keeps the batch path")
    void clearExtension() {
        MdcContext.setBatch("/app/.env");
        MdcContext.setExtension("checkout-ui");
        MdcContext.clearExtension();
        assertNull(MDC.get("extension"));
        assertEquals("/app/.env", MDC.get("batchPath"));
    }

    @Test
    @DisplayName("clear removes all extsync MDC keys")
    void clear() {
        MdcContext.setBatch("/app/.env");
        MdcContext.setExtension("checkout-ui");
        MdcContext.clear();
        assertNull(MDC.get("extension"));
        assertNull(MDC.get("batchPath"));
    }
}
