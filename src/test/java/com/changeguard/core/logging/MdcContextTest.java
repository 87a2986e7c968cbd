package com.changeguard.core.logging;

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
    @DisplayName("setChange puts changeId and filePath in MDC")
    void setChange() {
        MdcContext.setChange("c-1", "/w/src/a.js");
        assertEquals("c-1", MDC.get("changeId"));
        assertEquals("/w/src/a.js", MDC.get("filePath"));
    }

    @Test
    @DisplayName("setBranch puts branch in MDC")
    void setBranch() {
        MdcContext.setBranch("cleanup/imports");
        assertEquals("cleanup/imports", MDC.get("branch"));
    }

    @Test
    @DisplayName("clear removes all changeguard MDC keys and leaves others alone")
    void clear() {
        MDC.put("requestId", "r-9");
        MdcContext.setChange("c-1", "/w/a.js");
        MdcContext.setBranch("b");

        MdcContext.clear();

        assertNull(MDC.get("changeId"));
        assertNull(MDC.get("filePath"));
        assertNull(MDC.get("branch"));
        assertEquals("r-9", MDC.get("requestId"));
        MDC.remove("requestId");
    }
}
