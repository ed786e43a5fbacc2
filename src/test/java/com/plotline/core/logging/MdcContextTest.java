package com.plotline.core.logging;

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
    @DisplayName("setAnalysis puts analysisId in MDC")
    void setAnalysis() {
        MdcContext.setAnalysis("GC-2026-0001");
        assertEquals("GC-2026-0001", MDC.get("analysisId"));
    }

    @Test
    @DisplayName("setPass puts analysisId and pass in MDC")
    void setPass() {
        MdcContext.setPass("GC-2026-0001", "sequences");
        assertEquals("GC-2026-0001", MDC.get("analysisId"));
        assertEquals("sequences", MDC.get("pass"));
    }

    @Test
    @DisplayName("clearPass keeps the analysis id")
    void clearPass() {
        MdcContext.setPass("GC-2026-0001", "arc");
        MdcContext.clearPass();
        assertEquals("GC-2026-0001", MDC.get("analysisId"));
        assertNull(MDC.get("pass"));
    }

    @Test
    @DisplayName("clear removes all keys")
    void clear() {
        MdcContext.setPass("GC-2026-0001", "arc");
        MdcContext.clear();
        assertNull(MDC.get("analysisId"));
        assertNull(MDC.get("pass"));
    }
}
