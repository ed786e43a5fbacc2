package com.plotline.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Plotline-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String ANALYSIS_ID = "analysisId";
    public static final String PASS = "pass";

    private MdcContext() {}

    public static void setAnalysis(String analysisId) {
        MDC.put(ANALYSIS_ID, analysisId);
    }

    public static void setPass(String analysisId, String pass) {
        MDC.put(ANALYSIS_ID, analysisId);
        MDC.put(PASS, pass);
    }

    public static void clearPass() {
        MDC.remove(PASS);
    }

    public static void clear() {
        MDC.remove(ANALYSIS_ID);
        MDC.remove(PASS);
    }
}
