package com.plotline.dispatch.api;

import com.plotline.core.model.GlobalCoherenceSettings;
import com.plotline.core.model.Manuscript;

/**
 * Inbound JSON body for POST /api/v1/analyses.
 *
 * @param manuscript the manuscript to analyze
 * @param settings   pass toggles and depth; nullable, defaults to all passes at standard depth
 */
public record StartAnalysisRequest(
    Manuscript manuscript,
    GlobalCoherenceSettings settings
) {}
