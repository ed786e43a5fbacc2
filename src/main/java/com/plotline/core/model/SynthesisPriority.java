package com.plotline.core.model;

import java.io.Serializable;

/**
 * One prioritized issue pattern from the synthesis pass.
 *
 * @param impact "high", "medium" or "low" as reported by the provider
 */
public record SynthesisPriority(
    String issuePattern,
    int affectedSceneCount,
    String impact,
    String rootCause,
    String recommendedFix
) implements Serializable {

    public boolean isHighImpact() {
        return "high".equalsIgnoreCase(impact);
    }
}
