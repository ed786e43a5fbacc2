package com.plotline.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "plotline.analysis")
public class AnalysisProperties {

    /** Worker threads shared by all passes for concurrent AI calls. */
    private int maxParallel = 5;

    /** Analyses that may run at once; further submissions queue. */
    private int maxConcurrentRuns = 2;

    /** Completed runs kept in memory for the REST API. */
    private int retainedRuns = 50;

    public int getMaxParallel() {
        return maxParallel;
    }

    public void setMaxParallel(int maxParallel) {
        this.maxParallel = maxParallel;
    }

    public int getMaxConcurrentRuns() {
        return maxConcurrentRuns;
    }

    public void setMaxConcurrentRuns(int maxConcurrentRuns) {
        this.maxConcurrentRuns = maxConcurrentRuns;
    }

    public int getRetainedRuns() {
        return retainedRuns;
    }

    public void setRetainedRuns(int retainedRuns) {
        this.retainedRuns = retainedRuns;
    }
}
