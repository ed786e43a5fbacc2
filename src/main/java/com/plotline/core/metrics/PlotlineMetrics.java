package com.plotline.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for global coherence runs.
 */
@Service
public class PlotlineMetrics {

    private final MeterRegistry registry;

    public PlotlineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPassDuration(String pass, long ms) {
        Timer.builder("plotline.pass.duration")
                .description("Wall-clock time of one analysis pass")
                .tag("pass", pass)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPassFailure(String pass) {
        Counter.builder("plotline.pass.failures")
                .description("Passes that failed and were skipped")
                .tag("pass", pass)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "completed", "cancelled" or "failed"
     */
    public void recordAnalysisResult(String outcome) {
        Counter.builder("plotline.analyses.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordSynthesisShortCircuit() {
        Counter.builder("plotline.synthesis.short_circuits")
                .description("Synthesis passes that skipped the AI call for lack of findings")
                .register(registry)
                .increment();
    }
}
