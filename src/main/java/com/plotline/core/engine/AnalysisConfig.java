package com.plotline.core.engine;

import com.plotline.core.cache.AnalysisCache;
import com.plotline.core.cache.CachingContinuityAnalyzer;
import com.plotline.core.cache.InMemoryAnalysisCache;
import com.plotline.core.llm.ContinuityAnalyzer;
import com.plotline.core.llm.LlmContinuityAnalyzer;
import com.plotline.core.llm.LlmProperties;
import com.plotline.core.llm.LlmService;
import com.plotline.core.passes.BatchRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the AI capability, the optional cache and the two thread pools. Whole runs and the
 * AI calls inside them get separate pools so queued runs never starve the passes of workers.
 */
@Configuration
public class AnalysisConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

    @Bean(destroyMethod = "shutdown")
    public ExecutorService analysisExecutor(AnalysisProperties properties) {
        int threads = Math.max(1, properties.getMaxParallel());
        AtomicInteger counter = new AtomicInteger();
        log.info("Analysis worker pool sized at {} threads", threads);
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "plotline-analysis-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService analysisRunExecutor(AnalysisProperties properties) {
        int threads = Math.max(1, properties.getMaxConcurrentRuns());
        AtomicInteger counter = new AtomicInteger();
        log.info("Analysis run pool sized at {} threads", threads);
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "plotline-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public BatchRunner batchRunner(@Qualifier("analysisExecutor") ExecutorService analysisExecutor) {
        return new BatchRunner(analysisExecutor);
    }

    @Bean
    @ConditionalOnProperty(name = "plotline.cache.enabled", havingValue = "true")
    public AnalysisCache analysisCache(@Value("${plotline.cache.max-entries:10000}") int maxEntries) {
        return new InMemoryAnalysisCache(maxEntries);
    }

    @Bean
    public ContinuityAnalyzer continuityAnalyzer(LlmService llmService, LlmProperties properties,
                                                 @Autowired(required = false) AnalysisCache cache) {
        ContinuityAnalyzer analyzer = new LlmContinuityAnalyzer(llmService, properties);
        if (cache != null) {
            log.info("Analysis cache enabled");
            return new CachingContinuityAnalyzer(analyzer, cache);
        }
        return analyzer;
    }
}
