package com.plotline.core.compress;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "plotline.compressor")
public class CompressorProperties {

    private int maxBoundaryWords = 200;
    private int maxSummaryWords = 150;
    private boolean useAiSummaries = false;
    private int aiPreviousContextScenes = 0;
    private long delayMsBetweenBatches = 350;
    private int chapterSize = 10;

    public int getMaxBoundaryWords() { return maxBoundaryWords; }
    public void setMaxBoundaryWords(int maxBoundaryWords) { this.maxBoundaryWords = maxBoundaryWords; }
    public int getMaxSummaryWords() { return maxSummaryWords; }
    public void setMaxSummaryWords(int maxSummaryWords) { this.maxSummaryWords = maxSummaryWords; }
    public boolean isUseAiSummaries() { return useAiSummaries; }
    public void setUseAiSummaries(boolean useAiSummaries) { this.useAiSummaries = useAiSummaries; }
    public int getAiPreviousContextScenes() { return aiPreviousContextScenes; }
    public void setAiPreviousContextScenes(int aiPreviousContextScenes) { this.aiPreviousContextScenes = aiPreviousContextScenes; }
    public long getDelayMsBetweenBatches() { return delayMsBetweenBatches; }
    public void setDelayMsBetweenBatches(long delayMsBetweenBatches) { this.delayMsBetweenBatches = delayMsBetweenBatches; }
    public int getChapterSize() { return chapterSize; }
    public void setChapterSize(int chapterSize) { this.chapterSize = chapterSize; }
}
