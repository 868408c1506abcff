package com.kitchenlab.search.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.resilience")
public class SearchResilienceProperties {
    private int embedFailureThreshold = 3;
    private long embedOpenMs = 30000;
    private int denseFailureThreshold = 3;
    private long denseOpenMs = 30000;

    public int getEmbedFailureThreshold() {
        return embedFailureThreshold;
    }

    public void setEmbedFailureThreshold(int embedFailureThreshold) {
        this.embedFailureThreshold = embedFailureThreshold;
    }

    public long getEmbedOpenMs() {
        return embedOpenMs;
    }

    public void setEmbedOpenMs(long embedOpenMs) {
        this.embedOpenMs = embedOpenMs;
    }

    public int getDenseFailureThreshold() {
        return denseFailureThreshold;
    }

    public void setDenseFailureThreshold(int denseFailureThreshold) {
        this.denseFailureThreshold = denseFailureThreshold;
    }

    public long getDenseOpenMs() {
        return denseOpenMs;
    }

    public void setDenseOpenMs(long denseOpenMs) {
        this.denseOpenMs = denseOpenMs;
    }
}
