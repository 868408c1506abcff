package com.kitchenlab.search.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search")
public class SearchProperties {
    private int defaultResults = 10;
    private int oversampleFactor = 3;
    private int sparseTimeoutMs = 1000;
    private int denseTimeoutMs = 1500;
    private boolean hybridEnabled = true;

    public int getDefaultResults() {
        return defaultResults;
    }

    public void setDefaultResults(int defaultResults) {
        this.defaultResults = defaultResults;
    }

    public int getOversampleFactor() {
        return oversampleFactor;
    }

    public void setOversampleFactor(int oversampleFactor) {
        this.oversampleFactor = oversampleFactor;
    }

    public int getSparseTimeoutMs() {
        return sparseTimeoutMs;
    }

    public void setSparseTimeoutMs(int sparseTimeoutMs) {
        this.sparseTimeoutMs = sparseTimeoutMs;
    }

    public int getDenseTimeoutMs() {
        return denseTimeoutMs;
    }

    public void setDenseTimeoutMs(int denseTimeoutMs) {
        this.denseTimeoutMs = denseTimeoutMs;
    }

    public boolean isHybridEnabled() {
        return hybridEnabled;
    }

    public void setHybridEnabled(boolean hybridEnabled) {
        this.hybridEnabled = hybridEnabled;
    }
}
