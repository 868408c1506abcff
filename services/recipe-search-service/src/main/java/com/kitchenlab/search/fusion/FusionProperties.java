package com.kitchenlab.search.fusion;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.fusion")
public class FusionProperties {
    private int rrfK = 60;
    private double sparseWeight = 0.5;
    private double denseWeight = 0.5;

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        this.rrfK = rrfK;
    }

    public double getSparseWeight() {
        return sparseWeight;
    }

    public void setSparseWeight(double sparseWeight) {
        this.sparseWeight = sparseWeight;
    }

    public double getDenseWeight() {
        return denseWeight;
    }

    public void setDenseWeight(double denseWeight) {
        this.denseWeight = denseWeight;
    }
}
