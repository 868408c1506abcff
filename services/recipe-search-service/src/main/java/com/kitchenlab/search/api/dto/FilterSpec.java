package com.kitchenlab.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class FilterSpec {
    private String difficulty;

    @JsonProperty("prep_time_min")
    private Integer prepTimeMin;

    @JsonProperty("prep_time_max")
    private Integer prepTimeMax;

    @JsonProperty("cook_time_min")
    private Integer cookTimeMin;

    @JsonProperty("cook_time_max")
    private Integer cookTimeMax;

    @JsonProperty("servings_min")
    private Integer servingsMin;

    @JsonProperty("servings_max")
    private Integer servingsMax;

    @JsonProperty("max_total_time")
    private Integer maxTotalTime;

    @JsonProperty("dietary_restrictions")
    private List<String> dietaryRestrictions;

    public String getDifficulty() {
        return difficulty;
    }

    public void setDifficulty(String difficulty) {
        this.difficulty = difficulty;
    }

    public Integer getPrepTimeMin() {
        return prepTimeMin;
    }

    public void setPrepTimeMin(Integer prepTimeMin) {
        this.prepTimeMin = prepTimeMin;
    }

    public Integer getPrepTimeMax() {
        return prepTimeMax;
    }

    public void setPrepTimeMax(Integer prepTimeMax) {
        this.prepTimeMax = prepTimeMax;
    }

    public Integer getCookTimeMin() {
        return cookTimeMin;
    }

    public void setCookTimeMin(Integer cookTimeMin) {
        this.cookTimeMin = cookTimeMin;
    }

    public Integer getCookTimeMax() {
        return cookTimeMax;
    }

    public void setCookTimeMax(Integer cookTimeMax) {
        this.cookTimeMax = cookTimeMax;
    }

    public Integer getServingsMin() {
        return servingsMin;
    }

    public void setServingsMin(Integer servingsMin) {
        this.servingsMin = servingsMin;
    }

    public Integer getServingsMax() {
        return servingsMax;
    }

    public void setServingsMax(Integer servingsMax) {
        this.servingsMax = servingsMax;
    }

    public Integer getMaxTotalTime() {
        return maxTotalTime;
    }

    public void setMaxTotalTime(Integer maxTotalTime) {
        this.maxTotalTime = maxTotalTime;
    }

    public List<String> getDietaryRestrictions() {
        return dietaryRestrictions;
    }

    public void setDietaryRestrictions(List<String> dietaryRestrictions) {
        this.dietaryRestrictions = dietaryRestrictions;
    }
}
