package com.kitchenlab.search.filter;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.filter")
public class FilterProperties {
    private int maxMinutes = 1440;
    private int servingsMin = 1;
    private int servingsMax = 50;
    private List<String> supportedDietaryRestrictions = new ArrayList<>(DietaryRules.DEFAULT_SUPPORTED);

    public int getMaxMinutes() {
        return maxMinutes;
    }

    public void setMaxMinutes(int maxMinutes) {
        this.maxMinutes = maxMinutes;
    }

    public int getServingsMin() {
        return servingsMin;
    }

    public void setServingsMin(int servingsMin) {
        this.servingsMin = servingsMin;
    }

    public int getServingsMax() {
        return servingsMax;
    }

    public void setServingsMax(int servingsMax) {
        this.servingsMax = servingsMax;
    }

    public List<String> getSupportedDietaryRestrictions() {
        return supportedDietaryRestrictions;
    }

    public void setSupportedDietaryRestrictions(List<String> supportedDietaryRestrictions) {
        this.supportedDietaryRestrictions = supportedDietaryRestrictions;
    }
}
