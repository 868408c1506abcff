package com.kitchenlab.search.resilience;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@EnableConfigurationProperties(SearchResilienceProperties.class)
public class SearchResilienceRegistry {
    private final CircuitBreaker embedBreaker;
    private final CircuitBreaker denseBreaker;

    public SearchResilienceRegistry(SearchResilienceProperties properties) {
        this.embedBreaker = new CircuitBreaker(
            "embed",
            properties.getEmbedFailureThreshold(),
            properties.getEmbedOpenMs()
        );
        this.denseBreaker = new CircuitBreaker(
            "dense",
            properties.getDenseFailureThreshold(),
            properties.getDenseOpenMs()
        );
    }

    public CircuitBreaker getEmbedBreaker() {
        return embedBreaker;
    }

    public CircuitBreaker getDenseBreaker() {
        return denseBreaker;
    }
}
