package com.kitchenlab.search.embed;

import com.kitchenlab.search.resilience.CircuitBreaker;
import com.kitchenlab.search.resilience.SearchResilienceRegistry;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class EmbeddingService implements EmbeddingProvider {
    private final EmbeddingProperties properties;
    private final EmbeddingGateway embeddingGateway;
    private final ToyEmbedder toyEmbedder;
    private final SearchResilienceRegistry resilienceRegistry;

    public EmbeddingService(
        EmbeddingProperties properties,
        EmbeddingGateway embeddingGateway,
        ToyEmbedder toyEmbedder,
        SearchResilienceRegistry resilienceRegistry
    ) {
        this.properties = properties;
        this.embeddingGateway = embeddingGateway;
        this.toyEmbedder = toyEmbedder;
        this.resilienceRegistry = resilienceRegistry;
    }

    @Override
    public List<Double> embed(String text, Integer timeBudgetMs) {
        if (properties.getMode() != EmbeddingMode.HTTP) {
            return toyEmbedder.embed(text);
        }
        CircuitBreaker breaker = resilienceRegistry.getEmbedBreaker();
        if (!breaker.allowRequest()) {
            throw new EmbeddingUnavailableException("embed_circuit_open");
        }
        try {
            List<Double> vector = embeddingGateway.embed(text, timeBudgetMs);
            breaker.recordSuccess();
            return vector;
        } catch (EmbeddingUnavailableException ex) {
            breaker.recordFailure();
            throw ex;
        }
    }
}
