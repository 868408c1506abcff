package com.kitchenlab.search.vector;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(VectorStoreProperties.class)
public class VectorStoreConfig {

    @Bean
    public RestTemplate vectorStoreRestTemplate(RestTemplateBuilder builder, VectorStoreProperties properties) {
        return builder
            .setConnectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
            .build();
    }

    @Bean
    public VectorStore vectorStore(
        VectorStoreProperties properties,
        @Qualifier("vectorStoreRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper
    ) {
        if (properties.getMode() == VectorStoreMode.CHROMA) {
            return new ChromaVectorStore(restTemplate, objectMapper, properties);
        }
        return new InMemoryVectorStore();
    }
}
