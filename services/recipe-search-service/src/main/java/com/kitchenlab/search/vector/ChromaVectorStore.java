package com.kitchenlab.search.vector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kitchenlab.search.model.RecipeMetadata;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Queries a Chroma collection over its v1 REST API.
 *
 * <p>The collection id is taken from configuration when present, otherwise resolved once from the
 * collection name.
 */
public class ChromaVectorStore implements VectorStore {
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final VectorStoreProperties properties;
    private volatile String collectionId;

    public ChromaVectorStore(RestTemplate restTemplate, ObjectMapper objectMapper, VectorStoreProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.collectionId = properties.getCollectionId();
    }

    @Override
    public List<VectorHit> query(List<Double> vector, int topN, Integer timeBudgetMs) {
        if (vector == null || vector.isEmpty() || topN <= 0) {
            return List.of();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query_embeddings", List.of(vector));
        body.put("n_results", topN);
        body.put("include", List.of("metadatas", "distances"));

        String path = "/api/v1/collections/" + resolveCollectionId(timeBudgetMs) + "/query";
        JsonNode response = exchange(path, HttpMethod.POST, body, timeBudgetMs);
        return extractHits(response);
    }

    private String resolveCollectionId(Integer timeBudgetMs) {
        String resolved = collectionId;
        if (resolved != null && !resolved.isBlank()) {
            return resolved;
        }
        String name = properties.getCollection();
        if (name == null || name.isBlank()) {
            throw new VectorStoreUnavailableException("vector-store collection is not configured");
        }
        JsonNode response = exchange("/api/v1/collections/" + name, HttpMethod.GET, null, timeBudgetMs);
        resolved = response.path("id").asText(null);
        if (resolved == null || resolved.isBlank()) {
            throw new VectorStoreUnavailableException("collection not found: " + name);
        }
        collectionId = resolved;
        return resolved;
    }

    private List<VectorHit> extractHits(JsonNode response) {
        JsonNode ids = response.path("ids").path(0);
        JsonNode distances = response.path("distances").path(0);
        JsonNode metadatas = response.path("metadatas").path(0);
        if (!ids.isArray()) {
            throw new VectorStoreUnavailableException("malformed vector store response");
        }
        List<VectorHit> hits = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            String id = ids.get(i).asText(null);
            JsonNode distance = distances.path(i);
            if (id == null || !distance.isNumber()) {
                continue;
            }
            hits.add(new VectorHit(id, distance.asDouble(), RecipeMetadata.fromJson(metadatas.path(i))));
        }
        return hits;
    }

    private JsonNode exchange(String path, HttpMethod method, Object body, Integer timeBudgetMs) {
        String url = buildUrl(path);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            String payload = body == null ? null : objectMapper.writeValueAsString(body);
            HttpEntity<String> entity = new HttpEntity<>(payload, headers);
            ResponseEntity<String> response = restTemplateFor(timeBudgetMs).exchange(url, method, entity, String.class);
            if (response.getBody() == null) {
                throw new VectorStoreUnavailableException("empty vector store response");
            }
            return objectMapper.readTree(response.getBody());
        } catch (ResourceAccessException e) {
            throw new VectorStoreUnavailableException("vector store unreachable: " + url, e);
        } catch (HttpStatusCodeException e) {
            throw new VectorStoreUnavailableException("vector store error: " + e.getStatusCode().value(), e);
        } catch (JsonProcessingException e) {
            throw new VectorStoreUnavailableException("failed to parse vector store response", e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base == null || base.isBlank()) {
            throw new VectorStoreUnavailableException("vector-store base-url is not configured");
        }
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private RestTemplate restTemplateFor(Integer timeBudgetMs) {
        if (timeBudgetMs == null) {
            return restTemplate;
        }
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeBudgetMs);
        factory.setReadTimeout(timeBudgetMs);
        return new RestTemplate(factory);
    }
}
