package com.kitchenlab.search.vector;

import com.kitchenlab.search.model.RecipeMetadata;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brute-force cosine search over vectors held in memory. Used for local runs, where the catalog
 * loader upserts every recipe at startup.
 */
public class InMemoryVectorStore implements VectorStore {
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public synchronized void upsert(String id, List<Double> vector, RecipeMetadata metadata) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("vector id is required");
        }
        if (vector == null || vector.isEmpty()) {
            throw new IllegalArgumentException("vector is required for " + id);
        }
        entries.put(id, new Entry(id, toArray(vector), metadata));
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    @Override
    public List<VectorHit> query(List<Double> vector, int topN, Integer timeBudgetMs) {
        if (vector == null || vector.isEmpty() || topN <= 0) {
            return List.of();
        }
        double[] query = toArray(vector);
        List<Entry> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(entries.values());
        }
        List<VectorHit> hits = new ArrayList<>(snapshot.size());
        for (Entry entry : snapshot) {
            if (entry.vector.length != query.length) {
                throw new VectorStoreUnavailableException(
                    "dimension mismatch for " + entry.id + ": " + entry.vector.length + " != " + query.length
                );
            }
            hits.add(new VectorHit(entry.id, cosineDistance(query, entry.vector), entry.metadata));
        }
        hits.sort(Comparator.comparingDouble(VectorHit::getDistance));
        if (hits.size() > topN) {
            return new ArrayList<>(hits.subList(0, topN));
        }
        return hits;
    }

    static double cosineDistance(double[] left, double[] right) {
        double dot = 0.0;
        double leftNorm = 0.0;
        double rightNorm = 0.0;
        for (int i = 0; i < left.length; i++) {
            dot += left[i] * right[i];
            leftNorm += left[i] * left[i];
            rightNorm += right[i] * right[i];
        }
        if (leftNorm == 0.0 || rightNorm == 0.0) {
            return 1.0;
        }
        return 1.0 - dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }

    private static double[] toArray(List<Double> vector) {
        double[] values = new double[vector.size()];
        for (int i = 0; i < values.length; i++) {
            Double value = vector.get(i);
            values[i] = value == null ? 0.0 : value;
        }
        return values;
    }

    private static final class Entry {
        private final String id;
        private final double[] vector;
        private final RecipeMetadata metadata;

        private Entry(String id, double[] vector, RecipeMetadata metadata) {
            this.id = id;
            this.vector = vector;
            this.metadata = metadata;
        }
    }
}
