package com.kitchenlab.search.vector;

import com.kitchenlab.search.model.RecipeMetadata;

/**
 * One nearest-neighbour hit. {@code distance} is the cosine distance reported by the store.
 */
public final class VectorHit {
    private final String id;
    private final double distance;
    private final RecipeMetadata metadata;

    public VectorHit(String id, double distance, RecipeMetadata metadata) {
        this.id = id;
        this.distance = distance;
        this.metadata = metadata;
    }

    public String getId() {
        return id;
    }

    public double getDistance() {
        return distance;
    }

    public RecipeMetadata getMetadata() {
        return metadata;
    }
}
