package com.kitchenlab.search.vector;

public enum VectorStoreMode {
    CHROMA,
    MEMORY
}
