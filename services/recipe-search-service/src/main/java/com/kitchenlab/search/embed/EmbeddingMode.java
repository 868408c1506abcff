package com.kitchenlab.search.embed;

public enum EmbeddingMode {
    HTTP,
    TOY
}
