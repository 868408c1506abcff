package com.kitchenlab.search.text;

import java.util.Set;

public final class CookingStopwords {
    public static final Set<String> DEFAULT = Set.of(
        "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he",
        "in", "is", "it", "its", "of", "on", "that", "the", "to", "was", "will", "with",
        "add", "then", "into", "over", "until", "about", "all", "also", "can", "or"
    );

    private CookingStopwords() {
    }
}
