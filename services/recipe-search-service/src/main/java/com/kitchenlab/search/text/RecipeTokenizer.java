package com.kitchenlab.search.text;

import com.kitchenlab.search.model.RecipeDocument;
import com.kitchenlab.search.model.RecipeMetadata;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Turns recipe text and queries into the lower-case ASCII keywords the BM25 index works on.
 * Indexing and query encoding go through the same pipeline.
 */
@Component
public class RecipeTokenizer {
    private final int minKeywordLength;
    private final boolean stopwordsEnabled;
    private final Set<String> stopwords;

    public RecipeTokenizer(TokenizerProperties properties) {
        this.minKeywordLength = Math.max(1, properties.getMinKeywordLength());
        this.stopwordsEnabled = properties.isStopwordsEnabled();
        Set<String> words = new HashSet<>(CookingStopwords.DEFAULT);
        if (properties.getExtraStopwords() != null) {
            for (String extra : properties.getExtraStopwords()) {
                if (extra != null && !extra.isBlank()) {
                    words.add(extra.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.stopwords = Collections.unmodifiableSet(words);
    }

    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < lowered.length(); i++) {
            char ch = lowered.charAt(i);
            if ((ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9')) {
                current.append(ch);
            } else if (current.length() > 0) {
                tokens.add(current.toString());
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    public List<String> filterKeywords(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }
        List<String> keywords = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            if (token == null || token.length() < minKeywordLength) {
                continue;
            }
            if (stopwordsEnabled && stopwords.contains(token)) {
                continue;
            }
            keywords.add(token);
        }
        return keywords;
    }

    public List<String> queryKeywords(String query) {
        return filterKeywords(tokenize(query));
    }

    /**
     * Title tokens appear twice so title matches weigh more than ingredient or step matches.
     */
    public List<String> documentKeywords(RecipeDocument document) {
        RecipeMetadata metadata = document == null ? null : document.getMetadata();
        if (metadata == null) {
            return List.of();
        }
        return filterKeywords(tokenize(metadata.getTitle() + " " + document.searchableText()));
    }

    public Set<String> getStopwords() {
        return stopwords;
    }
}
