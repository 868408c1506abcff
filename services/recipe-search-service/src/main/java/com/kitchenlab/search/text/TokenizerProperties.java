package com.kitchenlab.search.text;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.tokenizer")
public class TokenizerProperties {
    private int minKeywordLength = 2;
    private boolean stopwordsEnabled = true;
    private List<String> extraStopwords = new ArrayList<>();

    public int getMinKeywordLength() {
        return minKeywordLength;
    }

    public void setMinKeywordLength(int minKeywordLength) {
        this.minKeywordLength = minKeywordLength;
    }

    public boolean isStopwordsEnabled() {
        return stopwordsEnabled;
    }

    public void setStopwordsEnabled(boolean stopwordsEnabled) {
        this.stopwordsEnabled = stopwordsEnabled;
    }

    public List<String> getExtraStopwords() {
        return extraStopwords;
    }

    public void setExtraStopwords(List<String> extraStopwords) {
        this.extraStopwords = extraStopwords;
    }
}
