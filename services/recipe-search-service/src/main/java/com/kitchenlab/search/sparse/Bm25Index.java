package com.kitchenlab.search.sparse;

import com.kitchenlab.search.model.RecipeDocument;
import com.kitchenlab.search.retrieval.SparseMatch;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Immutable BM25 snapshot over a fixed document set. Safe for concurrent readers.
 */
public final class Bm25Index {
    private final List<RecipeDocument> documents;
    private final Map<String, Integer> positions;
    private final Map<String, List<Posting>> postings;
    private final int[] lengths;
    private final double averageLength;
    private final double k1;
    private final double b;
    private final long builtAtMs;

    private Bm25Index(
        List<RecipeDocument> documents,
        Map<String, Integer> positions,
        Map<String, List<Posting>> postings,
        int[] lengths,
        double averageLength,
        double k1,
        double b,
        long builtAtMs
    ) {
        this.documents = documents;
        this.positions = positions;
        this.postings = postings;
        this.lengths = lengths;
        this.averageLength = averageLength;
        this.k1 = k1;
        this.b = b;
        this.builtAtMs = builtAtMs;
    }

    /**
     * A later document with an id already seen replaces the earlier record but keeps its position.
     */
    public static Bm25Index build(
        Collection<RecipeDocument> source,
        Function<RecipeDocument, List<String>> keywords,
        double k1,
        double b
    ) {
        Map<String, RecipeDocument> unique = new LinkedHashMap<>();
        for (RecipeDocument document : source) {
            if (document == null || document.getId() == null || document.getId().isBlank()) {
                throw new SparseIndexBuildException("document without id");
            }
            unique.put(document.getId(), document);
        }

        List<RecipeDocument> documents = new ArrayList<>(unique.values());
        Map<String, Integer> positions = new HashMap<>();
        Map<String, List<Posting>> postings = new HashMap<>();
        int[] lengths = new int[documents.size()];
        long totalLength = 0L;

        for (int i = 0; i < documents.size(); i++) {
            RecipeDocument document = documents.get(i);
            positions.put(document.getId(), i);
            List<String> tokens = keywords.apply(document);
            lengths[i] = tokens.size();
            totalLength += tokens.size();

            Map<String, Integer> frequencies = new LinkedHashMap<>();
            for (String token : tokens) {
                frequencies.merge(token, 1, Integer::sum);
            }
            for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
                postings.computeIfAbsent(entry.getKey(), key -> new ArrayList<>())
                    .add(new Posting(i, entry.getValue()));
            }
        }

        double averageLength = documents.isEmpty() ? 0.0 : (double) totalLength / documents.size();
        return new Bm25Index(
            Collections.unmodifiableList(documents),
            positions,
            postings,
            lengths,
            averageLength,
            k1,
            b,
            System.currentTimeMillis()
        );
    }

    public List<SparseMatch> search(List<String> queryTokens, int topN) {
        if (queryTokens == null || queryTokens.isEmpty() || topN <= 0 || documents.isEmpty()) {
            return List.of();
        }
        double[] scores = new double[documents.size()];
        for (String term : queryTokens) {
            List<Posting> termPostings = postings.get(term);
            if (termPostings == null) {
                continue;
            }
            double idf = idf(termPostings.size());
            for (Posting posting : termPostings) {
                scores[posting.position] += idf * termWeight(posting.frequency, lengths[posting.position]);
            }
        }

        List<Integer> matched = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] > 0.0) {
                matched.add(i);
            }
        }
        // stable on insertion position for equal scores
        matched.sort((left, right) -> {
            int byScore = Double.compare(scores[right], scores[left]);
            return byScore != 0 ? byScore : Integer.compare(left, right);
        });

        int limit = Math.min(topN, matched.size());
        List<SparseMatch> results = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            RecipeDocument document = documents.get(matched.get(i));
            results.add(new SparseMatch(document.getId(), scores[matched.get(i)], document.getMetadata()));
        }
        return results;
    }

    public RecipeDocument getDocument(String docId) {
        Integer position = docId == null ? null : positions.get(docId);
        return position == null ? null : documents.get(position);
    }

    public int size() {
        return documents.size();
    }

    public int vocabularySize() {
        return postings.size();
    }

    public double getAverageLength() {
        return averageLength;
    }

    public long getBuiltAtMs() {
        return builtAtMs;
    }

    private double idf(int documentFrequency) {
        int n = documents.size();
        return Math.log(1.0 + (n - documentFrequency + 0.5) / (documentFrequency + 0.5));
    }

    private double termWeight(int frequency, int length) {
        double norm = averageLength > 0.0 ? (1.0 - b + b * length / averageLength) : 1.0;
        return frequency * (k1 + 1.0) / (frequency + k1 * norm);
    }

    private static final class Posting {
        private final int position;
        private final int frequency;

        private Posting(int position, int frequency) {
            this.position = position;
            this.frequency = frequency;
        }
    }
}
