package com.kitchenlab.search.fusion;

import com.kitchenlab.search.model.RecipeMetadata;
import com.kitchenlab.search.retrieval.DenseMatch;
import com.kitchenlab.search.retrieval.SparseMatch;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Weighted Reciprocal Rank Fusion: {@code w / (k + rank)} per path, summed per recipe.
 *
 * <p>Equal combined scores keep first-appearance order: sparse hits in sparse order, then
 * dense-only hits in dense order.
 */
@Component
public class RrfFusionEngine {
    private final FusionProperties properties;

    public RrfFusionEngine(FusionProperties properties) {
        if (properties.getRrfK() < 1) {
            throw new IllegalArgumentException("search.fusion.rrf-k must be >= 1");
        }
        requireWeight("search.fusion.sparse-weight", properties.getSparseWeight());
        requireWeight("search.fusion.dense-weight", properties.getDenseWeight());
        this.properties = properties;
    }

    public List<FusedResult> fuse(List<SparseMatch> sparse, List<DenseMatch> dense) {
        return fuse(sparse, dense, properties.getSparseWeight(), properties.getDenseWeight(), 0);
    }

    public List<FusedResult> fuse(
        List<SparseMatch> sparse,
        List<DenseMatch> dense,
        double sparseWeight,
        double denseWeight,
        int nResults
    ) {
        requireWeight("sparse_weight", sparseWeight);
        requireWeight("dense_weight", denseWeight);
        int k = properties.getRrfK();
        Map<String, MutableCandidate> candidates = new LinkedHashMap<>();

        if (sparse != null) {
            int rank = 0;
            for (SparseMatch match : sparse) {
                rank++;
                MutableCandidate candidate = candidates.computeIfAbsent(match.getDocId(), MutableCandidate::new);
                if (candidate.sparseRank != null) {
                    continue;
                }
                candidate.sparseRank = rank;
                candidate.sparseScore = match.getScore();
                candidate.rrfSparse = sparseWeight / (k + rank);
                if (candidate.metadata == null) {
                    candidate.metadata = match.getMetadata();
                }
            }
        }

        if (dense != null) {
            int rank = 0;
            for (DenseMatch match : dense) {
                rank++;
                MutableCandidate candidate = candidates.computeIfAbsent(match.getDocId(), MutableCandidate::new);
                if (candidate.denseRank != null) {
                    continue;
                }
                candidate.denseRank = rank;
                candidate.denseScore = match.getSimilarity();
                candidate.rrfDense = denseWeight / (k + rank);
                if (candidate.metadata == null) {
                    candidate.metadata = match.getMetadata();
                }
            }
        }

        List<MutableCandidate> ordered = new ArrayList<>(candidates.values());
        // stable sort over insertion order gives the first-appearance tie-break
        ordered.sort(Comparator.comparingDouble(MutableCandidate::combined).reversed());

        int limit = nResults > 0 ? Math.min(nResults, ordered.size()) : ordered.size();
        List<FusedResult> fused = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            MutableCandidate candidate = ordered.get(i);
            fused.add(
                new FusedResult(
                    candidate.docId,
                    candidate.sparseScore,
                    candidate.denseScore,
                    candidate.sparseRank,
                    candidate.denseRank,
                    candidate.rrfSparse,
                    candidate.rrfDense,
                    candidate.metadata
                )
            );
        }
        return fused;
    }

    public static boolean isValidWeight(double weight) {
        return !Double.isNaN(weight) && !Double.isInfinite(weight) && weight >= 0.0;
    }

    private static void requireWeight(String name, double weight) {
        if (!isValidWeight(weight)) {
            throw new IllegalArgumentException(name + " must be a finite value >= 0");
        }
    }

    private static final class MutableCandidate {
        private final String docId;
        private Integer sparseRank;
        private Integer denseRank;
        private double sparseScore;
        private double denseScore;
        private double rrfSparse;
        private double rrfDense;
        private RecipeMetadata metadata;

        private MutableCandidate(String docId) {
            this.docId = docId;
        }

        private double combined() {
            return rrfSparse + rrfDense;
        }
    }
}
