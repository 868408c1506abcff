package com.kitchenlab.search.fusion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.kitchenlab.search.retrieval.DenseMatch;
import com.kitchenlab.search.retrieval.SparseMatch;
import java.util.List;
import org.junit.jupiter.api.Test;

class RrfFusionEngineTest {
    private final RrfFusionEngine engine = new RrfFusionEngine(new FusionProperties());

    @Test
    void combinesContributionsFromBothLists() {
        List<FusedResult> fused = engine.fuse(
            List.of(sparse("a", 3.0), sparse("b", 2.0)),
            List.of(dense("b", 0.9), dense("c", 0.8)),
            0.5,
            0.5,
            0
        );

        assertThat(fused).extracting(FusedResult::getDocId).containsExactly("b", "a", "c");
        FusedResult b = fused.get(0);
        assertThat(b.getRrfSparse()).isCloseTo(0.5 / 62, within(1e-12));
        assertThat(b.getRrfDense()).isCloseTo(0.5 / 61, within(1e-12));
        assertThat(b.getCombinedScore()).isCloseTo(0.5 / 62 + 0.5 / 61, within(1e-12));
        assertThat(b.getSparseRank()).isEqualTo(2);
        assertThat(b.getDenseRank()).isEqualTo(1);
        assertThat(b.getSparseScore()).isEqualTo(2.0);
        assertThat(b.getDenseScore()).isEqualTo(0.9);

        FusedResult c = fused.get(2);
        assertThat(c.getSparseRank()).isNull();
        assertThat(c.getSparseScore()).isZero();
        assertThat(c.getRrfSparse()).isZero();
    }

    @Test
    void tiesKeepFirstAppearanceOrder() {
        List<FusedResult> fused = engine.fuse(
            List.of(sparse("s1", 5.0)),
            List.of(dense("d1", 0.9)),
            0.5,
            0.5,
            0
        );

        assertThat(fused).extracting(FusedResult::getDocId).containsExactly("s1", "d1");
    }

    @Test
    void emptyInputsProduceEmptyOutput() {
        assertThat(engine.fuse(List.of(), List.of())).isEmpty();
        assertThat(engine.fuse(null, null)).isEmpty();
    }

    @Test
    void singleListIsItsOwnRrfTransform() {
        List<FusedResult> fused = engine.fuse(List.of(), List.of(dense("x", 0.7), dense("y", 0.6)), 0.5, 0.3, 0);

        assertThat(fused).extracting(FusedResult::getDocId).containsExactly("x", "y");
        assertThat(fused.get(1).getCombinedScore()).isCloseTo(0.3 / 62, within(1e-12));
    }

    @Test
    void duplicateIdsKeepTheirBestRank() {
        List<FusedResult> fused = engine.fuse(
            List.of(sparse("a", 3.0), sparse("b", 2.0), sparse("a", 1.0)),
            List.of(),
            1.0,
            1.0,
            0
        );

        assertThat(fused).hasSize(2);
        assertThat(fused.get(0).getSparseRank()).isEqualTo(1);
        assertThat(fused.get(0).getSparseScore()).isEqualTo(3.0);
    }

    @Test
    void truncatesWhenResultCountIsPositive() {
        List<FusedResult> fused = engine.fuse(
            List.of(sparse("a", 3.0), sparse("b", 2.0), sparse("c", 1.0)),
            List.of(),
            0.5,
            0.5,
            2
        );

        assertThat(fused).extracting(FusedResult::getDocId).containsExactly("a", "b");
    }

    @Test
    void combinedIsAtLeastEachContribution() {
        List<FusedResult> fused = engine.fuse(
            List.of(sparse("a", 3.0), sparse("b", 2.0), sparse("c", 1.0)),
            List.of(dense("c", 0.9), dense("d", 0.5), dense("a", 0.4)),
            0.7,
            0.3,
            0
        );

        assertThat(fused).allSatisfy(result -> {
            assertThat(result.getCombinedScore()).isGreaterThanOrEqualTo(result.getRrfSparse());
            assertThat(result.getCombinedScore()).isGreaterThanOrEqualTo(result.getRrfDense());
        });
    }

    @Test
    void weightsNeedNotSumToOne() {
        List<FusedResult> fused = engine.fuse(List.of(sparse("a", 1.0)), List.of(dense("a", 0.9)), 2.0, 3.0, 0);

        assertThat(fused.get(0).getCombinedScore()).isCloseTo(5.0 / 61, within(1e-12));
    }

    @Test
    void rejectsInvalidWeightsAndK() {
        assertThatThrownBy(() -> engine.fuse(List.of(), List.of(), -0.1, 0.5, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.fuse(List.of(), List.of(), 0.5, Double.NaN, 0))
            .isInstanceOf(IllegalArgumentException.class);

        FusionProperties properties = new FusionProperties();
        properties.setRrfK(0);
        assertThatThrownBy(() -> new RrfFusionEngine(properties)).isInstanceOf(IllegalArgumentException.class);
    }

    private static SparseMatch sparse(String id, double score) {
        return new SparseMatch(id, score, null);
    }

    private static DenseMatch dense(String id, double similarity) {
        return new DenseMatch(id, similarity, null);
    }
}
