package com.kitchenlab.search.dense;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.kitchenlab.search.resilience.SearchResilienceProperties;
import com.kitchenlab.search.resilience.SearchResilienceRegistry;
import com.kitchenlab.search.retrieval.DenseMatch;
import com.kitchenlab.search.retrieval.RetrievalException;
import com.kitchenlab.search.retrieval.RetrievalStageResult;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DenseRetrieverTest {

    @Mock
    private DenseSearchClient client;

    private DenseRetriever retriever;

    @BeforeEach
    void setUp() {
        SearchResilienceProperties resilience = new SearchResilienceProperties();
        resilience.setDenseFailureThreshold(2);
        retriever = new DenseRetriever(client, new DenseSearchProperties(), new SearchResilienceRegistry(resilience));
    }

    @Test
    void filtersBelowThresholdSortsAndTruncates() {
        when(client.embedAndSearch("curry", 2, 0.3)).thenReturn(
            List.of(
                new DenseMatch("low", 0.1, null),
                new DenseMatch("mid", 0.6, null),
                new DenseMatch("high", 0.9, null),
                new DenseMatch("mid2", 0.6, null)
            )
        );

        List<DenseMatch> matches = retriever.search("curry", 2, 0.3);

        assertThat(matches).extracting(DenseMatch::getDocId).containsExactly("high", "mid");
    }

    @Test
    void blankQueryOrNonPositiveLimitSkipsClient() {
        assertThat(retriever.search("  ", 5)).isEmpty();
        assertThat(retriever.search("curry", 0)).isEmpty();
        verify(client, never()).embedAndSearch(anyString(), anyInt(), anyDouble());
    }

    @Test
    void upstreamFailureSurfacesAsRetrievalException() {
        when(client.embedAndSearch("curry", 5, 0.3)).thenThrow(new IllegalStateException("store down"));

        assertThatThrownBy(() -> retriever.search("curry", 5))
            .isInstanceOf(RetrievalException.class)
            .satisfies(ex -> assertThat(((RetrievalException) ex).getPath()).isEqualTo(DenseRetriever.PATH));
    }

    @Test
    void retrieveReportsFailureAsErrorStage() {
        when(client.embedAndSearch("curry", 5, 0.3)).thenThrow(new IllegalStateException("store down"));

        RetrievalStageResult<DenseMatch> result = retriever.retrieve("curry", 5);

        assertThat(result.isError()).isTrue();
        assertThat(result.getItems()).isEmpty();
    }

    @Test
    void openCircuitRejectsWithoutCallingClient() {
        when(client.embedAndSearch("curry", 5, 0.3)).thenThrow(new IllegalStateException("store down"));
        retriever.retrieve("curry", 5);
        retriever.retrieve("curry", 5);

        RetrievalStageResult<DenseMatch> result = retriever.retrieve("curry", 5);

        assertThat(result.isError()).isTrue();
        assertThat(result.getReason()).isEqualTo("dense_circuit_open");
        verify(client, times(2)).embedAndSearch("curry", 5, 0.3);
    }

    @Test
    void abandonedCallDoesNotResetTimeoutFailures() {
        when(client.embedAndSearch("curry", 5, 0.3)).thenReturn(List.of(new DenseMatch("late", 0.8, null)));

        retriever.recordTimeout();
        RetrievalStageResult<DenseMatch> late = retriever.retrieve("curry", 5, () -> true);
        retriever.recordTimeout();

        assertThat(late.getItems()).extracting(DenseMatch::getDocId).containsExactly("late");
        assertThat(retriever.retrieve("curry", 5).getReason()).isEqualTo("dense_circuit_open");
        verify(client, times(1)).embedAndSearch("curry", 5, 0.3);
    }
}
