package com.kitchenlab.search.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.kitchenlab.search.RecipeFixtures;
import com.kitchenlab.search.filter.FilterConfig;
import com.kitchenlab.search.fusion.FusedResult;
import com.kitchenlab.search.retrieval.DenseMatch;
import com.kitchenlab.search.retrieval.RetrievalException;
import com.kitchenlab.search.retrieval.SparseMatch;
import com.kitchenlab.search.service.HybridSearchService;
import com.kitchenlab.search.service.TotalRetrievalFailureException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SearchController.class)
@Import(FilterConfig.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HybridSearchService hybridSearchService;

    @Test
    void healthReturnsOk() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void hybridSearchReturnsRankedHits() throws Exception {
        FusedResult top = new FusedResult(
            RecipeFixtures.CHICKEN_CURRY,
            1.62,
            0.92,
            1,
            1,
            0.5 / 61,
            0.5 / 61,
            RecipeFixtures.chickenCurry().getMetadata()
        );
        when(hybridSearchService.hybridSearch(eq("chicken curry"), eq(2), any(), any(), any()))
            .thenReturn(List.of(top));

        mockMvc.perform(post("/search/hybrid")
                .header(RequestIdUtil.TRACE_ID_HEADER, "trace-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"chicken curry\",\"n_results\":2}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.trace_id").value("trace-1"))
            .andExpect(jsonPath("$.strategy").value("hybrid"))
            .andExpect(jsonPath("$.hits[0].rank").value(1))
            .andExpect(jsonPath("$.hits[0].doc_id").value(RecipeFixtures.CHICKEN_CURRY))
            .andExpect(jsonPath("$.hits[0].rrf_sparse").value(0.5 / 61))
            .andExpect(jsonPath("$.hits[0].recipe.title").value("Chicken Curry"))
            .andExpect(jsonPath("$.hits[0].recipe.total_time").value(60));
    }

    @Test
    void sparseSearchUsesServiceDefaultWhenResultCountMissing() throws Exception {
        when(hybridSearchService.getDefaultResults()).thenReturn(10);
        when(hybridSearchService.sparseSearch(eq("curry"), eq(10), any()))
            .thenReturn(List.of(new SparseMatch(RecipeFixtures.VEGETABLE_CURRY, 0.66, null)));

        mockMvc.perform(post("/search/sparse")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"curry\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.strategy").value("sparse"))
            .andExpect(jsonPath("$.hits[0].sparse_score").value(0.66))
            .andExpect(jsonPath("$.hits[0].dense_score").doesNotExist());
    }

    @Test
    void denseSearchUnavailableMapsToServiceUnavailable() throws Exception {
        when(hybridSearchService.denseSearch(eq("curry"), eq(3), any()))
            .thenThrow(new RetrievalException("dense", "dense_circuit_open"));

        mockMvc.perform(post("/search/dense")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"curry\",\"n_results\":3}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error.code").value("dense_unavailable"));
    }

    @Test
    void denseSearchReturnsSimilarity() throws Exception {
        when(hybridSearchService.denseSearch(eq("curry"), eq(1), any()))
            .thenReturn(List.of(new DenseMatch(RecipeFixtures.VEGETABLE_CURRY, 0.8, null)));

        mockMvc.perform(post("/search/dense")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"curry\",\"n_results\":1}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hits[0].score").value(0.8))
            .andExpect(jsonPath("$.hits[0].dense_score").value(0.8));
    }

    @Test
    void totalFailureMapsToServiceUnavailable() throws Exception {
        when(hybridSearchService.hybridSearch(eq("curry"), anyInt(), any(), any(), any()))
            .thenThrow(new TotalRetrievalFailureException("boom", "timeout"));

        mockMvc.perform(post("/search/hybrid")
                .header(RequestIdUtil.REQUEST_ID_HEADER, "req-7")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"curry\",\"n_results\":5}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error.code").value("search_unavailable"))
            .andExpect(jsonPath("$.request_id").value("req-7"));
    }

    @Test
    void invertedPrepTimeRangeIsRejected() throws Exception {
        mockMvc.perform(post("/search/hybrid")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"curry\",\"n_results\":5,\"filters\":{\"prep_time_min\":30,\"prep_time_max\":10}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));

        verifyNoInteractions(hybridSearchService);
    }

    @Test
    void unknownDifficultyIsRejected() throws Exception {
        mockMvc.perform(post("/search/sparse")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"curry\",\"n_results\":5,\"filters\":{\"difficulty\":\"Expert\"}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void nonPositiveResultCountIsRejected() throws Exception {
        mockMvc.perform(post("/search/hybrid")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"curry\",\"n_results\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("n_results must be > 0"));
    }

    @Test
    void malformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/search/hybrid")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void filtersArePassedThroughToTheService() throws Exception {
        when(hybridSearchService.hybridSearch(eq("curry"), eq(4), any(), eq(0.2), eq(0.8)))
            .thenReturn(List.of());

        mockMvc.perform(post("/search/hybrid")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"curry\",\"n_results\":4,\"sparse_weight\":0.2,\"dense_weight\":0.8,"
                    + "\"filters\":{\"difficulty\":\"beginner\",\"dietary_restrictions\":[\"Vegan\"]}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hits").isEmpty());

        verify(hybridSearchService).hybridSearch(eq("curry"), eq(4), any(), eq(0.2), eq(0.8));
    }
}
