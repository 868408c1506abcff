package com.kitchenlab.search.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.kitchenlab.search.catalog.IndexStats;
import com.kitchenlab.search.catalog.RecipeIndexingService;
import com.kitchenlab.search.sparse.SparseIndexBuildException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(IndexAdminController.class)
class IndexAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RecipeIndexingService indexingService;

    @Test
    void statsBeforeFirstBuild() throws Exception {
        when(indexingService.stats()).thenReturn(IndexStats.notBuilt());

        mockMvc.perform(get("/internal/index/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.built").value(false))
            .andExpect(jsonPath("$.document_count").value(0))
            .andExpect(jsonPath("$.built_at_ms").doesNotExist());
    }

    @Test
    void rebuildReturnsFreshStats() throws Exception {
        when(indexingService.rebuild()).thenReturn(new IndexStats(true, 8, 120, 24.5, 1_700_000_000_000L));

        mockMvc.perform(post("/internal/index/rebuild"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.built").value(true))
            .andExpect(jsonPath("$.document_count").value(8))
            .andExpect(jsonPath("$.vocabulary_size").value(120))
            .andExpect(jsonPath("$.average_length").value(24.5));
    }

    @Test
    void rebuildFailureMapsToServerError() throws Exception {
        when(indexingService.rebuild()).thenThrow(new SparseIndexBuildException("no documents to index"));

        mockMvc.perform(post("/internal/index/rebuild"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error.code").value("index_build_failed"));
    }
}
