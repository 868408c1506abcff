package com.kitchenlab.search.api;

import com.kitchenlab.search.api.dto.IndexStatsResponse;
import com.kitchenlab.search.catalog.RecipeIndexingService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/index")
public class IndexAdminController {
    private final RecipeIndexingService indexingService;

    public IndexAdminController(RecipeIndexingService indexingService) {
        this.indexingService = indexingService;
    }

    @PostMapping("/rebuild")
    public IndexStatsResponse rebuild() {
        return IndexStatsResponse.from(indexingService.rebuild());
    }

    @GetMapping("/stats")
    public IndexStatsResponse stats() {
        return IndexStatsResponse.from(indexingService.stats());
    }
}
