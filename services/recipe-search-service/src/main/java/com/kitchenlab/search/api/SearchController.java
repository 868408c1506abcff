package com.kitchenlab.search.api;

import com.kitchenlab.search.api.dto.FilterSpec;
import com.kitchenlab.search.api.dto.SearchHit;
import com.kitchenlab.search.api.dto.SearchRequest;
import com.kitchenlab.search.api.dto.SearchResponse;
import com.kitchenlab.search.filter.FilterPolicy;
import com.kitchenlab.search.filter.RecipeFilter;
import com.kitchenlab.search.fusion.FusedResult;
import com.kitchenlab.search.retrieval.DenseMatch;
import com.kitchenlab.search.retrieval.SparseMatch;
import com.kitchenlab.search.service.HybridSearchService;
import com.kitchenlab.search.service.InvalidSearchRequestException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private final HybridSearchService searchService;
    private final FilterPolicy filterPolicy;

    public SearchController(HybridSearchService searchService, FilterPolicy filterPolicy) {
        this.searchService = searchService;
        this.filterPolicy = filterPolicy;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/search/hybrid")
    public SearchResponse hybrid(
        @RequestBody SearchRequest request,
        @RequestHeader(value = RequestIdUtil.TRACE_ID_HEADER, required = false) String traceIdHeader,
        @RequestHeader(value = RequestIdUtil.REQUEST_ID_HEADER, required = false) String requestIdHeader
    ) {
        long started = System.nanoTime();
        List<FusedResult> results = searchService.hybridSearch(
            request.getQuery(),
            resolveResults(request),
            toFilter(request.getFilters()),
            request.getSparseWeight(),
            request.getDenseWeight()
        );
        List<SearchHit> hits = new ArrayList<>(results.size());
        for (FusedResult result : results) {
            SearchHit hit = newHit(hits.size() + 1, result.getDocId(), result.getCombinedScore());
            hit.setSparseScore(result.getSparseScore());
            hit.setDenseScore(result.getDenseScore());
            hit.setRrfSparse(result.getRrfSparse());
            hit.setRrfDense(result.getRrfDense());
            hit.setRecipe(result.getMetadata());
            hits.add(hit);
        }
        return response("hybrid", hits, started, traceIdHeader, requestIdHeader);
    }

    @PostMapping("/search/sparse")
    public SearchResponse sparse(
        @RequestBody SearchRequest request,
        @RequestHeader(value = RequestIdUtil.TRACE_ID_HEADER, required = false) String traceIdHeader,
        @RequestHeader(value = RequestIdUtil.REQUEST_ID_HEADER, required = false) String requestIdHeader
    ) {
        long started = System.nanoTime();
        List<SparseMatch> matches = searchService.sparseSearch(
            request.getQuery(),
            resolveResults(request),
            toFilter(request.getFilters())
        );
        List<SearchHit> hits = new ArrayList<>(matches.size());
        for (SparseMatch match : matches) {
            SearchHit hit = newHit(hits.size() + 1, match.getDocId(), match.getScore());
            hit.setSparseScore(match.getScore());
            hit.setRecipe(match.getMetadata());
            hits.add(hit);
        }
        return response("sparse", hits, started, traceIdHeader, requestIdHeader);
    }

    @PostMapping("/search/dense")
    public SearchResponse dense(
        @RequestBody SearchRequest request,
        @RequestHeader(value = RequestIdUtil.TRACE_ID_HEADER, required = false) String traceIdHeader,
        @RequestHeader(value = RequestIdUtil.REQUEST_ID_HEADER, required = false) String requestIdHeader
    ) {
        long started = System.nanoTime();
        List<DenseMatch> matches = searchService.denseSearch(
            request.getQuery(),
            resolveResults(request),
            toFilter(request.getFilters())
        );
        List<SearchHit> hits = new ArrayList<>(matches.size());
        for (DenseMatch match : matches) {
            SearchHit hit = newHit(hits.size() + 1, match.getDocId(), match.getSimilarity());
            hit.setDenseScore(match.getSimilarity());
            hit.setRecipe(match.getMetadata());
            hits.add(hit);
        }
        return response("dense", hits, started, traceIdHeader, requestIdHeader);
    }

    private int resolveResults(SearchRequest request) {
        Integer requested = request.getNumResults();
        if (requested == null) {
            return searchService.getDefaultResults();
        }
        if (requested <= 0) {
            throw new InvalidSearchRequestException("n_results must be > 0");
        }
        return requested;
    }

    private RecipeFilter toFilter(FilterSpec spec) {
        if (spec == null) {
            return RecipeFilter.none();
        }
        return RecipeFilter.builder(filterPolicy)
            .difficulty(spec.getDifficulty())
            .prepTime(spec.getPrepTimeMin(), spec.getPrepTimeMax())
            .cookTime(spec.getCookTimeMin(), spec.getCookTimeMax())
            .servings(spec.getServingsMin(), spec.getServingsMax())
            .maxTotalTime(spec.getMaxTotalTime())
            .dietaryRestrictions(spec.getDietaryRestrictions())
            .build()
            .orElseThrow();
    }

    private static SearchHit newHit(int rank, String docId, double score) {
        SearchHit hit = new SearchHit();
        hit.setRank(rank);
        hit.setDocId(docId);
        hit.setScore(score);
        return hit;
    }

    private static SearchResponse response(
        String strategy,
        List<SearchHit> hits,
        long startedNanos,
        String traceIdHeader,
        String requestIdHeader
    ) {
        SearchResponse response = new SearchResponse();
        response.setTraceId(RequestIdUtil.resolveOrGenerate(traceIdHeader));
        response.setRequestId(RequestIdUtil.resolveOrGenerate(requestIdHeader));
        response.setTookMs((System.nanoTime() - startedNanos) / 1_000_000L);
        response.setStrategy(strategy);
        response.setHits(hits);
        return response;
    }
}
