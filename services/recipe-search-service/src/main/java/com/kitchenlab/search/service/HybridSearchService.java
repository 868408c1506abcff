package com.kitchenlab.search.service;

import com.kitchenlab.search.catalog.DocumentStore;
import com.kitchenlab.search.dense.DenseRetriever;
import com.kitchenlab.search.filter.MetadataFilterEngine;
import com.kitchenlab.search.filter.RecipeFilter;
import com.kitchenlab.search.fusion.FusedResult;
import com.kitchenlab.search.fusion.FusionProperties;
import com.kitchenlab.search.fusion.RrfFusionEngine;
import com.kitchenlab.search.model.RecipeDocument;
import com.kitchenlab.search.model.RecipeMetadata;
import com.kitchenlab.search.retrieval.DenseMatch;
import com.kitchenlab.search.retrieval.RetrievalException;
import com.kitchenlab.search.retrieval.RetrievalStageResult;
import com.kitchenlab.search.retrieval.SparseMatch;
import com.kitchenlab.search.retrieval.SparseRetriever;
import com.kitchenlab.search.sparse.Bm25Index;
import com.kitchenlab.search.sparse.SparseIndex;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the sparse and dense paths concurrently, fuses their rankings with weighted RRF, then
 * filters on recipe metadata and truncates.
 *
 * <p>A failed or timed-out path degrades to an empty list; the request only fails when every
 * active path failed. Each path has its own budget measured from the start of the request.
 */
@Service
public class HybridSearchService {
    private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);

    static final String DEGRADED_METRIC = "recipe_search_degraded_total";
    static final String TOTAL_FAILURE_METRIC = "recipe_search_total_failure_total";

    private final SparseRetriever sparseRetriever;
    private final DenseRetriever denseRetriever;
    private final RrfFusionEngine fusionEngine;
    private final MetadataFilterEngine filterEngine;
    private final SparseIndex sparseIndex;
    private final DocumentStore documentStore;
    private final SearchProperties searchProperties;
    private final FusionProperties fusionProperties;
    private final ExecutorService searchExecutor;
    private final MeterRegistry meterRegistry;

    public HybridSearchService(
        SparseRetriever sparseRetriever,
        DenseRetriever denseRetriever,
        RrfFusionEngine fusionEngine,
        MetadataFilterEngine filterEngine,
        SparseIndex sparseIndex,
        DocumentStore documentStore,
        SearchProperties searchProperties,
        FusionProperties fusionProperties,
        @Qualifier("searchExecutor") ExecutorService searchExecutor,
        MeterRegistry meterRegistry
    ) {
        if (searchProperties.getOversampleFactor() < 1) {
            throw new IllegalArgumentException("search.oversample-factor must be >= 1");
        }
        if (searchProperties.getSparseTimeoutMs() <= 0 || searchProperties.getDenseTimeoutMs() <= 0) {
            throw new IllegalArgumentException("search.sparse-timeout-ms and search.dense-timeout-ms must be > 0");
        }
        this.sparseRetriever = sparseRetriever;
        this.denseRetriever = denseRetriever;
        this.fusionEngine = fusionEngine;
        this.filterEngine = filterEngine;
        this.sparseIndex = sparseIndex;
        this.documentStore = documentStore;
        this.searchProperties = searchProperties;
        this.fusionProperties = fusionProperties;
        this.searchExecutor = searchExecutor;
        this.meterRegistry = meterRegistry;
    }

    public List<FusedResult> hybridSearch(String query, int nResults, RecipeFilter filter) {
        return hybridSearch(query, nResults, filter, null, null);
    }

    public List<FusedResult> hybridSearch(
        String query,
        int nResults,
        RecipeFilter filter,
        Double sparseWeight,
        Double denseWeight
    ) {
        requirePositive(nResults);
        double ws = resolveWeight("sparse_weight", sparseWeight, fusionProperties.getSparseWeight());
        double wd = resolveWeight("dense_weight", denseWeight, fusionProperties.getDenseWeight());
        if (isBlank(query)) {
            return List.of();
        }
        RecipeFilter activeFilter = filter == null ? RecipeFilter.none() : filter;
        int depth = candidateDepth(nResults, true);
        boolean hybridEnabled = searchProperties.isHybridEnabled();
        long startedNanos = System.nanoTime();
        AtomicBoolean denseAbandoned = new AtomicBoolean(false);

        CompletableFuture<RetrievalStageResult<SparseMatch>> sparseFuture = hybridEnabled
            ? CompletableFuture.supplyAsync(() -> sparseRetriever.retrieve(query, depth), searchExecutor)
            : CompletableFuture.completedFuture(RetrievalStageResult.skipped("hybrid_disabled"));
        CompletableFuture<RetrievalStageResult<DenseMatch>> denseFuture = CompletableFuture.supplyAsync(
            () -> denseRetriever.retrieve(query, depth, denseAbandoned::get),
            searchExecutor
        );

        // both budgets run from request start, so neither wait extends the other
        RetrievalStageResult<SparseMatch> sparseResult =
            awaitStage(sparseFuture, deadline(startedNanos, searchProperties.getSparseTimeoutMs()));
        RetrievalStageResult<DenseMatch> denseResult =
            awaitStage(denseFuture, deadline(startedNanos, searchProperties.getDenseTimeoutMs()));
        if (denseResult.isTimedOut()) {
            denseAbandoned.set(true);
            denseRetriever.recordTimeout();
        }

        if (sparseResult.isError()) {
            recordDegraded(SparseRetriever.PATH, sparseResult);
        }
        if (denseResult.isError()) {
            recordDegraded(DenseRetriever.PATH, denseResult);
        }
        boolean sparseFailed = sparseResult.isError() || !hybridEnabled;
        if (sparseFailed && denseResult.isError()) {
            meterRegistry.counter(TOTAL_FAILURE_METRIC).increment();
            log.error(
                "all retrieval paths failed: sparse={} dense={}",
                sparseResult.getReason(),
                denseResult.getReason()
            );
            throw new TotalRetrievalFailureException(sparseResult.getReason(), denseResult.getReason());
        }
        if (sparseResult.isSkipped() && hybridEnabled) {
            log.debug("sparse path skipped: {}", sparseResult.getReason());
        }

        List<FusedResult> fused = fusionEngine.fuse(sparseResult.getItems(), denseResult.getItems(), ws, wd, 0);
        List<FusedResult> results = new ArrayList<>(Math.min(nResults, fused.size()));
        for (FusedResult candidate : fused) {
            FusedResult resolved = candidate.withMetadata(resolveMetadata(candidate.getDocId(), candidate.getMetadata()));
            if (filterEngine.passes(resolved.getMetadata(), activeFilter)) {
                results.add(resolved);
                if (results.size() >= nResults) {
                    break;
                }
            }
        }
        log.debug(
            "hybrid search: sparse={} dense={} fused={} returned={}",
            sparseResult.getItems().size(),
            denseResult.getItems().size(),
            fused.size(),
            results.size()
        );
        return results;
    }

    public List<SparseMatch> sparseSearch(String query, int nResults, RecipeFilter filter) {
        requirePositive(nResults);
        if (isBlank(query)) {
            return List.of();
        }
        RecipeFilter activeFilter = filter == null ? RecipeFilter.none() : filter;
        RetrievalStageResult<SparseMatch> stage =
            sparseRetriever.retrieve(query, candidateDepth(nResults, activeFilter.hasFilters()));
        if (stage.isError()) {
            throw new RetrievalException(SparseRetriever.PATH, stage.getReason());
        }
        List<SparseMatch> resolved = new ArrayList<>(stage.getItems().size());
        for (SparseMatch match : stage.getItems()) {
            resolved.add(
                new SparseMatch(match.getDocId(), match.getScore(), resolveMetadata(match.getDocId(), match.getMetadata()))
            );
        }
        return truncate(filterEngine.apply(resolved, activeFilter, SparseMatch::getMetadata), nResults);
    }

    /**
     * @throws RetrievalException when the dense path fails
     */
    public List<DenseMatch> denseSearch(String query, int nResults, RecipeFilter filter) {
        requirePositive(nResults);
        if (isBlank(query)) {
            return List.of();
        }
        RecipeFilter activeFilter = filter == null ? RecipeFilter.none() : filter;
        List<DenseMatch> matches = denseRetriever.search(query, candidateDepth(nResults, activeFilter.hasFilters()));
        List<DenseMatch> resolved = new ArrayList<>(matches.size());
        for (DenseMatch match : matches) {
            resolved.add(
                new DenseMatch(
                    match.getDocId(),
                    match.getSimilarity(),
                    resolveMetadata(match.getDocId(), match.getMetadata())
                )
            );
        }
        return truncate(filterEngine.apply(resolved, activeFilter, DenseMatch::getMetadata), nResults);
    }

    public int getDefaultResults() {
        return searchProperties.getDefaultResults();
    }

    private RecipeMetadata resolveMetadata(String docId, RecipeMetadata payload) {
        Bm25Index snapshot = sparseIndex.snapshot().orElse(null);
        if (snapshot != null) {
            RecipeDocument document = snapshot.getDocument(docId);
            if (document != null && document.getMetadata() != null) {
                return document.getMetadata();
            }
        }
        if (payload != null) {
            return payload;
        }
        return documentStore.getDocumentMetadata(docId).orElse(null);
    }

    private int candidateDepth(int nResults, boolean oversample) {
        if (!oversample) {
            return nResults;
        }
        long depth = (long) nResults * searchProperties.getOversampleFactor();
        return (int) Math.min(Integer.MAX_VALUE, depth);
    }

    private void recordDegraded(String path, RetrievalStageResult<?> result) {
        meterRegistry.counter(DEGRADED_METRIC, "path", path).increment();
        if (result.isTimedOut()) {
            log.warn("{} retrieval timed out; continuing without it", path);
        } else {
            log.warn("{} retrieval failed; continuing without it: {}", path, result.getReason());
        }
    }

    private <T> RetrievalStageResult<T> awaitStage(
        CompletableFuture<RetrievalStageResult<T>> future,
        long deadlineNanos
    ) {
        try {
            long remainingNanos = Math.max(0L, deadlineNanos - System.nanoTime());
            return future.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return RetrievalStageResult.timedOut();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return RetrievalStageResult.error(cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RetrievalStageResult.error("interrupted");
        }
    }

    private static long deadline(long startedNanos, int budgetMs) {
        return startedNanos + TimeUnit.MILLISECONDS.toNanos(budgetMs);
    }

    private static <T> List<T> truncate(List<T> items, int nResults) {
        if (items.size() <= nResults) {
            return items;
        }
        return new ArrayList<>(items.subList(0, nResults));
    }

    private static void requirePositive(int nResults) {
        if (nResults <= 0) {
            throw new InvalidSearchRequestException("n_results must be > 0");
        }
    }

    private static double resolveWeight(String name, Double requested, double fallback) {
        double weight = requested == null ? fallback : requested;
        if (!RrfFusionEngine.isValidWeight(weight)) {
            throw new InvalidSearchRequestException(name + " must be a finite value >= 0");
        }
        return weight;
    }

    private static boolean isBlank(String query) {
        return query == null || query.isBlank();
    }
}
