package com.kitchenlab.search.retrieval;

import java.util.List;

/**
 * Outcome of one retrieval path. A skipped stage is an empty success; an error or timeout marks
 * the path as failed.
 */
public class RetrievalStageResult<T> {
    private final List<T> items;
    private final boolean error;
    private final boolean timedOut;
    private final boolean skipped;
    private final long tookMs;
    private final String reason;

    private RetrievalStageResult(
        List<T> items,
        boolean error,
        boolean timedOut,
        boolean skipped,
        long tookMs,
        String reason
    ) {
        this.items = items == null ? List.of() : List.copyOf(items);
        this.error = error;
        this.timedOut = timedOut;
        this.skipped = skipped;
        this.tookMs = tookMs;
        this.reason = reason;
    }

    public static <T> RetrievalStageResult<T> success(List<T> items, long tookMs) {
        return new RetrievalStageResult<>(items, false, false, false, tookMs, null);
    }

    public static <T> RetrievalStageResult<T> empty() {
        return new RetrievalStageResult<>(List.of(), false, false, false, 0L, null);
    }

    public static <T> RetrievalStageResult<T> error(String reason) {
        return new RetrievalStageResult<>(List.of(), true, false, false, 0L, reason);
    }

    public static <T> RetrievalStageResult<T> timedOut() {
        return new RetrievalStageResult<>(List.of(), true, true, false, 0L, "timeout");
    }

    public static <T> RetrievalStageResult<T> skipped(String reason) {
        return new RetrievalStageResult<>(List.of(), false, false, true, 0L, reason);
    }

    public List<T> getItems() {
        return items;
    }

    public boolean isError() {
        return error;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public long getTookMs() {
        return tookMs;
    }

    public String getReason() {
        return reason;
    }
}
