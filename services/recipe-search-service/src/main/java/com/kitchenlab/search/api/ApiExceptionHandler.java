package com.kitchenlab.search.api;

import com.kitchenlab.search.api.dto.ErrorResponse;
import com.kitchenlab.search.filter.FilterValidationException;
import com.kitchenlab.search.retrieval.RetrievalException;
import com.kitchenlab.search.service.InvalidSearchRequestException;
import com.kitchenlab.search.service.TotalRetrievalFailureException;
import com.kitchenlab.search.sparse.SparseIndexBuildException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", "Invalid request body", request);
    }

    @ExceptionHandler({FilterValidationException.class, InvalidSearchRequestException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), request);
    }

    @ExceptionHandler(TotalRetrievalFailureException.class)
    public ResponseEntity<ErrorResponse> handleTotalFailure(TotalRetrievalFailureException ex, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "search_unavailable", "Search is temporarily unavailable", request);
    }

    @ExceptionHandler(RetrievalException.class)
    public ResponseEntity<ErrorResponse> handleRetrieval(RetrievalException ex, HttpServletRequest request) {
        log.warn("{} retrieval unavailable: {}", ex.getPath(), ex.getMessage());
        String path = ex.getPath() == null ? "retrieval" : ex.getPath();
        return respond(
            HttpStatus.SERVICE_UNAVAILABLE,
            path + "_unavailable",
            "Retrieval path '" + path + "' is unavailable",
            request
        );
    }

    @ExceptionHandler(SparseIndexBuildException.class)
    public ResponseEntity<ErrorResponse> handleIndexBuild(SparseIndexBuildException ex, HttpServletRequest request) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "index_build_failed", "Sparse index build failed", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error(
            "unexpected_exception method={} path={}",
            request == null ? null : request.getMethod(),
            request == null ? null : request.getRequestURI(),
            ex
        );
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error", request);
    }

    private static ResponseEntity<ErrorResponse> respond(
        HttpStatus status,
        String code,
        String message,
        HttpServletRequest request
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(request, RequestIdUtil.TRACE_ID_HEADER);
        String requestId = RequestIdUtil.resolveOrGenerate(request, RequestIdUtil.REQUEST_ID_HEADER);
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, traceId, requestId));
    }
}
