package com.sahd.search.api;

import com.sahd.search.api.dto.ErrorResponse;
import com.sahd.search.api.dto.HealthResponse;
import com.sahd.search.api.dto.SearchRequest;
import com.sahd.search.api.dto.SearchResponse;
import com.sahd.search.embed.EmbeddingProvider;
import com.sahd.search.opensearch.ClusterInfo;
import com.sahd.search.opensearch.OpenSearchGateway;
import com.sahd.search.service.InvalidSearchRequestException;
import com.sahd.search.service.SearchCommand;
import com.sahd.search.service.SearchFailureException;
import com.sahd.search.service.SearchOrchestrator;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.client.RestClientException;

@RestController
public class SearchController {
    private static final Logger log = LoggerFactory.getLogger(SearchController.class);

    private final SearchOrchestrator searchOrchestrator;
    private final OpenSearchGateway openSearchGateway;
    private final EmbeddingProvider embeddingProvider;

    public SearchController(
        SearchOrchestrator searchOrchestrator,
        OpenSearchGateway openSearchGateway,
        EmbeddingProvider embeddingProvider
    ) {
        this.searchOrchestrator = searchOrchestrator;
        this.openSearchGateway = openSearchGateway;
        this.embeddingProvider = embeddingProvider;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        HealthResponse.OpenSearchStatus status = new HealthResponse.OpenSearchStatus();
        boolean reachable = openSearchGateway.ping();
        status.setReachable(reachable);
        boolean indexExists = false;
        if (reachable) {
            try {
                ClusterInfo info = openSearchGateway.clusterInfo();
                status.setVersion(info.version());
                status.setDistribution(info.distribution());
                status.setClusterName(info.clusterName());
                indexExists = openSearchGateway.indexExists();
            } catch (RuntimeException e) {
                log.warn("health probe failed: {}", e.getMessage());
            }
        }
        HealthResponse response = new HealthResponse();
        response.setOpensearch(status);
        response.setIndexExists(indexExists);
        response.setEmbeddingMode(embeddingProvider.mode().name().toLowerCase(Locale.ROOT));
        response.setStatus(reachable && indexExists ? "ok" : "degraded");
        return response;
    }

    @PostMapping("/search")
    public ResponseEntity<?> search(
        @RequestBody(required = false) SearchRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader,
        @RequestHeader(value = "traceparent", required = false) String traceparent
    ) {
        String traceId = resolveTraceId(traceIdHeader, traceparent);
        String requestId = normalizeOrGenerate(requestIdHeader);
        if (request == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "request body is required", traceId, requestId)
            );
        }
        SearchCommand command = new SearchCommand(
            request.getQuery(),
            request.getSize(),
            request.getMode(),
            request.isGroup(),
            request.getTimeoutMs()
        );
        return execute(command, traceId, requestId);
    }

    @GetMapping("/search")
    public ResponseEntity<?> searchByQueryString(
        @RequestParam(value = "q", required = false) String query,
        @RequestParam(value = "size", required = false) String size,
        @RequestParam(value = "mode", required = false) String mode,
        @RequestParam(value = "group", required = false, defaultValue = "false") boolean group,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader,
        @RequestHeader(value = "traceparent", required = false) String traceparent
    ) {
        String traceId = resolveTraceId(traceIdHeader, traceparent);
        String requestId = normalizeOrGenerate(requestIdHeader);
        return execute(new SearchCommand(query, size, mode, group, null), traceId, requestId);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleInvalidJson(HttpMessageNotReadableException e, HttpServletRequest request) {
        String traceId = resolveTraceId(request.getHeader("x-trace-id"), request.getHeader("traceparent"));
        String requestId = normalizeOrGenerate(request.getHeader("x-request-id"));
        return ResponseEntity.badRequest().body(
            new ErrorResponse("bad_request", "invalid JSON", traceId, requestId)
        );
    }

    private ResponseEntity<?> execute(SearchCommand command, String traceId, String requestId) {
        try {
            SearchResponse response = searchOrchestrator.search(command, traceId, requestId);
            return ResponseEntity.ok(response);
        } catch (InvalidSearchRequestException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        } catch (SearchFailureException e) {
            return failure(e, traceId, requestId);
        } catch (RestClientException e) {
            log.error("search upstream call failed trace_id={}", traceId, e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                new ErrorResponse("opensearch_unavailable", "Search backend unavailable", traceId, requestId)
            );
        } catch (Exception e) {
            log.error("search failed unexpectedly trace_id={}", traceId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                new ErrorResponse("internal_error", "Unexpected error", traceId, requestId)
            );
        }
    }

    private ResponseEntity<ErrorResponse> failure(SearchFailureException e, String traceId, String requestId) {
        return switch (e.getKind()) {
            case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                new ErrorResponse("index_not_found", "Search index not found", traceId, requestId)
            );
            case TIMEOUT -> ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(
                new ErrorResponse("timeout", "Search timed out", traceId, requestId)
            );
            case UNAVAILABLE -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                new ErrorResponse("opensearch_unavailable", "Search backend unavailable", traceId, requestId)
            );
            case INTERNAL -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                new ErrorResponse("internal_error", "Unexpected error", traceId, requestId)
            );
        };
    }

    private String resolveTraceId(String headerValue, String traceparent) {
        if (headerValue != null && !headerValue.trim().isEmpty()) {
            return headerValue;
        }
        String fromTraceparent = extractTraceId(traceparent);
        if (fromTraceparent != null) {
            return fromTraceparent;
        }
        return UUID.randomUUID().toString();
    }

    private String normalizeOrGenerate(String value) {
        if (value != null && !value.trim().isEmpty()) {
            return value;
        }
        return UUID.randomUUID().toString();
    }

    private String extractTraceId(String traceparent) {
        if (traceparent == null || traceparent.isBlank()) {
            return null;
        }
        String[] parts = traceparent.trim().split("-");
        if (parts.length != 4) {
            return null;
        }
        return parts[1];
    }
}
