package com.sahd.search.service;

import com.sahd.search.api.dto.SearchResponse;
import com.sahd.search.api.dto.SearchResultItem;
import com.sahd.search.embed.EmbeddingProvider;
import com.sahd.search.embed.EmbeddingUnavailableException;
import com.sahd.search.opensearch.OpenSearchAuthenticationException;
import com.sahd.search.opensearch.OpenSearchGateway;
import com.sahd.search.opensearch.OpenSearchHit;
import com.sahd.search.opensearch.OpenSearchIndexNotFoundException;
import com.sahd.search.opensearch.OpenSearchQueryResult;
import com.sahd.search.opensearch.OpenSearchRequestException;
import com.sahd.search.opensearch.OpenSearchTimeoutException;
import com.sahd.search.opensearch.OpenSearchUnavailableException;
import com.sahd.search.query.ExpandedQuery;
import com.sahd.search.query.QueryComposer;
import com.sahd.search.query.SynonymExpander;
import com.sahd.search.query.TextNormalizer;
import com.sahd.search.retrieval.ComposedQuery;
import com.sahd.search.retrieval.HybridScorer;
import com.sahd.search.retrieval.SearchMode;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one search request: validates it, composes the query for the requested mode, counts and
 * retrieves against the index, and shapes the results. Embedding failures drop semantic to
 * enhanced without a retry; an index failure drops one rung and retries once.
 */
@Service
public class SearchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SearchOrchestrator.class);

    static final String REQUESTS_METRIC = "sahd_search_requests_total";
    static final String DEGRADED_METRIC = "sahd_search_degraded_total";

    private final TextNormalizer normalizer;
    private final SynonymExpander synonymExpander;
    private final QueryComposer queryComposer;
    private final HybridScorer hybridScorer;
    private final EmbeddingProvider embeddingProvider;
    private final OpenSearchGateway openSearchGateway;
    private final ResultAggregator resultAggregator;
    private final SearchSizePolicy sizePolicy;
    private final SearchProperties properties;
    private final MeterRegistry meterRegistry;

    public SearchOrchestrator(
        TextNormalizer normalizer,
        SynonymExpander synonymExpander,
        QueryComposer queryComposer,
        HybridScorer hybridScorer,
        EmbeddingProvider embeddingProvider,
        OpenSearchGateway openSearchGateway,
        ResultAggregator resultAggregator,
        SearchSizePolicy sizePolicy,
        SearchProperties properties,
        MeterRegistry meterRegistry
    ) {
        this.normalizer = normalizer;
        this.synonymExpander = synonymExpander;
        this.queryComposer = queryComposer;
        this.hybridScorer = hybridScorer;
        this.embeddingProvider = embeddingProvider;
        this.openSearchGateway = openSearchGateway;
        this.resultAggregator = resultAggregator;
        this.sizePolicy = sizePolicy;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public SearchResponse search(SearchCommand command, String traceId, String requestId) {
        long started = System.nanoTime();
        if (command == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        String rawQuery = validateQuery(command.query());
        SearchMode requested = resolveMode(command.mode());
        if (command.timeoutMs() != null && command.timeoutMs() <= 0) {
            throw new InvalidSearchRequestException("timeout_ms must be positive");
        }
        int size = sizePolicy.resolve(command.size());
        RequestDeadline deadline = RequestDeadline.of(command.timeoutMs());
        meterRegistry.counter(REQUESTS_METRIC, "mode", requested.label()).increment();

        String normalized = normalizer.normalize(rawQuery);
        SearchMode mode = requested;
        String degradeReason = null;
        boolean retried = false;
        Attempt attempt;
        while (true) {
            checkDeadline(deadline);
            ComposedQuery composed;
            if (mode == SearchMode.SEMANTIC) {
                try {
                    composed = composeSemantic(rawQuery, normalized, deadline);
                } catch (EmbeddingUnavailableException e) {
                    degradeReason = e.getReason();
                    recordDegrade(mode, SearchMode.ENHANCED, degradeReason);
                    mode = SearchMode.ENHANCED;
                    composed = compose(mode, rawQuery, normalized);
                }
            } else {
                composed = compose(mode, rawQuery, normalized);
            }
            try {
                attempt = execute(composed, size, command.group(), deadline);
                break;
            } catch (OpenSearchAuthenticationException e) {
                log.error("opensearch rejected credentials trace_id={}", traceId);
                throw new SearchFailureException(SearchFailureException.FailureKind.UNAVAILABLE, "Search backend unavailable", e);
            } catch (OpenSearchIndexNotFoundException e) {
                throw new SearchFailureException(SearchFailureException.FailureKind.NOT_FOUND, "Search index not found", e);
            } catch (OpenSearchUnavailableException | OpenSearchRequestException e) {
                checkDeadline(deadline);
                SearchMode next = mode.simpler();
                if (retried || next == null) {
                    throw terminalFailure(e);
                }
                retried = true;
                degradeReason = reasonOf(e);
                log.warn("search degraded from={} to={} reason={} trace_id={}", mode.label(), next.label(), degradeReason, traceId);
                recordDegrade(mode, next, degradeReason);
                mode = next;
            }
        }
        checkDeadline(deadline);

        SearchResponse response = new SearchResponse();
        response.setResults(attempt.results());
        response.setReturned(attempt.results().size());
        response.setTotal(attempt.total());
        response.setModeUsed(mode.label());
        response.setRequestedMode(requested.label());
        response.setDegraded(mode != requested);
        response.setDegradeReason(mode != requested ? degradeReason : null);
        response.setTookMs((System.nanoTime() - started) / 1_000_000L);
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        return response;
    }

    private String validateQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new InvalidSearchRequestException("query is required");
        }
        String trimmed = query.trim();
        if (trimmed.length() > properties.getMaxQueryLength()) {
            throw new InvalidSearchRequestException(
                "query must be at most " + properties.getMaxQueryLength() + " characters"
            );
        }
        return trimmed;
    }

    private SearchMode resolveMode(String mode) {
        String value = mode == null || mode.isBlank() ? properties.getDefaultMode() : mode;
        try {
            return SearchMode.from(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidSearchRequestException("mode must be one of lexical, enhanced, semantic");
        }
    }

    private ComposedQuery compose(SearchMode mode, String rawQuery, String normalized) {
        if (mode == SearchMode.LEXICAL) {
            Map<String, Object> query = queryComposer.basic(rawQuery);
            return new ComposedQuery(mode, query, query);
        }
        ExpandedQuery expanded = synonymExpander.expand(normalized);
        Map<String, Object> query = queryComposer.compose(rawQuery, expanded);
        return new ComposedQuery(mode, query, query);
    }

    private ComposedQuery composeSemantic(String rawQuery, String normalized, RequestDeadline deadline) {
        List<Double> embedding = embeddingProvider.embed(normalized, deadline.budgetMs());
        ComposedQuery lexical = compose(SearchMode.ENHANCED, rawQuery, normalized);
        Map<String, Object> hybrid = hybridScorer.combine(lexical.rankingQuery(), embedding);
        return new ComposedQuery(SearchMode.SEMANTIC, hybrid, lexical.rankingQuery());
    }

    private Attempt execute(ComposedQuery composed, int size, boolean group, RequestDeadline deadline) {
        long count = openSearchGateway.count(composed.countQuery(), deadline.budgetMs());
        checkDeadline(deadline);
        OpenSearchQueryResult result = openSearchGateway.search(composed.rankingQuery(), size, deadline.budgetMs());
        List<OpenSearchHit> hits = distinct(result.getHits(), size);
        if (group) {
            checkDeadline(deadline);
            List<? extends SearchResultItem> groups = resultAggregator.grouped(hits, deadline.budgetMs());
            return new Attempt(groups, groups.size());
        }
        List<? extends SearchResultItem> flat = resultAggregator.flat(hits);
        return new Attempt(flat, Math.max(count, flat.size()));
    }

    private static List<OpenSearchHit> distinct(List<OpenSearchHit> hits, int size) {
        Set<String> seen = new HashSet<>();
        List<OpenSearchHit> unique = new ArrayList<>(Math.min(hits.size(), size));
        for (OpenSearchHit hit : hits) {
            if (unique.size() >= size) {
                break;
            }
            if (seen.add(hit.getDocId())) {
                unique.add(hit);
            }
        }
        return unique;
    }

    private void checkDeadline(RequestDeadline deadline) {
        if (deadline.isExpired()) {
            throw new SearchFailureException(SearchFailureException.FailureKind.TIMEOUT, "Search timed out");
        }
    }

    private SearchFailureException terminalFailure(RuntimeException e) {
        if (e instanceof OpenSearchRequestException) {
            log.error("opensearch rejected search request", e);
            return new SearchFailureException(SearchFailureException.FailureKind.INTERNAL, "Search request failed", e);
        }
        return new SearchFailureException(SearchFailureException.FailureKind.UNAVAILABLE, "Search backend unavailable", e);
    }

    private static String reasonOf(RuntimeException e) {
        if (e instanceof OpenSearchTimeoutException) {
            return "opensearch_timeout";
        }
        if (e instanceof OpenSearchRequestException) {
            return "opensearch_request_error";
        }
        return "opensearch_unavailable";
    }

    private void recordDegrade(SearchMode from, SearchMode to, String reason) {
        meterRegistry.counter(DEGRADED_METRIC, "from", from.label(), "to", to.label(), "reason", reason).increment();
    }

    private record Attempt(List<? extends SearchResultItem> results, long total) {
    }
}
