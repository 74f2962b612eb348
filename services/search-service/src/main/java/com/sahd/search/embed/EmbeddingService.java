package com.sahd.search.embed;

import com.sahd.search.resilience.CircuitBreaker;
import com.sahd.search.resilience.SearchResilienceRegistry;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class EmbeddingService implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingProperties properties;
    private final EmbeddingGateway embeddingGateway;
    private final ToyEmbedder toyEmbedder;
    private final EmbeddingCacheService cacheService;
    private final SearchResilienceRegistry resilienceRegistry;

    public EmbeddingService(
        EmbeddingProperties properties,
        EmbeddingGateway embeddingGateway,
        ToyEmbedder toyEmbedder,
        EmbeddingCacheService cacheService,
        SearchResilienceRegistry resilienceRegistry
    ) {
        this.properties = properties;
        this.embeddingGateway = embeddingGateway;
        this.toyEmbedder = toyEmbedder;
        this.cacheService = cacheService;
        this.resilienceRegistry = resilienceRegistry;
    }

    @Override
    public EmbeddingMode mode() {
        return properties.getMode() == null ? EmbeddingMode.DISABLED : properties.getMode();
    }

    @Override
    public List<Double> embed(String text, Integer timeBudgetMs) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        if (cacheService.isEnabled()) {
            var cached = cacheService.get(text);
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        List<Double> vector = fetch(List.of(text), timeBudgetMs).get(0);
        cacheService.put(text, vector);
        return vector;
    }

    @Override
    public List<List<Double>> embedAll(List<String> texts, Integer timeBudgetMs) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        int batchSize = Math.max(1, properties.getBatchSize());
        if (texts.size() <= batchSize) {
            return fetch(texts, timeBudgetMs);
        }
        List<List<Double>> vectors = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            vectors.addAll(fetch(texts.subList(from, Math.min(texts.size(), from + batchSize)), timeBudgetMs));
        }
        return vectors;
    }

    private List<List<Double>> fetch(List<String> texts, Integer timeBudgetMs) {
        switch (mode()) {
            case DISABLED:
                throw new EmbeddingUnavailableException("embed_disabled");
            case TOY:
                List<List<Double>> vectors = new ArrayList<>(texts.size());
                for (String text : texts) {
                    vectors.add(toyEmbedder.embed(text));
                }
                return vectors;
            case HTTP:
            default:
                return fetchHttp(texts, timeBudgetMs);
        }
    }

    private List<List<Double>> fetchHttp(List<String> texts, Integer timeBudgetMs) {
        CircuitBreaker breaker = resilienceRegistry.getEmbedBreaker();
        if (!breaker.allowRequest()) {
            throw new EmbeddingUnavailableException("embed_circuit_open");
        }
        try {
            List<List<Double>> vectors = embeddingGateway.embedAll(texts, timeBudgetMs);
            breaker.recordSuccess();
            return vectors;
        } catch (EmbeddingUnavailableException ex) {
            if (breaker.recordFailure()) {
                log.warn("embedding circuit opened after repeated failures, last reason={}", ex.getReason());
            }
            throw ex;
        }
    }
}
