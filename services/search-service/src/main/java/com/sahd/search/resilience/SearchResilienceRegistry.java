package com.sahd.search.resilience;

import org.springframework.stereotype.Component;

@Component
public class SearchResilienceRegistry {
    private final CircuitBreaker embedBreaker;

    public SearchResilienceRegistry(SearchResilienceProperties properties) {
        this.embedBreaker = new CircuitBreaker(
            "embed",
            properties.getEmbedFailureThreshold(),
            properties.getEmbedOpenMs()
        );
    }

    public CircuitBreaker getEmbedBreaker() {
        return embedBreaker;
    }
}
