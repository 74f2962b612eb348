package com.sahd.search.retrieval;

import java.util.Map;

public record ComposedQuery(SearchMode mode, Map<String, Object> rankingQuery, Map<String, Object> countQuery) {
}
