package com.sahd.search.opensearch;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class OpenSearchQueryResult {
    private final List<OpenSearchHit> hits;
    private final Map<String, Object> queryDsl;

    public OpenSearchQueryResult(List<OpenSearchHit> hits, Map<String, Object> queryDsl) {
        this.hits = hits == null ? Collections.emptyList() : hits;
        this.queryDsl = queryDsl;
    }

    public List<OpenSearchHit> getHits() {
        return hits;
    }

    public Map<String, Object> getQueryDsl() {
        return queryDsl;
    }
}
