package com.sahd.search.opensearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

public class OpenSearchHit {
    private final String docId;
    private final String indexId;
    private final JsonNode source;
    private final double score;

    public OpenSearchHit(String docId, JsonNode source, double score) {
        this(docId, docId, source, score);
    }

    public OpenSearchHit(String docId, String indexId, JsonNode source, double score) {
        this.docId = docId;
        this.indexId = indexId == null ? docId : indexId;
        this.source = source == null ? MissingNode.getInstance() : source;
        this.score = score;
    }

    public String getDocId() {
        return docId;
    }

    public String getIndexId() {
        return indexId;
    }

    public JsonNode getSource() {
        return source;
    }

    public double getScore() {
        return score;
    }
}
