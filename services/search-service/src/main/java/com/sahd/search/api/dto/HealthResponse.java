package com.sahd.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class HealthResponse {
    private String status;
    private OpenSearchStatus opensearch;

    @JsonProperty("index_exists")
    private boolean indexExists;

    @JsonProperty("embedding_mode")
    private String embeddingMode;

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public OpenSearchStatus getOpensearch() {
        return opensearch;
    }

    public void setOpensearch(OpenSearchStatus opensearch) {
        this.opensearch = opensearch;
    }

    public boolean isIndexExists() {
        return indexExists;
    }

    public void setIndexExists(boolean indexExists) {
        this.indexExists = indexExists;
    }

    public String getEmbeddingMode() {
        return embeddingMode;
    }

    public void setEmbeddingMode(String embeddingMode) {
        this.embeddingMode = embeddingMode;
    }

    public static class OpenSearchStatus {
        private boolean reachable;
        private String version;
        private String distribution;

        @JsonProperty("cluster_name")
        private String clusterName;

        public boolean isReachable() {
            return reachable;
        }

        public void setReachable(boolean reachable) {
            this.reachable = reachable;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public String getDistribution() {
            return distribution;
        }

        public void setDistribution(String distribution) {
            this.distribution = distribution;
        }

        public String getClusterName() {
            return clusterName;
        }

        public void setClusterName(String clusterName) {
            this.clusterName = clusterName;
        }
    }
}
