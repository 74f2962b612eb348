package com.sahd.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class EnrichRequest {
    @JsonProperty("max_batches")
    private Integer maxBatches;

    public Integer getMaxBatches() {
        return maxBatches;
    }

    public void setMaxBatches(Integer maxBatches) {
        this.maxBatches = maxBatches;
    }
}
