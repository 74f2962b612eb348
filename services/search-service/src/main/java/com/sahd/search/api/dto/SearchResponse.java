package com.sahd.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class SearchResponse {
    private List<? extends SearchResultItem> results;
    private long total;
    private int returned;

    @JsonProperty("mode_used")
    private String modeUsed;

    @JsonProperty("requested_mode")
    private String requestedMode;

    private boolean degraded;

    @JsonProperty("degrade_reason")
    private String degradeReason;

    @JsonProperty("took_ms")
    private long tookMs;

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    public List<? extends SearchResultItem> getResults() {
        return results;
    }

    public void setResults(List<? extends SearchResultItem> results) {
        this.results = results;
    }

    public long getTotal() {
        return total;
    }

    public void setTotal(long total) {
        this.total = total;
    }

    public int getReturned() {
        return returned;
    }

    public void setReturned(int returned) {
        this.returned = returned;
    }

    public String getModeUsed() {
        return modeUsed;
    }

    public void setModeUsed(String modeUsed) {
        this.modeUsed = modeUsed;
    }

    public String getRequestedMode() {
        return requestedMode;
    }

    public void setRequestedMode(String requestedMode) {
        this.requestedMode = requestedMode;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public void setDegraded(boolean degraded) {
        this.degraded = degraded;
    }

    public String getDegradeReason() {
        return degradeReason;
    }

    public void setDegradeReason(String degradeReason) {
        this.degradeReason = degradeReason;
    }

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }
}
