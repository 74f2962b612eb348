package com.sahd.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class ErrorResponse {
    private final String error;
    private final String code;
    private final List<Object> results = List.of();
    private final long total = 0L;

    @JsonProperty("trace_id")
    private final String traceId;

    @JsonProperty("request_id")
    private final String requestId;

    public ErrorResponse(String code, String error, String traceId, String requestId) {
        this.code = code;
        this.error = error;
        this.traceId = traceId;
        this.requestId = requestId;
    }

    public String getError() {
        return error;
    }

    public String getCode() {
        return code;
    }

    public List<Object> getResults() {
        return results;
    }

    public long getTotal() {
        return total;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getRequestId() {
        return requestId;
    }
}
