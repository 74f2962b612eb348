package com.sahd.search.opensearch;

import java.util.List;

public record BulkResult(boolean errors, int itemCount, List<String> failedIds) {
    public int succeeded() {
        return Math.max(0, itemCount - failedIds.size());
    }
}
