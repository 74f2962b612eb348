package com.sahd.search.ingest;

public record EnrichmentReport(int batches, int processed, int embedded, int failed) {
}
