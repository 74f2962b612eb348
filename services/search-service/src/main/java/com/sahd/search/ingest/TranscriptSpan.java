package com.sahd.search.ingest;

public record TranscriptSpan(double start, double end, String text) {
    public double duration() {
        return end - start;
    }
}
