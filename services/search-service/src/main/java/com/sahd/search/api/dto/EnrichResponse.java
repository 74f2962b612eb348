package com.sahd.search.api.dto;

public class EnrichResponse {
    private int batches;
    private int processed;
    private int embedded;
    private int failed;

    public int getBatches() {
        return batches;
    }

    public void setBatches(int batches) {
        this.batches = batches;
    }

    public int getProcessed() {
        return processed;
    }

    public void setProcessed(int processed) {
        this.processed = processed;
    }

    public int getEmbedded() {
        return embedded;
    }

    public void setEmbedded(int embedded) {
        this.embedded = embedded;
    }

    public int getFailed() {
        return failed;
    }

    public void setFailed(int failed) {
        this.failed = failed;
    }
}
