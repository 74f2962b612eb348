package com.sahd.search.embed;

public class EmbeddingUnavailableException extends RuntimeException {
    public EmbeddingUnavailableException(String reason) {
        super(reason);
    }

    public EmbeddingUnavailableException(String reason, Throwable cause) {
        super(reason, cause);
    }

    public String getReason() {
        return getMessage();
    }
}
