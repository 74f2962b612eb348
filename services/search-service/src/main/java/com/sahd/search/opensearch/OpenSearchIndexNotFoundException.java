package com.sahd.search.opensearch;

public class OpenSearchIndexNotFoundException extends RuntimeException {
    public OpenSearchIndexNotFoundException(String message) {
        super(message);
    }

    public OpenSearchIndexNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
