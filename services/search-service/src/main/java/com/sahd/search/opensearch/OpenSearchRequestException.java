package com.sahd.search.opensearch;

public class OpenSearchRequestException extends RuntimeException {
    public OpenSearchRequestException(String message) {
        super(message);
    }

    public OpenSearchRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
