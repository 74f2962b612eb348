package com.sahd.search.opensearch;

public class OpenSearchAuthenticationException extends RuntimeException {
    public OpenSearchAuthenticationException(String message) {
        super(message);
    }

    public OpenSearchAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
