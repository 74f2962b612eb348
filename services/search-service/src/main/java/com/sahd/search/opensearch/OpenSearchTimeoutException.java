package com.sahd.search.opensearch;

public class OpenSearchTimeoutException extends OpenSearchUnavailableException {
    public OpenSearchTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
