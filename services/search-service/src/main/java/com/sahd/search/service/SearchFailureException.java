package com.sahd.search.service;

public class SearchFailureException extends RuntimeException {
    public enum FailureKind {
        UNAVAILABLE,
        NOT_FOUND,
        TIMEOUT,
        INTERNAL
    }

    private final FailureKind kind;

    public SearchFailureException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SearchFailureException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
