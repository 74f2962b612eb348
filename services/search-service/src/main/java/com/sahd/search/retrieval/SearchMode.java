package com.sahd.search.retrieval;

import java.util.Locale;

public enum SearchMode {
    LEXICAL("lexical"),
    ENHANCED("enhanced"),
    SEMANTIC("semantic");

    private final String label;

    SearchMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public SearchMode simpler() {
        return switch (this) {
            case SEMANTIC -> ENHANCED;
            case ENHANCED -> LEXICAL;
            case LEXICAL -> null;
        };
    }

    public static SearchMode from(String value) {
        if (value == null) {
            throw new IllegalArgumentException("search mode is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("basic".equals(normalized)) {
            return LEXICAL;
        }
        for (SearchMode mode : values()) {
            if (mode.label.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown search mode: " + value);
    }
}
