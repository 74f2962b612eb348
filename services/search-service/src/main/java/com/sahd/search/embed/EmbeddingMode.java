package com.sahd.search.embed;

public enum EmbeddingMode {
    HTTP,
    TOY,
    DISABLED
}
