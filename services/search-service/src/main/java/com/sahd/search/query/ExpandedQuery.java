package com.sahd.search.query;

import java.util.List;

public record ExpandedQuery(List<String> terms) {
    public ExpandedQuery {
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("expanded query needs the normalized original term");
        }
        terms = List.copyOf(terms);
    }

    public String original() {
        return terms.get(0);
    }

    public List<String> related() {
        return terms.subList(1, terms.size());
    }
}
