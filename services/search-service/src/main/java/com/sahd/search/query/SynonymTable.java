package com.sahd.search.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SynonymTable {
    private final Map<String, List<String>> relations;

    public SynonymTable(Map<String, List<String>> relations) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (relations != null) {
            relations.forEach((term, related) -> copy.put(term, related == null ? List.of() : List.copyOf(related)));
        }
        this.relations = Collections.unmodifiableMap(copy);
    }

    public static SynonymTable empty() {
        return new SynonymTable(Map.of());
    }

    public List<String> related(String term) {
        if (term == null) {
            return List.of();
        }
        return relations.getOrDefault(term, List.of());
    }

    public int size() {
        return relations.size();
    }

    public Map<String, List<String>> asMap() {
        return relations;
    }
}
