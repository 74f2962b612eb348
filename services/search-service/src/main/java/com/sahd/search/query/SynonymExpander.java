package com.sahd.search.query;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class SynonymExpander {
    private final SynonymTable table;

    public SynonymExpander(SynonymTable table) {
        this.table = table == null ? SynonymTable.empty() : table;
    }

    public ExpandedQuery expand(String normalizedQuery) {
        String original = normalizedQuery == null ? "" : normalizedQuery;
        Set<String> terms = new LinkedHashSet<>();
        terms.add(original);
        for (String token : original.split(" ")) {
            if (token.isEmpty()) {
                continue;
            }
            terms.addAll(table.related(token));
        }
        return new ExpandedQuery(new ArrayList<>(terms));
    }
}
