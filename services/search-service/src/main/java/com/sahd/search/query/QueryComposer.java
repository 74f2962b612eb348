package com.sahd.search.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class QueryComposer {
    private final QueryBoostProperties boosts;
    private final QueryFieldProperties fields;

    public QueryComposer(QueryBoostProperties boosts, QueryFieldProperties fields) {
        boosts.validateOrdering();
        this.boosts = boosts;
        this.fields = fields;
    }

    public Map<String, Object> compose(String rawTerm, ExpandedQuery expanded) {
        String term = requireTerm(rawTerm);
        String field = fields.getPrimary();
        List<Object> should = new ArrayList<>();

        should.add(Map.of("match_phrase", Map.of(field, clause(term, boosts.getPhrase()))));

        Map<String, Object> allWords = clause(term, boosts.getAllWords());
        allWords.put("operator", "and");
        should.add(Map.of("match", Map.of(field, allWords)));

        Map<String, Object> fuzzy = clause(term, boosts.getFuzzy());
        fuzzy.put("fuzziness", "AUTO");
        should.add(Map.of("match", Map.of(field, fuzzy)));

        if (expanded != null) {
            List<String> related = expanded.related();
            for (int i = 0; i < related.size(); i++) {
                double weight = i < boosts.getEarlySynonymCount() ? boosts.getSynonymEarly() : boosts.getSynonymLate();
                should.add(Map.of("match", Map.of(field, clause(related.get(i), weight))));
            }
        }

        Map<String, Object> multiMatch = clause(term, boosts.getCrossField());
        multiMatch.put("fields", fields.getCrossFields());
        multiMatch.put("type", "best_fields");
        should.add(Map.of("multi_match", multiMatch));

        Map<String, Object> wildcard = new LinkedHashMap<>();
        wildcard.put("value", "*" + escapeWildcard(term) + "*");
        wildcard.put("boost", boosts.getSubstring());
        should.add(Map.of("wildcard", Map.of(field, wildcard)));

        String[] words = term.split("\\s+");
        if (words.length > 1) {
            List<Object> must = new ArrayList<>(words.length);
            for (String word : words) {
                must.add(Map.of("match", Map.of(field, word)));
            }
            Map<String, Object> conjunction = new LinkedHashMap<>();
            conjunction.put("must", must);
            conjunction.put("boost", boosts.getBooleanAllWords());
            should.add(Map.of("bool", conjunction));
        }

        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("should", should);
        bool.put("minimum_should_match", 1);
        return Map.of("bool", bool);
    }

    public Map<String, Object> basic(String rawTerm) {
        String term = requireTerm(rawTerm);
        return Map.of("match", Map.of(fields.getPrimary(), Map.of("query", term)));
    }

    private static String requireTerm(String rawTerm) {
        if (rawTerm == null || rawTerm.isBlank()) {
            throw new IllegalArgumentException("query term must not be blank");
        }
        return rawTerm.trim();
    }

    private static Map<String, Object> clause(String query, double boost) {
        Map<String, Object> clause = new LinkedHashMap<>();
        clause.put("query", query);
        clause.put("boost", boost);
        return clause;
    }

    static String escapeWildcard(String term) {
        StringBuilder escaped = new StringBuilder(term.length());
        for (int i = 0; i < term.length(); i++) {
            char ch = term.charAt(i);
            if (ch == '*' || ch == '?' || ch == '\\') {
                escaped.append('\\');
            }
            escaped.append(ch);
        }
        return escaped.toString();
    }
}
