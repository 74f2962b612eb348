package com.sahd.search.retrieval;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Wraps a lexical query with a cosine-similarity clause over the segment vectors. The script
 * scores {@code 1 + cosine}; a zero-magnitude query or a segment without a usable vector scores
 * the neutral 1.0.
 */
@Component
public class HybridScorer {
    static final String COSINE_SCRIPT = String.join("\n",
        "if (params.query_norm == 0.0 || doc[params.field].size() == 0) { return 1.0; }",
        "double similarity = cosineSimilarity(params.query_vector, doc[params.field]);",
        "if (Double.isNaN(similarity) || Double.isInfinite(similarity)) { return 1.0; }",
        "return 1.0 + similarity;"
    );

    private final HybridScoringProperties properties;

    public HybridScorer(HybridScoringProperties properties) {
        this.properties = properties;
    }

    public Map<String, Object> combine(Map<String, Object> lexicalQuery, List<Double> embedding) {
        if (embedding == null || embedding.isEmpty()) {
            return lexicalQuery;
        }
        String field = properties.getVectorField();

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("field", field);
        params.put("query_vector", embedding);
        params.put("query_norm", VectorMath.norm(embedding));

        Map<String, Object> script = new LinkedHashMap<>();
        script.put("source", COSINE_SCRIPT);
        script.put("params", params);

        Map<String, Object> scriptScore = new LinkedHashMap<>();
        scriptScore.put("query", Map.of("exists", Map.of("field", field)));
        scriptScore.put("script", script);
        scriptScore.put("boost", properties.getVectorBoost());

        Map<String, Object> lexical = new LinkedHashMap<>();
        lexical.put("must", List.of(lexicalQuery));
        lexical.put("boost", properties.getLexicalBoost());

        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("should", List.of(Map.of("script_score", scriptScore), Map.of("bool", lexical)));
        bool.put("minimum_should_match", 1);
        return Map.of("bool", bool);
    }
}
