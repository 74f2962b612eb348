package com.sahd.search.embed;

import java.util.List;

public interface EmbeddingProvider {
    List<Double> embed(String text, Integer timeBudgetMs);

    List<List<Double>> embedAll(List<String> texts, Integer timeBudgetMs);

    EmbeddingMode mode();
}
