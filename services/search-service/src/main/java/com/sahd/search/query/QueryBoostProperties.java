package com.sahd.search.query;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Clause weights of the enhanced lexical query. Values may be tuned, their relative order may
 * not: {@link #validateOrdering()} rejects a configuration that breaks it.
 */
@ConfigurationProperties(prefix = "search.query.boost")
public class QueryBoostProperties {
    private double phrase = 5.0;
    private double allWords = 3.0;
    private double synonymEarly = 2.6;
    private double crossField = 2.4;
    private double fuzzy = 2.0;
    private double booleanAllWords = 1.8;
    private double synonymLate = 1.5;
    private double substring = 1.2;
    private int earlySynonymCount = 3;

    public void validateOrdering() {
        requireAbove("phrase", phrase, "all-words", allWords);
        requireAbove("all-words", allWords, "synonym-early", synonymEarly);
        requireAbove("synonym-early", synonymEarly, "cross-field", crossField);
        requireAbove("cross-field", crossField, "fuzzy", fuzzy);
        requireAbove("fuzzy", fuzzy, "boolean-all-words", booleanAllWords);
        requireAbove("boolean-all-words", booleanAllWords, "synonym-late", synonymLate);
        if (synonymLate < substring) {
            throw new IllegalStateException(
                "search.query.boost.synonym-late (" + synonymLate + ") must not be below substring (" + substring + ")"
            );
        }
        if (substring <= 0) {
            throw new IllegalStateException("search.query.boost.substring must be positive");
        }
        if (earlySynonymCount < 0) {
            throw new IllegalStateException("search.query.boost.early-synonym-count must not be negative");
        }
    }

    private static void requireAbove(String higherName, double higher, String lowerName, double lower) {
        if (higher <= lower) {
            throw new IllegalStateException(
                "search.query.boost." + higherName + " (" + higher + ") must be greater than "
                    + lowerName + " (" + lower + ")"
            );
        }
    }

    public double getPhrase() {
        return phrase;
    }

    public void setPhrase(double phrase) {
        this.phrase = phrase;
    }

    public double getAllWords() {
        return allWords;
    }

    public void setAllWords(double allWords) {
        this.allWords = allWords;
    }

    public double getSynonymEarly() {
        return synonymEarly;
    }

    public void setSynonymEarly(double synonymEarly) {
        this.synonymEarly = synonymEarly;
    }

    public double getCrossField() {
        return crossField;
    }

    public void setCrossField(double crossField) {
        this.crossField = crossField;
    }

    public double getFuzzy() {
        return fuzzy;
    }

    public void setFuzzy(double fuzzy) {
        this.fuzzy = fuzzy;
    }

    public double getBooleanAllWords() {
        return booleanAllWords;
    }

    public void setBooleanAllWords(double booleanAllWords) {
        this.booleanAllWords = booleanAllWords;
    }

    public double getSynonymLate() {
        return synonymLate;
    }

    public void setSynonymLate(double synonymLate) {
        this.synonymLate = synonymLate;
    }

    public double getSubstring() {
        return substring;
    }

    public void setSubstring(double substring) {
        this.substring = substring;
    }

    public int getEarlySynonymCount() {
        return earlySynonymCount;
    }

    public void setEarlySynonymCount(int earlySynonymCount) {
        this.earlySynonymCount = earlySynonymCount;
    }
}
