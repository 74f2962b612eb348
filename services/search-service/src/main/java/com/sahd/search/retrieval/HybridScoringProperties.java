package com.sahd.search.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.hybrid")
public class HybridScoringProperties {
    private double vectorBoost = 2.0;
    private double lexicalBoost = 1.0;
    private String vectorField = "vector";

    public double getVectorBoost() {
        return vectorBoost;
    }

    public void setVectorBoost(double vectorBoost) {
        this.vectorBoost = vectorBoost;
    }

    public double getLexicalBoost() {
        return lexicalBoost;
    }

    public void setLexicalBoost(double lexicalBoost) {
        this.lexicalBoost = lexicalBoost;
    }

    public String getVectorField() {
        return vectorField;
    }

    public void setVectorField(String vectorField) {
        this.vectorField = vectorField;
    }
}
