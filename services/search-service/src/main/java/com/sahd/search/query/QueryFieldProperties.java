package com.sahd.search.query;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.query.fields")
public class QueryFieldProperties {
    private String primary = "text";
    private List<String> crossFields = new ArrayList<>(List.of("text^3", "processed_text^2"));

    public String getPrimary() {
        return primary;
    }

    public void setPrimary(String primary) {
        this.primary = primary;
    }

    public List<String> getCrossFields() {
        return crossFields;
    }

    public void setCrossFields(List<String> crossFields) {
        this.crossFields = crossFields;
    }
}
