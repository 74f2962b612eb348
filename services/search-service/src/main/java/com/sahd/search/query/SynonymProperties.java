package com.sahd.search.query;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.synonyms")
public class SynonymProperties {
    private String location = "classpath:synonyms/arabic-synonyms.yml";

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }
}
