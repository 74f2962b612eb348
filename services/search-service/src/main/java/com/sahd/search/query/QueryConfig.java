package com.sahd.search.query;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({SynonymProperties.class, QueryBoostProperties.class, QueryFieldProperties.class})
public class QueryConfig {

    @Bean
    public SynonymTable synonymTable(SynonymTableLoader loader, SynonymProperties properties) {
        return loader.load(properties.getLocation());
    }
}
