package com.sahd.search.retrieval;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(HybridScoringProperties.class)
public class RetrievalConfig {
}
