package com.sahd.search.query;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the term-relation table from YAML:
 *
 * <pre>
 * synonyms:
 *   صلاة: [صلوات, الصلاة, فريضة]
 * </pre>
 *
 * Keys and related terms are stored normalized so lookups by normalized tokens hit.
 */
@Component
public class SynonymTableLoader {
    private static final Logger log = LoggerFactory.getLogger(SynonymTableLoader.class);

    private final ResourceLoader resourceLoader;
    private final TextNormalizer normalizer;

    public SynonymTableLoader(ResourceLoader resourceLoader, TextNormalizer normalizer) {
        this.resourceLoader = resourceLoader;
        this.normalizer = normalizer;
    }

    public SynonymTable load(String location) {
        if (location == null || location.isBlank()) {
            log.warn("synonym table location not configured; query expansion disabled");
            return SynonymTable.empty();
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("synonym table not found at {}", location);
            return SynonymTable.empty();
        }
        try (InputStream input = resource.getInputStream()) {
            return parse(new Yaml().load(input), location);
        } catch (IOException | YAMLException ex) {
            log.warn("synonym table load failed location={}", location, ex);
            return SynonymTable.empty();
        }
    }

    SynonymTable parse(Object parsed, String location) {
        if (!(parsed instanceof Map<?, ?> root) || !(root.get("synonyms") instanceof Map<?, ?> entries)) {
            log.warn("synonym table malformed (no synonyms map) location={}", location);
            return SynonymTable.empty();
        }
        Map<String, Set<String>> relations = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            String term = normalizer.normalize(String.valueOf(entry.getKey()));
            if (term.isEmpty()) {
                continue;
            }
            Set<String> related = relations.computeIfAbsent(term, k -> new LinkedHashSet<>());
            if (entry.getValue() instanceof List<?> values) {
                for (Object value : values) {
                    String normalized = value == null ? "" : normalizer.normalize(value.toString());
                    if (!normalized.isEmpty() && !normalized.equals(term)) {
                        related.add(normalized);
                    }
                }
            }
        }
        Map<String, List<String>> table = new LinkedHashMap<>();
        relations.forEach((term, related) -> table.put(term, new ArrayList<>(related)));
        log.info("synonym table loaded terms={} location={}", table.size(), location);
        return new SynonymTable(table);
    }
}
