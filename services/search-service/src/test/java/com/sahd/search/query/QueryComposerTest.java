package com.sahd.search.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryComposerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final QueryBoostProperties boosts = new QueryBoostProperties();
    private final QueryComposer composer = new QueryComposer(boosts, new QueryFieldProperties());

    @Test
    void singleWordQueryHasFiveStrategiesPlusExpandedTerms() {
        ExpandedQuery expanded = new ExpandedQuery(List.of("صلاه", "صلوات", "الصلاه", "فريضه", "عباده"));

        JsonNode bool = toJson(composer.compose("صلاة", expanded)).path("bool");
        JsonNode should = bool.path("should");

        assertThat(bool.path("minimum_should_match").asInt()).isEqualTo(1);
        assertThat(should.size()).isEqualTo(5 + 4);
        assertThat(should.get(0).path("match_phrase").path("text").path("query").asText()).isEqualTo("صلاة");
        assertThat(should.get(0).path("match_phrase").path("text").path("boost").asDouble()).isEqualTo(5.0);
        assertThat(should.get(1).path("match").path("text").path("operator").asText()).isEqualTo("and");
        assertThat(should.get(2).path("match").path("text").path("fuzziness").asText()).isEqualTo("AUTO");

        assertThat(should.get(3).path("match").path("text").path("boost").asDouble()).isEqualTo(2.6);
        assertThat(should.get(5).path("match").path("text").path("boost").asDouble()).isEqualTo(2.6);
        assertThat(should.get(6).path("match").path("text").path("query").asText()).isEqualTo("عباده");
        assertThat(should.get(6).path("match").path("text").path("boost").asDouble()).isEqualTo(1.5);

        JsonNode multiMatch = should.get(7).path("multi_match");
        assertThat(multiMatch.path("type").asText()).isEqualTo("best_fields");
        assertThat(multiMatch.path("fields").toString()).contains("text^3", "processed_text^2");
        assertThat(should.get(8).path("wildcard").path("text").path("value").asText()).isEqualTo("*صلاة*");
    }

    @Test
    void multiWordQueryAddsBooleanConjunction() {
        JsonNode should = toJson(composer.compose("حكم السفر", new ExpandedQuery(List.of("حكم السفر"))))
            .path("bool").path("should");

        JsonNode last = should.get(should.size() - 1).path("bool");
        assertThat(last.path("boost").asDouble()).isEqualTo(1.8);
        assertThat(last.path("must").size()).isEqualTo(2);
        assertThat(last.path("must").get(1).path("match").path("text").asText()).isEqualTo("السفر");
    }

    @Test
    void defaultWeightsKeepTheirOrdering() {
        assertThat(boosts.getPhrase()).isGreaterThan(boosts.getAllWords());
        assertThat(boosts.getAllWords()).isGreaterThan(boosts.getSynonymEarly());
        assertThat(boosts.getSynonymEarly()).isGreaterThan(boosts.getCrossField());
        assertThat(boosts.getCrossField()).isGreaterThan(boosts.getFuzzy());
        assertThat(boosts.getFuzzy()).isGreaterThan(boosts.getBooleanAllWords());
        assertThat(boosts.getBooleanAllWords()).isGreaterThan(boosts.getSynonymLate());
        assertThat(boosts.getSynonymLate()).isGreaterThanOrEqualTo(boosts.getSubstring());
    }

    @Test
    void misorderedWeightsFailFast() {
        QueryBoostProperties broken = new QueryBoostProperties();
        broken.setFuzzy(4.0);

        assertThatThrownBy(() -> new QueryComposer(broken, new QueryFieldProperties()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("cross-field");
    }

    @Test
    void wildcardMetacharactersAreEscaped() {
        assertThat(QueryComposer.escapeWildcard("a*b?c\\")).isEqualTo("a\\*b\\?c\\\\");
    }

    @Test
    void basicQueryIsASingleMatch() {
        Map<String, Object> basic = composer.basic(" صلاة ");

        assertThat(toJson(basic).path("match").path("text").path("query").asText()).isEqualTo("صلاة");
    }

    private JsonNode toJson(Map<String, Object> query) {
        return objectMapper.valueToTree(query);
    }
}
