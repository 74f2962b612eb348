package com.sahd.search.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sahd.search.api.dto.ConversationGroup;
import com.sahd.search.api.dto.SearchResponse;
import com.sahd.search.api.dto.SegmentHit;
import com.sahd.search.embed.EmbeddingProvider;
import com.sahd.search.embed.EmbeddingUnavailableException;
import com.sahd.search.opensearch.OpenSearchAuthenticationException;
import com.sahd.search.opensearch.OpenSearchGateway;
import com.sahd.search.opensearch.OpenSearchHit;
import com.sahd.search.opensearch.OpenSearchIndexNotFoundException;
import com.sahd.search.opensearch.OpenSearchQueryResult;
import com.sahd.search.opensearch.OpenSearchRequestException;
import com.sahd.search.opensearch.OpenSearchTimeoutException;
import com.sahd.search.opensearch.OpenSearchUnavailableException;
import com.sahd.search.query.QueryBoostProperties;
import com.sahd.search.query.QueryComposer;
import com.sahd.search.query.QueryFieldProperties;
import com.sahd.search.query.SynonymExpander;
import com.sahd.search.query.SynonymTableLoader;
import com.sahd.search.query.TextNormalizer;
import com.sahd.search.retrieval.HybridScorer;
import com.sahd.search.retrieval.HybridScoringProperties;
import com.sahd.search.service.grouping.ConversationGroupingService;
import com.sahd.search.service.grouping.GroupingProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.DefaultResourceLoader;

@ExtendWith(MockitoExtension.class)
class SearchOrchestratorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private OpenSearchGateway openSearchGateway;

    @Mock
    private EmbeddingProvider embeddingProvider;

    private SimpleMeterRegistry meterRegistry;
    private SearchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        TextNormalizer normalizer = new TextNormalizer();
        SynonymTableLoader loader = new SynonymTableLoader(new DefaultResourceLoader(), normalizer);
        SearchProperties properties = new SearchProperties();
        meterRegistry = new SimpleMeterRegistry();
        orchestrator = new SearchOrchestrator(
            normalizer,
            new SynonymExpander(loader.load("classpath:synonyms/arabic-synonyms.yml")),
            new QueryComposer(new QueryBoostProperties(), new QueryFieldProperties()),
            new HybridScorer(new HybridScoringProperties()),
            embeddingProvider,
            openSearchGateway,
            new ResultAggregator(new ConversationGroupingService(openSearchGateway, new GroupingProperties())),
            new SearchSizePolicy(properties),
            properties,
            meterRegistry
        );
    }

    @Test
    @SuppressWarnings("unchecked")
    void enhancedSearchExpandsPrayerQuery() {
        when(openSearchGateway.count(anyMap(), any())).thenReturn(37L);
        when(openSearchGateway.search(anyMap(), anyInt(), any())).thenReturn(result(hit("d1", 9.0), hit("d2", 8.0), hit("d3", 7.0)));

        SearchResponse response = orchestrator.search(new SearchCommand("صلاة", 10, "enhanced", false, null), "t1", "r1");

        ArgumentCaptor<Map<String, Object>> query = ArgumentCaptor.forClass(Map.class);
        verify(openSearchGateway).search(query.capture(), eq(10), any());
        String dsl = MAPPER.valueToTree(query.getValue()).toString();
        assertThat(dsl).contains("\"match_phrase\"", "صلوات", "الصلاه", "فرىضه", "\"wildcard\"");
        assertThat(dsl).doesNotContain("script_score");

        assertThat(response.getModeUsed()).isEqualTo("enhanced");
        assertThat(response.getRequestedMode()).isEqualTo("enhanced");
        assertThat(response.isDegraded()).isFalse();
        assertThat(response.getDegradeReason()).isNull();
        assertThat(response.getReturned()).isEqualTo(3);
        assertThat(response.getTotal()).isEqualTo(37L);
        assertThat(response.getTotal()).isGreaterThanOrEqualTo(response.getReturned());
        List<SegmentHit> results = (List<SegmentHit>) response.getResults();
        assertThat(results).allSatisfy(r -> assertThat(r.getDeepLink()).isNotBlank());
        assertThat(results).extracting(SegmentHit::getScore).isSortedAccordingTo(Comparator.reverseOrder());
        assertThat(response.getTraceId()).isEqualTo("t1");
        assertThat(meterRegistry.counter("sahd_search_requests_total", "mode", "enhanced").count()).isEqualTo(1.0);
    }

    @Test
    void embeddingFailureDegradesSemanticToEnhanced() {
        when(embeddingProvider.embed(eq("صلاه"), any())).thenThrow(new EmbeddingUnavailableException("embed_timeout"));
        when(openSearchGateway.count(anyMap(), any())).thenReturn(2L);
        when(openSearchGateway.search(anyMap(), anyInt(), any())).thenReturn(result(hit("d1", 3.0)));

        SearchResponse response = orchestrator.search(new SearchCommand("صلاة", null, "semantic", false, null), "t", "r");

        assertThat(response.getModeUsed()).isEqualTo("enhanced");
        assertThat(response.getRequestedMode()).isEqualTo("semantic");
        assertThat(response.isDegraded()).isTrue();
        assertThat(response.getDegradeReason()).isEqualTo("embed_timeout");
        assertThat(response.getReturned()).isEqualTo(1);
        assertThat(meterRegistry.counter(
            "sahd_search_degraded_total", "from", "semantic", "to", "enhanced", "reason", "embed_timeout"
        ).count()).isEqualTo(1.0);
    }

    @Test
    @SuppressWarnings("unchecked")
    void semanticSearchRanksHybridButCountsLexically() {
        when(embeddingProvider.embed(eq("صلاه"), any())).thenReturn(List.of(0.6, 0.8));
        when(openSearchGateway.count(anyMap(), any())).thenReturn(0L);
        when(openSearchGateway.search(anyMap(), anyInt(), any())).thenReturn(result(hit("d1", 3.0), hit("d2", 2.0)));

        SearchResponse response = orchestrator.search(new SearchCommand("صلاة", 5, "semantic", false, null), "t", "r");

        ArgumentCaptor<Map<String, Object>> ranking = ArgumentCaptor.forClass(Map.class);
        ArgumentCaptor<Map<String, Object>> counting = ArgumentCaptor.forClass(Map.class);
        verify(openSearchGateway).search(ranking.capture(), eq(5), any());
        verify(openSearchGateway).count(counting.capture(), any());
        assertThat(MAPPER.valueToTree(ranking.getValue()).toString()).contains("script_score");
        assertThat(MAPPER.valueToTree(counting.getValue()).toString()).doesNotContain("script_score");

        assertThat(response.getModeUsed()).isEqualTo("semantic");
        assertThat(response.isDegraded()).isFalse();
        assertThat(response.getTotal()).isEqualTo(2L);
    }

    @Test
    void indexFailureDropsOneRungAndRetries() {
        when(openSearchGateway.count(anyMap(), any()))
            .thenThrow(new OpenSearchUnavailableException("OpenSearch unavailable: 503"))
            .thenReturn(4L);
        when(openSearchGateway.search(anyMap(), anyInt(), any())).thenReturn(result(hit("d1", 1.0)));

        SearchResponse response = orchestrator.search(new SearchCommand("صلاة", 10, null, false, null), "t", "r");

        assertThat(response.getRequestedMode()).isEqualTo("enhanced");
        assertThat(response.getModeUsed()).isEqualTo("lexical");
        assertThat(response.getDegradeReason()).isEqualTo("opensearch_unavailable");
        assertThat(response.getTotal()).isEqualTo(4L);
    }

    @Test
    void secondIndexFailureSurfacesUnavailable() {
        when(openSearchGateway.count(anyMap(), any())).thenThrow(new OpenSearchTimeoutException("slow", null));

        assertThatThrownBy(() -> orchestrator.search(new SearchCommand("صلاة", 10, "semantic", false, null), "t", "r"))
            .isInstanceOfSatisfying(SearchFailureException.class,
                e -> assertThat(e.getKind()).isEqualTo(SearchFailureException.FailureKind.UNAVAILABLE));

        verify(openSearchGateway, times(2)).count(anyMap(), any());
    }

    @Test
    void rejectedLexicalQueryIsNotRetried() {
        when(openSearchGateway.count(anyMap(), any())).thenThrow(new OpenSearchRequestException("OpenSearch error: 400"));

        assertThatThrownBy(() -> orchestrator.search(new SearchCommand("صلاة", 10, "lexical", false, null), "t", "r"))
            .isInstanceOfSatisfying(SearchFailureException.class,
                e -> assertThat(e.getKind()).isEqualTo(SearchFailureException.FailureKind.INTERNAL));

        verify(openSearchGateway, times(1)).count(anyMap(), any());
    }

    @Test
    void authenticationFailureIsNeverRetried() {
        when(openSearchGateway.count(anyMap(), any())).thenThrow(new OpenSearchAuthenticationException("401"));

        assertThatThrownBy(() -> orchestrator.search(new SearchCommand("صلاة", 10, "enhanced", false, null), "t", "r"))
            .isInstanceOfSatisfying(SearchFailureException.class,
                e -> assertThat(e.getKind()).isEqualTo(SearchFailureException.FailureKind.UNAVAILABLE));

        verify(openSearchGateway, times(1)).count(anyMap(), any());
        verify(openSearchGateway, never()).search(anyMap(), anyInt(), any());
    }

    @Test
    void missingIndexMapsToNotFound() {
        when(openSearchGateway.count(anyMap(), any())).thenThrow(new OpenSearchIndexNotFoundException("no index"));

        assertThatThrownBy(() -> orchestrator.search(new SearchCommand("صلاة", 10, "enhanced", false, null), "t", "r"))
            .isInstanceOfSatisfying(SearchFailureException.class,
                e -> assertThat(e.getKind()).isEqualTo(SearchFailureException.FailureKind.NOT_FOUND));
    }

    @Test
    void invalidRequestsNeverReachTheIndex() {
        assertThatThrownBy(() -> orchestrator.search(new SearchCommand("   ", 10, null, false, null), "t", "r"))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> orchestrator.search(new SearchCommand("ا".repeat(513), 10, null, false, null), "t", "r"))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> orchestrator.search(new SearchCommand("صلاة", 10, "neural", false, null), "t", "r"))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> orchestrator.search(new SearchCommand("صلاة", 10, null, false, 0), "t", "r"))
            .isInstanceOf(InvalidSearchRequestException.class);

        verifyNoInteractions(openSearchGateway, embeddingProvider);
    }

    @Test
    void duplicateHitsAreDroppedAndTotalNeverBelowReturned() {
        when(openSearchGateway.count(anyMap(), any())).thenReturn(0L);
        when(openSearchGateway.search(anyMap(), anyInt(), any()))
            .thenReturn(result(hit("d1", 5.0), hit("d1", 4.0), hit("d2", 3.0)));

        SearchResponse response = orchestrator.search(new SearchCommand("صلاة", "abc", "lexical", false, null), "t", "r");

        verify(openSearchGateway).search(anyMap(), eq(50), any());
        @SuppressWarnings("unchecked")
        List<SegmentHit> results = (List<SegmentHit>) response.getResults();
        assertThat(results).extracting(SegmentHit::getDocId).containsExactly("d1", "d2");
        assertThat(results.get(0).getScore()).isEqualTo(5.0);
        assertThat(response.getTotal()).isEqualTo(2L);
    }

    @Test
    void exhaustedDeadlineFailsWithTimeout() {
        lenient().when(openSearchGateway.count(anyMap(), any())).thenAnswer(invocation -> {
            Thread.sleep(30);
            return 3L;
        });

        assertThatThrownBy(() -> orchestrator.search(new SearchCommand("صلاة", 10, "enhanced", false, 5), "t", "r"))
            .isInstanceOfSatisfying(SearchFailureException.class,
                e -> assertThat(e.getKind()).isEqualTo(SearchFailureException.FailureKind.TIMEOUT));

        verify(openSearchGateway, never()).search(anyMap(), anyInt(), any());
    }

    @Test
    void groupedSearchReportsGroupCounts() {
        when(openSearchGateway.count(anyMap(), any())).thenReturn(12L);
        when(openSearchGateway.search(anyMap(), anyInt(), any()))
            .thenReturn(result(grouped("d1", "G1", 2), grouped("d2", "G2", 1), grouped("d3", "G1", 1)));
        when(openSearchGateway.search(anyMap(), anyInt(), any(), any()))
            .thenReturn(result(grouped("d3", "G1", 1), grouped("d1", "G1", 2), grouped("d2", "G2", 1)));

        SearchResponse response = orchestrator.search(new SearchCommand("صلاة", 10, "enhanced", true, null), "t", "r");

        @SuppressWarnings("unchecked")
        List<ConversationGroup> groups = (List<ConversationGroup>) response.getResults();
        assertThat(groups).extracting(ConversationGroup::getGroupId).containsExactly("G1", "G2");
        assertThat(response.getTotal()).isEqualTo(2L);
        assertThat(response.getReturned()).isEqualTo(2);
    }

    private static OpenSearchQueryResult result(OpenSearchHit... hits) {
        return new OpenSearchQueryResult(new ArrayList<>(List.of(hits)), Map.of());
    }

    private static OpenSearchHit hit(String docId, double score) {
        ObjectNode source = MAPPER.createObjectNode();
        source.put("doc_id", docId);
        source.put("text", "الصلاة في السفر");
        source.put("start", 12.5);
        source.put("end", 30.0);
        source.put("video_link", "https://www.youtube.com/watch?v=abc123");
        return new OpenSearchHit(docId, source, score);
    }

    private static OpenSearchHit grouped(String docId, String groupId, int sequence) {
        ObjectNode source = MAPPER.createObjectNode();
        source.put("doc_id", docId);
        source.put("group_id", groupId);
        source.put("sequence", sequence);
        return new OpenSearchHit(docId, source, 1.0);
    }
}
