package com.sahd.search.ingest;

import com.sahd.search.embed.EmbeddingProvider;
import com.sahd.search.embed.EmbeddingUnavailableException;
import com.sahd.search.opensearch.BulkResult;
import com.sahd.search.opensearch.OpenSearchGateway;
import com.sahd.search.opensearch.OpenSearchHit;
import com.sahd.search.opensearch.SegmentFields;
import com.sahd.search.query.TextNormalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SegmentEnrichmentService {
    private static final Logger log = LoggerFactory.getLogger(SegmentEnrichmentService.class);

    private final OpenSearchGateway openSearchGateway;
    private final EmbeddingProvider embeddingProvider;
    private final TextNormalizer normalizer;
    private final EnrichmentProperties properties;

    public SegmentEnrichmentService(
        OpenSearchGateway openSearchGateway,
        EmbeddingProvider embeddingProvider,
        TextNormalizer normalizer,
        EnrichmentProperties properties
    ) {
        this.openSearchGateway = openSearchGateway;
        this.embeddingProvider = embeddingProvider;
        this.normalizer = normalizer;
        this.properties = properties;
    }

    public EnrichmentReport enrichMissing(Integer maxBatchesOverride) {
        int maxBatches = maxBatchesOverride == null || maxBatchesOverride <= 0
            ? properties.getMaxBatches()
            : maxBatchesOverride;
        int batchSize = Math.max(1, properties.getBatchSize());
        Map<String, Object> pending = Map.of(
            "bool", Map.of("must_not", List.of(Map.of("exists", Map.of("field", SegmentFields.PROCESSED_TEXT))))
        );

        int batches = 0;
        int processed = 0;
        int embedded = 0;
        int failed = 0;
        while (batches < maxBatches) {
            List<OpenSearchHit> hits = openSearchGateway.search(pending, batchSize, properties.getTimeoutMs()).getHits();
            if (hits.isEmpty()) {
                break;
            }
            batches++;

            List<OpenSearchHit> withText = new ArrayList<>();
            List<String> texts = new ArrayList<>();
            List<Map<String, Object>> actions = new ArrayList<>();
            for (OpenSearchHit hit : hits) {
                String processedText = normalizer.normalize(hit.getSource().path(SegmentFields.TEXT).asText(""));
                if (processedText.isEmpty()) {
                    addUpdate(actions, hit, processedText, null);
                } else {
                    withText.add(hit);
                    texts.add(processedText);
                }
            }

            List<List<Double>> vectors;
            try {
                vectors = texts.isEmpty() ? List.of() : embeddingProvider.embedAll(texts, properties.getTimeoutMs());
            } catch (EmbeddingUnavailableException e) {
                log.warn("enrichment stopped: embedding unavailable reason={} batch={}", e.getReason(), batches);
                failed += withText.size();
                break;
            }
            for (int i = 0; i < withText.size(); i++) {
                addUpdate(actions, withText.get(i), texts.get(i), vectors.get(i));
            }

            BulkResult result = openSearchGateway.bulk(actions);
            Set<String> failedIds = new HashSet<>(result.failedIds());
            int batchFailed = failedIds.size();
            processed += hits.size() - batchFailed;
            for (OpenSearchHit hit : withText) {
                if (!failedIds.contains(hit.getIndexId())) {
                    embedded++;
                }
            }
            failed += batchFailed;
            log.info("enrichment batch={} processed={} embedded={} failed={}", batches, hits.size(), withText.size(), batchFailed);
            if (batchFailed == hits.size()) {
                log.warn("enrichment stopped: every update in batch {} failed", batches);
                break;
            }
        }
        return new EnrichmentReport(batches, processed, embedded, failed);
    }

    private void addUpdate(List<Map<String, Object>> actions, OpenSearchHit hit, String processedText, List<Double> vector) {
        Map<String, Object> target = new LinkedHashMap<>();
        target.put("_index", openSearchGateway.index());
        target.put("_id", hit.getIndexId());
        actions.add(Map.of("update", target));

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(SegmentFields.PROCESSED_TEXT, processedText);
        if (vector != null) {
            fields.put(SegmentFields.VECTOR, vector);
        }
        actions.add(Map.of("doc", fields));
    }
}
