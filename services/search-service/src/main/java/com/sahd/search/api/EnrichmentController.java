package com.sahd.search.api;

import com.sahd.search.api.dto.EnrichRequest;
import com.sahd.search.api.dto.EnrichResponse;
import com.sahd.search.ingest.EnrichmentReport;
import com.sahd.search.ingest.SegmentEnrichmentService;
import com.sahd.search.opensearch.OpenSearchUnavailableException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EnrichmentController {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentController.class);

    private final SegmentEnrichmentService enrichmentService;

    public EnrichmentController(SegmentEnrichmentService enrichmentService) {
        this.enrichmentService = enrichmentService;
    }

    @PostMapping("/internal/enrich")
    public ResponseEntity<?> enrich(@RequestBody(required = false) EnrichRequest request) {
        try {
            EnrichmentReport report = enrichmentService.enrichMissing(request == null ? null : request.getMaxBatches());
            EnrichResponse response = new EnrichResponse();
            response.setBatches(report.batches());
            response.setProcessed(report.processed());
            response.setEmbedded(report.embedded());
            response.setFailed(report.failed());
            return ResponseEntity.ok(response);
        } catch (OpenSearchUnavailableException e) {
            log.warn("enrichment aborted: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                Map.of("error", "OpenSearch is unavailable", "code", "opensearch_unavailable")
            );
        }
    }
}
