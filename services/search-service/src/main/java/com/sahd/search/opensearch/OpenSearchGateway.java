package com.sahd.search.opensearch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Component
public class OpenSearchGateway {
    private static final Logger log = LoggerFactory.getLogger(OpenSearchGateway.class);
    private static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final OpenSearchClientHolder clientHolder;
    private final ObjectMapper objectMapper;
    private final OpenSearchProperties properties;

    public OpenSearchGateway(
        OpenSearchClientHolder clientHolder,
        ObjectMapper objectMapper,
        OpenSearchProperties properties
    ) {
        this.clientHolder = clientHolder;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public String index() {
        return properties.getIndex();
    }

    public OpenSearchQueryResult search(Map<String, Object> query, int size, Integer timeBudgetMs) {
        return search(query, size, null, timeBudgetMs);
    }

    public OpenSearchQueryResult search(
        Map<String, Object> query,
        int size,
        List<Map<String, Object>> sort,
        Integer timeBudgetMs
    ) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", size);
        body.put("track_total_hits", false);
        body.put("query", query);
        if (sort != null && !sort.isEmpty()) {
            body.put("sort", sort);
        }

        JsonNode response = postJson("/" + properties.getIndex() + "/_search", body, timeBudgetMs);
        return new OpenSearchQueryResult(extractHits(response), query);
    }

    public long count(Map<String, Object> query, Integer timeBudgetMs) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query);
        JsonNode response = postJson("/" + properties.getIndex() + "/_count", body, timeBudgetMs);
        return Math.max(0L, response.path("count").asLong(0L));
    }

    public boolean indexExists() {
        String url = buildUrl("/" + properties.getIndex());
        RestTemplate client = clientHolder.current();
        try {
            client.exchange(url, HttpMethod.HEAD, new HttpEntity<>(baseHeaders(null)), Void.class);
            return true;
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == 404) {
                return false;
            }
            throw translate(e, url);
        } catch (ResourceAccessException e) {
            throw translate(e, url, client);
        }
    }

    public BulkResult bulk(List<Map<String, Object>> actions) {
        if (actions == null || actions.isEmpty()) {
            return new BulkResult(false, 0, List.of());
        }
        StringBuilder payload = new StringBuilder();
        try {
            for (Map<String, Object> line : actions) {
                payload.append(objectMapper.writeValueAsString(line)).append('\n');
            }
        } catch (JsonProcessingException e) {
            throw new OpenSearchRequestException("Failed to serialize bulk payload", e);
        }

        JsonNode response = send(HttpMethod.POST, "/_bulk?refresh=wait_for", payload.toString(), NDJSON, null);
        List<String> failedIds = new ArrayList<>();
        int itemCount = 0;
        for (JsonNode item : response.path("items")) {
            itemCount++;
            JsonNode result = item.elements().hasNext() ? item.elements().next() : null;
            if (result != null && result.hasNonNull("error")) {
                failedIds.add(result.path("_id").asText(""));
            }
        }
        boolean errors = response.path("errors").asBoolean(false);
        if (errors) {
            log.warn("opensearch bulk reported errors failed={} items={}", failedIds.size(), itemCount);
        }
        return new BulkResult(errors, itemCount, failedIds);
    }

    public boolean ping() {
        String url = buildUrl("/");
        try {
            clientHolder.current().exchange(url, HttpMethod.HEAD, new HttpEntity<>(baseHeaders(null)), Void.class);
            return true;
        } catch (RestClientException e) {
            log.debug("opensearch ping failed: {}", e.getMessage());
            return false;
        }
    }

    public ClusterInfo clusterInfo() {
        JsonNode root = send(HttpMethod.GET, "/", null, null, null);
        JsonNode version = root.path("version");
        return new ClusterInfo(
            root.path("cluster_name").asText(null),
            version.path("number").asText(null),
            version.path("distribution").asText("elasticsearch")
        );
    }

    private JsonNode postJson(String path, Object body, Integer timeBudgetMs) {
        try {
            String payload = objectMapper.writeValueAsString(body);
            return send(HttpMethod.POST, path, payload, MediaType.APPLICATION_JSON, timeBudgetMs);
        } catch (JsonProcessingException e) {
            throw new OpenSearchRequestException("Failed to serialize OpenSearch request", e);
        }
    }

    private JsonNode send(HttpMethod method, String path, String payload, MediaType contentType, Integer timeBudgetMs) {
        String url = buildUrl(path);
        RestTemplate client = restTemplateFor(timeBudgetMs);
        try {
            HttpEntity<String> entity = new HttpEntity<>(payload, baseHeaders(contentType));
            ResponseEntity<String> response = client.exchange(url, method, entity, String.class);
            String body = response.getBody();
            if (body == null || body.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(body);
        } catch (ResourceAccessException e) {
            throw translate(e, url, client);
        } catch (HttpStatusCodeException e) {
            throw translate(e, url);
        } catch (JsonProcessingException e) {
            throw new OpenSearchRequestException("Failed to parse OpenSearch response", e);
        }
    }

    private RuntimeException translate(ResourceAccessException e, String url, RestTemplate client) {
        if (e.getCause() instanceof SocketTimeoutException) {
            return new OpenSearchTimeoutException("OpenSearch timed out: " + url, e);
        }
        clientHolder.reconnect(client);
        return new OpenSearchUnavailableException("OpenSearch unreachable: " + url, e);
    }

    private RuntimeException translate(HttpStatusCodeException e, String url) {
        int status = e.getStatusCode().value();
        if (status == 401 || status == 403) {
            return new OpenSearchAuthenticationException("OpenSearch rejected credentials: " + status, e);
        }
        if (status == 404) {
            return new OpenSearchIndexNotFoundException("OpenSearch index not found: " + properties.getIndex(), e);
        }
        if (status == 408 || status == 504) {
            return new OpenSearchTimeoutException("OpenSearch timed out: " + status, e);
        }
        if (status == 429 || status == 502 || status == 503) {
            return new OpenSearchUnavailableException("OpenSearch unavailable: " + status, e);
        }
        return new OpenSearchRequestException("OpenSearch error: " + status + " " + url, e);
    }

    private HttpHeaders baseHeaders(MediaType contentType) {
        HttpHeaders headers = new HttpHeaders();
        if (contentType != null) {
            headers.setContentType(contentType);
        }
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.set(HttpHeaders.AUTHORIZATION, "ApiKey " + properties.getApiKey());
        } else if (properties.getUsername() != null && !properties.getUsername().isBlank()) {
            headers.setBasicAuth(properties.getUsername(), properties.getPassword() == null ? "" : properties.getPassword());
        }
        return headers;
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base == null || base.isBlank()) {
            throw new OpenSearchUnavailableException("opensearch.base-url is not configured");
        }
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private List<OpenSearchHit> extractHits(JsonNode response) {
        List<OpenSearchHit> hits = new ArrayList<>();
        for (JsonNode hit : response.path("hits").path("hits")) {
            JsonNode source = hit.path("_source");
            String indexId = hit.path("_id").asText(null);
            String docId = source.path(SegmentFields.DOC_ID).asText(null);
            if (docId == null || docId.isEmpty()) {
                docId = indexId;
            }
            if (docId == null) {
                continue;
            }
            hits.add(new OpenSearchHit(docId, indexId, source, hit.path("_score").asDouble(0.0)));
        }
        return hits;
    }

    private RestTemplate restTemplateFor(Integer timeBudgetMs) {
        if (timeBudgetMs == null) {
            return clientHolder.current();
        }
        int budget = Math.max(1, Math.min(timeBudgetMs, properties.getReadTimeoutMs()));
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Math.min(budget, properties.getConnectTimeoutMs()));
        factory.setReadTimeout(budget);
        return new RestTemplate(factory);
    }
}
