package com.sahd.search.embed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.net.SocketTimeoutException;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
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
public class EmbeddingGateway {
    private final RestTemplate restTemplate;
    private final EmbeddingProperties properties;

    public EmbeddingGateway(
        @Qualifier("embeddingRestTemplate") RestTemplate restTemplate,
        EmbeddingProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public List<Double> embed(String text, Integer timeBudgetMs) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        return embedAll(List.of(text), timeBudgetMs).get(0);
    }

    public List<List<Double>> embedAll(List<String> texts, Integer timeBudgetMs) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new EmbeddingUnavailableException("embed_base_url_missing");
        }
        EmbeddingRequest request = new EmbeddingRequest();
        request.setModel(properties.getModel());
        request.setTexts(texts);
        request.setNormalize(true);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<EmbeddingRequest> entity = new HttpEntity<>(request, headers);

        int retries = Math.max(0, properties.getRetryCount());
        for (int attempt = 0; ; attempt++) {
            try {
                ResponseEntity<EmbeddingResponse> response = restTemplateFor(timeBudgetMs).exchange(
                    buildUrl("/v1/embed"),
                    HttpMethod.POST,
                    entity,
                    EmbeddingResponse.class
                );
                return validate(response.getBody(), texts.size());
            } catch (ResourceAccessException e) {
                if (attempt >= retries) {
                    String reason = e.getCause() instanceof SocketTimeoutException ? "embed_timeout" : "embed_unavailable";
                    throw new EmbeddingUnavailableException(reason, e);
                }
            } catch (HttpStatusCodeException e) {
                if (attempt >= retries) {
                    throw new EmbeddingUnavailableException("embed_http_" + e.getStatusCode().value(), e);
                }
            } catch (RestClientException e) {
                throw new EmbeddingUnavailableException("embed_bad_response", e);
            }
        }
    }

    private List<List<Double>> validate(EmbeddingResponse body, int expected) {
        if (body == null || body.getVectors() == null || body.getVectors().size() != expected) {
            throw new EmbeddingUnavailableException("embed_empty_response");
        }
        for (List<Double> vector : body.getVectors()) {
            if (vector == null || vector.isEmpty()) {
                throw new EmbeddingUnavailableException("embed_empty_vector");
            }
            if (properties.getDimension() > 0 && vector.size() != properties.getDimension()) {
                throw new EmbeddingUnavailableException("embed_dimension_mismatch");
            }
        }
        return body.getVectors();
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private RestTemplate restTemplateFor(Integer timeBudgetMs) {
        if (timeBudgetMs == null) {
            return restTemplate;
        }
        int budget = Math.max(1, Math.min(timeBudgetMs, properties.getTimeoutMs()));
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(budget);
        factory.setReadTimeout(budget);
        return new RestTemplate(factory);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingRequest {
        private String model;
        private List<String> texts;
        private Boolean normalize;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<String> getTexts() {
            return texts;
        }

        public void setTexts(List<String> texts) {
            this.texts = texts;
        }

        public Boolean getNormalize() {
            return normalize;
        }

        public void setNormalize(Boolean normalize) {
            this.normalize = normalize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingResponse {
        private String model;
        private List<List<Double>> vectors;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<List<Double>> getVectors() {
            return vectors;
        }

        public void setVectors(List<List<Double>> vectors) {
            this.vectors = vectors;
        }
    }
}
