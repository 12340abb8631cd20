package com.stagegate.sandbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stagegate.core.StageGateException;
import com.stagegate.core.collaborator.EvidencePackage;
import com.stagegate.core.collaborator.ExternalReviewer;
import com.stagegate.core.collaborator.ReviewVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Posts the evidence package to a review service and reads back
 * {@code {"approved": bool, "reasons": [...]}}.
 */
public class HttpExternalReviewer implements ExternalReviewer {

    private static final Logger log = LoggerFactory.getLogger(HttpExternalReviewer.class);

    private final URI endpoint;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    public HttpExternalReviewer(String url, ObjectMapper mapper) {
        this(url, mapper, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    HttpExternalReviewer(String url, ObjectMapper mapper, HttpClient httpClient) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("stagegate.reviewer.url is required for the http reviewer");
        }
        this.endpoint = URI.create(url);
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    @Override
    public ReviewVerdict review(EvidencePackage evidencePackage) {
        try {
            String body = mapper.writeValueAsString(evidencePackage);
            var request = HttpRequest.newBuilder(endpoint)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            log.info("Requesting external review of {} from {}", evidencePackage.stage(), endpoint);
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new StageGateException(String.format("Reviewer answered HTTP %d: %s",
                        response.statusCode(), response.body()));
            }
            return parseVerdict(mapper.readTree(response.body()));
        } catch (IOException e) {
            throw new StageGateException("Reviewer call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageGateException("Interrupted while waiting for reviewer", e);
        }
    }

    static ReviewVerdict parseVerdict(JsonNode node) {
        if (node == null || !node.path("approved").isBoolean()) {
            throw new StageGateException("Reviewer response has no boolean 'approved' field");
        }
        List<String> reasons = new ArrayList<>();
        node.path("reasons").forEach(r -> reasons.add(r.asText()));
        return new ReviewVerdict(node.get("approved").asBoolean(), reasons);
    }
}
