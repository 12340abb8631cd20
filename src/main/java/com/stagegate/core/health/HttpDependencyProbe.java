package com.stagegate.core.health;

import com.stagegate.core.collaborator.DependencyProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Treats a dependency as up when a GET on its URL answers below 500.
 */
public class HttpDependencyProbe implements DependencyProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpDependencyProbe.class);

    private final URI uri;
    private final Duration timeout;
    private final HttpClient httpClient;

    public HttpDependencyProbe(String url, Duration timeout) {
        this(url, timeout, HttpClient.newBuilder().connectTimeout(timeout).build());
    }

    HttpDependencyProbe(String url, Duration timeout, HttpClient httpClient) {
        this.uri = URI.create(url);
        this.timeout = timeout;
        this.httpClient = httpClient;
    }

    @Override
    public HealthStatus check() {
        String component = "dependency:" + uri.getHost();
        try {
            var request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            if (response.statusCode() < 500) {
                return new HealthStatus(component, HealthStatus.Status.UP,
                        "HTTP " + response.statusCode(), Map.of("url", uri.toString()));
            }
            return new HealthStatus(component, HealthStatus.Status.DOWN,
                    "HTTP " + response.statusCode(), Map.of("url", uri.toString()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthStatus.down(component, "Interrupted while probing " + uri);
        } catch (Exception e) {
            log.warn("Dependency probe {} failed: {}", uri, e.getMessage());
            return new HealthStatus(component, HealthStatus.Status.DOWN,
                    "Unreachable: " + e.getMessage(), Map.of("url", uri.toString()));
        }
    }
}
