package com.venturegate.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * POSTs {@link ResumeNotification} as JSON to the configured resume URL with its own timeout.
 * No retries; a failed call surfaces as {@link OrchestratorNotificationException}.
 */
@Component
public class HttpOrchestratorNotifier implements OrchestratorNotifier {

    private static final Logger log = LoggerFactory.getLogger(HttpOrchestratorNotifier.class);

    private final OrchestratorProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public HttpOrchestratorNotifier(OrchestratorProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(properties.getTimeout())
            .build();
    }

    @Override
    public void notifyResume(ResumeNotification notification) {
        String url = properties.getResumeUrl();
        if (url == null || url.isBlank()) {
            log.info("No orchestrator resume URL configured; skipping resume of run {}", notification.runId());
            return;
        }

        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(properties.getTimeout())
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(toJson(notification)));
        String token = properties.getAuthToken();
        if (token != null && !token.isBlank()) {
            request.header("Authorization", "Bearer " + token);
        }

        try {
            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new OrchestratorNotificationException("Orchestrator resume failed (HTTP %d): %s"
                    .formatted(response.statusCode(), response.body()));
            }
            log.info("Resumed orchestrator run {} at checkpoint {} with decision {}",
                notification.runId(), notification.checkpoint(), notification.decision());
        } catch (IOException e) {
            throw new OrchestratorNotificationException("Orchestrator resume request failed for run " + notification.runId(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestratorNotificationException("Interrupted while resuming run " + notification.runId(), e);
        }
    }

    private String toJson(ResumeNotification notification) {
        try {
            return objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new OrchestratorNotificationException("Could not serialize resume notification", e);
        }
    }
}
