package com.coordinator.core.events;

import com.coordinator.core.config.CoordinatorProperties;
import com.coordinator.core.metrics.CoordinatorMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards every {@link CoordinatorEvent} to the external observability server as JSON.
 * <p>
 * Requests are sent with {@link HttpClient#sendAsync}, so publishing never waits on the
 * network. Non-2xx responses and transport errors are logged at WARN and dropped.
 */
@Component
@ConditionalOnProperty(prefix = "coordinator.observability", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HttpEventForwarder {

    private static final Logger log = LoggerFactory.getLogger(HttpEventForwarder.class);

    static final String SOURCE_APP = "multi-agent-coordinator";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(5);

    private final EventBus eventBus;
    private final URI endpoint;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CoordinatorMetrics metrics;
    private EventBus.Subscription subscription;

    @Autowired
    public HttpEventForwarder(EventBus eventBus, CoordinatorProperties properties,
                              @Autowired(required = false) CoordinatorMetrics metrics) {
        this(eventBus, properties.getObservabilityServer(),
                HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build(), metrics);
    }

    HttpEventForwarder(EventBus eventBus, String observabilityServer, HttpClient httpClient,
                       CoordinatorMetrics metrics) {
        this.eventBus = eventBus;
        this.endpoint = URI.create(stripTrailingSlash(observabilityServer) + "/events");
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.metrics = metrics;
    }

    @PostConstruct
    void start() {
        subscription = eventBus.subscribeAll(this::forward);
        log.info("Forwarding coordinator events to {}", endpoint);
    }

    @PreDestroy
    void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    /**
     * Sends one event. The returned future completes once the attempt has been logged;
     * it never completes exceptionally.
     */
    CompletableFuture<Void> forward(CoordinatorEvent event) {
        String body;
        try {
            body = objectMapper.writeValueAsString(envelope(event));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize event {}: {}", event.eventType(), e.getMessage());
            recordDelivery(false);
            return CompletableFuture.completedFuture(null);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .handle((response, error) -> {
                    if (error != null) {
                        log.warn("Could not send event {} to observability server: {}",
                                event.eventType(), error.getMessage());
                        recordDelivery(false);
                    } else if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        log.warn("Failed to send event {} to observability server: HTTP {}",
                                event.eventType(), response.statusCode());
                        recordDelivery(false);
                    } else {
                        recordDelivery(true);
                    }
                    return null;
                });
    }

    /**
     * The JSON body posted to the collector.
     */
    Map<String, Object> envelope(CoordinatorEvent event) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("source_app", SOURCE_APP);
        envelope.put("session_id", event.sessionId());
        envelope.put("hook_event_type", event.eventType());
        envelope.put("payload", event.payload());
        envelope.put("timestamp", event.timestamp().toEpochMilli());
        return envelope;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    private void recordDelivery(boolean success) {
        if (metrics != null) {
            metrics.recordEventDelivery(success);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
