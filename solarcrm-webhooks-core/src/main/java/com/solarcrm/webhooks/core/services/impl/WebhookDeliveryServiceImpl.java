/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.solarcrm.webhooks.core.services.impl;

import com.solarcrm.webhooks.core.client.EndpointCircuitOpenException;
import com.solarcrm.webhooks.core.client.WebhookHttpClient;
import com.solarcrm.webhooks.core.client.WebhookHttpResponse;
import com.solarcrm.webhooks.core.client.WebhookTransportException;
import com.solarcrm.webhooks.core.config.WebhookDeliveryProperties;
import com.solarcrm.webhooks.core.domain.DeliveryAttemptResult;
import com.solarcrm.webhooks.core.domain.WebhookDelivery;
import com.solarcrm.webhooks.core.domain.WebhookEndpoint;
import com.solarcrm.webhooks.core.metrics.WebhookMetricsService;
import com.solarcrm.webhooks.core.services.WebhookDeliveryService;
import com.solarcrm.webhooks.core.signing.WebhookSigner;
import com.solarcrm.webhooks.core.store.WebhookDeliveryRepository;
import com.solarcrm.webhooks.core.store.WebhookEndpointRepository;
import com.solarcrm.webhooks.interfaces.enums.DeliveryStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Implementation of the delivery engine.
 * <p>
 * Every failure other than a missing endpoint or an unusable secret is transient: the
 * delivery is retried on the configured backoff until {@code maxRetries} is reached.
 * A call refused by an open circuit sends nothing; it is rescheduled for when the circuit
 * allows a trial request and keeps its retry count.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookDeliveryServiceImpl implements WebhookDeliveryService {

    static final String ENDPOINT_NOT_FOUND = "Webhook endpoint not found";

    private final WebhookEndpointRepository endpointRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookSigner signer;
    private final WebhookHttpClient httpClient;
    private final WebhookDeliveryProperties deliveryProperties;
    private final WebhookMetricsService metricsService;
    private final Clock clock;

    @Override
    public Mono<WebhookDelivery> attemptDelivery(WebhookDelivery delivery) {
        if (delivery.getStatus() != null && delivery.getStatus().isTerminal()) {
            log.debug("Delivery {} is already {}, nothing to attempt", delivery.getId(), delivery.getStatus());
            return Mono.just(delivery);
        }

        return Mono.defer(() -> {
                    long startNanos = System.nanoTime();
                    withDeliveryContext(delivery, () -> log.debug("Attempting delivery {} of {} (retry count {})",
                            delivery.getId(), delivery.getEventType(), delivery.getRetryCount()));

                    return endpointRepository.findById(delivery.getEndpointId())
                            .flatMap(endpoint -> send(delivery, endpoint))
                            .switchIfEmpty(Mono.fromSupplier(() -> DeliveryAttemptResult.permanentFailure(ENDPOINT_NOT_FOUND)))
                            .flatMap(result -> recordOutcome(delivery, result, startNanos));
                })
                .onErrorResume(error -> {
                    withDeliveryContext(delivery, () -> log.error("Error processing delivery {}: {}",
                            delivery.getId(), error.getMessage(), error));
                    return Mono.just(delivery);
                });
    }

    /**
     * Runs a statement with the delivery's ids in the MDC. The reactive chain may hop threads
     * between signals, so the ids are set around each statement and the caller's MDC is restored.
     */
    private void withDeliveryContext(WebhookDelivery delivery, Runnable statement) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        MDC.put("deliveryId", String.valueOf(delivery.getId()));
        MDC.put("endpointId", String.valueOf(delivery.getEndpointId()));
        MDC.put("tenantId", String.valueOf(delivery.getTenantId()));
        try {
            statement.run();
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }

    private Mono<DeliveryAttemptResult> send(WebhookDelivery delivery, WebhookEndpoint endpoint) {
        byte[] body = delivery.getPayload().getBytes(StandardCharsets.UTF_8);

        String signature;
        try {
            signature = signer.sign(body, endpoint.getSecret());
        } catch (IllegalArgumentException e) {
            withDeliveryContext(delivery, () -> log.error("Cannot sign delivery {} for endpoint {}: {}",
                    delivery.getId(), endpoint.getId(), e.getMessage()));
            return Mono.just(DeliveryAttemptResult.permanentFailure("Signing failed: " + e.getMessage()));
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(WebhookSigner.SIGNATURE_HEADER, signature);
        headers.set(WebhookSigner.TIMESTAMP_HEADER, clock.instant().toString());
        headers.set(HttpHeaders.USER_AGENT, deliveryProperties.getUserAgent());

        return httpClient.post(endpoint.getId(), endpoint.getUrl(), headers, body)
                .map(this::classifyResponse)
                .onErrorResume(this::classifyError);
    }

    private DeliveryAttemptResult classifyResponse(WebhookHttpResponse response) {
        String body = truncate(response.getBody());
        if (response.isSuccessful()) {
            return DeliveryAttemptResult.delivered(response.getStatusCode(), body);
        }
        return DeliveryAttemptResult.transientFailure(response.getStatusCode(), body,
                truncate("HTTP " + response.getStatusCode() + ": " + response.getBody()));
    }

    private Mono<DeliveryAttemptResult> classifyError(Throwable error) {
        if (error instanceof EndpointCircuitOpenException) {
            EndpointCircuitOpenException circuitOpen = (EndpointCircuitOpenException) error;
            return Mono.just(DeliveryAttemptResult.deferred(circuitOpen.getMessage(), circuitOpen.getRetryAfter()));
        }
        if (error instanceof WebhookTransportException) {
            return Mono.just(DeliveryAttemptResult.transientFailure(truncate(error.getMessage())));
        }
        log.warn("Unexpected error during webhook request: {}", error.toString());
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return Mono.just(DeliveryAttemptResult.transientFailure(truncate(message)));
    }

    private Mono<WebhookDelivery> recordOutcome(WebhookDelivery delivery, DeliveryAttemptResult result, long startNanos) {
        WebhookDelivery updated = applyResult(delivery, result, OffsetDateTime.now(clock));

        return deliveryRepository.compareAndSetOutcome(
                        delivery.getId(),
                        delivery.getStatus().name(),
                        delivery.getRetryCount(),
                        updated.getStatus().name(),
                        updated.getResponseStatus(),
                        updated.getResponseBody(),
                        updated.getErrorMessage(),
                        updated.getRetryCount(),
                        updated.getNextRetryAt(),
                        updated.getDeliveredAt(),
                        updated.getUpdatedAt())
                .flatMap(rows -> {
                    if (rows == 0) {
                        withDeliveryContext(delivery, () -> log.warn(
                                "Delivery {} changed during the attempt, discarding outcome {}",
                                delivery.getId(), updated.getStatus()));
                        return deliveryRepository.findById(delivery.getId()).defaultIfEmpty(delivery);
                    }
                    Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
                    withDeliveryContext(updated, () -> {
                        logOutcome(updated, result);
                        recordMetrics(updated, result, duration);
                    });
                    return Mono.just(updated);
                });
    }

    WebhookDelivery applyResult(WebhookDelivery delivery, DeliveryAttemptResult result, OffsetDateTime now) {
        WebhookDelivery.WebhookDeliveryBuilder builder = delivery.toBuilder()
                .responseStatus(result.getResponseStatus())
                .responseBody(result.getResponseBody())
                .updatedAt(now)
                .newDelivery(false);

        if (result.isSuccessful()) {
            return builder
                    .status(DeliveryStatus.DELIVERED)
                    .errorMessage(null)
                    .nextRetryAt(null)
                    .deliveredAt(now)
                    .build();
        }

        builder.errorMessage(result.getErrorMessage());

        if (result.isPermanent()) {
            return builder
                    .status(DeliveryStatus.FAILED)
                    .nextRetryAt(null)
                    .build();
        }

        if (result.isDeferred()) {
            // refused before sending, so the attempt does not count against maxRetries
            return builder
                    .status(DeliveryStatus.RETRYING)
                    .nextRetryAt(now.plus(result.getRetryAfter()))
                    .build();
        }

        int maxRetries = deliveryProperties.getMaxRetries();
        int nextRetryCount = delivery.getRetryCount() + 1;
        if (nextRetryCount <= maxRetries) {
            return builder
                    .status(DeliveryStatus.RETRYING)
                    .retryCount(nextRetryCount)
                    .nextRetryAt(now.plus(deliveryProperties.delayForRetry(nextRetryCount)))
                    .build();
        }

        return builder
                .status(DeliveryStatus.FAILED)
                .retryCount(maxRetries)
                .nextRetryAt(null)
                .build();
    }

    private void logOutcome(WebhookDelivery updated, DeliveryAttemptResult result) {
        switch (updated.getStatus()) {
            case DELIVERED -> log.info("Delivered {} to endpoint {} (HTTP {})",
                    updated.getEventType(), updated.getEndpointId(), updated.getResponseStatus());
            case RETRYING -> {
                if (result.isDeferred()) {
                    log.warn("Delivery {} deferred until {}: {}",
                            updated.getId(), updated.getNextRetryAt(), result.getErrorMessage());
                } else {
                    log.warn("Delivery {} failed (attempt {}), retrying at {}: {}",
                            updated.getId(), updated.getRetryCount(), updated.getNextRetryAt(), result.getErrorMessage());
                }
            }
            default -> log.error("Delivery {} failed permanently after {} retries: {}",
                    updated.getId(), updated.getRetryCount(), result.getErrorMessage());
        }
    }

    private void recordMetrics(WebhookDelivery updated, DeliveryAttemptResult result, Duration duration) {
        String eventType = updated.getEventType();
        switch (updated.getStatus()) {
            case DELIVERED -> metricsService.recordDelivered(eventType);
            case RETRYING -> metricsService.recordRetryScheduled(eventType);
            default -> metricsService.recordFailed(eventType, result.isPermanent() ? "permanent" : "max_retries");
        }
        metricsService.recordAttemptTime(eventType, updated.getStatus().getValue(), duration);
    }

    private String truncate(String text) {
        if (text == null) {
            return null;
        }
        int limit = deliveryProperties.getResponseBodyLimit();
        return text.length() <= limit ? text : text.substring(0, limit);
    }
}
