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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solarcrm.webhooks.core.config.WebhookDeliveryProperties;
import com.solarcrm.webhooks.core.domain.WebhookDelivery;
import com.solarcrm.webhooks.core.domain.WebhookEndpoint;
import com.solarcrm.webhooks.core.domain.WebhookEnvelope;
import com.solarcrm.webhooks.core.metrics.WebhookMetricsService;
import com.solarcrm.webhooks.core.services.WebhookDeliveryService;
import com.solarcrm.webhooks.core.services.WebhookDispatchService;
import com.solarcrm.webhooks.core.services.WebhookEndpointService;
import com.solarcrm.webhooks.core.store.WebhookDeliveryRepository;
import com.solarcrm.webhooks.core.validation.WebhookEndpointValidator;
import com.solarcrm.webhooks.interfaces.enums.DeliveryStatus;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Implementation of the event dispatcher.
 * <p>
 * Dispatch is two-phase: records are inserted first, then attempted. The envelope is
 * serialized once and the same string is stored, signed and sent on every attempt.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookDispatchServiceImpl implements WebhookDispatchService {

    private final WebhookEndpointService endpointService;
    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookDeliveryService deliveryService;
    private final WebhookEndpointValidator validator;
    private final WebhookDeliveryProperties deliveryProperties;
    private final WebhookMetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Mono<List<WebhookDelivery>> sendWebhook(UUID tenantId, WebhookEventType eventType, Map<String, Object> data) {
        return sendWebhook(tenantId, eventType, data, null);
    }

    @Override
    public Mono<List<WebhookDelivery>> sendWebhook(UUID tenantId,
                                                   WebhookEventType eventType,
                                                   Map<String, Object> data,
                                                   Map<String, Object> metadata) {
        if (!validator.isMetadataWithinBounds(metadata)) {
            log.error("Rejected {} event for tenant {}: metadata has {} entries", eventType, tenantId, metadata.size());
            return Mono.just(List.of());
        }

        return endpointService.listActiveFor(tenantId, eventType)
                .collectList()
                .flatMap(endpoints -> {
                    if (endpoints.isEmpty()) {
                        log.debug("No active webhook endpoints for tenant {} and event {}", tenantId, eventType);
                        return Mono.just(List.<WebhookDelivery>of());
                    }
                    String payload = serialize(buildEnvelope(tenantId, eventType, data, metadata));
                    return createDeliveries(tenantId, eventType, payload, endpoints)
                            .flatMap(this::startAttempts);
                })
                .onErrorResume(error -> {
                    log.error("Failed to dispatch {} event for tenant {}: {}", eventType, tenantId, error.getMessage(), error);
                    return Mono.just(List.of());
                });
    }

    private WebhookEnvelope buildEnvelope(UUID tenantId,
                                          WebhookEventType eventType,
                                          Map<String, Object> data,
                                          Map<String, Object> metadata) {
        return WebhookEnvelope.builder()
                .event(eventType)
                .tenantId(tenantId)
                .timestamp(clock.instant().toString())
                .data(data != null ? data : Map.of())
                .metadata(metadata)
                .build();
    }

    private String serialize(WebhookEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook payload cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    private Mono<List<WebhookDelivery>> createDeliveries(UUID tenantId,
                                                         WebhookEventType eventType,
                                                         String payload,
                                                         List<WebhookEndpoint> endpoints) {
        return Flux.fromIterable(endpoints)
                .concatMap(endpoint -> insertPending(tenantId, eventType, payload, endpoint))
                .collectList();
    }

    private Mono<WebhookDelivery> insertPending(UUID tenantId,
                                                WebhookEventType eventType,
                                                String payload,
                                                WebhookEndpoint endpoint) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        WebhookDelivery delivery = WebhookDelivery.builder()
                .id(UUID.randomUUID())
                .tenantId(tenantId)
                .endpointId(endpoint.getId())
                .eventType(eventType.getValue())
                .payload(payload)
                .status(DeliveryStatus.PENDING)
                .retryCount(0)
                .createdAt(now)
                .updatedAt(now)
                .newDelivery(true)
                .build();

        return deliveryRepository.save(delivery)
                .map(saved -> saved.toBuilder().newDelivery(false).build())
                .doOnNext(saved -> {
                    metricsService.recordDispatched(saved.getEventType());
                    log.debug("Created delivery {} of {} for endpoint {}", saved.getId(), eventType, endpoint.getId());
                })
                .onErrorResume(error -> {
                    log.error("Failed to create delivery of {} for endpoint {}: {}",
                            eventType, endpoint.getId(), error.getMessage(), error);
                    return Mono.empty();
                });
    }

    private Mono<List<WebhookDelivery>> startAttempts(List<WebhookDelivery> deliveries) {
        if (deliveryProperties.isAsyncDispatch()) {
            deliveries.forEach(delivery -> deliveryService.attemptDelivery(delivery)
                    .subscribe(
                            result -> log.debug("Delivery {} attempted: {}", result.getId(), result.getStatus()),
                            error -> log.error("Delivery {} attempt failed: {}", delivery.getId(), error.getMessage(), error)));
            return Mono.just(deliveries);
        }

        return Flux.fromIterable(deliveries)
                .flatMapSequential(deliveryService::attemptDelivery)
                .collectList();
    }
}
