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

import com.solarcrm.webhooks.core.domain.WebhookEndpoint;
import com.solarcrm.webhooks.core.mappers.WebhookEndpointMapper;
import com.solarcrm.webhooks.core.services.WebhookEndpointService;
import com.solarcrm.webhooks.core.signing.WebhookSecretGenerator;
import com.solarcrm.webhooks.core.store.WebhookEndpointRepository;
import com.solarcrm.webhooks.core.validation.WebhookEndpointValidator;
import com.solarcrm.webhooks.interfaces.dto.WebhookEndpointCreateDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookEndpointDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookEndpointUpdateDTO;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookEndpointServiceImpl implements WebhookEndpointService {

    private final WebhookEndpointRepository endpointRepository;
    private final WebhookEndpointValidator validator;
    private final WebhookSecretGenerator secretGenerator;
    private final WebhookEndpointMapper endpointMapper;
    private final Clock clock;

    @Override
    public Mono<WebhookEndpointDTO> registerEndpoint(UUID tenantId, WebhookEndpointCreateDTO request) {
        return Mono.fromCallable(() -> {
                    validator.validateUrl(request.getUrl());
                    Set<WebhookEventType> events = validator.validateEvents(request.getEvents());
                    validator.validateSecret(request.getSecret());

                    OffsetDateTime now = OffsetDateTime.now(clock);
                    return WebhookEndpoint.builder()
                            .id(UUID.randomUUID())
                            .tenantId(tenantId)
                            .name(request.getName())
                            .description(request.getDescription())
                            .url(request.getUrl().trim())
                            .secret(request.getSecret() != null ? request.getSecret() : secretGenerator.generate())
                            .events(WebhookEndpoint.joinEvents(events))
                            .active(true)
                            .createdAt(now)
                            .updatedAt(now)
                            .newEndpoint(true)
                            .build();
                })
                .flatMap(endpointRepository::save)
                .doOnNext(endpoint -> log.info("Registered webhook endpoint {} for tenant {} with events [{}]",
                        endpoint.getId(), tenantId, endpoint.getEvents()))
                .map(endpointMapper::toDtoWithSecret);
    }

    @Override
    public Mono<WebhookEndpointDTO> updateEndpoint(UUID tenantId, UUID endpointId, WebhookEndpointUpdateDTO request) {
        return findOwned(tenantId, endpointId)
                .map(existing -> applyUpdate(existing, request))
                .flatMap(endpointRepository::save)
                .doOnNext(endpoint -> log.info("Updated webhook endpoint {} for tenant {} (active: {})",
                        endpoint.getId(), tenantId, endpoint.isActive()))
                .map(endpointMapper::toDto);
    }

    @Override
    public Mono<Void> deleteEndpoint(UUID tenantId, UUID endpointId) {
        return findOwned(tenantId, endpointId)
                .flatMap(endpointRepository::delete)
                .doOnSuccess(v -> log.info("Deleted webhook endpoint {} for tenant {}", endpointId, tenantId));
    }

    @Override
    public Flux<WebhookEndpointDTO> getEndpoints(UUID tenantId) {
        return endpointRepository.findByTenantIdOrderByCreatedAtDesc(tenantId)
                .map(endpointMapper::toDto);
    }

    @Override
    public Mono<WebhookEndpointDTO> getEndpoint(UUID tenantId, UUID endpointId) {
        return findOwned(tenantId, endpointId)
                .map(endpointMapper::toDto);
    }

    @Override
    public Flux<WebhookEndpoint> listActiveFor(UUID tenantId, WebhookEventType eventType) {
        return endpointRepository.findByTenantIdAndActiveTrue(tenantId)
                .filter(endpoint -> endpoint.isSubscribedTo(eventType));
    }

    private Mono<WebhookEndpoint> findOwned(UUID tenantId, UUID endpointId) {
        return endpointRepository.findByIdAndTenantId(endpointId, tenantId)
                .switchIfEmpty(Mono.error(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Webhook endpoint not found: " + endpointId)));
    }

    private WebhookEndpoint applyUpdate(WebhookEndpoint existing, WebhookEndpointUpdateDTO request) {
        WebhookEndpoint.WebhookEndpointBuilder builder = existing.toBuilder()
                .updatedAt(OffsetDateTime.now(clock))
                .newEndpoint(false);

        if (request.getUrl() != null) {
            validator.validateUrl(request.getUrl());
            builder.url(request.getUrl().trim());
        }
        if (request.getEvents() != null) {
            builder.events(WebhookEndpoint.joinEvents(validator.validateEvents(request.getEvents())));
        }
        if (request.getActive() != null) {
            builder.active(request.getActive());
        }
        if (request.getName() != null) {
            builder.name(request.getName());
        }
        if (request.getDescription() != null) {
            builder.description(request.getDescription());
        }
        return builder.build();
    }
}
