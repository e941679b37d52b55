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

package com.solarcrm.webhooks.core.services;

import com.solarcrm.webhooks.core.domain.WebhookEndpoint;
import com.solarcrm.webhooks.interfaces.dto.WebhookEndpointCreateDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookEndpointDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookEndpointUpdateDTO;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Registry of tenant webhook endpoints.
 * <p>
 * Validation failures error with {@code ResponseStatusException(BAD_REQUEST)}, endpoints
 * that do not exist for the tenant with {@code ResponseStatusException(NOT_FOUND)}.
 */
public interface WebhookEndpointService {

    /**
     * Registers an active endpoint. A secret is generated when none is supplied.
     *
     * @param tenantId the owning tenant
     * @param request url, events and optional secret, name and description
     * @return Mono with the endpoint, including its secret in clear
     */
    Mono<WebhookEndpointDTO> registerEndpoint(UUID tenantId, WebhookEndpointCreateDTO request);

    /**
     * Applies the non-null fields of the request.
     *
     * @param tenantId the owning tenant
     * @param endpointId the endpoint
     * @param request fields to change
     * @return Mono with the updated endpoint, secret masked
     */
    Mono<WebhookEndpointDTO> updateEndpoint(UUID tenantId, UUID endpointId, WebhookEndpointUpdateDTO request);

    /**
     * Deletes the endpoint. Its delivery history is kept.
     *
     * @param tenantId the owning tenant
     * @param endpointId the endpoint
     * @return Mono completing when deleted
     */
    Mono<Void> deleteEndpoint(UUID tenantId, UUID endpointId);

    /**
     * Lists the tenant's endpoints, newest first, secrets masked.
     *
     * @param tenantId the owning tenant
     * @return Flux of endpoints
     */
    Flux<WebhookEndpointDTO> getEndpoints(UUID tenantId);

    /**
     * Gets one endpoint, secret masked.
     *
     * @param tenantId the owning tenant
     * @param endpointId the endpoint
     * @return Mono with the endpoint
     */
    Mono<WebhookEndpointDTO> getEndpoint(UUID tenantId, UUID endpointId);

    /**
     * Finds the active endpoints of a tenant subscribed to an event type.
     *
     * @param tenantId the tenant
     * @param eventType the event type
     * @return Flux of subscribed endpoints
     */
    Flux<WebhookEndpoint> listActiveFor(UUID tenantId, WebhookEventType eventType);
}
