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

package com.solarcrm.webhooks.core.store;

import com.solarcrm.webhooks.core.domain.WebhookEndpoint;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface WebhookEndpointRepository extends ReactiveCrudRepository<WebhookEndpoint, UUID> {

    /**
     * Finds all endpoints of a tenant, newest first.
     *
     * @param tenantId the tenant
     * @return Flux of endpoints
     */
    Flux<WebhookEndpoint> findByTenantIdOrderByCreatedAtDesc(UUID tenantId);

    Mono<WebhookEndpoint> findByIdAndTenantId(UUID id, UUID tenantId);

    /**
     * Finds the active endpoints of a tenant. Subscription filtering happens in the service.
     *
     * @param tenantId the tenant
     * @return Flux of active endpoints
     */
    Flux<WebhookEndpoint> findByTenantIdAndActiveTrue(UUID tenantId);

    Mono<Long> countByActiveTrue();
}
