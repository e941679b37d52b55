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

import com.solarcrm.webhooks.core.domain.WebhookDelivery;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryFilterDTO;
import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Delivery history queries with optional filters.
 */
public interface WebhookDeliveryRepositoryCustom {

    /**
     * Finds a page of a tenant's deliveries, newest first.
     *
     * @param tenantId the tenant
     * @param filter optional endpoint, status and event type filters plus limit and offset
     * @return Flux of deliveries
     */
    Flux<WebhookDelivery> findHistory(UUID tenantId, WebhookDeliveryFilterDTO filter);
}
