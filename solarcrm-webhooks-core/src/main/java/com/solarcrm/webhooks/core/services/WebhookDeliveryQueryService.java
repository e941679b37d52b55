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

import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryFilterDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryPageDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryStatisticsDTO;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Tenant-scoped read access to delivery history, plus manual redelivery.
 */
public interface WebhookDeliveryQueryService {

    int DEFAULT_STATISTICS_DAYS = 7;

    /**
     * Gets a page of the tenant's deliveries, newest first.
     *
     * @param tenantId the tenant
     * @param limit page size, 1 to 200
     * @param offset rows to skip
     * @return Flux of deliveries
     */
    Flux<WebhookDeliveryDTO> getDeliveryHistory(UUID tenantId, int limit, int offset);

    /**
     * Gets a filtered page of the tenant's deliveries together with the statistics of the
     * last {@value #DEFAULT_STATISTICS_DAYS} days.
     *
     * @param tenantId the tenant
     * @param filter optional endpoint, status and event type filters with paging
     * @return Mono with the page
     */
    Mono<WebhookDeliveryPageDTO> getDeliveryPage(UUID tenantId, WebhookDeliveryFilterDTO filter);

    Mono<WebhookDeliveryDTO> getDelivery(UUID tenantId, UUID deliveryId);

    /**
     * Counts the tenant's deliveries created in the last {@code days} days by outcome.
     *
     * @param tenantId the tenant
     * @param days period length, 1 to 365
     * @return Mono with the statistics
     */
    Mono<WebhookDeliveryStatisticsDTO> getStatistics(UUID tenantId, int days);

    /**
     * Sends a failed delivery again as a new delivery with the same endpoint and payload.
     * The failed record is left as it is.
     *
     * @param tenantId the tenant
     * @param deliveryId a FAILED delivery
     * @return Mono with the new delivery
     */
    Mono<WebhookDeliveryDTO> redeliver(UUID tenantId, UUID deliveryId);
}
