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

import com.solarcrm.webhooks.core.domain.WebhookDelivery;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Fans a domain event out to every subscribed endpoint of the tenant.
 */
public interface WebhookDispatchService {

    /**
     * Sends an event without metadata.
     *
     * @see #sendWebhook(UUID, WebhookEventType, Map, Map)
     */
    Mono<List<WebhookDelivery>> sendWebhook(UUID tenantId, WebhookEventType eventType, Map<String, Object> data);

    /**
     * Creates one PENDING delivery per active subscribed endpoint and hands each to the
     * delivery engine.
     * <p>
     * The Mono completes once the records exist. With asynchronous dispatch the attempts
     * continue in the background and the emitted records are the PENDING ones; otherwise the
     * records are emitted after their first attempt. It never errors: failures are logged and
     * an endpoint that fails does not affect the others.
     *
     * @param tenantId the tenant the event belongs to
     * @param eventType the event type
     * @param data event data, placed under {@code data} in the envelope
     * @param metadata optional metadata, may be null
     * @return Mono with the created deliveries, empty list when nobody is subscribed
     */
    Mono<List<WebhookDelivery>> sendWebhook(UUID tenantId,
                                            WebhookEventType eventType,
                                            Map<String, Object> data,
                                            Map<String, Object> metadata);
}
