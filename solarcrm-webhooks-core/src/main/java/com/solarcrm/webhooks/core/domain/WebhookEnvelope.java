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

package com.solarcrm.webhooks.core.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * Body of every outbound webhook request.
 * <pre>
 * {
 *   "event": "lead.created",
 *   "tenant_id": "...",
 *   "timestamp": "2026-01-01T10:00:00Z",
 *   "data": { ... },
 *   "metadata": { ... }
 * }
 * </pre>
 * {@code metadata} is left out of the JSON when absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"event", "tenant_id", "timestamp", "data", "metadata"})
public class WebhookEnvelope {

    private WebhookEventType event;

    @JsonProperty("tenant_id")
    private UUID tenantId;

    /**
     * ISO-8601 instant the event was dispatched
     */
    private String timestamp;

    private Map<String, Object> data;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Map<String, Object> metadata;
}
