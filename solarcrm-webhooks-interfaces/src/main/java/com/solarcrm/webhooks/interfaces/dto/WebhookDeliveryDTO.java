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

package com.solarcrm.webhooks.interfaces.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.solarcrm.webhooks.interfaces.enums.DeliveryStatus;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * DTO representing one delivery of one event to one endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Webhook delivery record")
public class WebhookDeliveryDTO {

    private UUID id;

    private UUID tenantId;

    @Schema(description = "Target endpoint. The endpoint may since have been deleted")
    private UUID endpointId;

    private WebhookEventType eventType;

    @Schema(description = "Envelope exactly as sent")
    private JsonNode payload;

    private DeliveryStatus status;

    @Schema(description = "HTTP status of the last attempt", example = "200")
    private Integer responseStatus;

    @Schema(description = "Response body of the last attempt, truncated")
    private String responseBody;

    @Schema(description = "Error of the last failed attempt", example = "HTTP 500: Internal Server Error")
    private String errorMessage;

    @Schema(description = "Number of failed attempts so far", example = "1")
    private Integer retryCount;

    @Schema(description = "Due time of the next attempt, set only while retrying")
    private Instant nextRetryAt;

    private Instant deliveredAt;

    private Instant createdAt;

    private Instant updatedAt;
}
