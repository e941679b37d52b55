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

import com.solarcrm.webhooks.interfaces.enums.DeliveryStatus;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Filter criteria for querying delivery history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Filter criteria for querying webhook deliveries")
public class WebhookDeliveryFilterDTO {

    @Schema(description = "Only deliveries to this endpoint")
    private UUID endpointId;

    @Schema(description = "Only deliveries in this status")
    private DeliveryStatus status;

    @Schema(description = "Only deliveries of this event type")
    private WebhookEventType eventType;

    @Schema(description = "Page size", example = "50")
    @Builder.Default
    private int limit = 50;

    @Schema(description = "Rows to skip", example = "0")
    @Builder.Default
    private int offset = 0;
}
