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

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Delivery counts for a tenant over a trailing window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Webhook delivery statistics")
public class WebhookDeliveryStatisticsDTO {

    @Schema(description = "Window size in days", example = "7")
    private int periodDays;

    private long totalDeliveries;

    @Schema(description = "Deliveries in status delivered")
    private long successfulDeliveries;

    @Schema(description = "Deliveries in status failed")
    private long failedDeliveries;

    @Schema(description = "Deliveries in status pending or retrying")
    private long pendingDeliveries;

    @Schema(description = "Percentage of delivered over total, two decimals", example = "97.5")
    private double successRate;
}
