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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * DTO representing a webhook endpoint registered by a tenant.
 * <p>
 * The {@code secret} is only returned in clear in the registration response.
 * Every other read returns it masked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Webhook endpoint registered by a tenant")
public class WebhookEndpointDTO {

    @Schema(description = "Endpoint identifier", example = "6f1c2a4e-8f0b-4a55-9c61-0d0f4b1f2e3a")
    private UUID id;

    @Schema(description = "Owning tenant")
    private UUID tenantId;

    @Schema(description = "Human readable name", example = "ERP sync")
    private String name;

    @Schema(description = "Free text description")
    private String description;

    @Schema(description = "Absolute http(s) URL deliveries are POSTed to", example = "https://erp.example.com/hooks/solarcrm")
    private String url;

    @Schema(description = "HMAC secret. Shown in clear only once, on registration", example = "***")
    private String secret;

    @Schema(description = "Subscribed event types")
    private Set<WebhookEventType> events;

    @Schema(description = "Whether the endpoint receives deliveries")
    private Boolean active;

    private Instant createdAt;

    private Instant updatedAt;
}
