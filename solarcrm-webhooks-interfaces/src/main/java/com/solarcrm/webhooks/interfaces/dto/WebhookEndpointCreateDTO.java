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

import java.util.List;

/**
 * Request body for registering a webhook endpoint.
 * <p>
 * Event types are accepted as raw wire values so that unknown values can be reported back
 * to the caller all at once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Webhook endpoint registration request")
public class WebhookEndpointCreateDTO {

    @Schema(description = "Absolute http(s) URL", example = "https://erp.example.com/hooks/solarcrm", requiredMode = Schema.RequiredMode.REQUIRED)
    private String url;

    @Schema(description = "Event types to subscribe to", example = "[\"lead.created\", \"invoice.paid\"]", requiredMode = Schema.RequiredMode.REQUIRED)
    private List<String> events;

    @Schema(description = "Signing secret. Generated when omitted")
    private String secret;

    @Schema(description = "Human readable name")
    private String name;

    @Schema(description = "Free text description")
    private String description;
}
