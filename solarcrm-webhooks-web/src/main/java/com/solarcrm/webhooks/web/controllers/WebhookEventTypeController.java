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

package com.solarcrm.webhooks.web.controllers;

import com.solarcrm.webhooks.interfaces.dto.WebhookEventTypeDTO;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/api/v1/webhooks/event-types")
@Tag(name = "Webhook Event Types", description = "Catalogue of subscribable event types")
public class WebhookEventTypeController {

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List event types", description = "Every event type an endpoint can subscribe to")
    @ApiResponse(responseCode = "200", description = "Event type catalogue")
    public Flux<WebhookEventTypeDTO> listEventTypes() {
        return Flux.fromArray(WebhookEventType.values())
                .map(type -> WebhookEventTypeDTO.builder()
                        .value(type.getValue())
                        .category(type.getCategory())
                        .build());
    }
}
