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

import com.solarcrm.webhooks.core.services.WebhookDeliveryQueryService;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryFilterDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryPageDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryStatisticsDTO;
import com.solarcrm.webhooks.interfaces.enums.DeliveryStatus;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import com.solarcrm.webhooks.web.filter.RequestLogContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * REST controller for a tenant's delivery history, statistics and manual redelivery.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/webhooks/deliveries")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Webhook Deliveries", description = "Delivery history, statistics and redelivery")
public class WebhookDeliveryController {

    private final WebhookDeliveryQueryService deliveryQueryService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "List deliveries",
            description = "Returns a page of deliveries, newest first, together with the last 7 days of statistics"
    )
    @ApiResponse(
            responseCode = "200",
            description = "Page of deliveries",
            content = @Content(schema = @Schema(implementation = WebhookDeliveryPageDTO.class))
    )
    @ApiResponse(responseCode = "400", description = "Invalid filter, limit or offset")
    public Mono<WebhookDeliveryPageDTO> listDeliveries(
            @Parameter(description = "Tenant id", required = true) @PathVariable UUID tenantId,
            @Parameter(description = "Only deliveries to this endpoint") @RequestParam(required = false) UUID endpointId,
            @Parameter(description = "Only deliveries in this status", example = "failed") @RequestParam(required = false) String status,
            @Parameter(description = "Only deliveries of this event type", example = "invoice.paid") @RequestParam(required = false) String eventType,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "Rows to skip") @RequestParam(defaultValue = "0") int offset) {
        return Mono.fromCallable(() -> WebhookDeliveryFilterDTO.builder()
                        .endpointId(endpointId)
                        .status(parseStatus(status))
                        .eventType(parseEventType(eventType))
                        .limit(limit)
                        .offset(offset)
                        .build())
                .flatMap(filter -> deliveryQueryService.getDeliveryPage(tenantId, filter));
    }

    @GetMapping(value = "/statistics", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Delivery statistics", description = "Counts per status and success rate over the last N days")
    @ApiResponse(responseCode = "200", description = "Statistics")
    @ApiResponse(responseCode = "400", description = "days out of range")
    public Mono<WebhookDeliveryStatisticsDTO> getStatistics(
            @PathVariable UUID tenantId,
            @Parameter(description = "Window in days") @RequestParam(defaultValue = "7") int days) {
        return deliveryQueryService.getStatistics(tenantId, days);
    }

    @GetMapping(value = "/{deliveryId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get a delivery")
    @ApiResponse(responseCode = "200", description = "The delivery")
    @ApiResponse(responseCode = "404", description = "No such delivery for this tenant")
    public Mono<WebhookDeliveryDTO> getDelivery(@PathVariable UUID tenantId, @PathVariable UUID deliveryId) {
        return deliveryQueryService.getDelivery(tenantId, deliveryId);
    }

    @PostMapping(value = "/{deliveryId}/redeliver", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Redeliver a failed delivery",
            description = "Creates a new delivery with the same payload and endpoint. The failed record is left untouched."
    )
    @ApiResponse(responseCode = "202", description = "Redelivery accepted")
    @ApiResponse(responseCode = "400", description = "The delivery has not failed")
    @ApiResponse(responseCode = "404", description = "No such delivery for this tenant")
    public Mono<ResponseEntity<WebhookDeliveryDTO>> redeliver(@PathVariable UUID tenantId, @PathVariable UUID deliveryId) {
        return RequestLogContext.log(tenantId, () -> log.info("Redelivery requested for delivery {}", deliveryId))
                .then(Mono.defer(() -> deliveryQueryService.redeliver(tenantId, deliveryId)))
                .map(delivery -> ResponseEntity.status(HttpStatus.ACCEPTED).body(delivery));
    }

    private static DeliveryStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return DeliveryStatus.of(status);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    private static WebhookEventType parseEventType(String eventType) {
        if (eventType == null || eventType.isBlank()) {
            return null;
        }
        return WebhookEventType.fromValue(eventType)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown webhook event type: " + eventType));
    }
}
