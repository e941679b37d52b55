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

import com.solarcrm.webhooks.core.services.WebhookEndpointService;
import com.solarcrm.webhooks.interfaces.dto.WebhookEndpointCreateDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookEndpointDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookEndpointUpdateDTO;
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
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * REST controller for a tenant's webhook endpoints.
 * <p>
 * Secrets are only returned in full by the registration response. Every other read masks them.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/webhooks/endpoints")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Webhook Endpoints", description = "Registration and management of tenant webhook endpoints")
public class WebhookEndpointController {

    private final WebhookEndpointService endpointService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List endpoints", description = "Lists the tenant's endpoints, newest first, with masked secrets")
    @ApiResponse(responseCode = "200", description = "Endpoints of the tenant")
    public Flux<WebhookEndpointDTO> listEndpoints(
            @Parameter(description = "Tenant id", required = true) @PathVariable UUID tenantId) {
        return endpointService.getEndpoints(tenantId);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Register an endpoint",
            description = "Registers an endpoint for the given event types. A signing secret is generated when none is supplied " +
                    "and is returned in full only in this response."
    )
    @ApiResponse(
            responseCode = "201",
            description = "Endpoint registered",
            content = @Content(schema = @Schema(implementation = WebhookEndpointDTO.class))
    )
    @ApiResponse(responseCode = "400", description = "Invalid URL, event types or secret")
    public Mono<ResponseEntity<WebhookEndpointDTO>> registerEndpoint(
            @Parameter(description = "Tenant id", required = true) @PathVariable UUID tenantId,
            @RequestBody WebhookEndpointCreateDTO request) {
        return RequestLogContext.log(tenantId, () -> log.info("Registering webhook endpoint for tenant {}", tenantId))
                .then(Mono.defer(() -> endpointService.registerEndpoint(tenantId, request)))
                .map(endpoint -> ResponseEntity.status(HttpStatus.CREATED).body(endpoint));
    }

    @GetMapping(value = "/{endpointId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get an endpoint")
    @ApiResponse(responseCode = "200", description = "The endpoint, with its secret masked")
    @ApiResponse(responseCode = "404", description = "No such endpoint for this tenant")
    public Mono<WebhookEndpointDTO> getEndpoint(@PathVariable UUID tenantId, @PathVariable UUID endpointId) {
        return endpointService.getEndpoint(tenantId, endpointId);
    }

    @PatchMapping(value = "/{endpointId}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Update an endpoint", description = "Partially updates url, events, active flag, name and description")
    @ApiResponse(responseCode = "200", description = "The updated endpoint, with its secret masked")
    @ApiResponse(responseCode = "400", description = "Invalid URL or event types")
    @ApiResponse(responseCode = "404", description = "No such endpoint for this tenant")
    public Mono<WebhookEndpointDTO> updateEndpoint(@PathVariable UUID tenantId,
                                                   @PathVariable UUID endpointId,
                                                   @RequestBody WebhookEndpointUpdateDTO request) {
        return endpointService.updateEndpoint(tenantId, endpointId, request);
    }

    @DeleteMapping("/{endpointId}")
    @Operation(summary = "Delete an endpoint", description = "Deletes the endpoint. Its delivery history is kept.")
    @ApiResponse(responseCode = "204", description = "Endpoint deleted")
    @ApiResponse(responseCode = "404", description = "No such endpoint for this tenant")
    public Mono<ResponseEntity<Void>> deleteEndpoint(@PathVariable UUID tenantId, @PathVariable UUID endpointId) {
        return endpointService.deleteEndpoint(tenantId, endpointId)
                .then(Mono.fromSupplier(() -> ResponseEntity.noContent().<Void>build()));
    }
}
