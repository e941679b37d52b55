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

package com.solarcrm.webhooks.core.client;

import lombok.Getter;

import java.time.Duration;
import java.util.UUID;

/**
 * The endpoint's circuit breaker refused the call, so no request was sent.
 */
@Getter
public class EndpointCircuitOpenException extends WebhookTransportException {

    /**
     * How long the circuit stays open before a trial request is let through.
     */
    private final Duration retryAfter;

    public EndpointCircuitOpenException(UUID endpointId, Duration retryAfter, Throwable cause) {
        super("Circuit breaker open for endpoint " + endpointId, cause);
        this.retryAfter = retryAfter;
    }
}
