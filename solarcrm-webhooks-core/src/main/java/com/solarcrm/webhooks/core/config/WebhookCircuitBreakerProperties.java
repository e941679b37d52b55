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

package com.solarcrm.webhooks.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for the per-endpoint circuit breakers.
 * <p>
 * Every endpoint gets its own breaker named {@code webhook-endpoint-<id>}, so one
 * unreachable receiver never opens the circuit for the others. A call rejected by an
 * open breaker counts as a transient delivery failure.
 */
@Configuration
@ConfigurationProperties(prefix = "solarcrm.webhooks.circuit-breaker")
@Data
public class WebhookCircuitBreakerProperties {

    /**
     * Wrap outbound calls in a circuit breaker
     */
    private boolean enabled = true;

    /**
     * Failure rate in percent above which the circuit opens
     */
    private float failureRateThreshold = 50;

    /**
     * Calls needed before the failure rate is evaluated
     */
    private int minimumNumberOfCalls = 10;

    /**
     * Number of calls in the count-based sliding window
     */
    private int slidingWindowSize = 20;

    /**
     * Time the circuit stays open before probing the endpoint again
     */
    private Duration waitDurationInOpenState = Duration.ofSeconds(60);

    /**
     * Probe calls allowed while half-open
     */
    private int permittedNumberOfCallsInHalfOpenState = 2;
}
