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

import com.solarcrm.webhooks.core.client.WebhookHttpResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Resilience4j patterns guarding outbound deliveries:
 * a circuit breaker per endpoint and a time limiter enforcing the attempt timeout.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class ResilienceConfig {

    private final WebhookCircuitBreakerProperties circuitBreakerProperties;
    private final WebhookDeliveryProperties deliveryProperties;

    /**
     * Circuit Breaker Registry. Breakers are created lazily, one per endpoint.
     * Non-2xx responses are recorded as failures.
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(circuitBreakerProperties.getFailureRateThreshold())
                .waitDurationInOpenState(circuitBreakerProperties.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(circuitBreakerProperties.getPermittedNumberOfCallsInHalfOpenState())
                .minimumNumberOfCalls(circuitBreakerProperties.getMinimumNumberOfCalls())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(circuitBreakerProperties.getSlidingWindowSize())
                .recordExceptions(Exception.class)
                .recordResult(result -> result instanceof WebhookHttpResponse response && !response.isSuccessful())
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);

        registry.getEventPublisher()
                .onEntryAdded(event -> {
                    CircuitBreaker cb = event.getAddedEntry();
                    cb.getEventPublisher()
                            .onStateTransition(e -> log.warn("Circuit Breaker '{}' state changed: {} -> {}",
                                    cb.getName(), e.getStateTransition().getFromState(),
                                    e.getStateTransition().getToState()))
                            .onCallNotPermitted(e -> log.debug("Circuit Breaker '{}' rejected a delivery attempt",
                                    cb.getName()));
                });

        return registry;
    }

    /**
     * Time Limiter Registry bounding every delivery attempt by the configured request timeout.
     */
    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(deliveryProperties.getRequestTimeout())
                .cancelRunningFuture(true)
                .build();

        TimeLimiterRegistry registry = TimeLimiterRegistry.of(config);

        registry.getEventPublisher()
                .onEntryAdded(event -> {
                    TimeLimiter tl = event.getAddedEntry();
                    tl.getEventPublisher()
                            .onTimeout(e -> log.warn("Time Limiter '{}' timed out", tl.getName()));
                });

        return registry;
    }
}
