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

package com.solarcrm.webhooks.core.resilience;

import com.solarcrm.webhooks.core.client.EndpointCircuitOpenException;
import com.solarcrm.webhooks.core.client.WebhookHttpClient;
import com.solarcrm.webhooks.core.client.WebhookHttpResponse;
import com.solarcrm.webhooks.core.client.WebhookTransportException;
import com.solarcrm.webhooks.core.config.WebhookCircuitBreakerProperties;
import com.solarcrm.webhooks.core.config.WebhookDeliveryProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Decorator that adds resilience patterns (Circuit Breaker, Time Limiter) to outbound
 * webhook requests.
 * <p>
 * - Time Limiter: enforces the attempt timeout
 * - Circuit Breaker: one per endpoint, so an endpoint that keeps failing is skipped quickly
 *   until it recovers, without affecting other endpoints
 * <p>
 * Non-2xx responses count as circuit breaker failures. Resilience errors are turned into
 * {@link WebhookTransportException}s; a call refused by an open circuit surfaces as an
 * {@link EndpointCircuitOpenException}, since no request left the service.
 */
@Service
@Primary
@Slf4j
public class ResilientWebhookHttpClient implements WebhookHttpClient {

    static final String CIRCUIT_BREAKER_PREFIX = "webhook-endpoint-";
    private static final String TIME_LIMITER_NAME = "webhookDelivery";

    private final WebhookHttpClient delegate;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeLimiter timeLimiter;
    private final WebhookCircuitBreakerProperties circuitBreakerProperties;
    private final WebhookDeliveryProperties deliveryProperties;

    public ResilientWebhookHttpClient(
            @Qualifier("webClientWebhookHttpClient") WebhookHttpClient delegate,
            CircuitBreakerRegistry circuitBreakerRegistry,
            TimeLimiterRegistry timeLimiterRegistry,
            WebhookCircuitBreakerProperties circuitBreakerProperties,
            WebhookDeliveryProperties deliveryProperties) {
        this.delegate = delegate;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.timeLimiter = timeLimiterRegistry.timeLimiter(TIME_LIMITER_NAME);
        this.circuitBreakerProperties = circuitBreakerProperties;
        this.deliveryProperties = deliveryProperties;

        log.info("Initialized ResilientWebhookHttpClient (circuit breaker enabled: {}, timeout: {})",
                circuitBreakerProperties.isEnabled(), deliveryProperties.getRequestTimeout());
    }

    @Override
    public Mono<WebhookHttpResponse> post(UUID endpointId, String url, HttpHeaders headers, byte[] body) {
        Mono<WebhookHttpResponse> call = Mono.defer(() -> delegate.post(endpointId, url, headers, body))
                // Apply time limiter first (inner decorator)
                .transformDeferred(TimeLimiterOperator.of(timeLimiter));

        if (circuitBreakerProperties.isEnabled()) {
            // Then apply circuit breaker (outer decorator)
            call = call.transformDeferred(CircuitBreakerOperator.of(circuitBreakerFor(endpointId)));
        }

        return call.onErrorMap(error -> !(error instanceof WebhookTransportException),
                error -> handleResilienceError(endpointId, error));
    }

    /**
     * Gets the states of all endpoint circuit breakers created so far.
     *
     * @return circuit breaker name to state
     */
    public Map<String, CircuitBreaker.State> getCircuitBreakerStates() {
        return circuitBreakerRegistry.getAllCircuitBreakers().stream()
                .filter(cb -> cb.getName().startsWith(CIRCUIT_BREAKER_PREFIX))
                .collect(Collectors.toMap(CircuitBreaker::getName, CircuitBreaker::getState));
    }

    private CircuitBreaker circuitBreakerFor(UUID endpointId) {
        return circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_PREFIX + endpointId);
    }

    private static String format(Duration timeout) {
        return timeout.toMillis() % 1000 == 0 ? timeout.toSeconds() + "s" : timeout.toMillis() + "ms";
    }

    private Throwable handleResilienceError(UUID endpointId, Throwable error) {
        if (error instanceof TimeoutException) {
            log.warn("Webhook request to endpoint {} timed out", endpointId);
            return new WebhookTransportException(
                    "Request timed out after " + format(deliveryProperties.getRequestTimeout()), error);
        }

        if (error instanceof CallNotPermittedException) {
            log.warn("Circuit breaker is OPEN - skipping request to endpoint {}", endpointId);
            return new EndpointCircuitOpenException(endpointId, circuitBreakerProperties.getWaitDurationInOpenState(), error);
        }

        log.error("Error in resilient webhook request to endpoint {}: {}", endpointId, error.getMessage(), error);
        return error;
    }
}
