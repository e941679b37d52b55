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

package com.solarcrm.webhooks.core.health;

import com.solarcrm.webhooks.core.resilience.ResilientWebhookHttpClient;
import com.solarcrm.webhooks.core.store.WebhookDeliveryRepository;
import com.solarcrm.webhooks.interfaces.enums.DeliveryStatus;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Health indicator for outbound webhook delivery.
 * Reports the retry backlog and the endpoints whose circuit breaker is open.
 * Open circuits degrade the status, a failing store takes it down.
 */
@Component
@RequiredArgsConstructor
public class WebhookDeliveryHealthIndicator implements ReactiveHealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final WebhookDeliveryRepository deliveryRepository;
    private final ResilientWebhookHttpClient resilientClient;

    @Override
    public Mono<Health> health() {
        return Mono.zip(deliveryRepository.countByStatus(DeliveryStatus.RETRYING),
                        deliveryRepository.countByStatus(DeliveryStatus.PENDING))
                .map(counts -> {
                    Map<String, CircuitBreaker.State> states = resilientClient.getCircuitBreakerStates();
                    List<String> openCircuits = states.entrySet().stream()
                            .filter(e -> e.getValue() == CircuitBreaker.State.OPEN
                                    || e.getValue() == CircuitBreaker.State.FORCED_OPEN)
                            .map(Map.Entry::getKey)
                            .sorted()
                            .toList();

                    Health.Builder builder = openCircuits.isEmpty() ? Health.up() : Health.status(DEGRADED);
                    return builder
                            .withDetail("retryingDeliveries", counts.getT1())
                            .withDetail("pendingDeliveries", counts.getT2())
                            .withDetail("endpointCircuits", states.size())
                            .withDetail("openCircuits", openCircuits)
                            .build();
                })
                .onErrorResume(e -> Mono.just(Health.down().withException(e).build()));
    }
}
