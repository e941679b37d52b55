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

package com.solarcrm.webhooks.core.services.impl;

import com.solarcrm.webhooks.core.config.WebhookRetentionProperties;
import com.solarcrm.webhooks.core.metrics.WebhookMetricsService;
import com.solarcrm.webhooks.core.services.WebhookRetentionService;
import com.solarcrm.webhooks.core.store.WebhookDeliveryRepository;
import com.solarcrm.webhooks.interfaces.enums.DeliveryStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookRetentionServiceImpl implements WebhookRetentionService {

    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookRetentionProperties retentionProperties;
    private final WebhookMetricsService metricsService;
    private final Clock clock;

    @Override
    public Mono<Long> purgeExpiredDeliveries() {
        return Mono.defer(() -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            return purge(DeliveryStatus.DELIVERED, now, retentionProperties.getDeliveredRetention())
                    .zipWith(purge(DeliveryStatus.FAILED, now, retentionProperties.getFailedRetention()), Long::sum);
        }).doOnNext(total -> {
            if (total > 0) {
                log.info("Purged {} expired webhook deliveries", total);
            }
        });
    }

    private Mono<Long> purge(DeliveryStatus status, OffsetDateTime now, Duration retention) {
        OffsetDateTime cutoff = now.minus(retention);
        return deliveryRepository.deleteByStatusCreatedBefore(status.name(), cutoff)
                .map(Integer::longValue)
                .doOnNext(count -> {
                    metricsService.recordPurged(status.getValue(), count);
                    log.debug("Purged {} {} deliveries created before {}", count, status, cutoff);
                });
    }
}
