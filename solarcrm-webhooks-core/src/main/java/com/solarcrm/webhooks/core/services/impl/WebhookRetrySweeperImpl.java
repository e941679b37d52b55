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

import com.solarcrm.webhooks.core.config.WebhookSweeperProperties;
import com.solarcrm.webhooks.core.domain.WebhookDelivery;
import com.solarcrm.webhooks.core.metrics.WebhookMetricsService;
import com.solarcrm.webhooks.core.services.WebhookDeliveryService;
import com.solarcrm.webhooks.core.services.WebhookRetrySweeper;
import com.solarcrm.webhooks.core.store.WebhookDeliveryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Sweeper over the delivery store.
 * <p>
 * A due retry is claimed by moving its {@code nextRetryAt} one lease into the future; if the
 * worker dies mid-attempt the record becomes due again once the lease expires.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookRetrySweeperImpl implements WebhookRetrySweeper {

    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookDeliveryService deliveryService;
    private final WebhookSweeperProperties sweeperProperties;
    private final WebhookMetricsService metricsService;
    private final Clock clock;

    @Override
    public Mono<Integer> processRetries() {
        return Mono.defer(() -> {
                    OffsetDateTime now = OffsetDateTime.now(clock);
                    return Flux.concat(dueRetries(now), stalePending(now))
                            .count()
                            .map(Long::intValue);
                })
                .doOnNext(processed -> {
                    metricsService.recordSweeperProcessed(processed);
                    if (processed > 0) {
                        log.info("Retry sweep attempted {} deliveries", processed);
                    } else {
                        log.debug("Retry sweep found nothing due");
                    }
                });
    }

    // Each record is claimed right before its own attempt so the lease covers that attempt only.
    private Flux<WebhookDelivery> dueRetries(OffsetDateTime now) {
        return deliveryRepository.findDueRetries(now, sweeperProperties.getBatchSize())
                .concatMap(delivery -> {
                    OffsetDateTime claimedAt = OffsetDateTime.now(clock);
                    OffsetDateTime leaseUntil = claimedAt.plus(sweeperProperties.getClaimLease());
                    return deliveryRepository.claimRetry(delivery.getId(), delivery.getRetryCount(), claimedAt, leaseUntil)
                            .flatMap(rows -> claimed(delivery, rows))
                            .flatMap(deliveryService::attemptDelivery);
                });
    }

    private Flux<WebhookDelivery> stalePending(OffsetDateTime now) {
        OffsetDateTime staleBefore = now.minus(sweeperProperties.getStalePendingAfter());
        return deliveryRepository.findStalePending(staleBefore, sweeperProperties.getBatchSize())
                .concatMap(delivery -> deliveryRepository.claimStalePending(delivery.getId(), staleBefore,
                                OffsetDateTime.now(clock))
                        .flatMap(rows -> claimed(delivery, rows))
                        .doOnNext(recovered -> log.warn("Recovering delivery {} left PENDING since {}",
                                recovered.getId(), recovered.getUpdatedAt()))
                        .flatMap(deliveryService::attemptDelivery));
    }

    private Mono<WebhookDelivery> claimed(WebhookDelivery delivery, int rows) {
        if (rows == 0) {
            log.debug("Delivery {} was claimed by another worker", delivery.getId());
            return Mono.empty();
        }
        return Mono.just(delivery);
    }
}
