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

import com.solarcrm.webhooks.core.config.WebhookDeliveryProperties;
import com.solarcrm.webhooks.core.domain.WebhookDelivery;
import com.solarcrm.webhooks.core.mappers.WebhookDeliveryMapper;
import com.solarcrm.webhooks.core.metrics.WebhookMetricsService;
import com.solarcrm.webhooks.core.services.WebhookDeliveryQueryService;
import com.solarcrm.webhooks.core.services.WebhookDeliveryService;
import com.solarcrm.webhooks.core.store.WebhookDeliveryRepository;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryFilterDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryPageDTO;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryStatisticsDTO;
import com.solarcrm.webhooks.interfaces.enums.DeliveryStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookDeliveryQueryServiceImpl implements WebhookDeliveryQueryService {

    static final int MAX_LIMIT = 200;
    static final int MAX_STATISTICS_DAYS = 365;

    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookDeliveryService deliveryService;
    private final WebhookDeliveryMapper deliveryMapper;
    private final WebhookDeliveryProperties deliveryProperties;
    private final WebhookMetricsService metricsService;
    private final Clock clock;

    @Override
    public Flux<WebhookDeliveryDTO> getDeliveryHistory(UUID tenantId, int limit, int offset) {
        WebhookDeliveryFilterDTO filter = WebhookDeliveryFilterDTO.builder()
                .limit(limit)
                .offset(offset)
                .build();
        return findHistory(tenantId, filter);
    }

    @Override
    public Mono<WebhookDeliveryPageDTO> getDeliveryPage(UUID tenantId, WebhookDeliveryFilterDTO filter) {
        return findHistory(tenantId, filter)
                .collectList()
                .zipWith(getStatistics(tenantId, DEFAULT_STATISTICS_DAYS))
                .map(tuple -> WebhookDeliveryPageDTO.builder()
                        .deliveries(tuple.getT1())
                        .statistics(tuple.getT2())
                        .pagination(WebhookDeliveryPageDTO.Pagination.builder()
                                .limit(filter.getLimit())
                                .offset(filter.getOffset())
                                .total(tuple.getT1().size())
                                .build())
                        .build());
    }

    @Override
    public Mono<WebhookDeliveryDTO> getDelivery(UUID tenantId, UUID deliveryId) {
        return findOwned(tenantId, deliveryId)
                .map(deliveryMapper::toDto);
    }

    @Override
    public Mono<WebhookDeliveryStatisticsDTO> getStatistics(UUID tenantId, int days) {
        if (days < 1 || days > MAX_STATISTICS_DAYS) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "days must be between 1 and " + MAX_STATISTICS_DAYS));
        }

        OffsetDateTime since = OffsetDateTime.now(clock).minusDays(days);
        return Mono.zip(
                        count(tenantId, DeliveryStatus.DELIVERED, since),
                        count(tenantId, DeliveryStatus.FAILED, since),
                        count(tenantId, DeliveryStatus.PENDING, since),
                        count(tenantId, DeliveryStatus.RETRYING, since))
                .map(counts -> {
                    long delivered = counts.getT1();
                    long failed = counts.getT2();
                    long pending = counts.getT3() + counts.getT4();
                    long total = delivered + failed + pending;
                    return WebhookDeliveryStatisticsDTO.builder()
                            .periodDays(days)
                            .totalDeliveries(total)
                            .successfulDeliveries(delivered)
                            .failedDeliveries(failed)
                            .pendingDeliveries(pending)
                            .successRate(successRate(delivered, total))
                            .build();
                });
    }

    @Override
    public Mono<WebhookDeliveryDTO> redeliver(UUID tenantId, UUID deliveryId) {
        return findOwned(tenantId, deliveryId)
                .flatMap(original -> {
                    if (original.getStatus() != DeliveryStatus.FAILED) {
                        return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                                "Only failed deliveries can be redelivered"));
                    }
                    return deliveryRepository.save(copyAsPending(original));
                })
                .map(created -> created.toBuilder().newDelivery(false).build())
                .doOnNext(created -> {
                    metricsService.recordDispatched(created.getEventType());
                    log.info("Redelivering failed delivery {} as {}", deliveryId, created.getId());
                })
                .flatMap(this::startAttempt)
                .map(deliveryMapper::toDto);
    }

    private Flux<WebhookDeliveryDTO> findHistory(UUID tenantId, WebhookDeliveryFilterDTO filter) {
        if (filter.getLimit() < 1 || filter.getLimit() > MAX_LIMIT) {
            return Flux.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "limit must be between 1 and " + MAX_LIMIT));
        }
        if (filter.getOffset() < 0) {
            return Flux.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "offset must not be negative"));
        }
        return deliveryRepository.findHistory(tenantId, filter)
                .map(deliveryMapper::toDto);
    }

    private Mono<WebhookDelivery> findOwned(UUID tenantId, UUID deliveryId) {
        return deliveryRepository.findByIdAndTenantId(deliveryId, tenantId)
                .switchIfEmpty(Mono.error(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Webhook delivery not found: " + deliveryId)));
    }

    private WebhookDelivery copyAsPending(WebhookDelivery original) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return WebhookDelivery.builder()
                .id(UUID.randomUUID())
                .tenantId(original.getTenantId())
                .endpointId(original.getEndpointId())
                .eventType(original.getEventType())
                .payload(original.getPayload())
                .status(DeliveryStatus.PENDING)
                .retryCount(0)
                .createdAt(now)
                .updatedAt(now)
                .newDelivery(true)
                .build();
    }

    private Mono<WebhookDelivery> startAttempt(WebhookDelivery delivery) {
        if (deliveryProperties.isAsyncDispatch()) {
            deliveryService.attemptDelivery(delivery)
                    .subscribe(
                            result -> log.debug("Redelivery {} attempted: {}", result.getId(), result.getStatus()),
                            error -> log.error("Redelivery {} attempt failed: {}", delivery.getId(), error.getMessage(), error));
            return Mono.just(delivery);
        }
        return deliveryService.attemptDelivery(delivery);
    }

    private Mono<Long> count(UUID tenantId, DeliveryStatus status, OffsetDateTime since) {
        return deliveryRepository.countByTenantIdAndStatusAndCreatedAtGreaterThanEqual(tenantId, status, since);
    }

    private double successRate(long delivered, long total) {
        if (total == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(delivered * 100.0 / total)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
