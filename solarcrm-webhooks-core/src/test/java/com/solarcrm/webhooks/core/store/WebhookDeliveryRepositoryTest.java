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

package com.solarcrm.webhooks.core.store;

import com.solarcrm.webhooks.core.config.WebhookStoreConfig;
import com.solarcrm.webhooks.core.domain.WebhookDelivery;
import com.solarcrm.webhooks.core.domain.WebhookEndpoint;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryFilterDTO;
import com.solarcrm.webhooks.interfaces.enums.DeliveryStatus;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import reactor.test.StepVerifier;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        classes = WebhookDeliveryRepositoryTest.StoreTestConfiguration.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = "spring.r2dbc.url=r2dbc:h2:mem:///webhook-store-test;DB_CLOSE_DELAY=-1"
)
@DisplayName("Webhook Store Tests")
class WebhookDeliveryRepositoryTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 2, 8, 0, 0, 0, ZoneOffset.UTC);
    private static final UUID TENANT = UUID.fromString("11111111-2222-3333-4444-555555555555");
    private static final UUID OTHER_TENANT = UUID.fromString("99999999-2222-3333-4444-555555555555");

    @SpringBootConfiguration
    @EnableAutoConfiguration
    @Import(WebhookStoreConfig.class)
    static class StoreTestConfiguration {
    }

    @Autowired
    private WebhookDeliveryRepository deliveryRepository;

    @Autowired
    private WebhookEndpointRepository endpointRepository;

    @BeforeEach
    void setUp() {
        deliveryRepository.deleteAll().block();
        endpointRepository.deleteAll().block();
    }

    @Test
    @DisplayName("Should store and reload an endpoint with its subscriptions")
    void shouldStoreEndpoint() {
        // Given
        WebhookEndpoint endpoint = endpoint(TENANT, true, WebhookEventType.INVOICE_PAID, WebhookEventType.LEAD_CREATED);

        // When
        endpointRepository.save(endpoint).block();

        // Then
        StepVerifier.create(endpointRepository.findByIdAndTenantId(endpoint.getId(), TENANT))
                .assertNext(found -> {
                    assertThat(found.getUrl()).isEqualTo("https://example.com/hook");
                    assertThat(found.subscribedEvents())
                            .containsExactly(WebhookEventType.INVOICE_PAID, WebhookEventType.LEAD_CREATED);
                    assertThat(found.isNew()).isFalse();
                })
                .verifyComplete();
        StepVerifier.create(endpointRepository.findByIdAndTenantId(endpoint.getId(), OTHER_TENANT))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should list only active endpoints of the tenant")
    void shouldListActiveEndpoints() {
        endpointRepository.save(endpoint(TENANT, true, WebhookEventType.INVOICE_PAID)).block();
        endpointRepository.save(endpoint(TENANT, false, WebhookEventType.INVOICE_PAID)).block();
        endpointRepository.save(endpoint(OTHER_TENANT, true, WebhookEventType.INVOICE_PAID)).block();

        StepVerifier.create(endpointRepository.findByTenantIdAndActiveTrue(TENANT).collectList())
                .assertNext(endpoints -> assertThat(endpoints).hasSize(1)
                        .allSatisfy(e -> assertThat(e.isActive()).isTrue()))
                .verifyComplete();
        StepVerifier.create(endpointRepository.countByActiveTrue())
                .expectNext(2L)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should apply an outcome only when the record is still in the expected state")
    void shouldCompareAndSetOutcome() {
        // Given
        WebhookDelivery delivery = deliveryRepository.save(delivery(TENANT, DeliveryStatus.PENDING, 0, null, NOW)).block();
        UUID id = delivery.getId();
        OffsetDateTime retryAt = NOW.plusSeconds(30);

        // When
        Integer first = deliveryRepository.compareAndSetOutcome(id, "PENDING", 0, "RETRYING", 500,
                "oops", "HTTP 500: oops", 1, retryAt, null, NOW).block();
        Integer second = deliveryRepository.compareAndSetOutcome(id, "PENDING", 0, "DELIVERED", 200,
                "ok", null, 0, null, NOW, NOW).block();

        // Then
        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        StepVerifier.create(deliveryRepository.findById(id))
                .assertNext(stored -> {
                    assertThat(stored.getStatus()).isEqualTo(DeliveryStatus.RETRYING);
                    assertThat(stored.getRetryCount()).isEqualTo(1);
                    assertThat(stored.getResponseStatus()).isEqualTo(500);
                    assertThat(stored.getErrorMessage()).isEqualTo("HTTP 500: oops");
                    assertThat(stored.getNextRetryAt()).isEqualTo(retryAt);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should find due retries and let only one worker claim each")
    void shouldClaimDueRetriesOnce() {
        // Given
        WebhookDelivery due = deliveryRepository.save(
                delivery(TENANT, DeliveryStatus.RETRYING, 2, NOW.minusMinutes(1), NOW.minusMinutes(10))).block();
        deliveryRepository.save(delivery(TENANT, DeliveryStatus.RETRYING, 1, NOW.plusMinutes(5), NOW)).block();
        deliveryRepository.save(delivery(TENANT, DeliveryStatus.FAILED, 5, null, NOW.minusHours(1))).block();

        // When & Then
        StepVerifier.create(deliveryRepository.findDueRetries(NOW, 100).map(WebhookDelivery::getId).collectList())
                .expectNext(List.of(due.getId()))
                .verifyComplete();

        OffsetDateTime lease = NOW.plusMinutes(5);
        assertThat(deliveryRepository.claimRetry(due.getId(), 2, NOW, lease).block()).isEqualTo(1);
        assertThat(deliveryRepository.claimRetry(due.getId(), 2, NOW, lease).block()).isZero();

        StepVerifier.create(deliveryRepository.findDueRetries(NOW, 100))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should find and claim stale pending deliveries")
    void shouldClaimStalePending() {
        WebhookDelivery stale = deliveryRepository.save(
                delivery(TENANT, DeliveryStatus.PENDING, 0, null, NOW.minusMinutes(30))).block();
        deliveryRepository.save(delivery(TENANT, DeliveryStatus.PENDING, 0, null, NOW)).block();
        OffsetDateTime staleBefore = NOW.minusMinutes(10);

        StepVerifier.create(deliveryRepository.findStalePending(staleBefore, 100).map(WebhookDelivery::getId))
                .expectNext(stale.getId())
                .verifyComplete();

        assertThat(deliveryRepository.claimStalePending(stale.getId(), staleBefore, NOW).block()).isEqualTo(1);
        assertThat(deliveryRepository.claimStalePending(stale.getId(), staleBefore, NOW).block()).isZero();
    }

    @Test
    @DisplayName("Should return filtered history newest first with limit and offset")
    void shouldFilterHistory() {
        // Given
        UUID endpointId = UUID.randomUUID();
        for (int i = 0; i < 5; i++) {
            deliveryRepository.save(delivery(TENANT, DeliveryStatus.DELIVERED, 0, null, NOW.minusMinutes(i))
                    .toBuilder().endpointId(endpointId).build()).block();
        }
        deliveryRepository.save(delivery(TENANT, DeliveryStatus.FAILED, 5, null, NOW)).block();
        deliveryRepository.save(delivery(OTHER_TENANT, DeliveryStatus.DELIVERED, 0, null, NOW)).block();

        WebhookDeliveryFilterDTO filter = WebhookDeliveryFilterDTO.builder()
                .endpointId(endpointId)
                .status(DeliveryStatus.DELIVERED)
                .eventType(WebhookEventType.INVOICE_PAID)
                .limit(2)
                .offset(1)
                .build();

        // When & Then
        StepVerifier.create(deliveryRepository.findHistory(TENANT, filter).collectList())
                .assertNext(page -> {
                    assertThat(page).hasSize(2);
                    assertThat(page).extracting(WebhookDelivery::getCreatedAt)
                            .containsExactly(NOW.minusMinutes(1), NOW.minusMinutes(2));
                    assertThat(page).allSatisfy(d -> assertThat(d.getTenantId()).isEqualTo(TENANT));
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should count deliveries per status in a window and purge old terminal ones")
    void shouldCountAndPurge() {
        // Given
        deliveryRepository.save(delivery(TENANT, DeliveryStatus.DELIVERED, 0, null, NOW.minusDays(40))).block();
        deliveryRepository.save(delivery(TENANT, DeliveryStatus.DELIVERED, 0, null, NOW.minusDays(1))).block();
        deliveryRepository.save(delivery(TENANT, DeliveryStatus.FAILED, 5, null, NOW.minusDays(10))).block();
        deliveryRepository.save(delivery(TENANT, DeliveryStatus.RETRYING, 1, NOW, NOW.minusDays(10))).block();

        // When & Then
        StepVerifier.create(deliveryRepository.countByTenantIdAndStatusAndCreatedAtGreaterThanEqual(
                        TENANT, DeliveryStatus.DELIVERED, NOW.minusDays(7)))
                .expectNext(1L)
                .verifyComplete();
        StepVerifier.create(deliveryRepository.countByStatus(DeliveryStatus.RETRYING))
                .expectNext(1L)
                .verifyComplete();

        assertThat(deliveryRepository.deleteByStatusCreatedBefore("DELIVERED", NOW.minusDays(30)).block()).isEqualTo(1);
        assertThat(deliveryRepository.deleteByStatusCreatedBefore("FAILED", NOW.minusDays(7)).block()).isEqualTo(1);
        StepVerifier.create(deliveryRepository.count())
                .expectNext(2L)
                .verifyComplete();
    }

    private static WebhookEndpoint endpoint(UUID tenantId, boolean active, WebhookEventType... events) {
        return WebhookEndpoint.builder()
                .id(UUID.randomUUID())
                .tenantId(tenantId)
                .name("ERP")
                .url("https://example.com/hook")
                .secret("whsec_test")
                .events(WebhookEndpoint.joinEvents(List.of(events)))
                .active(active)
                .createdAt(NOW)
                .updatedAt(NOW)
                .newEndpoint(true)
                .build();
    }

    private static WebhookDelivery delivery(UUID tenantId, DeliveryStatus status, int retryCount,
                                            OffsetDateTime nextRetryAt, OffsetDateTime createdAt) {
        return WebhookDelivery.builder()
                .id(UUID.randomUUID())
                .tenantId(tenantId)
                .endpointId(UUID.randomUUID())
                .eventType(WebhookEventType.INVOICE_PAID.getValue())
                .payload("{\"event\":\"invoice.paid\"}")
                .status(status)
                .retryCount(retryCount)
                .nextRetryAt(nextRetryAt)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .newDelivery(true)
                .build();
    }
}
