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

package com.solarcrm.webhooks.core.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.solarcrm.webhooks.core.config.WebhookDeliveryProperties;
import com.solarcrm.webhooks.core.config.WebhookSecurityProperties;
import com.solarcrm.webhooks.core.domain.WebhookDelivery;
import com.solarcrm.webhooks.core.domain.WebhookEndpoint;
import com.solarcrm.webhooks.core.metrics.WebhookMetricsService;
import com.solarcrm.webhooks.core.services.impl.WebhookDispatchServiceImpl;
import com.solarcrm.webhooks.core.store.WebhookDeliveryRepository;
import com.solarcrm.webhooks.core.validation.WebhookEndpointValidator;
import com.solarcrm.webhooks.interfaces.enums.DeliveryStatus;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WebhookDispatchService Tests")
class WebhookDispatchServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T08:15:00Z");

    @Mock
    private WebhookEndpointService endpointService;

    @Mock
    private WebhookDeliveryRepository deliveryRepository;

    @Mock
    private WebhookDeliveryService deliveryService;

    @Mock
    private WebhookMetricsService metricsService;

    private WebhookDeliveryProperties deliveryProperties;
    private WebhookDispatchServiceImpl dispatchService;
    private UUID tenantId;

    @BeforeEach
    void setUp() {
        deliveryProperties = new WebhookDeliveryProperties();
        deliveryProperties.setAsyncDispatch(false);
        dispatchService = new WebhookDispatchServiceImpl(endpointService, deliveryRepository, deliveryService,
                new WebhookEndpointValidator(new WebhookSecurityProperties()), deliveryProperties, metricsService,
                new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
        tenantId = UUID.fromString("11111111-2222-3333-4444-555555555555");
    }

    @Test
    @DisplayName("Should do nothing when no endpoint is subscribed")
    void shouldNoOpWithoutSubscribers() {
        // Given
        when(endpointService.listActiveFor(tenantId, WebhookEventType.LEAD_CREATED)).thenReturn(Flux.empty());

        // When & Then
        StepVerifier.create(dispatchService.sendWebhook(tenantId, WebhookEventType.LEAD_CREATED, Map.of("lead", "x")))
                .assertNext(deliveries -> assertThat(deliveries).isEmpty())
                .verifyComplete();

        verifyNoInteractions(deliveryRepository, deliveryService);
    }

    @Test
    @DisplayName("Should create one PENDING delivery per subscribed endpoint with the same envelope")
    void shouldFanOutToSubscribers() {
        // Given
        WebhookEndpoint first = endpoint();
        WebhookEndpoint second = endpoint();
        when(endpointService.listActiveFor(tenantId, WebhookEventType.INVOICE_PAID)).thenReturn(Flux.just(first, second));
        when(deliveryRepository.save(any(WebhookDelivery.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(deliveryService.attemptDelivery(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("invoice", Map.of("id", "inv-1"));

        // When & Then
        StepVerifier.create(dispatchService.sendWebhook(tenantId, WebhookEventType.INVOICE_PAID, data))
                .assertNext(deliveries -> {
                    assertThat(deliveries).hasSize(2);
                    assertThat(deliveries).extracting(WebhookDelivery::getEndpointId)
                            .containsExactly(first.getId(), second.getId());
                    assertThat(deliveries).allSatisfy(delivery -> {
                        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.PENDING);
                        assertThat(delivery.getRetryCount()).isZero();
                        assertThat(delivery.getTenantId()).isEqualTo(tenantId);
                        assertThat(delivery.getEventType()).isEqualTo("invoice.paid");
                        assertThat(delivery.getPayload()).isEqualTo(
                                "{\"event\":\"invoice.paid\",\"tenant_id\":\"11111111-2222-3333-4444-555555555555\","
                                        + "\"timestamp\":\"2026-03-02T08:15:00Z\",\"data\":{\"invoice\":{\"id\":\"inv-1\"}}}");
                        assertThat(delivery.isNew()).isFalse();
                    });
                })
                .verifyComplete();

        verify(deliveryService, times(2)).attemptDelivery(any());
        verify(metricsService, times(2)).recordDispatched("invoice.paid");
    }

    @Test
    @DisplayName("Should include metadata in the envelope when given")
    void shouldIncludeMetadata() {
        // Given
        when(endpointService.listActiveFor(tenantId, WebhookEventType.LEAD_CREATED)).thenReturn(Flux.just(endpoint()));
        when(deliveryRepository.save(any(WebhookDelivery.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(deliveryService.attemptDelivery(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        // When & Then
        StepVerifier.create(dispatchService.sendWebhook(tenantId, WebhookEventType.LEAD_CREATED,
                        Map.of("lead", Map.of("id", 7)), Map.of("source", "import")))
                .assertNext(deliveries -> assertThat(deliveries.get(0).getPayload())
                        .endsWith("\"data\":{\"lead\":{\"id\":7}},\"metadata\":{\"source\":\"import\"}}"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should return the PENDING records without waiting when dispatch is asynchronous")
    void shouldReturnPendingRecordsWhenAsync() {
        // Given
        deliveryProperties.setAsyncDispatch(true);
        when(endpointService.listActiveFor(tenantId, WebhookEventType.PAYMENT_FAILED)).thenReturn(Flux.just(endpoint()));
        when(deliveryRepository.save(any(WebhookDelivery.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(deliveryService.attemptDelivery(any())).thenAnswer(inv -> {
            WebhookDelivery delivery = inv.getArgument(0);
            return Mono.just(delivery.toBuilder().status(DeliveryStatus.DELIVERED).build());
        });

        // When & Then
        StepVerifier.create(dispatchService.sendWebhook(tenantId, WebhookEventType.PAYMENT_FAILED, Map.of("error", "card declined")))
                .assertNext(deliveries -> {
                    assertThat(deliveries).hasSize(1);
                    assertThat(deliveries.get(0).getStatus()).isEqualTo(DeliveryStatus.PENDING);
                })
                .verifyComplete();

        verify(deliveryService).attemptDelivery(any());
    }

    @Test
    @DisplayName("Should keep dispatching to other endpoints when one insert fails")
    void shouldIsolateEndpointFailures() {
        // Given
        WebhookEndpoint broken = endpoint();
        WebhookEndpoint healthy = endpoint();
        when(endpointService.listActiveFor(tenantId, WebhookEventType.USER_CREATED)).thenReturn(Flux.just(broken, healthy));
        when(deliveryRepository.save(any(WebhookDelivery.class))).thenAnswer(inv -> {
            WebhookDelivery delivery = inv.getArgument(0);
            if (delivery.getEndpointId().equals(broken.getId())) {
                return Mono.error(new IllegalStateException("constraint violation"));
            }
            return Mono.just(delivery);
        });
        when(deliveryService.attemptDelivery(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        // When & Then
        StepVerifier.create(dispatchService.sendWebhook(tenantId, WebhookEventType.USER_CREATED, Map.of("user", "u")))
                .assertNext(deliveries -> assertThat(deliveries)
                        .extracting(WebhookDelivery::getEndpointId)
                        .containsExactly(healthy.getId()))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should reject oversized metadata without creating deliveries")
    void shouldRejectOversizedMetadata() {
        // Given
        Map<String, Object> metadata = new HashMap<>();
        for (int i = 0; i < 51; i++) {
            metadata.put("k" + i, i);
        }

        // When & Then
        StepVerifier.create(dispatchService.sendWebhook(tenantId, WebhookEventType.LEAD_CREATED, Map.of(), metadata))
                .assertNext(deliveries -> assertThat(deliveries).isEmpty())
                .verifyComplete();

        verifyNoInteractions(endpointService, deliveryRepository, deliveryService);
    }

    @Test
    @DisplayName("Should swallow lookup errors and return no deliveries")
    void shouldNotPropagateLookupErrors() {
        // Given
        when(endpointService.listActiveFor(tenantId, WebhookEventType.TENANT_UPDATED))
                .thenReturn(Flux.error(new IllegalStateException("db down")));

        // When & Then
        StepVerifier.create(dispatchService.sendWebhook(tenantId, WebhookEventType.TENANT_UPDATED, Map.of()))
                .assertNext(deliveries -> assertThat(deliveries).isEmpty())
                .verifyComplete();

        verify(deliveryRepository, never()).save(any());
    }

    private WebhookEndpoint endpoint() {
        return WebhookEndpoint.builder()
                .id(UUID.randomUUID())
                .tenantId(tenantId)
                .url("https://example.com/hook")
                .secret("secret")
                .events("lead.created,invoice.paid,payment.failed,user.created")
                .active(true)
                .build();
    }
}
