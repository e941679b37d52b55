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

package com.solarcrm.webhooks.web.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solarcrm.webhooks.core.domain.WebhookDelivery;
import com.solarcrm.webhooks.core.services.WebhookDispatchService;
import com.solarcrm.webhooks.core.services.WebhookEvents;
import com.solarcrm.webhooks.core.services.WebhookRetrySweeper;
import com.solarcrm.webhooks.core.signing.WebhookSigner;
import com.solarcrm.webhooks.core.store.WebhookDeliveryRepository;
import com.solarcrm.webhooks.core.store.WebhookEndpointRepository;
import com.solarcrm.webhooks.interfaces.dto.WebhookEndpointDTO;
import com.solarcrm.webhooks.interfaces.enums.DeliveryStatus;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import com.solarcrm.webhooks.web.WebhookManagementApplication;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        classes = {WebhookManagementApplication.class, WebhookDeliveryIntegrationTest.ClockConfiguration.class},
        properties = {
                "spring.r2dbc.url=r2dbc:h2:mem:///webhooks-e2e;DB_CLOSE_DELAY=-1",
                "spring.r2dbc.username=sa",
                "spring.r2dbc.password=",
                "solarcrm.webhooks.delivery.async-dispatch=false",
                "solarcrm.webhooks.sweeper.enabled=false",
                "solarcrm.webhooks.retention.enabled=false"
        }
)
@AutoConfigureWebTestClient
@DisplayName("Webhook Delivery Integration Tests")
class WebhookDeliveryIntegrationTest {

    private static final Instant T0 = Instant.parse("2026-03-02T08:00:00Z");
    private static final UUID TENANT = UUID.fromString("11111111-2222-3333-4444-555555555555");

    @TestConfiguration
    static class ClockConfiguration {

        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(T0);
        }
    }

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private WebhookDispatchService dispatchService;

    @Autowired
    private WebhookEvents webhookEvents;

    @Autowired
    private WebhookRetrySweeper retrySweeper;

    @Autowired
    private WebhookSigner signer;

    @Autowired
    private WebhookDeliveryRepository deliveryRepository;

    @Autowired
    private WebhookEndpointRepository endpointRepository;

    @Autowired
    private MutableClock clock;

    @Autowired
    private ObjectMapper objectMapper;

    private MockWebServer receiver;

    @BeforeEach
    void setUp() throws IOException {
        deliveryRepository.deleteAll().block();
        endpointRepository.deleteAll().block();
        clock.set(T0);
        receiver = new MockWebServer();
        receiver.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        receiver.shutdown();
    }

    @Test
    @DisplayName("Should deliver a subscribed event with a verifiable signature")
    void shouldDeliverSubscribedEvent() throws Exception {
        // Given
        WebhookEndpointDTO endpoint = registerEndpoint(List.of("lead.created"));
        receiver.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        // When
        List<WebhookDelivery> deliveries = webhookEvents.leadCreated(TENANT, Map.of("id", "lead-1", "name", "Zonnepanelen BV")).block();

        // Then
        assertThat(deliveries).hasSize(1);
        assertThat(deliveries.get(0).getStatus()).isEqualTo(DeliveryStatus.DELIVERED);

        RecordedRequest request = receiver.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        byte[] body = request.getBody().readByteArray();
        assertThat(signer.verify(body, request.getHeader(WebhookSigner.SIGNATURE_HEADER), endpoint.getSecret())).isTrue();
        assertThat(request.getHeader(WebhookSigner.TIMESTAMP_HEADER)).isEqualTo(T0.toString());
        assertThat(request.getHeader("User-Agent")).isEqualTo("SolarCRM-Webhooks/1.0");

        JsonNode envelope = objectMapper.readTree(body);
        assertThat(envelope.get("event").asText()).isEqualTo("lead.created");
        assertThat(envelope.get("tenant_id").asText()).isEqualTo(TENANT.toString());
        assertThat(envelope.get("data").get("lead").get("id").asText()).isEqualTo("lead-1");

        webTestClient.get()
                .uri("/api/v1/tenants/{tenantId}/webhooks/deliveries", TENANT)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.deliveries.length()").isEqualTo(1)
                .jsonPath("$.deliveries[0].status").isEqualTo("delivered")
                .jsonPath("$.deliveries[0].responseStatus").isEqualTo(200)
                .jsonPath("$.deliveries[0].endpointId").isEqualTo(endpoint.getId().toString())
                .jsonPath("$.statistics.successfulDeliveries").isEqualTo(1)
                .jsonPath("$.statistics.successRate").isEqualTo(100.0);
    }

    @Test
    @DisplayName("Should schedule a retry 30 seconds out when the endpoint answers 500")
    void shouldScheduleRetryOnServerError() {
        // Given
        registerEndpoint(List.of("lead.created"));
        receiver.enqueue(new MockResponse().setResponseCode(500).setBody("Internal Server Error"));

        // When
        List<WebhookDelivery> deliveries = dispatchService.sendWebhook(TENANT, WebhookEventType.LEAD_CREATED,
                Map.of("lead", Map.of("id", "lead-2"))).block();

        // Then
        assertThat(deliveries).hasSize(1);
        WebhookDelivery stored = deliveryRepository.findById(deliveries.get(0).getId()).block();
        assertThat(stored.getStatus()).isEqualTo(DeliveryStatus.RETRYING);
        assertThat(stored.getRetryCount()).isEqualTo(1);
        assertThat(stored.getResponseStatus()).isEqualTo(500);
        assertThat(stored.getErrorMessage()).isEqualTo("HTTP 500: Internal Server Error");
        assertThat(stored.getNextRetryAt().toInstant()).isEqualTo(T0.plusSeconds(30));
    }

    @Test
    @DisplayName("Should fail permanently after five retries and allow a manual redelivery")
    void shouldFailAfterRetriesAndRedeliver() {
        // Given
        registerEndpoint(List.of("invoice.paid"));
        for (int i = 0; i < 6; i++) {
            receiver.enqueue(new MockResponse().setResponseCode(500));
        }
        UUID deliveryId = webhookEvents.invoicePaid(TENANT, Map.of("id", "inv-1", "amount", 1250), Map.of("method", "ideal")).block().get(0).getId();

        // When
        for (int retry = 1; retry <= 5; retry++) {
            clock.advance(Duration.ofHours(2));
            assertThat(retrySweeper.processRetries().block()).isEqualTo(1);
        }

        // Then
        WebhookDelivery failed = deliveryRepository.findById(deliveryId).block();
        assertThat(failed.getStatus()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(failed.getRetryCount()).isEqualTo(5);
        assertThat(failed.getNextRetryAt()).isNull();
        assertThat(receiver.getRequestCount()).isEqualTo(6);

        clock.advance(Duration.ofHours(2));
        assertThat(retrySweeper.processRetries().block()).isZero();

        // When
        receiver.enqueue(new MockResponse().setResponseCode(204));
        webTestClient.post()
                .uri("/api/v1/tenants/{tenantId}/webhooks/deliveries/{deliveryId}/redeliver", TENANT, deliveryId)
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.status").isEqualTo("delivered")
                .jsonPath("$.retryCount").isEqualTo(0);

        // Then
        assertThat(deliveryRepository.findById(deliveryId).block().getStatus()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(deliveryRepository.count().block()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should create no delivery for an event the endpoint did not subscribe to")
    void shouldSkipUnsubscribedEvent() {
        // Given
        registerEndpoint(List.of("lead.created"));

        // When
        List<WebhookDelivery> deliveries = dispatchService.sendWebhook(TENANT, WebhookEventType.INVOICE_PAID,
                Map.of("invoice", Map.of("id", "inv-2"))).block();

        // Then
        assertThat(deliveries).isEmpty();
        assertThat(deliveryRepository.count().block()).isZero();
        assertThat(receiver.getRequestCount()).isZero();
    }

    @Test
    @DisplayName("Should stop delivering to a deactivated endpoint")
    void shouldSkipInactiveEndpoint() {
        // Given
        WebhookEndpointDTO endpoint = registerEndpoint(List.of("lead.created"));
        webTestClient.patch()
                .uri("/api/v1/tenants/{tenantId}/webhooks/endpoints/{endpointId}", TENANT, endpoint.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"active\":false}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.secret").isEqualTo("***");

        // When
        List<WebhookDelivery> deliveries = webhookEvents.leadCreated(TENANT, Map.of("id", "lead-3")).block();

        // Then
        assertThat(deliveries).isEmpty();
        assertThat(receiver.getRequestCount()).isZero();
    }

    @Test
    @DisplayName("Should report delivery health")
    void shouldReportHealth() {
        webTestClient.get()
                .uri("/actuator/health/webhookDelivery")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP")
                .jsonPath("$.details.retryingDeliveries").isEqualTo(0);
    }

    private WebhookEndpointDTO registerEndpoint(List<String> events) {
        WebhookEndpointDTO endpoint = webTestClient.post()
                .uri("/api/v1/tenants/{tenantId}/webhooks/endpoints", TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("url", receiver.url("/hooks/solarcrm").toString(), "events", events, "name", "ERP"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(WebhookEndpointDTO.class)
                .returnResult()
                .getResponseBody();
        assertThat(endpoint).isNotNull();
        assertThat(endpoint.getSecret()).isNotEqualTo("***");
        return endpoint;
    }
}
