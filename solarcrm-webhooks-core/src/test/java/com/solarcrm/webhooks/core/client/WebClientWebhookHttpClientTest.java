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

package com.solarcrm.webhooks.core.client;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WebClientWebhookHttpClient Tests")
class WebClientWebhookHttpClientTest {

    private MockWebServer server;
    private WebClientWebhookHttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new WebClientWebhookHttpClient(WebClient.builder().build());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Should POST the exact body with the given headers")
    void shouldPostExactBody() throws Exception {
        // Given
        server.enqueue(new MockResponse().setResponseCode(200).setBody("received"));
        byte[] body = "{\"event\":\"lead.created\",\"data\":{\"lead\":{\"name\":\"Zoë\"}}}".getBytes(StandardCharsets.UTF_8);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Webhook-Signature", "abc123");
        headers.set(HttpHeaders.USER_AGENT, "SolarCRM-Webhooks/1.0");

        // When & Then
        StepVerifier.create(client.post(UUID.randomUUID(), server.url("/hooks").toString(), headers, body))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(200);
                    assertThat(response.getBody()).isEqualTo("received");
                    assertThat(response.isSuccessful()).isTrue();
                })
                .verifyComplete();

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/hooks");
        assertThat(request.getBody().readByteArray()).isEqualTo(body);
        assertThat(request.getHeader("Content-Type")).isEqualTo("application/json");
        assertThat(request.getHeader("X-Webhook-Signature")).isEqualTo("abc123");
        assertThat(request.getHeader("User-Agent")).isEqualTo("SolarCRM-Webhooks/1.0");
    }

    @Test
    @DisplayName("Should return error statuses as responses")
    void shouldReturnErrorStatus() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("Internal Server Error"));

        StepVerifier.create(client.post(UUID.randomUUID(), server.url("/").toString(), new HttpHeaders(), new byte[0]))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(500);
                    assertThat(response.getBody()).isEqualTo("Internal Server Error");
                    assertThat(response.isSuccessful()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should return an empty body for responses without content")
    void shouldHandleEmptyBody() {
        server.enqueue(new MockResponse().setResponseCode(204));

        StepVerifier.create(client.post(UUID.randomUUID(), server.url("/").toString(), new HttpHeaders(), new byte[0]))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(204);
                    assertThat(response.getBody()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should not follow redirects")
    void shouldNotFollowRedirects() {
        server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "/elsewhere"));

        StepVerifier.create(client.post(UUID.randomUUID(), server.url("/").toString(), new HttpHeaders(), new byte[0]))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(302))
                .verifyComplete();

        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should report refused connections as transport errors")
    void shouldReportConnectionErrors() throws IOException {
        String url = server.url("/").toString();
        server.shutdown();

        StepVerifier.create(client.post(UUID.randomUUID(), url, new HttpHeaders(), new byte[0]))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(WebhookTransportException.class);
                    assertThat(error.getMessage()).startsWith("Connection error");
                })
                .verify();
    }
}
