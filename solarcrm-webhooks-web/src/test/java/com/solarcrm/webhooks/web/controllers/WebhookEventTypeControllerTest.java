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

package com.solarcrm.webhooks.web.controllers;

import com.solarcrm.webhooks.interfaces.dto.WebhookEventTypeDTO;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;

@WebFluxTest(controllers = WebhookEventTypeController.class)
@DisplayName("WebhookEventTypeController Tests")
class WebhookEventTypeControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    @DisplayName("Should list all 17 event types with their category")
    void shouldListEventTypes() {
        webTestClient.get()
                .uri("/api/v1/webhooks/event-types")
                .exchange()
                .expectStatus().isOk()
                .expectBodyList(WebhookEventTypeDTO.class)
                .value(types -> {
                    assertThat(types).hasSize(17);
                    assertThat(types.get(0).getValue()).isEqualTo("lead.created");
                    assertThat(types.get(0).getCategory()).isEqualTo("lead");
                    assertThat(types).extracting(WebhookEventTypeDTO::getValue)
                            .contains("whatsapp.message_received", "tenant.updated");
                });
    }
}
