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

package com.solarcrm.webhooks.core.config;

import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

/**
 * Outbound HTTP client and clock used by the delivery engine.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class WebhookClientConfig {

    private final WebhookDeliveryProperties deliveryProperties;

    /**
     * WebClient for endpoint calls. Redirects are not followed. The attempt timeout is
     * enforced by the time limiter around each request.
     */
    @Bean("webhookWebClient")
    public WebClient webhookWebClient(WebClient.Builder builder) {
        log.info("Configuring webhook WebClient - Connect: {}ms", deliveryProperties.getConnectTimeout().toMillis());

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) deliveryProperties.getConnectTimeout().toMillis())
                .followRedirect(false);

        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Bean
    public Clock webhookClock() {
        return Clock.systemUTC();
    }
}
