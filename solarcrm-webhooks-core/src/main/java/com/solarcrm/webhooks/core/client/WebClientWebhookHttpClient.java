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

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.UUID;

/**
 * {@link WebhookHttpClient} on top of the reactive {@link WebClient}.
 */
@Component("webClientWebhookHttpClient")
@Slf4j
public class WebClientWebhookHttpClient implements WebhookHttpClient {

    private final WebClient webClient;

    public WebClientWebhookHttpClient(@Qualifier("webhookWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<WebhookHttpResponse> post(UUID endpointId, String url, HttpHeaders headers, byte[] body) {
        log.debug("POST {} ({} bytes) for endpoint {}", url, body.length, endpointId);

        return webClient.post()
                .uri(URI.create(url))
                .headers(h -> h.addAll(headers))
                .bodyValue(body)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        // an oversized body still leaves a usable status
                        .onErrorResume(DataBufferLimitException.class, e -> Mono.just(""))
                        .defaultIfEmpty("")
                        .map(text -> new WebhookHttpResponse(response.statusCode().value(), text)))
                .onErrorMap(WebClientRequestException.class, e -> new WebhookTransportException(
                        "Connection error: " + describe(e), e));
    }

    private String describe(WebClientRequestException e) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
