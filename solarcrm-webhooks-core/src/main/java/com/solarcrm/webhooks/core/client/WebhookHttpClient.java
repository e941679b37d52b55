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

import org.springframework.http.HttpHeaders;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Sends one signed webhook request.
 * <p>
 * Any HTTP status is returned as a {@link WebhookHttpResponse}. Transport problems
 * (timeout, refused connection, unknown host, open circuit) error with a
 * {@link WebhookTransportException}.
 */
public interface WebhookHttpClient {

    /**
     * POSTs the body to the endpoint URL.
     *
     * @param endpointId the endpoint, used to isolate per-endpoint resilience state
     * @param url the absolute endpoint URL
     * @param headers request headers, including the signature
     * @param body the exact bytes to send
     * @return Mono with the response status and body
     */
    Mono<WebhookHttpResponse> post(UUID endpointId, String url, HttpHeaders headers, byte[] body);
}
