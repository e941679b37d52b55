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

package com.solarcrm.webhooks.web.filter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.Map;
import java.util.UUID;

/**
 * Web filter for request id propagation.
 *
 * <p>Takes the caller's {@code X-Request-ID} or generates one and echoes it on the response.
 * The id is written to the Reactor Context under {@link #REQUEST_ID_KEY}, where
 * {@link RequestLogContext} picks it up for the controllers' log lines.</p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TracingWebFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_KEY = "requestId";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String requestId = extractHeader(exchange, REQUEST_ID_HEADER);
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }

        exchange.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);

        if (log.isDebugEnabled()) {
            ServerHttpRequest request = exchange.getRequest();
            RequestLogContext.run(Map.of(REQUEST_ID_KEY, requestId),
                    () -> log.debug("{} {}", request.getMethod(), request.getPath().value()));
        }

        return chain.filter(exchange)
                .contextWrite(Context.of(REQUEST_ID_KEY, requestId));
    }

    private String extractHeader(ServerWebExchange exchange, String headerName) {
        String value = exchange.getRequest().getHeaders().getFirst(headerName);
        return (value != null && !value.isBlank()) ? value : null;
    }
}
