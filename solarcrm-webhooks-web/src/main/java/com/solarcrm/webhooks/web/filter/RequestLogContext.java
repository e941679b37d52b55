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

import org.slf4j.MDC;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Puts the request id and tenant id into the MDC around a single log statement.
 * <p>
 * Handlers run on whichever thread delivers the signal, so MDC entries are never left behind:
 * the caller's MDC is restored as soon as the statement returns.
 */
public final class RequestLogContext {

    public static final String TENANT_ID_KEY = "tenantId";

    private RequestLogContext() {
    }

    /**
     * Logs with the request id taken from the Reactor Context written by {@link TracingWebFilter}.
     *
     * @param tenantId  tenant the request is for
     * @param statement the log statement
     * @return an empty Mono that runs the statement when subscribed
     */
    public static Mono<Void> log(UUID tenantId, Runnable statement) {
        return Mono.deferContextual(context -> {
            Map<String, String> entries = new LinkedHashMap<>();
            String requestId = context.getOrDefault(TracingWebFilter.REQUEST_ID_KEY, null);
            if (requestId != null) {
                entries.put(TracingWebFilter.REQUEST_ID_KEY, requestId);
            }
            entries.put(TENANT_ID_KEY, tenantId.toString());
            run(entries, statement);
            return Mono.empty();
        });
    }

    static void run(Map<String, String> entries, Runnable statement) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        entries.forEach(MDC::put);
        try {
            statement.run();
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }
}
