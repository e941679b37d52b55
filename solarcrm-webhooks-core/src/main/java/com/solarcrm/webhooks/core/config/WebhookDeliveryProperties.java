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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for outbound delivery attempts and the retry schedule.
 * <p>
 * Example:
 * <pre>
 * solarcrm:
 *   webhooks:
 *     delivery:
 *       max-retries: 5
 *       retry-delays: PT30S, PT1M, PT5M, PT15M, PT1H
 *       request-timeout: PT30S
 *       async-dispatch: true
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "solarcrm.webhooks.delivery")
@Data
public class WebhookDeliveryProperties {

    /**
     * Maximum number of retries after the first failed attempt
     */
    private int maxRetries = 5;

    /**
     * Delay before the n-th retry. Retries beyond the table reuse the last entry.
     */
    private List<Duration> retryDelays = List.of(
            Duration.ofSeconds(30),
            Duration.ofMinutes(1),
            Duration.ofMinutes(5),
            Duration.ofMinutes(15),
            Duration.ofHours(1)
    );

    /**
     * Timeout of a single HTTP attempt
     */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * Connect timeout of the outbound HTTP client
     */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * Number of characters of the response body kept on the delivery record
     */
    private int responseBodyLimit = 1000;

    /**
     * User-Agent sent with every delivery
     */
    private String userAgent = "SolarCRM-Webhooks/1.0";

    /**
     * When true, sendWebhook returns once delivery records exist and attempts run detached.
     * When false, it waits for the first attempt of every delivery.
     */
    private boolean asyncDispatch = true;

    /**
     * Returns the delay before the given retry.
     *
     * @param retryCount the retry number, starting at 1
     * @return the delay from the retry table
     */
    public Duration delayForRetry(int retryCount) {
        if (retryDelays == null || retryDelays.isEmpty()) {
            throw new IllegalStateException("solarcrm.webhooks.delivery.retry-delays must not be empty");
        }
        int index = Math.min(Math.max(retryCount, 1), retryDelays.size()) - 1;
        return retryDelays.get(index);
    }
}
