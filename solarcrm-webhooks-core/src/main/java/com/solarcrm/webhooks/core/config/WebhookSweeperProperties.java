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

/**
 * Configuration properties for the retry sweeper.
 */
@Configuration
@ConfigurationProperties(prefix = "solarcrm.webhooks.sweeper")
@Data
public class WebhookSweeperProperties {

    /**
     * Run the sweeper on a fixed delay
     */
    private boolean enabled = true;

    /**
     * Delay between the end of one pass and the start of the next
     */
    private Duration interval = Duration.ofSeconds(15);

    /**
     * Maximum number of records attempted per pass and per category
     */
    private int batchSize = 100;

    /**
     * How far a claimed retry's due time is pushed so other sweepers skip it
     */
    private Duration claimLease = Duration.ofMinutes(2);

    /**
     * Age after which a pending record is considered orphaned and attempted by the sweeper
     */
    private Duration stalePendingAfter = Duration.ofMinutes(5);
}
