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
 * Configuration properties for purging old terminal deliveries.
 * Pending and retrying deliveries are never purged.
 */
@Configuration
@ConfigurationProperties(prefix = "solarcrm.webhooks.retention")
@Data
public class WebhookRetentionProperties {

    private boolean enabled = true;

    private Duration interval = Duration.ofHours(1);

    /**
     * Age after which delivered records are deleted
     */
    private Duration deliveredRetention = Duration.ofDays(30);

    /**
     * Age after which failed records are deleted
     */
    private Duration failedRetention = Duration.ofDays(7);
}
