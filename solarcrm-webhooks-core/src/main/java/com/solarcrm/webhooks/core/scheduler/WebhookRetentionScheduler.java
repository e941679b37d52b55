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

package com.solarcrm.webhooks.core.scheduler;

import com.solarcrm.webhooks.core.services.WebhookRetentionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Purges expired deliveries periodically.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "solarcrm.webhooks.retention", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WebhookRetentionScheduler {

    private final WebhookRetentionService retentionService;

    @Scheduled(fixedDelayString = "${solarcrm.webhooks.retention.interval:PT1H}",
            initialDelayString = "${solarcrm.webhooks.retention.interval:PT1H}")
    public void purge() {
        try {
            retentionService.purgeExpiredDeliveries().block();
        } catch (Exception e) {
            log.error("Error purging expired webhook deliveries", e);
        }
    }
}
