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

import com.solarcrm.webhooks.core.services.WebhookRetrySweeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the retry sweep with a fixed delay between runs.
 * Disabled with {@code solarcrm.webhooks.sweeper.enabled=false}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "solarcrm.webhooks.sweeper", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WebhookRetryScheduler {

    private final WebhookRetrySweeper retrySweeper;
    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${solarcrm.webhooks.sweeper.interval:PT15S}",
            initialDelayString = "${solarcrm.webhooks.sweeper.interval:PT15S}")
    public void sweep() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Previous retry sweep still running, skipping");
            return;
        }
        try {
            retrySweeper.processRetries().block();
        } catch (Exception e) {
            log.error("Error processing webhook retries", e);
        } finally {
            running.set(false);
        }
    }
}
