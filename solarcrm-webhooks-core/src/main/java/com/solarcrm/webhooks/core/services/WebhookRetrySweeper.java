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

package com.solarcrm.webhooks.core.services;

import reactor.core.publisher.Mono;

/**
 * Re-attempts deliveries whose retry is due.
 */
public interface WebhookRetrySweeper {

    /**
     * Claims and attempts, one at a time, the due RETRYING deliveries and the PENDING
     * deliveries left behind without a first attempt. Deliveries that are not due are not
     * touched. A delivery claimed by another worker is skipped.
     *
     * @return Mono with the number of deliveries attempted
     */
    Mono<Integer> processRetries();
}
