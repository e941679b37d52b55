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

import com.solarcrm.webhooks.core.domain.WebhookDelivery;
import reactor.core.publisher.Mono;

/**
 * Executes delivery attempts and records their outcome.
 */
public interface WebhookDeliveryService {

    /**
     * Attempts one delivery: signs the stored envelope, POSTs it to the endpoint and writes
     * the outcome (DELIVERED, RETRYING with the next due time, or FAILED).
     * <p>
     * Terminal records are returned unchanged. The outcome is only written if the record
     * still has the status and retry count it had when the attempt started; otherwise the
     * stored record is returned. The returned Mono never errors.
     *
     * @param delivery the delivery record
     * @return Mono with the record as stored after the attempt
     */
    Mono<WebhookDelivery> attemptDelivery(WebhookDelivery delivery);
}
