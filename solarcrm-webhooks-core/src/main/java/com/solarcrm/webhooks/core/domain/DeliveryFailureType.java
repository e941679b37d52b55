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

package com.solarcrm.webhooks.core.domain;

/**
 * Classification of a failed delivery attempt.
 */
public enum DeliveryFailureType {

    /**
     * Non-2xx response, timeout, connection or DNS error. Drives the retry schedule.
     */
    TRANSIENT,

    /**
     * The endpoint's circuit is open and nothing was sent. Rescheduled without using up a retry.
     */
    DEFERRED,

    /**
     * No destination or no usable secret. The delivery fails at once.
     */
    PERMANENT
}
