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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of a single HTTP attempt, before it is applied to the delivery record.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DeliveryAttemptResult {

    boolean successful;
    Integer responseStatus;
    String responseBody;
    String errorMessage;
    DeliveryFailureType failureType;
    Duration retryAfter;

    public static DeliveryAttemptResult delivered(int responseStatus, String responseBody) {
        return new DeliveryAttemptResult(true, responseStatus, responseBody, null, null, null);
    }

    public static DeliveryAttemptResult transientFailure(Integer responseStatus, String responseBody, String errorMessage) {
        return new DeliveryAttemptResult(false, responseStatus, responseBody, errorMessage, DeliveryFailureType.TRANSIENT, null);
    }

    public static DeliveryAttemptResult transientFailure(String errorMessage) {
        return transientFailure(null, null, errorMessage);
    }

    public static DeliveryAttemptResult permanentFailure(String errorMessage) {
        return new DeliveryAttemptResult(false, null, null, errorMessage, DeliveryFailureType.PERMANENT, null);
    }

    public static DeliveryAttemptResult deferred(String errorMessage, Duration retryAfter) {
        return new DeliveryAttemptResult(false, null, null, errorMessage, DeliveryFailureType.DEFERRED, retryAfter);
    }

    public boolean isPermanent() {
        return failureType == DeliveryFailureType.PERMANENT;
    }

    public boolean isDeferred() {
        return failureType == DeliveryFailureType.DEFERRED;
    }
}
