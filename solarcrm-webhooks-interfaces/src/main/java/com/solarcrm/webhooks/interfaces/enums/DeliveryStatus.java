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

package com.solarcrm.webhooks.interfaces.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Arrays;

/**
 * Lifecycle state of a single webhook delivery.
 * <p>
 * {@code PENDING -> DELIVERED | RETRYING}, {@code RETRYING -> DELIVERED | RETRYING | FAILED}.
 * DELIVERED and FAILED are terminal.
 */
@Schema(description = "Webhook delivery status", enumAsRef = true)
public enum DeliveryStatus {

    PENDING("pending"),
    DELIVERED("delivered"),
    FAILED("failed"),
    RETRYING("retrying");

    private final String value;

    DeliveryStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == FAILED;
    }

    @JsonCreator
    public static DeliveryStatus of(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown delivery status: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
