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
import java.util.List;
import java.util.Optional;

/**
 * Closed set of domain events a tenant can subscribe a webhook endpoint to.
 * <p>
 * The wire value (e.g. {@code lead.created}) is what appears in the {@code event} field of
 * the outbound envelope, in endpoint subscriptions and in the delivery store.
 */
@Schema(description = "Webhook event type", enumAsRef = true)
public enum WebhookEventType {

    LEAD_CREATED("lead.created"),
    LEAD_UPDATED("lead.updated"),
    LEAD_STATUS_CHANGED("lead.status_changed"),
    CONTRACT_GENERATED("contract.generated"),
    CONTRACT_SIGNED("contract.signed"),
    CONTRACT_EXPIRED("contract.expired"),
    INVOICE_CREATED("invoice.created"),
    INVOICE_PAID("invoice.paid"),
    INVOICE_OVERDUE("invoice.overdue"),
    PAYMENT_SUCCEEDED("payment.succeeded"),
    PAYMENT_FAILED("payment.failed"),
    SCREENING_COMPLETED("screening.completed"),
    WHATSAPP_MESSAGE_SENT("whatsapp.message_sent"),
    WHATSAPP_MESSAGE_RECEIVED("whatsapp.message_received"),
    USER_CREATED("user.created"),
    USER_UPDATED("user.updated"),
    TENANT_UPDATED("tenant.updated");

    private final String value;

    WebhookEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Domain prefix of the wire value, e.g. {@code whatsapp} for {@code whatsapp.message_sent}.
     */
    public String getCategory() {
        return value.substring(0, value.indexOf('.'));
    }

    /**
     * Resolves an event type from its wire value.
     *
     * @param value the wire value, e.g. {@code invoice.paid}
     * @return the matching event type, or empty if the value is unknown
     */
    public static Optional<WebhookEventType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value.trim()))
                .findFirst();
    }

    @JsonCreator
    public static WebhookEventType of(String value) {
        return fromValue(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown webhook event type: " + value));
    }

    /**
     * Returns every wire value, in declaration order.
     */
    public static List<String> allValues() {
        return Arrays.stream(values()).map(WebhookEventType::getValue).toList();
    }

    @Override
    public String toString() {
        return value;
    }
}
