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
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Typed entry points for the domain services that raise webhook events.
 * Each method only shapes the envelope {@code data} for its event type.
 */
@Component
@RequiredArgsConstructor
public class WebhookEvents {

    private final WebhookDispatchService dispatchService;

    public Mono<List<WebhookDelivery>> leadCreated(UUID tenantId, Object lead) {
        return send(tenantId, WebhookEventType.LEAD_CREATED, "lead", lead);
    }

    public Mono<List<WebhookDelivery>> leadUpdated(UUID tenantId, Object lead, Object changes) {
        return send(tenantId, WebhookEventType.LEAD_UPDATED, "lead", lead, "changes", changes);
    }

    public Mono<List<WebhookDelivery>> leadStatusChanged(UUID tenantId, Object lead, String oldStatus, String newStatus) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("lead", lead);
        data.put("old_status", oldStatus);
        data.put("new_status", newStatus);
        return dispatchService.sendWebhook(tenantId, WebhookEventType.LEAD_STATUS_CHANGED, data);
    }

    public Mono<List<WebhookDelivery>> contractGenerated(UUID tenantId, Object contract) {
        return send(tenantId, WebhookEventType.CONTRACT_GENERATED, "contract", contract);
    }

    public Mono<List<WebhookDelivery>> contractSigned(UUID tenantId, Object contract) {
        return send(tenantId, WebhookEventType.CONTRACT_SIGNED, "contract", contract);
    }

    public Mono<List<WebhookDelivery>> contractExpired(UUID tenantId, Object contract) {
        return send(tenantId, WebhookEventType.CONTRACT_EXPIRED, "contract", contract);
    }

    public Mono<List<WebhookDelivery>> invoiceCreated(UUID tenantId, Object invoice) {
        return send(tenantId, WebhookEventType.INVOICE_CREATED, "invoice", invoice);
    }

    public Mono<List<WebhookDelivery>> invoicePaid(UUID tenantId, Object invoice, Object payment) {
        return send(tenantId, WebhookEventType.INVOICE_PAID, "invoice", invoice, "payment", payment);
    }

    public Mono<List<WebhookDelivery>> invoiceOverdue(UUID tenantId, Object invoice) {
        return send(tenantId, WebhookEventType.INVOICE_OVERDUE, "invoice", invoice);
    }

    public Mono<List<WebhookDelivery>> paymentSucceeded(UUID tenantId, Object payment) {
        return send(tenantId, WebhookEventType.PAYMENT_SUCCEEDED, "payment", payment);
    }

    public Mono<List<WebhookDelivery>> paymentFailed(UUID tenantId, Object payment, String error) {
        return send(tenantId, WebhookEventType.PAYMENT_FAILED, "payment", payment, "error", error);
    }

    public Mono<List<WebhookDelivery>> screeningCompleted(UUID tenantId, Object screening) {
        return send(tenantId, WebhookEventType.SCREENING_COMPLETED, "screening", screening);
    }

    public Mono<List<WebhookDelivery>> whatsappMessageSent(UUID tenantId, Object message) {
        return send(tenantId, WebhookEventType.WHATSAPP_MESSAGE_SENT, "message", message);
    }

    public Mono<List<WebhookDelivery>> whatsappMessageReceived(UUID tenantId, Object message) {
        return send(tenantId, WebhookEventType.WHATSAPP_MESSAGE_RECEIVED, "message", message);
    }

    public Mono<List<WebhookDelivery>> userCreated(UUID tenantId, Object user) {
        return send(tenantId, WebhookEventType.USER_CREATED, "user", user);
    }

    public Mono<List<WebhookDelivery>> userUpdated(UUID tenantId, Object user, Object changes) {
        return send(tenantId, WebhookEventType.USER_UPDATED, "user", user, "changes", changes);
    }

    public Mono<List<WebhookDelivery>> tenantUpdated(UUID tenantId, Object tenant, Object changes) {
        return send(tenantId, WebhookEventType.TENANT_UPDATED, "tenant", tenant, "changes", changes);
    }

    private Mono<List<WebhookDelivery>> send(UUID tenantId, WebhookEventType eventType, String key, Object value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(key, value);
        return dispatchService.sendWebhook(tenantId, eventType, data);
    }

    private Mono<List<WebhookDelivery>> send(UUID tenantId, WebhookEventType eventType,
                                             String key, Object value, String otherKey, Object otherValue) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(key, value);
        data.put(otherKey, otherValue);
        return dispatchService.sendWebhook(tenantId, eventType, data);
    }
}
