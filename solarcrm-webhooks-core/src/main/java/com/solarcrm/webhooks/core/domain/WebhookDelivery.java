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

import com.solarcrm.webhooks.interfaces.enums.DeliveryStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One delivery of one event envelope to one endpoint, with the outcome of its last attempt.
 * <p>
 * Invariants: {@code retryCount} never exceeds the configured maximum, {@code nextRetryAt}
 * is set if and only if the status is RETRYING, and DELIVERED or FAILED records are never
 * updated again.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("webhook_deliveries")
public class WebhookDelivery implements Persistable<UUID> {

    @Id
    private UUID id;

    @Column("tenant_id")
    private UUID tenantId;

    @Column("endpoint_id")
    private UUID endpointId;

    /**
     * Event type wire value, e.g. {@code invoice.paid}
     */
    @Column("event_type")
    private String eventType;

    /**
     * Serialized envelope. These exact bytes are signed and sent on every attempt.
     */
    @Column("payload")
    private String payload;

    @Column("status")
    private DeliveryStatus status;

    @Column("response_status")
    private Integer responseStatus;

    @Column("response_body")
    private String responseBody;

    @Column("error_message")
    private String errorMessage;

    @Column("retry_count")
    private int retryCount;

    @Column("next_retry_at")
    private OffsetDateTime nextRetryAt;

    @Column("delivered_at")
    private OffsetDateTime deliveredAt;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Column("updated_at")
    private OffsetDateTime updatedAt;

    @Transient
    private boolean newDelivery;

    @Override
    public boolean isNew() {
        return newDelivery;
    }
}
