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

import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
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
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A tenant-registered receiver of webhook deliveries.
 * <p>
 * Subscriptions are stored as a comma separated list of event type wire values.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("webhook_endpoints")
public class WebhookEndpoint implements Persistable<UUID> {

    static final String EVENT_SEPARATOR = ",";

    @Id
    private UUID id;

    @Column("tenant_id")
    private UUID tenantId;

    @Column("name")
    private String name;

    @Column("description")
    private String description;

    @Column("url")
    private String url;

    @Column("secret")
    private String secret;

    @Column("events")
    private String events;

    @Column("active")
    private boolean active;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Column("updated_at")
    private OffsetDateTime updatedAt;

    @Transient
    private boolean newEndpoint;

    @Override
    public boolean isNew() {
        return newEndpoint;
    }

    public Set<WebhookEventType> subscribedEvents() {
        if (events == null || events.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(events.split(EVENT_SEPARATOR))
                .map(WebhookEventType::fromValue)
                .flatMap(Optional::stream)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public boolean isSubscribedTo(WebhookEventType eventType) {
        return subscribedEvents().contains(eventType);
    }

    public static String joinEvents(Collection<WebhookEventType> eventTypes) {
        return eventTypes.stream()
                .map(WebhookEventType::getValue)
                .distinct()
                .collect(Collectors.joining(EVENT_SEPARATOR));
    }
}
