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

package com.solarcrm.webhooks.core.mappers;

import com.solarcrm.webhooks.core.domain.WebhookEndpoint;
import com.solarcrm.webhooks.interfaces.dto.WebhookEndpointDTO;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingConstants;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Set;

/**
 * MapStruct mapper for converting endpoints to their API representation.
 */
@Mapper(componentModel = MappingConstants.ComponentModel.SPRING)
public abstract class WebhookEndpointMapper {

    public static final String MASKED_SECRET = "***";

    /**
     * Converts an endpoint for reads. The secret is masked.
     *
     * @param endpoint the stored endpoint
     * @return the DTO
     */
    @Mapping(target = "secret", constant = MASKED_SECRET)
    public abstract WebhookEndpointDTO toDto(WebhookEndpoint endpoint);

    /**
     * Converts a freshly registered endpoint. The secret is returned in clear, once.
     *
     * @param endpoint the stored endpoint
     * @return the DTO
     */
    public abstract WebhookEndpointDTO toDtoWithSecret(WebhookEndpoint endpoint);

    protected Set<WebhookEventType> eventsFromColumn(String events) {
        if (events == null) {
            return null;
        }
        return WebhookEndpoint.builder().events(events).build().subscribedEvents();
    }

    protected Instant toInstant(OffsetDateTime dateTime) {
        return dateTime == null ? null : dateTime.toInstant();
    }
}
