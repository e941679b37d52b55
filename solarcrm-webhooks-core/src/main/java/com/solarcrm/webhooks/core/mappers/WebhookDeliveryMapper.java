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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solarcrm.webhooks.core.domain.WebhookDelivery;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryDTO;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import org.mapstruct.Mapper;
import org.mapstruct.MappingConstants;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * MapStruct mapper for converting delivery records to their API representation.
 */
@Mapper(componentModel = MappingConstants.ComponentModel.SPRING)
public abstract class WebhookDeliveryMapper {

    @Autowired
    protected ObjectMapper objectMapper;

    /**
     * Converts a delivery record to a DTO. The stored envelope is exposed as JSON.
     *
     * @param delivery the delivery record
     * @return the DTO
     */
    public abstract WebhookDeliveryDTO toDto(WebhookDelivery delivery);

    /**
     * Parses the stored envelope.
     *
     * @param payload the serialized envelope
     * @return JSON tree
     */
    protected JsonNode payloadToJson(String payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored webhook payload is not valid JSON", e);
        }
    }

    protected WebhookEventType eventTypeFromValue(String eventType) {
        if (eventType == null) {
            return null;
        }
        return WebhookEventType.of(eventType);
    }

    protected Instant toInstant(OffsetDateTime dateTime) {
        return dateTime == null ? null : dateTime.toInstant();
    }
}
