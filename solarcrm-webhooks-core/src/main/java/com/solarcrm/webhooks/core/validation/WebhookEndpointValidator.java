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

package com.solarcrm.webhooks.core.validation;

import com.solarcrm.webhooks.core.config.WebhookSecurityProperties;
import com.solarcrm.webhooks.interfaces.enums.WebhookEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validator for endpoint registrations and updates.
 * Validates the target URL, the subscribed event types and caller supplied secrets.
 */
@Component
@Slf4j
public class WebhookEndpointValidator {

    private final WebhookSecurityProperties securityProperties;

    public WebhookEndpointValidator(WebhookSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    /**
     * Validates the endpoint URL: absolute, allowed scheme, with a host.
     *
     * @param url the endpoint URL
     * @throws ResponseStatusException if validation fails
     */
    public void validateUrl(String url) {
        if (url == null || url.isBlank()) {
            log.warn("Endpoint URL is null or blank");
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Endpoint URL is required");
        }

        if (url.length() > securityProperties.getMaxUrlLength()) {
            log.warn("Endpoint URL length {} exceeds maximum {}", url.length(), securityProperties.getMaxUrlLength());
            throw new ResponseStatusException(
                    HttpStatus.BAD_REQUEST,
                    "Endpoint URL must not be longer than " + securityProperties.getMaxUrlLength() + " characters"
            );
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            log.warn("Malformed endpoint URL: {}", url);
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid endpoint URL: " + e.getMessage());
        }

        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (scheme == null || !securityProperties.getAllowedSchemes().contains(scheme)) {
            log.warn("Endpoint URL scheme not allowed: {}", url);
            throw new ResponseStatusException(
                    HttpStatus.BAD_REQUEST,
                    "Endpoint URL must use one of: " + String.join(", ", securityProperties.getAllowedSchemes())
            );
        }

        if (uri.getHost() == null || uri.getHost().isBlank()) {
            log.warn("Endpoint URL has no host: {}", url);
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Endpoint URL must include a host");
        }
    }

    /**
     * Parses the subscribed event types.
     *
     * @param events raw wire values
     * @return the parsed event types, in request order, without duplicates
     * @throws ResponseStatusException if the list is empty or contains unknown values
     */
    public Set<WebhookEventType> validateEvents(List<String> events) {
        if (events == null || events.isEmpty()) {
            log.warn("Endpoint has no subscribed events");
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "At least one event type is required");
        }

        Set<WebhookEventType> parsed = new LinkedHashSet<>();
        List<String> invalid = new ArrayList<>();
        for (String event : events) {
            Optional<WebhookEventType> type = WebhookEventType.fromValue(event);
            if (type.isPresent()) {
                parsed.add(type.get());
            } else {
                invalid.add(event);
            }
        }

        if (!invalid.isEmpty()) {
            log.warn("Invalid event types: {}", invalid);
            throw new ResponseStatusException(
                    HttpStatus.BAD_REQUEST,
                    "Invalid event types: " + String.join(", ", invalid.stream().map(String::valueOf).toList())
            );
        }

        return parsed;
    }

    /**
     * Validates a caller supplied secret. Absent secrets are generated instead.
     *
     * @param secret the secret, may be null
     * @throws ResponseStatusException if the secret is present but blank or contains whitespace
     */
    public void validateSecret(String secret) {
        if (secret == null) {
            return;
        }
        if (secret.isBlank() || !secret.equals(secret.trim())) {
            log.warn("Rejected blank or padded endpoint secret");
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Secret must not be blank or padded with whitespace");
        }
    }

    /**
     * Validates the size of an envelope metadata map.
     *
     * @param metadata the metadata, may be null
     * @return true if the metadata is within bounds
     */
    public boolean isMetadataWithinBounds(Map<String, Object> metadata) {
        return metadata == null || metadata.size() <= securityProperties.getMaxMetadataEntries();
    }
}
