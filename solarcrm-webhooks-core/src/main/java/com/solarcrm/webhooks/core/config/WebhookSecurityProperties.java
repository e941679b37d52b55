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

package com.solarcrm.webhooks.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuration properties for endpoint registration and envelope validation.
 * <p>
 * All properties can be configured via:
 * <ul>
 *   <li>application.yml: {@code solarcrm.webhooks.security.secret-length: 48}</li>
 *   <li>Environment variables: {@code SOLARCRM_WEBHOOKS_SECURITY_SECRET_LENGTH=48}</li>
 *   <li>System properties: {@code -Dsolarcrm.webhooks.security.secret-length=48}</li>
 * </ul>
 * <p>
 * Example environment variables:
 * <pre>
 * SOLARCRM_WEBHOOKS_SECURITY_SECRET_LENGTH=32
 * SOLARCRM_WEBHOOKS_SECURITY_ALLOWED_SCHEMES=https
 * SOLARCRM_WEBHOOKS_SECURITY_MAX_URL_LENGTH=2048
 * SOLARCRM_WEBHOOKS_SECURITY_MAX_METADATA_ENTRIES=50
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "solarcrm.webhooks.security")
@Data
public class WebhookSecurityProperties {

    /**
     * Length of generated endpoint secrets (alphanumeric characters)
     */
    private int secretLength = 32;

    /**
     * URL schemes an endpoint may use
     */
    private List<String> allowedSchemes = List.of("http", "https");

    /**
     * Maximum endpoint URL length
     */
    private int maxUrlLength = 2048;

    /**
     * Maximum number of entries in an envelope's metadata map
     */
    private int maxMetadataEntries = 50;
}
