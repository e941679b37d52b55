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

package com.solarcrm.webhooks.web;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the SolarCRM outbound webhook service.
 * <p>
 * Hosts the endpoint registry and delivery history API, the delivery engine and the
 * scheduled retry sweeper.
 */
@SpringBootApplication(scanBasePackages = {
        "com.solarcrm.webhooks.web",
        "com.solarcrm.webhooks.core"
})
@ConfigurationPropertiesScan
@EnableScheduling
@OpenAPIDefinition(
        info = @Info(
                title = "SolarCRM Webhooks",
                version = "1.0.0",
                description = "Tenant webhook endpoints, signed event delivery and delivery history",
                contact = @Contact(
                        name = "SolarCRM Platform Team",
                        email = "platform@solarcrm.example"
                )
        ),
        servers = {
                @Server(
                        url = "http://localhost:8080",
                        description = "Local Development Environment"
                )
        }
)
public class WebhookManagementApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebhookManagementApplication.class, args);
    }
}
