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

import io.r2dbc.spi.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

/**
 * Delivery store wiring: Spring Data R2DBC repositories and schema initialization.
 * <p>
 * The connection itself comes from the standard {@code spring.r2dbc.*} properties.
 */
@Configuration
@EnableR2dbcRepositories(basePackages = "com.solarcrm.webhooks.core.store")
@Slf4j
public class WebhookStoreConfig {

    static final String SCHEMA_LOCATION = "db/webhooks-schema.sql";

    /**
     * Creates the webhook tables on startup when they do not exist yet.
     *
     * @param connectionFactory the R2DBC connection factory
     * @return database initializer
     */
    @Bean
    @ConditionalOnProperty(prefix = "solarcrm.webhooks.store", name = "initialize-schema", havingValue = "true", matchIfMissing = true)
    public ConnectionFactoryInitializer webhookSchemaInitializer(ConnectionFactory connectionFactory) {
        log.info("Setting up webhook schema initializer from {}", SCHEMA_LOCATION);

        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.addScript(new ClassPathResource(SCHEMA_LOCATION));
        initializer.setDatabasePopulator(populator);

        return initializer;
    }
}
