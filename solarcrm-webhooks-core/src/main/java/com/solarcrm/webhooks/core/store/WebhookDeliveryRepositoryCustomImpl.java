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

package com.solarcrm.webhooks.core.store;

import com.solarcrm.webhooks.core.domain.WebhookDelivery;
import com.solarcrm.webhooks.interfaces.dto.WebhookDeliveryFilterDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import reactor.core.publisher.Flux;

import java.util.UUID;

@RequiredArgsConstructor
public class WebhookDeliveryRepositoryCustomImpl implements WebhookDeliveryRepositoryCustom {

    private final R2dbcEntityTemplate template;

    @Override
    public Flux<WebhookDelivery> findHistory(UUID tenantId, WebhookDeliveryFilterDTO filter) {
        Criteria criteria = Criteria.where("tenantId").is(tenantId);
        if (filter.getEndpointId() != null) {
            criteria = criteria.and("endpointId").is(filter.getEndpointId());
        }
        if (filter.getStatus() != null) {
            criteria = criteria.and("status").is(filter.getStatus().name());
        }
        if (filter.getEventType() != null) {
            criteria = criteria.and("eventType").is(filter.getEventType().getValue());
        }

        Query query = Query.query(criteria)
                .sort(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")))
                .limit(filter.getLimit())
                .offset(filter.getOffset());

        return template.select(query, WebhookDelivery.class);
    }
}
