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
import com.solarcrm.webhooks.interfaces.enums.DeliveryStatus;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Delivery store. Every state change of an existing delivery goes through a conditional
 * update so that two workers can never both apply an outcome to the same attempt.
 */
@Repository
public interface WebhookDeliveryRepository extends ReactiveCrudRepository<WebhookDelivery, UUID>,
        WebhookDeliveryRepositoryCustom {

    Mono<WebhookDelivery> findByIdAndTenantId(UUID id, UUID tenantId);

    /**
     * Finds retrying deliveries that are due, oldest due first.
     *
     * @param now the current time
     * @param limit the batch size
     * @return Flux of due deliveries
     */
    @Query("SELECT * FROM webhook_deliveries WHERE status = 'RETRYING' AND next_retry_at <= :now "
            + "ORDER BY next_retry_at ASC LIMIT :limit")
    Flux<WebhookDelivery> findDueRetries(@Param("now") OffsetDateTime now, @Param("limit") int limit);

    /**
     * Finds pending deliveries that have not been touched since the given time.
     *
     * @param staleBefore the cutoff
     * @param limit the batch size
     * @return Flux of stale pending deliveries
     */
    @Query("SELECT * FROM webhook_deliveries WHERE status = 'PENDING' AND updated_at <= :staleBefore "
            + "ORDER BY created_at ASC LIMIT :limit")
    Flux<WebhookDelivery> findStalePending(@Param("staleBefore") OffsetDateTime staleBefore, @Param("limit") int limit);

    /**
     * Claims a due retry by pushing its due time forward. Returns 0 when another worker
     * claimed it first or it is no longer due.
     */
    @Modifying
    @Query("UPDATE webhook_deliveries SET next_retry_at = :leaseUntil, updated_at = :now "
            + "WHERE id = :id AND status = 'RETRYING' AND retry_count = :retryCount AND next_retry_at <= :now")
    Mono<Integer> claimRetry(@Param("id") UUID id,
                             @Param("retryCount") int retryCount,
                             @Param("now") OffsetDateTime now,
                             @Param("leaseUntil") OffsetDateTime leaseUntil);

    /**
     * Claims an orphaned pending delivery by bumping its update time.
     */
    @Modifying
    @Query("UPDATE webhook_deliveries SET updated_at = :now "
            + "WHERE id = :id AND status = 'PENDING' AND updated_at <= :staleBefore")
    Mono<Integer> claimStalePending(@Param("id") UUID id,
                                    @Param("staleBefore") OffsetDateTime staleBefore,
                                    @Param("now") OffsetDateTime now);

    /**
     * Writes the outcome of an attempt if the record is still in the state the attempt started from.
     *
     * @return 1 if applied, 0 if the record moved on in the meantime
     */
    @Modifying
    @Query("UPDATE webhook_deliveries SET status = :status, response_status = :responseStatus, "
            + "response_body = :responseBody, error_message = :errorMessage, retry_count = :retryCount, "
            + "next_retry_at = :nextRetryAt, delivered_at = :deliveredAt, updated_at = :updatedAt "
            + "WHERE id = :id AND status = :expectedStatus AND retry_count = :expectedRetryCount")
    Mono<Integer> compareAndSetOutcome(@Param("id") UUID id,
                                       @Param("expectedStatus") String expectedStatus,
                                       @Param("expectedRetryCount") int expectedRetryCount,
                                       @Param("status") String status,
                                       @Param("responseStatus") Integer responseStatus,
                                       @Param("responseBody") String responseBody,
                                       @Param("errorMessage") String errorMessage,
                                       @Param("retryCount") int retryCount,
                                       @Param("nextRetryAt") OffsetDateTime nextRetryAt,
                                       @Param("deliveredAt") OffsetDateTime deliveredAt,
                                       @Param("updatedAt") OffsetDateTime updatedAt);

    Mono<Long> countByTenantIdAndStatusAndCreatedAtGreaterThanEqual(UUID tenantId,
                                                                    DeliveryStatus status,
                                                                    OffsetDateTime since);

    Mono<Long> countByStatus(DeliveryStatus status);

    @Modifying
    @Query("DELETE FROM webhook_deliveries WHERE status = :status AND created_at < :cutoff")
    Mono<Integer> deleteByStatusCreatedBefore(@Param("status") String status, @Param("cutoff") OffsetDateTime cutoff);
}
