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

package com.solarcrm.webhooks.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service for recording outbound webhook metrics using Micrometer.
 */
@Service
@Slf4j
public class WebhookMetricsService {

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> dispatchedCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> deliveredCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> failedCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> purgedCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> attemptTimers = new ConcurrentHashMap<>();
    private final Counter sweeperCounter;

    public WebhookMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.sweeperCounter = Counter.builder("webhooks.sweeper.processed")
                .description("Total number of deliveries re-attempted by the retry sweeper")
                .register(meterRegistry);
    }

    /**
     * Records a delivery record created for a dispatched event.
     *
     * @param eventType the event type wire value
     */
    public void recordDispatched(String eventType) {
        getDispatchedCounter(eventType).increment();
        log.debug("Recorded webhook dispatched for event type: {}", eventType);
    }

    /**
     * Records a delivery that reached DELIVERED.
     *
     * @param eventType the event type wire value
     */
    public void recordDelivered(String eventType) {
        getDeliveredCounter(eventType).increment();
        log.debug("Recorded webhook delivered for event type: {}", eventType);
    }

    /**
     * Records a failed attempt that was scheduled for retry.
     *
     * @param eventType the event type wire value
     */
    public void recordRetryScheduled(String eventType) {
        getRetryCounter(eventType).increment();
        log.debug("Recorded webhook retry scheduled for event type: {}", eventType);
    }

    /**
     * Records a delivery that reached FAILED.
     *
     * @param eventType the event type wire value
     * @param reason why the delivery was abandoned (e.g., "max_retries", "permanent")
     */
    public void recordFailed(String eventType, String reason) {
        getFailedCounter(eventType, reason).increment();
        log.debug("Recorded webhook failure for event type: {}, reason: {}", eventType, reason);
    }

    /**
     * Records the duration of one delivery attempt.
     *
     * @param eventType the event type wire value
     * @param outcome "delivered", "retrying" or "failed"
     * @param duration the attempt duration
     */
    public void recordAttemptTime(String eventType, String outcome, Duration duration) {
        getAttemptTimer(eventType, outcome).record(duration);
        log.debug("Recorded attempt time for event type: {} ({}) - {}ms", eventType, outcome, duration.toMillis());
    }

    /**
     * Records deliveries re-attempted by one sweep.
     *
     * @param count number of deliveries attempted
     */
    public void recordSweeperProcessed(int count) {
        sweeperCounter.increment(count);
    }

    /**
     * Records deliveries removed by the retention purge.
     *
     * @param status the purged status
     * @param count number of rows removed
     */
    public void recordPurged(String status, long count) {
        purgedCounters.computeIfAbsent(status, s ->
                Counter.builder("webhooks.purged")
                        .description("Total number of delivery records removed by retention")
                        .tag("status", s)
                        .register(meterRegistry)
        ).increment(count);
    }

    // Counter getters with lazy initialization

    private Counter getDispatchedCounter(String eventType) {
        return dispatchedCounters.computeIfAbsent(eventType, type ->
                Counter.builder("webhooks.dispatched")
                        .description("Total number of delivery records created")
                        .tag("event_type", type)
                        .register(meterRegistry)
        );
    }

    private Counter getDeliveredCounter(String eventType) {
        return deliveredCounters.computeIfAbsent(eventType, type ->
                Counter.builder("webhooks.delivered")
                        .description("Total number of deliveries acknowledged with a 2xx response")
                        .tag("event_type", type)
                        .register(meterRegistry)
        );
    }

    private Counter getRetryCounter(String eventType) {
        return retryCounters.computeIfAbsent(eventType, type ->
                Counter.builder("webhooks.retry.scheduled")
                        .description("Total number of failed attempts scheduled for retry")
                        .tag("event_type", type)
                        .register(meterRegistry)
        );
    }

    private Counter getFailedCounter(String eventType, String reason) {
        String key = eventType + ":" + reason;
        return failedCounters.computeIfAbsent(key, k ->
                Counter.builder("webhooks.failed")
                        .description("Total number of deliveries abandoned")
                        .tag("event_type", eventType)
                        .tag("reason", reason)
                        .register(meterRegistry)
        );
    }

    private Timer getAttemptTimer(String eventType, String outcome) {
        String key = eventType + ":" + outcome;
        return attemptTimers.computeIfAbsent(key, k ->
                Timer.builder("webhooks.attempt.time")
                        .description("Delivery attempt time, from signing to the recorded outcome")
                        .tag("event_type", eventType)
                        .tag("outcome", outcome)
                        .register(meterRegistry)
        );
    }
}
