package me.golemcore.nationstates.infrastructure.event;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.nationstates.domain.model.LimiterSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Running counts of rate limiter signals, fed from Spring application
 * events.
 */
@Slf4j
public class LimiterSignalStatistics {

    private final AtomicLong throttled = new AtomicLong();
    private final AtomicLong authRejected = new AtomicLong();
    private final AtomicLong malformedQuota = new AtomicLong();
    private final AtomicReference<Instant> lastRetryAt = new AtomicReference<>();

    @EventListener
    public void onThrottled(LimiterSignal.Throttled signal) {
        throttled.incrementAndGet();
        lastRetryAt.set(signal.retryAt());
    }

    @EventListener
    public void onAuthRejected(LimiterSignal.AuthRejected signal) {
        authRejected.incrementAndGet();
        log.info("[NationStates] Credential rejected for {} ({} total)", signal.identity(), authRejected.get());
    }

    @EventListener
    public void onMalformedQuota(LimiterSignal.MalformedQuotaData signal) {
        malformedQuota.incrementAndGet();
    }

    public long getThrottledCount() {
        return throttled.get();
    }

    public long getAuthRejectedCount() {
        return authRejected.get();
    }

    public long getMalformedQuotaCount() {
        return malformedQuota.get();
    }

    /**
     * When the most recent throttle ends, {@code null} if never throttled.
     */
    public Instant getLastRetryAt() {
        return lastRetryAt.get();
    }
}
