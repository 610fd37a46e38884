package me.golemcore.nationstates.ratelimit;

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

import java.time.Duration;

/**
 * Fixed minimum spacing between grants of one limiter.
 *
 * <p>
 * Mutable, but only touched by the owning {@link AdmissionAuthority} while it
 * holds its lock.
 */
public final class PacingFloor {

    private final Duration minInterval;
    private final long minIntervalNanos;
    private boolean granted;
    private long lastGrantedAtNanos;

    public PacingFloor(Duration minInterval) {
        if (minInterval == null || minInterval.isNegative() || minInterval.isZero()) {
            throw new IllegalArgumentException("minInterval must be > 0, got: " + minInterval);
        }
        this.minInterval = minInterval;
        this.minIntervalNanos = minInterval.toNanos();
    }

    public Duration minInterval() {
        return minInterval;
    }

    long earliestGrant(long nowNanos) {
        return granted ? lastGrantedAtNanos + minIntervalNanos : nowNanos;
    }

    void recordGrant(long nowNanos) {
        granted = true;
        lastGrantedAtNanos = nowNanos;
    }
}
