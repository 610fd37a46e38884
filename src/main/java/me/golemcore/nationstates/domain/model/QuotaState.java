package me.golemcore.nationstates.domain.model;

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

/**
 * Remote request quota as last observed by a rate limiter.
 *
 * <p>
 * All timestamps are monotonic-clock nanoseconds taken on this machine, never
 * the server's clock. Instances are immutable so the remaining count and the
 * reset time are always swapped together.
 *
 * @param remaining
 *            requests the server still permits in the current window
 * @param resetAtNanos
 *            when the window resets
 * @param windowSeenNanos
 *            when this state was captured
 */
public record QuotaState(int remaining, long resetAtNanos, long windowSeenNanos) {

    public QuotaState {
        if (remaining < 0) {
            throw new IllegalArgumentException("remaining must be >= 0, got: " + remaining);
        }
    }

    /**
     * Whether the advertised window has already rolled over at {@code nowNanos}.
     */
    public boolean isExpired(long nowNanos) {
        return resetAtNanos - nowNanos <= 0;
    }

    /**
     * Earliest time this quota allows another request.
     */
    public long admissionAt(long nowNanos) {
        if (remaining > 0 || isExpired(nowNanos)) {
            return nowNanos;
        }
        return resetAtNanos;
    }

    /**
     * Same window with one request optimistically spent.
     */
    public QuotaState consume() {
        return new QuotaState(Math.max(0, remaining - 1), resetAtNanos, windowSeenNanos);
    }
}
