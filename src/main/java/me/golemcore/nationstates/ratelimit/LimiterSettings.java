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
 * Construction-time settings of an admission authority.
 *
 * @param name
 *            used in logs, signals and the timer thread name
 * @param fallbackDelay
 *            how long to hold back when a response carries no usable quota
 *            information
 */
public record LimiterSettings(String name, Duration fallbackDelay) {

    public static final Duration DEFAULT_FALLBACK_DELAY = Duration.ofSeconds(1);

    public LimiterSettings {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (fallbackDelay == null || fallbackDelay.isNegative() || fallbackDelay.isZero()) {
            throw new IllegalArgumentException("fallbackDelay must be > 0, got: " + fallbackDelay);
        }
    }

    public static LimiterSettings named(String name) {
        return new LimiterSettings(name, DEFAULT_FALLBACK_DELAY);
    }
}
