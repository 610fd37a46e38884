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
 * Minimum spacing between telegrams. Recruitment telegrams have a longer
 * floor than standard ones.
 */
public record TelegramPacing(Duration standardInterval, Duration recruitmentInterval) {

    public TelegramPacing {
        requirePositive(standardInterval, "standardInterval");
        requirePositive(recruitmentInterval, "recruitmentInterval");
    }

    public Duration intervalFor(boolean recruitment) {
        return recruitment ? recruitmentInterval : standardInterval;
    }

    private static void requirePositive(Duration value, String field) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(field + " must be > 0, got: " + value);
        }
    }
}
