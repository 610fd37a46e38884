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
 * Rate limiter for telegram sends. On top of the shared API quota it keeps a
 * fixed minimum interval between its own grants; a granted slot counts even
 * if the telegram is never sent.
 */
public class TelegramRateLimiter extends RateLimiter {

    private final boolean recruitment;
    private final PacingFloor floor;

    TelegramRateLimiter(RateLimiter parent, boolean recruitment, TelegramPacing pacing) {
        super(parent);
        if (pacing == null) {
            throw new IllegalArgumentException("pacing cannot be null");
        }
        this.recruitment = recruitment;
        this.floor = new PacingFloor(pacing.intervalFor(recruitment));
    }

    public boolean isRecruitment() {
        return recruitment;
    }

    public Duration minInterval() {
        return floor.minInterval();
    }

    @Override
    protected PacingFloor pacingFloor() {
        return floor;
    }
}
