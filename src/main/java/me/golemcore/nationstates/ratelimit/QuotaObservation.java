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
 * Quota fields pulled out of one response. Any field the response did not
 * carry (or carried in an unparsable form) is {@code null}.
 *
 * @param remaining
 *            requests left in the current window
 * @param resetAfter
 *            time until the window resets
 * @param retryAfter
 *            explicit wait requested by the server
 * @param throttled
 *            whether the status code means "too many requests"
 */
public record QuotaObservation(Integer remaining, Duration resetAfter, Duration retryAfter, boolean throttled) {

    public boolean hasQuota() {
        return remaining != null && resetAfter != null;
    }

    String describeMissing() {
        if (remaining == null && resetAfter == null) {
            return "remaining and reset missing";
        }
        return remaining == null ? "remaining missing" : "reset missing";
    }
}
