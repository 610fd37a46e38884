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

import me.golemcore.nationstates.domain.model.ObservedResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * {@link QuotaExtractor} for APIs that advertise their quota through
 * integer-valued headers: a remaining count, seconds until reset, and
 * seconds to wait when throttled.
 */
@Slf4j
public class HeaderQuotaExtractor implements QuotaExtractor {

    public static final String DEFAULT_REMAINING_HEADER = "RateLimit-Remaining";
    public static final String DEFAULT_RESET_HEADER = "RateLimit-Reset";
    public static final String DEFAULT_RETRY_AFTER_HEADER = "Retry-After";
    public static final int DEFAULT_THROTTLE_STATUS = 429;

    /** Second counts above a day are treated as unusable. */
    static final long MAX_SECONDS = 86_400;

    private final String remainingHeader;
    private final String resetHeader;
    private final String retryAfterHeader;
    private final int throttleStatus;

    public HeaderQuotaExtractor(String remainingHeader, String resetHeader, String retryAfterHeader,
            int throttleStatus) {
        if (remainingHeader == null || resetHeader == null || retryAfterHeader == null) {
            throw new IllegalArgumentException("quota header names cannot be null");
        }
        this.remainingHeader = remainingHeader;
        this.resetHeader = resetHeader;
        this.retryAfterHeader = retryAfterHeader;
        this.throttleStatus = throttleStatus;
    }

    /**
     * Extractor for the NationStates API header set.
     */
    public static HeaderQuotaExtractor nationStates() {
        return new HeaderQuotaExtractor(DEFAULT_REMAINING_HEADER, DEFAULT_RESET_HEADER,
                DEFAULT_RETRY_AFTER_HEADER, DEFAULT_THROTTLE_STATUS);
    }

    @Override
    public QuotaObservation extract(ObservedResponse response) {
        Long remaining = parseNonNegative(response, remainingHeader);
        Long resetSeconds = parseSeconds(response, resetHeader);
        Long retrySeconds = parseSeconds(response, retryAfterHeader);

        return new QuotaObservation(
                remaining != null ? (int) Math.min(remaining, Integer.MAX_VALUE) : null,
                resetSeconds != null ? Duration.ofSeconds(resetSeconds) : null,
                retrySeconds != null && retrySeconds > 0 ? Duration.ofSeconds(retrySeconds) : null,
                response.status() == throttleStatus);
    }

    private Long parseSeconds(ObservedResponse response, String header) {
        Long seconds = parseNonNegative(response, header);
        if (seconds != null && seconds > MAX_SECONDS) {
            log.debug("[RateLimiter] Ignoring out-of-range {} header: {}", header, seconds);
            return null;
        }
        return seconds;
    }

    private Long parseNonNegative(ObservedResponse response, String header) {
        String raw = response.header(header);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            long value = Long.parseLong(raw.trim());
            return value >= 0 ? value : null;
        } catch (NumberFormatException e) {
            log.debug("[RateLimiter] Ignoring unparsable {} header: '{}'", header, raw);
            return null;
        }
    }
}
