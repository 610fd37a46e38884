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

import java.time.Duration;
import java.time.Instant;

/**
 * Notable conditions computed by a rate limiter from observed responses.
 *
 * <p>
 * Signals are informational: throttling is already absorbed into scheduling
 * and malformed quota data into fallback pacing. Only {@link AuthRejected}
 * requires the caller to change what it sends.
 */
public interface LimiterSignal {

    /**
     * Name of the limiter that raised the signal.
     */
    String limiter();

    /**
     * The server asked us to stop sending until {@code retryAt}.
     */
    record Throttled(String limiter, Duration retryAfter, Instant retryAt) implements LimiterSignal {
    }

    /**
     * The server refused the credential of {@code identity}; cached session
     * values were dropped.
     */
    record AuthRejected(String limiter, String identity, int status) implements LimiterSignal {
    }

    /**
     * Quota headers were missing or unparsable; fallback pacing applies.
     */
    record MalformedQuotaData(String limiter, int status, String detail) implements LimiterSignal {
    }
}
