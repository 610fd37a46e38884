package me.golemcore.nationstates.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration of the NationStates client, bound from the
 * {@code nationstates.*} prefix.
 *
 * <p>
 * Nested property classes:
 * <ul>
 * <li>{@link HttpProperties} - OkHttp timeouts and connection pool</li>
 * <li>{@link RateLimitProperties} - quota header names and fallback pacing</li>
 * <li>{@link AuthProperties} - credential header names</li>
 * <li>{@link TelegramProperties} - telegram spacing</li>
 * </ul>
 *
 * <p>
 * Defaults match the live NationStates API; only {@code user-agent} has to
 * be set.
 */
@ConfigurationProperties(prefix = "nationstates")
@Data
public class NationStatesProperties {

    private String baseUrl = "https://www.nationstates.net/cgi-bin/api.cgi";
    private String userAgent;
    private int maxThrottleRetries = 3;
    private HttpProperties http = new HttpProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private AuthProperties auth = new AuthProperties();
    private TelegramProperties telegram = new TelegramProperties();

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class RateLimitProperties {
        private String name = "nationstates-api";
        private String remainingHeader = "RateLimit-Remaining";
        private String resetHeader = "RateLimit-Reset";
        private String retryAfterHeader = "Retry-After";
        private int throttleStatus = 429;
        private Duration fallbackDelay = Duration.ofSeconds(1);
        private int asyncThreads = 2;
    }

    @Data
    public static class AuthProperties {
        private String passwordHeader = "X-Password";
        private String autologinHeader = "X-Autologin";
        private String pinHeader = "X-Pin";
        private int rejectedStatus = 403;
    }

    @Data
    public static class TelegramProperties {
        private Duration standardInterval = Duration.ofSeconds(30);
        private Duration recruitmentInterval = Duration.ofSeconds(180);
    }
}
