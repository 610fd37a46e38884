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

import me.golemcore.nationstates.adapter.outbound.nationstates.NationStatesClient;
import me.golemcore.nationstates.infrastructure.event.LimiterSignalStatistics;
import me.golemcore.nationstates.infrastructure.event.SpringEventBus;
import me.golemcore.nationstates.infrastructure.http.OkHttpConfig;
import me.golemcore.nationstates.ratelimit.HeaderQuotaExtractor;
import me.golemcore.nationstates.ratelimit.LimiterSettings;
import me.golemcore.nationstates.ratelimit.MonotonicClock;
import me.golemcore.nationstates.ratelimit.QuotaExtractor;
import me.golemcore.nationstates.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring Boot auto-configuration for the NationStates client.
 *
 * <p>
 * Registers, unless the application defines its own:
 * <ul>
 * <li>the OkHttp client ({@link OkHttpConfig})</li>
 * <li>a {@link QuotaExtractor} reading the configured quota headers</li>
 * <li>the process-wide API {@link RateLimiter}, whose signals are published
 * as application events</li>
 * <li>the {@link NationStatesClient}</li>
 * </ul>
 */
@AutoConfiguration
@EnableConfigurationProperties(NationStatesProperties.class)
@Import(OkHttpConfig.class)
@Slf4j
public class NationStatesAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public QuotaExtractor quotaExtractor(NationStatesProperties properties) {
        NationStatesProperties.RateLimitProperties rateLimit = properties.getRateLimit();
        return new HeaderQuotaExtractor(rateLimit.getRemainingHeader(), rateLimit.getResetHeader(),
                rateLimit.getRetryAfterHeader(), rateLimit.getThrottleStatus());
    }

    @Bean
    @ConditionalOnMissingBean
    public SpringEventBus springEventBus(ApplicationEventPublisher eventPublisher) {
        return new SpringEventBus(eventPublisher);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "nationStatesAsyncExecutor")
    public ExecutorService nationStatesAsyncExecutor(NationStatesProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getRateLimit().getAsyncThreads()), r -> {
            Thread t = new Thread(r, "nationstates-async-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiter nationStatesRateLimiter(NationStatesProperties properties, QuotaExtractor quotaExtractor,
            SpringEventBus eventBus, @Qualifier("nationStatesAsyncExecutor") ExecutorService asyncExecutor) {
        NationStatesProperties.RateLimitProperties rateLimit = properties.getRateLimit();
        LimiterSettings settings = new LimiterSettings(rateLimit.getName(), rateLimit.getFallbackDelay());
        log.info("[RateLimiter] Creating {} (fallbackDelay={}ms, throttleStatus={})",
                settings.name(), settings.fallbackDelay().toMillis(), rateLimit.getThrottleStatus());
        return new RateLimiter(settings, quotaExtractor, eventBus, MonotonicClock.SYSTEM, asyncExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public NationStatesClient nationStatesClient(OkHttpClient okHttpClient, RateLimiter rateLimiter,
            NationStatesProperties properties) {
        return new NationStatesClient(okHttpClient, rateLimiter, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public LimiterSignalStatistics limiterSignalStatistics() {
        return new LimiterSignalStatistics();
    }
}
