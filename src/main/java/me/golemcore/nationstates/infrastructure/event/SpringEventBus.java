package me.golemcore.nationstates.infrastructure.event;

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

import me.golemcore.nationstates.domain.model.LimiterSignal;
import me.golemcore.nationstates.ratelimit.LimiterSignalListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Forwards rate limiter signals to Spring's ApplicationEventPublisher.
 *
 * <p>
 * Signals are delivered synchronously to every {@code @EventListener} method
 * that accepts {@link LimiterSignal} or one of its records, on the thread
 * that observed the response:
 *
 * <pre>{@code
 * @EventListener
 * public void onThrottled(LimiterSignal.Throttled signal) {
 *     ...
 * }
 * }</pre>
 */
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus implements LimiterSignalListener {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void onSignal(LimiterSignal signal) {
        publish(signal);
    }

    /**
     * Publish an event.
     */
    public void publish(Object event) {
        log.debug("Publishing event: {}", event.getClass().getSimpleName());
        eventPublisher.publishEvent(event);
    }
}
