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

import me.golemcore.nationstates.domain.model.Credential;
import me.golemcore.nationstates.domain.model.LimiterSignal;
import me.golemcore.nationstates.domain.model.ObservedResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rate limiter that also carries one nation's credential.
 *
 * <p>
 * Outgoing requests get the cached autologin token when there is one and the
 * plaintext password otherwise, plus the session pin. Token and pin issued by
 * the server are picked up from every observed response. A rejection status
 * drops the cached values so the next request falls back to the password.
 */
@Slf4j
public class AuthRateLimiter extends RateLimiter {

    private final AtomicReference<Credential> credential;
    private final AuthSettings authSettings;

    public AuthRateLimiter(LimiterSettings settings, QuotaExtractor extractor, LimiterSignalListener signalListener,
            Credential credential, AuthSettings authSettings) {
        super(settings, extractor, signalListener);
        this.credential = new AtomicReference<>(requireCredential(credential));
        this.authSettings = requireSettings(authSettings);
    }

    AuthRateLimiter(RateLimiter parent, Credential credential, AuthSettings authSettings) {
        super(parent);
        this.credential = new AtomicReference<>(requireCredential(credential));
        this.authSettings = requireSettings(authSettings);
    }

    @Override
    public Map<String, String> prepareRequest() {
        Credential current = credential.get();
        Map<String, String> fields = new LinkedHashMap<>();
        if (current.cachedToken() != null) {
            fields.put(authSettings.autologinHeader(), current.cachedToken());
        } else {
            fields.put(authSettings.passwordHeader(), current.plaintextSecret());
        }
        if (current.cachedPin() != null) {
            fields.put(authSettings.pinHeader(), current.cachedPin());
        }
        return fields;
    }

    @Override
    public ResponseOutcome observe(ObservedResponse response) {
        ResponseOutcome outcome = super.observe(response);
        if (response.status() == authSettings.rejectedStatus()) {
            invalidate();
            String identity = credential.get().identity();
            log.warn("[RateLimiter] {}: credential for {} rejected with HTTP {}", name(), identity,
                    response.status());
            publish(new LimiterSignal.AuthRejected(name(), identity, response.status()));
            return ResponseOutcome.AUTH_REJECTED;
        }

        String token = response.header(authSettings.autologinHeader());
        String pin = response.header(authSettings.pinHeader());
        if (token != null || pin != null) {
            credential.updateAndGet(c -> c.withSession(token, pin));
            log.debug("[RateLimiter] {}: session refreshed for {}", name(), credential.get().identity());
        }
        return outcome;
    }

    /**
     * Forget the cached token and pin.
     */
    public void invalidate() {
        credential.updateAndGet(Credential::invalidated);
    }

    public Credential credential() {
        return credential.get();
    }

    private static Credential requireCredential(Credential credential) {
        if (credential == null) {
            throw new IllegalArgumentException("credential cannot be null");
        }
        return credential;
    }

    private static AuthSettings requireSettings(AuthSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("authSettings cannot be null");
        }
        return settings;
    }
}
