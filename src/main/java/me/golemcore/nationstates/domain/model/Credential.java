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

import java.util.Objects;

/**
 * Login material for one nation.
 *
 * <p>
 * The server may answer an authenticated request with a reusable autologin
 * token and a session pin. Once cached, those are sent instead of the
 * plaintext password until the cache is invalidated.
 *
 * @param identity
 *            nation name the credential belongs to
 * @param plaintextSecret
 *            password, may be {@code null} if only a token is known
 * @param cachedToken
 *            server-issued autologin token
 * @param cachedPin
 *            server-issued session pin
 */
public record Credential(String identity, String plaintextSecret, String cachedToken, String cachedPin) {

    public Credential {
        Objects.requireNonNull(identity, "identity");
        if (plaintextSecret == null && cachedToken == null) {
            throw new IllegalArgumentException("credential for " + identity + " needs a password or a token");
        }
    }

    public static Credential ofPassword(String identity, String password) {
        return new Credential(identity, password, null, null);
    }

    public static Credential ofToken(String identity, String autologin) {
        return new Credential(identity, null, autologin, null);
    }

    /**
     * Merge freshly issued session values, keeping the current ones where the
     * response carried nothing new.
     */
    public Credential withSession(String token, String pin) {
        return new Credential(identity, plaintextSecret,
                token != null ? token : cachedToken,
                pin != null ? pin : cachedPin);
    }

    public Credential invalidated() {
        if (plaintextSecret == null) {
            // nothing to fall back to, keep the token so the next attempt fails loudly
            return new Credential(identity, null, cachedToken, null);
        }
        return new Credential(identity, plaintextSecret, null, null);
    }

    public boolean hasSession() {
        return cachedToken != null;
    }

    @Override
    public String toString() {
        return "Credential[identity=" + identity
                + ", password=" + (plaintextSecret != null ? "***" : "none")
                + ", token=" + (cachedToken != null ? "***" : "none")
                + ", pin=" + (cachedPin != null ? "***" : "none") + "]";
    }
}
