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

/**
 * Header names and rejection status used by {@link AuthRateLimiter}.
 */
public record AuthSettings(String passwordHeader, String autologinHeader, String pinHeader, int rejectedStatus) {

    public AuthSettings {
        if (passwordHeader == null || autologinHeader == null || pinHeader == null) {
            throw new IllegalArgumentException("credential header names cannot be null");
        }
    }

    public static AuthSettings nationStates() {
        return new AuthSettings("X-Password", "X-Autologin", "X-Pin", 403);
    }
}
