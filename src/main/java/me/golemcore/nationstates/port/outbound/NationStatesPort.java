package me.golemcore.nationstates.port.outbound;

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

import me.golemcore.nationstates.domain.model.ApiErrorKind;
import me.golemcore.nationstates.domain.model.ApiRequest;
import me.golemcore.nationstates.domain.model.ApiResponse;
import me.golemcore.nationstates.domain.model.ObservedResponse;
import me.golemcore.nationstates.domain.model.TelegramRequest;
import me.golemcore.nationstates.ratelimit.RateLimiter;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Port for talking to the NationStates site. API calls are admitted through
 * a {@link RateLimiter}; dump downloads are not rate limited.
 */
public interface NationStatesPort {

    /**
     * Send through the default limiter and read the whole body.
     */
    ApiResponse execute(ApiRequest request);

    /**
     * Send through {@code limiter}, which also supplies credentials for
     * requests that act for a nation.
     */
    ApiResponse execute(ApiRequest request, RateLimiter limiter);

    CompletableFuture<ApiResponse> executeAsync(ApiRequest request);

    CompletableFuture<ApiResponse> executeAsync(ApiRequest request, RateLimiter limiter);

    Mono<ApiResponse> executeReactive(ApiRequest request, RateLimiter limiter);

    /**
     * Hand the body to {@code handler} as a stream instead of buffering it.
     * The response and the permit are released when the handler returns or
     * throws.
     */
    <T> T stream(ApiRequest request, RateLimiter limiter, ResponseHandler<T> handler);

    /**
     * Send a telegram, paced by the standard or recruitment telegram limiter.
     */
    ApiResponse sendTelegram(TelegramRequest telegram);

    /**
     * Consumer of a streamed response body.
     */
    @FunctionalInterface
    interface ResponseHandler<T> {
        T handle(ObservedResponse response, InputStream body) throws IOException;
    }

    /**
     * The API answered with a non-success status.
     */
    class ApiStatusException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        private final int status;
        private final ApiErrorKind kind;
        private final String body;

        public ApiStatusException(int status, String body) {
            super("NationStates API returned HTTP " + status + " (" + ApiErrorKind.fromStatus(status) + ")");
            this.status = status;
            this.kind = ApiErrorKind.fromStatus(status);
            this.body = body;
        }

        public int getStatus() {
            return status;
        }

        public ApiErrorKind getKind() {
            return kind;
        }

        public String getBody() {
            return body;
        }
    }

    /**
     * The credential of a nation was refused. Cached session values have
     * already been dropped, so a retry goes out with the password.
     */
    class AuthRejectedException extends ApiStatusException {

        private static final long serialVersionUID = 1L;

        private final String identity;

        public AuthRejectedException(String identity, int status, String body) {
            super(status, body);
            this.identity = identity;
        }

        public String getIdentity() {
            return identity;
        }
    }

    /**
     * No User-Agent configured. NationStates requires one that identifies
     * the operator.
     */
    class UserAgentNotSetException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        public UserAgentNotSetException() {
            super("No User-Agent configured. Set nationstates.user-agent to something that identifies you, "
                    + "e.g. your main nation name");
        }
    }
}
