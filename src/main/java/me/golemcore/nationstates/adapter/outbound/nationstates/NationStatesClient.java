package me.golemcore.nationstates.adapter.outbound.nationstates;

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

import me.golemcore.nationstates.domain.model.ApiRequest;
import me.golemcore.nationstates.domain.model.ApiResponse;
import me.golemcore.nationstates.domain.model.Credential;
import me.golemcore.nationstates.domain.model.ObservedResponse;
import me.golemcore.nationstates.domain.model.TelegramRequest;
import me.golemcore.nationstates.infrastructure.config.NationStatesProperties;
import me.golemcore.nationstates.port.outbound.NationStatesPort;
import me.golemcore.nationstates.ratelimit.AuthRateLimiter;
import me.golemcore.nationstates.ratelimit.AuthSettings;
import me.golemcore.nationstates.ratelimit.Permit;
import me.golemcore.nationstates.ratelimit.RateLimiter;
import me.golemcore.nationstates.ratelimit.RequestAuthorizer;
import me.golemcore.nationstates.ratelimit.ResponseOutcome;
import me.golemcore.nationstates.ratelimit.TelegramPacing;
import me.golemcore.nationstates.ratelimit.TelegramRateLimiter;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * OkHttp adapter for the NationStates API.
 *
 * <p>
 * Every API call holds a {@link Permit} of the given limiter from before the
 * request is sent until its response has been observed, so the next caller is
 * scheduled with the quota that response advertised. Throttled responses are
 * re-queued up to {@code nationstates.max-throttle-retries} times. Dump
 * downloads go to the same host but bypass the limiter.
 *
 * <p>
 * Requests that act for a nation (a {@code nation} parameter) carry the
 * limiter's credential headers and are sent as POST.
 */
@Slf4j
public class NationStatesClient implements NationStatesPort {

    private static final String USER_AGENT_HEADER = "User-Agent";
    private static final int MAX_ERROR_BODY_CHARS = 500;

    private final OkHttpClient okHttpClient;
    private final RateLimiter rateLimiter;
    private final NationStatesProperties properties;
    private final HttpUrl apiUrl;
    private final TelegramRateLimiter telegramLimiter;
    private final TelegramRateLimiter recruitmentLimiter;

    public NationStatesClient(OkHttpClient okHttpClient, RateLimiter rateLimiter,
            NationStatesProperties properties) {
        this.okHttpClient = okHttpClient;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        this.apiUrl = HttpUrl.get(properties.getBaseUrl());

        NationStatesProperties.TelegramProperties telegram = properties.getTelegram();
        TelegramPacing pacing = new TelegramPacing(telegram.getStandardInterval(),
                telegram.getRecruitmentInterval());
        this.telegramLimiter = rateLimiter.forTelegrams(false, pacing);
        this.recruitmentLimiter = rateLimiter.forTelegrams(true, pacing);

        log.info("[NationStates] Client initialized: baseUrl={}, userAgentConfigured={}, limiter={}",
                apiUrl, hasUserAgent(), rateLimiter.name());
    }

    /**
     * Limiter for one nation that shares this client's quota.
     */
    public AuthRateLimiter authenticate(Credential credential) {
        NationStatesProperties.AuthProperties auth = properties.getAuth();
        return rateLimiter.withCredential(credential, new AuthSettings(auth.getPasswordHeader(),
                auth.getAutologinHeader(), auth.getPinHeader(), auth.getRejectedStatus()));
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    @Override
    public ApiResponse execute(ApiRequest request) {
        return execute(request, rateLimiter);
    }

    @Override
    public ApiResponse execute(ApiRequest request, RateLimiter limiter) {
        return exchange(request, limiter, (observed, body) -> new ApiResponse(observed.status(),
                observed.headers(), new String(body.readAllBytes(), StandardCharsets.UTF_8)));
    }

    @Override
    public <T> T stream(ApiRequest request, RateLimiter limiter, ResponseHandler<T> handler) {
        return exchange(request, limiter, handler);
    }

    @Override
    public ApiResponse sendTelegram(TelegramRequest telegram) {
        TelegramRateLimiter limiter = telegram.recruitment() ? recruitmentLimiter : telegramLimiter;
        log.info("[NationStates] Sending {} telegram {} to {}",
                telegram.recruitment() ? "recruitment" : "standard", telegram.tgid(), telegram.to());
        return execute(telegram.toApiRequest(), limiter);
    }

    @Override
    public CompletableFuture<ApiResponse> executeAsync(ApiRequest request) {
        return executeAsync(request, rateLimiter);
    }

    /**
     * Non-blocking variant of {@link #execute(ApiRequest, RateLimiter)}.
     * Cancelling the returned future withdraws a pending admission or cancels
     * the call in flight.
     */
    @Override
    public CompletableFuture<ApiResponse> executeAsync(ApiRequest request, RateLimiter limiter) {
        CompletableFuture<ApiResponse> result = new CompletableFuture<>();
        try {
            requireUserAgent();
        } catch (UserAgentNotSetException e) {
            result.completeExceptionally(e);
            return result;
        }
        attemptAsync(request, limiter, 0, result);
        return result;
    }

    @Override
    public Mono<ApiResponse> executeReactive(ApiRequest request, RateLimiter limiter) {
        return Mono.fromFuture(() -> executeAsync(request, limiter));
    }

    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    private <T> T exchange(ApiRequest request, RateLimiter limiter, ResponseHandler<T> handler) {
        requireUserAgent();
        int attempt = 0;
        try {
            while (true) {
                try (Permit permit = request.isApiCall() ? limiter.acquire() : null;
                        Response response = okHttpClient.newCall(buildRequest(request, limiter)).execute()) {
                    ObservedResponse observed = observe(response);
                    ResponseOutcome outcome = request.isApiCall()
                            ? limiter.observe(observed)
                            : ResponseOutcome.ACCEPTED;

                    if (outcome == ResponseOutcome.THROTTLED && attempt < properties.getMaxThrottleRetries()) {
                        attempt++;
                        log.info("[NationStates] Throttled on {}, re-queueing (attempt {}/{})",
                                request, attempt, properties.getMaxThrottleRetries());
                        continue;
                    }

                    ResponseBody body = response.body();
                    checkStatus(outcome, limiter, observed, body);
                    try (InputStream stream = body.byteStream()) {
                        return handler.handle(observed, stream);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("NationStates request interrupted", e);
        } catch (IOException e) {
            log.error("[NationStates] Network error on {}: {}", request, e.getMessage(), e);
            throw new UncheckedIOException("NationStates request failed: " + e.getMessage(), e);
        }
    }

    private void attemptAsync(ApiRequest request, RateLimiter limiter, int attempt,
            CompletableFuture<ApiResponse> result) {
        CompletableFuture<Permit> admission = request.isApiCall()
                ? limiter.acquireAsync()
                : CompletableFuture.completedFuture(null);
        result.whenComplete((response, error) -> admission.cancel(false));

        admission.whenComplete((permit, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
                return;
            }
            if (result.isDone()) {
                release(permit);
                return;
            }
            Call call;
            try {
                call = okHttpClient.newCall(buildRequest(request, limiter));
            } catch (RuntimeException e) {
                release(permit);
                result.completeExceptionally(e);
                return;
            }
            result.whenComplete((response, failure) -> {
                if (result.isCancelled()) {
                    call.cancel();
                }
            });
            call.enqueue(new Callback() {
                @Override
                public void onFailure(Call failedCall, IOException e) {
                    release(permit);
                    log.error("[NationStates] Network error on {}: {}", request, e.getMessage());
                    result.completeExceptionally(
                            new UncheckedIOException("NationStates request failed: " + e.getMessage(), e));
                }

                @Override
                public void onResponse(Call completedCall, Response response) {
                    handleAsyncResponse(request, limiter, attempt, result, permit, response);
                }
            });
        });
    }

    private void handleAsyncResponse(ApiRequest request, RateLimiter limiter, int attempt,
            CompletableFuture<ApiResponse> result, Permit permit, Response response) {
        ResponseOutcome outcome;
        ApiResponse apiResponse;
        try (response) {
            ObservedResponse observed = observe(response);
            outcome = request.isApiCall() ? limiter.observe(observed) : ResponseOutcome.ACCEPTED;
            String text = response.body().string();
            apiResponse = new ApiResponse(observed.status(), observed.headers(), text);
        } catch (IOException e) {
            result.completeExceptionally(new UncheckedIOException("NationStates request failed: "
                    + e.getMessage(), e));
            return;
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        } finally {
            release(permit);
        }

        if (outcome == ResponseOutcome.THROTTLED && attempt < properties.getMaxThrottleRetries()) {
            log.info("[NationStates] Throttled on {}, re-queueing (attempt {}/{})",
                    request, attempt + 1, properties.getMaxThrottleRetries());
            attemptAsync(request, limiter, attempt + 1, result);
            return;
        }
        try {
            checkStatus(outcome, limiter, apiResponse.status(), apiResponse.body());
            result.complete(apiResponse);
        } catch (ApiStatusException e) {
            result.completeExceptionally(e);
        }
    }

    Request buildRequest(ApiRequest request, RequestAuthorizer limiter) {
        Request.Builder builder = new Request.Builder()
                .url(toUrl(request))
                .header(USER_AGENT_HEADER, properties.getUserAgent());

        if (request.isApiCall() && request.nation() != null) {
            Map<String, String> credentials = limiter.prepareRequest();
            if (!credentials.isEmpty()) {
                credentials.forEach(builder::header);
                builder.post(RequestBody.create(new byte[0], null));
            }
        }
        return builder.build();
    }

    HttpUrl toUrl(ApiRequest request) {
        if (!request.isApiCall()) {
            return apiUrl.resolve(request.path());
        }
        HttpUrl.Builder url = apiUrl.newBuilder();
        if (!request.shards().isEmpty()) {
            url.addEncodedQueryParameter("q", request.shards().stream()
                    .map(shard -> URLEncoder.encode(shard, StandardCharsets.UTF_8))
                    .collect(Collectors.joining("+")));
        }
        request.parameters().forEach(url::addQueryParameter);
        return url.build();
    }

    private void checkStatus(ResponseOutcome outcome, RateLimiter limiter, ObservedResponse observed,
            ResponseBody body) throws IOException {
        if (outcome != ResponseOutcome.AUTH_REJECTED && isSuccessful(observed.status())) {
            return;
        }
        checkStatus(outcome, limiter, observed.status(), truncate(body.string()));
    }

    private void checkStatus(ResponseOutcome outcome, RateLimiter limiter, int status, String body) {
        if (outcome == ResponseOutcome.AUTH_REJECTED) {
            String identity = limiter instanceof AuthRateLimiter auth ? auth.credential().identity() : null;
            throw new AuthRejectedException(identity, status, truncate(body));
        }
        if (!isSuccessful(status)) {
            log.warn("[NationStates] HTTP {} from API: {}", status, truncate(body));
            throw new ApiStatusException(status, truncate(body));
        }
    }

    private static ObservedResponse observe(Response response) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : response.headers().names()) {
            headers.put(name, response.header(name));
        }
        return ObservedResponse.of(response.code(), headers);
    }

    private void requireUserAgent() {
        if (!hasUserAgent()) {
            throw new UserAgentNotSetException();
        }
    }

    private boolean hasUserAgent() {
        String userAgent = properties.getUserAgent();
        return userAgent != null && !userAgent.isBlank();
    }

    private static boolean isSuccessful(int status) {
        return status >= 200 && status < 300;
    }

    private static String truncate(String body) {
        if (body == null || body.length() <= MAX_ERROR_BODY_CHARS) {
            return body;
        }
        return body.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }

    private static void release(Permit permit) {
        if (permit != null) {
            permit.close();
        }
    }
}
