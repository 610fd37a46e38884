package me.golemcore.nationstates.adapter.outbound.nationstates;

import me.golemcore.nationstates.domain.model.ApiErrorKind;
import me.golemcore.nationstates.domain.model.ApiRequest;
import me.golemcore.nationstates.domain.model.ApiResponse;
import me.golemcore.nationstates.domain.model.Credential;
import me.golemcore.nationstates.domain.model.LimiterSignal;
import me.golemcore.nationstates.domain.model.TelegramRequest;
import me.golemcore.nationstates.infrastructure.config.NationStatesProperties;
import me.golemcore.nationstates.port.outbound.NationStatesPort;
import me.golemcore.nationstates.ratelimit.AuthRateLimiter;
import me.golemcore.nationstates.ratelimit.HeaderQuotaExtractor;
import me.golemcore.nationstates.ratelimit.LimiterSettings;
import me.golemcore.nationstates.ratelimit.Permit;
import me.golemcore.nationstates.ratelimit.RateLimiter;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NationStatesClientTest {

    private static final String USER_AGENT = "UnitTest/1.0 (testlandia)";
    private static final String API_PATH = "/cgi-bin/api.cgi";

    private MockWebServer mockServer;
    private NationStatesProperties properties;
    private List<LimiterSignal> signals;
    private RateLimiter limiter;
    private NationStatesClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        OkHttpClient okHttpClient = new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(5, TimeUnit.SECONDS)
                .build();

        properties = new NationStatesProperties();
        properties.setBaseUrl(mockServer.url(API_PATH).toString());
        properties.setUserAgent(USER_AGENT);

        signals = new CopyOnWriteArrayList<>();
        limiter = new RateLimiter(new LimiterSettings("test-api", Duration.ofMillis(50)),
                HeaderQuotaExtractor.nationStates(), signals::add);
        client = new NationStatesClient(okHttpClient, limiter, properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        limiter.close();
        mockServer.shutdown();
    }

    private static MockResponse ok(String body) {
        return new MockResponse()
                .setBody(body)
                .addHeader("RateLimit-Remaining", "49")
                .addHeader("RateLimit-Reset", "30");
    }

    private RecordedRequest takeRequest() throws InterruptedException {
        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        return request;
    }

    // ===== Public API calls =====

    @Test
    void shouldSendShardsAndUserAgent() throws Exception {
        mockServer.enqueue(ok("<NATION id=\"testlandia\"><NAME>Testlandia</NAME></NATION>"));

        ApiResponse response = client.execute(ApiRequest.nation("testlandia", "name", "fullname"));

        assertEquals(200, response.status());
        assertTrue(response.body().contains("Testlandia"));
        assertEquals("49", response.header("ratelimit-remaining"));

        RecordedRequest request = takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals(API_PATH + "?q=name+fullname&nation=testlandia", request.getPath());
        assertEquals(USER_AGENT, request.getHeader("User-Agent"));
    }

    @Test
    void shouldFeedResponseQuotaToLimiter() {
        mockServer.enqueue(ok("<WORLD/>"));

        client.execute(ApiRequest.world("numnations"));

        assertEquals(49, limiter.quotaState().remaining());
        assertEquals(0, limiter.pendingCount());
    }

    @Test
    void shouldNotAttachCredentialsWithoutNationParameter() throws Exception {
        mockServer.enqueue(ok("<WORLD/>"));
        AuthRateLimiter auth = client.authenticate(Credential.ofPassword("testlandia", "hunter2"));

        client.execute(ApiRequest.world("featuredregion"), auth);

        RecordedRequest request = takeRequest();
        assertEquals("GET", request.getMethod());
        assertNull(request.getHeader("X-Password"));
    }

    // ===== Credentialed calls =====

    @Test
    void shouldPostPasswordThenReuseIssuedSession() throws Exception {
        mockServer.enqueue(ok("<NATION/>")
                .addHeader("X-Autologin", "token-1")
                .addHeader("X-Pin", "9876"));
        mockServer.enqueue(ok("<NATION/>"));
        AuthRateLimiter auth = client.authenticate(Credential.ofPassword("testlandia", "hunter2"));

        client.execute(ApiRequest.nation("testlandia", "ping"), auth);
        client.execute(ApiRequest.command("testlandia", "issue", Map.of("issue", "1", "option", "0")), auth);

        RecordedRequest first = takeRequest();
        assertEquals("POST", first.getMethod());
        assertEquals("hunter2", first.getHeader("X-Password"));
        assertNull(first.getHeader("X-Autologin"));

        RecordedRequest second = takeRequest();
        assertEquals("POST", second.getMethod());
        assertEquals("token-1", second.getHeader("X-Autologin"));
        assertEquals("9876", second.getHeader("X-Pin"));
        assertNull(second.getHeader("X-Password"));
        assertTrue(second.getPath().contains("c=issue"));
    }

    @Test
    void shouldRaiseAuthRejectedAndDropSession() {
        mockServer.enqueue(ok("<NATION/>").addHeader("X-Autologin", "token-1"));
        mockServer.enqueue(ok("Forbidden").setResponseCode(403));
        AuthRateLimiter auth = client.authenticate(Credential.ofPassword("testlandia", "hunter2"));
        client.execute(ApiRequest.nation("testlandia", "ping"), auth);

        NationStatesPort.AuthRejectedException ex = assertThrows(NationStatesPort.AuthRejectedException.class,
                () -> client.execute(ApiRequest.nation("testlandia", "ping"), auth));

        assertEquals("testlandia", ex.getIdentity());
        assertEquals(ApiErrorKind.FORBIDDEN, ex.getKind());
        assertFalse(auth.credential().hasSession());
        assertTrue(signals.stream().anyMatch(LimiterSignal.AuthRejected.class::isInstance));
    }

    // ===== Errors and throttling =====

    @Test
    void shouldRequeueThrottledRequest() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(429).addHeader("RateLimit-Reset", "0"));
        mockServer.enqueue(ok("<WORLD/>"));

        ApiResponse response = client.execute(ApiRequest.world("numnations"));

        assertEquals(200, response.status());
        assertEquals(2, mockServer.getRequestCount());
        assertTrue(signals.stream().anyMatch(LimiterSignal.Throttled.class::isInstance));
    }

    @Test
    void shouldGiveUpAfterConfiguredThrottleRetries() {
        properties.setMaxThrottleRetries(1);
        mockServer.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        mockServer.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));

        NationStatesPort.ApiStatusException ex = assertThrows(NationStatesPort.ApiStatusException.class,
                () -> client.execute(ApiRequest.world("numnations")));

        assertEquals(ApiErrorKind.TOO_MANY_REQUESTS, ex.getKind());
        assertEquals(2, mockServer.getRequestCount());
    }

    @Test
    void shouldNarrowNotFound() {
        mockServer.enqueue(ok("Unknown nation").setResponseCode(404));

        NationStatesPort.ApiStatusException ex = assertThrows(NationStatesPort.ApiStatusException.class,
                () -> client.execute(ApiRequest.nation("nowhere", "name")));

        assertEquals(404, ex.getStatus());
        assertEquals(ApiErrorKind.NOT_FOUND, ex.getKind());
        assertEquals("Unknown nation", ex.getBody());
    }

    @Test
    void shouldRequireUserAgent() {
        properties.setUserAgent(" ");

        assertThrows(NationStatesPort.UserAgentNotSetException.class,
                () -> client.execute(ApiRequest.world("numnations")));
        assertEquals(0, mockServer.getRequestCount());
        assertNull(limiter.quotaState());
    }

    // ===== Dumps =====

    @Test
    void shouldDownloadDumpWithoutWaitingForLimiter() throws Exception {
        mockServer.enqueue(new MockResponse().setBody("gz-bytes"));

        try (Permit held = limiter.acquire()) {
            ApiResponse response = client.execute(ApiRequest.nationsDump(null));
            assertEquals("gz-bytes", response.body());
        }

        RecordedRequest request = takeRequest();
        assertEquals("/pages/nations.xml.gz", request.getPath());
        assertEquals(USER_AGENT, request.getHeader("User-Agent"));
        assertNull(limiter.quotaState());
    }

    // ===== Streaming =====

    @Test
    void shouldStreamBodyAndReleasePermit() throws Exception {
        mockServer.enqueue(ok("<REGIONS>...</REGIONS>"));

        String body = client.stream(ApiRequest.world("regions"), limiter,
                (response, stream) -> new String(stream.readAllBytes(), StandardCharsets.UTF_8));

        assertEquals("<REGIONS>...</REGIONS>", body);
        limiter.tryAcquire(Duration.ofSeconds(1)).orElseThrow().close();
    }

    @Test
    void shouldReleasePermitWhenStreamHandlerFails() throws Exception {
        mockServer.enqueue(ok("<WORLD/>"));

        assertThrows(UncheckedIOException.class, () -> client.stream(ApiRequest.world("numnations"), limiter,
                (response, stream) -> {
                    throw new IOException("parser failed");
                }));

        limiter.tryAcquire(Duration.ofSeconds(1)).orElseThrow().close();
    }

    // ===== Async and reactive =====

    @Test
    void shouldExecuteAsync() throws Exception {
        mockServer.enqueue(ok("<WORLD/>"));

        ApiResponse response = client.executeAsync(ApiRequest.world("numnations")).get(5, TimeUnit.SECONDS);

        assertEquals(200, response.status());
        assertEquals("<WORLD/>", response.body());
        assertEquals(49, limiter.quotaState().remaining());
    }

    @Test
    void shouldFailAsyncWithNarrowedStatus() {
        mockServer.enqueue(ok("Bad").setResponseCode(400));

        CompletableFuture<ApiResponse> future = client.executeAsync(ApiRequest.world("bogus"));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        NationStatesPort.ApiStatusException cause = assertInstanceOf(NationStatesPort.ApiStatusException.class,
                ex.getCause());
        assertEquals(ApiErrorKind.BAD_REQUEST, cause.getKind());
    }

    @Test
    void shouldRequeueThrottledAsyncRequest() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(429).addHeader("RateLimit-Reset", "0"));
        mockServer.enqueue(ok("<WORLD/>"));

        ApiResponse response = client.executeAsync(ApiRequest.world("numnations")).get(5, TimeUnit.SECONDS);

        assertEquals(200, response.status());
        assertEquals(2, mockServer.getRequestCount());
    }

    @Test
    void shouldFailAsyncWithoutUserAgent() {
        properties.setUserAgent(null);

        CompletableFuture<ApiResponse> future = client.executeAsync(ApiRequest.world("numnations"));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertInstanceOf(NationStatesPort.UserAgentNotSetException.class, ex.getCause());
    }

    @Test
    void shouldWithdrawAdmissionWhenAsyncCallIsCancelled() throws Exception {
        Permit held = limiter.acquire();
        CompletableFuture<ApiResponse> future = client.executeAsync(ApiRequest.world("numnations"));
        assertEquals(1, limiter.pendingCount());

        future.cancel(false);

        assertEquals(0, limiter.pendingCount());
        held.close();
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void shouldExecuteReactive() {
        mockServer.enqueue(ok("<REGION/>"));

        StepVerifier.create(client.executeReactive(ApiRequest.region("the_pacific", "numnations"), limiter))
                .assertNext(response -> assertEquals("<REGION/>", response.body()))
                .verifyComplete();
    }

    // ===== Telegrams =====

    @Test
    void shouldSendTelegramThroughApi() throws Exception {
        mockServer.enqueue(ok("queued"));

        ApiResponse response = client.sendTelegram(
                new TelegramRequest("client-key", "1234", "secret", "testlandia", false));

        assertEquals("queued", response.body());
        RecordedRequest request = takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals(API_PATH + "?a=sendtg&client=client-key&tgid=1234&key=secret&to=testlandia",
                request.getPath());
        assertEquals(49, limiter.quotaState().remaining());
    }
}
