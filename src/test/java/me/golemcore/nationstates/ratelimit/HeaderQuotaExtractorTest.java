package me.golemcore.nationstates.ratelimit;

import me.golemcore.nationstates.domain.model.ObservedResponse;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeaderQuotaExtractorTest {

    private final HeaderQuotaExtractor extractor = HeaderQuotaExtractor.nationStates();

    @Test
    void shouldExtractRemainingAndReset() {
        QuotaObservation observation = extractor.extract(ObservedResponse.of(200, Map.of(
                "RateLimit-Remaining", "42", "RateLimit-Reset", "17")));

        assertEquals(42, observation.remaining());
        assertEquals(Duration.ofSeconds(17), observation.resetAfter());
        assertNull(observation.retryAfter());
        assertFalse(observation.throttled());
        assertTrue(observation.hasQuota());
    }

    @Test
    void shouldMatchHeaderNamesCaseInsensitively() {
        QuotaObservation observation = extractor.extract(ObservedResponse.of(200, Map.of(
                "ratelimit-remaining", "3", "RATELIMIT-RESET", "9")));

        assertEquals(3, observation.remaining());
        assertEquals(Duration.ofSeconds(9), observation.resetAfter());
    }

    @Test
    void shouldDetectThrottleWithRetryAfter() {
        QuotaObservation observation = extractor.extract(ObservedResponse.of(429, Map.of("Retry-After", "12")));

        assertTrue(observation.throttled());
        assertEquals(Duration.ofSeconds(12), observation.retryAfter());
        assertFalse(observation.hasQuota());
    }

    @Test
    void shouldIgnoreUnparsableAndNegativeValues() {
        QuotaObservation observation = extractor.extract(ObservedResponse.of(200, Map.of(
                "RateLimit-Remaining", "-1", "RateLimit-Reset", "soon", "Retry-After", " ")));

        assertNull(observation.remaining());
        assertNull(observation.resetAfter());
        assertNull(observation.retryAfter());
        assertFalse(observation.hasQuota());
    }

    @Test
    void shouldTreatOversizedSecondCountsAsUnusable() {
        QuotaObservation observation = extractor.extract(ObservedResponse.of(429, Map.of(
                "RateLimit-Remaining", "5", "RateLimit-Reset", "99999999999", "Retry-After", "86401")));

        assertEquals(5, observation.remaining());
        assertNull(observation.resetAfter());
        assertNull(observation.retryAfter());
        assertFalse(observation.hasQuota());
    }

    @Test
    void shouldAcceptSecondCountsUpToOneDay() {
        QuotaObservation observation = extractor.extract(ObservedResponse.of(200, Map.of(
                "RateLimit-Remaining", "5", "RateLimit-Reset", "86400")));

        assertEquals(Duration.ofDays(1), observation.resetAfter());
    }

    @Test
    void shouldTreatZeroRetryAfterAsAbsent() {
        QuotaObservation observation = extractor.extract(ObservedResponse.of(429, Map.of("Retry-After", "0")));

        assertNull(observation.retryAfter());
    }

    @Test
    void shouldHonourCustomHeaderNamesAndStatus() {
        HeaderQuotaExtractor custom = new HeaderQuotaExtractor("X-Left", "X-Window", "X-Wait", 503);

        QuotaObservation observation = custom.extract(ObservedResponse.of(503, Map.of(
                "X-Left", "1", "X-Window", "2", "X-Wait", "3")));

        assertEquals(1, observation.remaining());
        assertEquals(Duration.ofSeconds(2), observation.resetAfter());
        assertEquals(Duration.ofSeconds(3), observation.retryAfter());
        assertTrue(observation.throttled());
    }

    @Test
    void shouldDescribeWhichQuotaFieldIsMissing() {
        assertEquals("reset missing", new QuotaObservation(5, null, null, false).describeMissing());
        assertEquals("remaining missing",
                new QuotaObservation(null, Duration.ofSeconds(1), null, false).describeMissing());
    }
}
