package me.golemcore.nationstates.domain.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiRequestTest {

    @Test
    void shouldJoinShardsIntoQuery() {
        ApiRequest request = ApiRequest.nation("testlandia", "name", "fullname", "motto");

        assertTrue(request.isApiCall());
        assertEquals("name+fullname+motto", request.q());
        assertEquals("testlandia", request.nation());
        assertEquals(Map.of("nation", "testlandia"), request.parameters());
    }

    @Test
    void shouldMergeShardParameters() {
        ApiRequest request = ApiRequest.builder()
                .param("nation", "testlandia")
                .shard(ApiRequest.shard("census", Map.of("scale", "all", "mode", "score")))
                .shard("name")
                .build();

        assertEquals(List.of("census", "name"), request.shards());
        assertEquals("all", request.parameters().get("scale"));
        assertEquals("score", request.parameters().get("mode"));
    }

    @Test
    void shouldBuildWorldRegionAndAssemblyRequests() {
        assertNull(ApiRequest.world().q());
        assertEquals("featuredregion", ApiRequest.world("featuredregion").q());
        assertEquals("the_pacific", ApiRequest.region("the_pacific", "numnations").parameters().get("region"));
        assertEquals("2", ApiRequest.wa(2, "resolution").parameters().get("wa"));
        assertThrows(IllegalArgumentException.class, () -> ApiRequest.wa(3));
        assertNull(ApiRequest.region("the_pacific").nation());
    }

    @Test
    void shouldBuildCommandForNation() {
        ApiRequest request = ApiRequest.command("testlandia", "issue", Map.of("issue", "12", "option", "1"));

        assertEquals("testlandia", request.nation());
        assertEquals("issue", request.parameters().get("c"));
        assertEquals("12", request.parameters().get("issue"));
        assertNull(request.q());
    }

    @Test
    void shouldRejectRawQueryParameter() {
        assertThrows(IllegalArgumentException.class, () -> ApiRequest.builder().param("q", "name"));
        assertThrows(IllegalArgumentException.class, () -> ApiRequest.world(" "));
    }

    @Test
    void shouldPointDumpsAtFixedPaths() {
        LocalDate date = LocalDate.of(2018, 9, 30);

        assertEquals("/pages/nations.xml.gz", ApiRequest.nationsDump(null).path());
        assertEquals("/archive/nations/2018-09-30-nations-xml.gz", ApiRequest.nationsDump(date).path());
        assertEquals("/pages/regions.xml.gz", ApiRequest.regionsDump(null).path());
        assertEquals("/archive/nations/2018-09-30-regions-xml.gz", ApiRequest.regionsDump(date).path());
        assertEquals("/pages/cardlist_S3.xml.gz", ApiRequest.cardsDump(3).path());
        assertFalse(ApiRequest.cardsDump(1).isApiCall());
        assertThrows(IllegalArgumentException.class, () -> ApiRequest.cardsDump(0));
    }

    @Test
    void shouldBuildTelegramSend() {
        ApiRequest request = new TelegramRequest("client-key", "1234", "secret", "testlandia", true).toApiRequest();

        assertEquals(List.of("a", "client", "tgid", "key", "to"), List.copyOf(request.parameters().keySet()));
        assertEquals("sendtg", request.parameters().get("a"));
        assertEquals("testlandia", request.parameters().get("to"));
        assertNull(request.nation());
    }

    @Test
    void shouldMaskTelegramSecretsInToString() {
        String text = new TelegramRequest("client-key", "1234", "secret", "testlandia", false)
                .toApiRequest().toString();

        assertFalse(text.contains("client-key"));
        assertFalse(text.contains("secret"));
        assertTrue(text.contains("1234"));
    }

    @Test
    void shouldCompareByContent() {
        assertEquals(ApiRequest.nation("testlandia", "name"), ApiRequest.nation("testlandia", "name"));
        assertNotEquals(ApiRequest.nation("testlandia", "name"), ApiRequest.nation("testlandia", "motto"));
    }

    @Test
    void shouldNarrowErrorStatuses() {
        assertEquals(ApiErrorKind.BAD_REQUEST, ApiErrorKind.fromStatus(400));
        assertEquals(ApiErrorKind.FORBIDDEN, ApiErrorKind.fromStatus(403));
        assertEquals(ApiErrorKind.NOT_FOUND, ApiErrorKind.fromStatus(404));
        assertEquals(ApiErrorKind.CONFLICT, ApiErrorKind.fromStatus(409));
        assertEquals(ApiErrorKind.TEAPOT, ApiErrorKind.fromStatus(418));
        assertEquals(ApiErrorKind.TOO_MANY_REQUESTS, ApiErrorKind.fromStatus(429));
        assertEquals(ApiErrorKind.CLIENT_ERROR, ApiErrorKind.fromStatus(451));
        assertEquals(ApiErrorKind.SERVER_ERROR, ApiErrorKind.fromStatus(502));
        assertEquals(ApiErrorKind.UNEXPECTED, ApiErrorKind.fromStatus(302));
    }
}
