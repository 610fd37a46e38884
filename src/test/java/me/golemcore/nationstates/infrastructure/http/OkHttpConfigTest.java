package me.golemcore.nationstates.infrastructure.http;

import me.golemcore.nationstates.infrastructure.config.NationStatesProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OkHttpConfigTest {

    @Test
    void shouldApplyConfiguredTimeouts() {
        NationStatesProperties properties = new NationStatesProperties();
        properties.getHttp().setConnectTimeout(1000);
        properties.getHttp().setReadTimeout(2000);
        properties.getHttp().setWriteTimeout(3000);

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(1000, client.connectTimeoutMillis());
        assertEquals(2000, client.readTimeoutMillis());
        assertEquals(3000, client.writeTimeoutMillis());
        assertTrue(client.retryOnConnectionFailure());
    }
}
