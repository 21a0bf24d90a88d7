package io.polychain.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HttpTransportTest {

    @Test
    void mergeHeadersLaterLayersWin() {
        Map<String, String> merged = HttpTransport.mergeHeaders(
                Map.of("X-A", "instance", "User-Agent", "instance"),
                Map.of("X-A", "call", "X-B", "call"));

        assertEquals("call", merged.get("X-A"));
        assertEquals("call", merged.get("X-B"));
        assertEquals("instance", merged.get("User-Agent"));
        assertEquals("application/json", merged.get("Content-Type"));
    }

    @Test
    void mergeHeadersWithoutOverrides() {
        assertEquals(HttpTransport.DEFAULT_HEADERS, HttpTransport.mergeHeaders(null, null));
    }

    @Test
    void configDefaults() {
        TransportConfig config = TransportConfig.withDefaults("http://node");

        assertEquals(Duration.ofSeconds(10), config.connectTimeout());
        assertEquals(Duration.ofSeconds(30), config.readTimeout());
        assertTrue(config.headers().isEmpty());
    }

    @Test
    void responseClassification() {
        assertTrue(new TransportResponse(204, "").isSuccess());
        assertTrue(!new TransportResponse(301, "").isSuccess());
    }

    @Test
    void rejectsMissingUrl() {
        assertThrows(NullPointerException.class, () -> new TransportConfig(null, null, null, Map.of()));
    }

    @Test
    void rpcCallDefaultsToEmptyParams() {
        assertEquals(List.of(), new RpcCall("chain.info", null).params());
    }
}
