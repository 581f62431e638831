package me.golemcore.newsroom.adapter.outbound.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.newsroom.domain.model.ProviderConfig;
import me.golemcore.newsroom.domain.model.ToolDefinition;
import me.golemcore.newsroom.domain.model.ToolFailureKind;
import me.golemcore.newsroom.domain.model.ToolResult;
import me.golemcore.newsroom.domain.model.TransportType;
import me.golemcore.newsroom.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamableHttpCapabilityClientTest {

    private static final String URL = "https://mcp.example.test/linkedin";
    private static final String SESSION = "session-42";
    private static final String PUBLISH_TOOL = "LINKEDIN_CREATE_LINKED_IN_POST";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private OkHttpMockEngine httpEngine;
    private StreamableHttpCapabilityClient client;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        OkHttpClient okHttpClient = new OkHttpClient.Builder()
                .addInterceptor(httpEngine)
                .build();
        ProviderConfig config = ProviderConfig.builder()
                .name("linkedin")
                .transport(TransportType.HTTP)
                .url(URL)
                .apiKey("secret")
                .headers(Map.of("X-Client", "newsroom"))
                .startupTimeoutSeconds(5)
                .requestTimeoutSeconds(5)
                .build();
        client = new StreamableHttpCapabilityClient(config, objectMapper, okHttpClient);
    }

    // ===== handshake =====

    @Test
    void shouldInitializeWithJsonReplyAndEventStreamToolList() throws Exception {
        enqueueHandshake();

        List<ToolDefinition> tools = client.start();

        assertEquals(1, tools.size());
        assertEquals(PUBLISH_TOOL, tools.get(0).getName());
        assertEquals(SESSION, client.getSessionId());
        assertTrue(client.isRunning());

        OkHttpMockEngine.CapturedRequest init = httpEngine.takeRequest();
        assertEquals("POST", init.method());
        assertEquals("Bearer secret", init.header("Authorization"));
        assertEquals("newsroom", init.header("X-Client"));
        assertTrue(init.header("Accept").contains("text/event-stream"));
        assertNull(init.header(StreamableHttpCapabilityClient.SESSION_HEADER));
        assertEquals("initialize", objectMapper.readTree(init.body()).get("method").asText());

        OkHttpMockEngine.CapturedRequest notification = httpEngine.takeRequest();
        assertEquals(SESSION, notification.header(StreamableHttpCapabilityClient.SESSION_HEADER));
        assertEquals("notifications/initialized", objectMapper.readTree(notification.body()).get("method").asText());

        OkHttpMockEngine.CapturedRequest list = httpEngine.takeRequest();
        assertEquals(SESSION, list.header(StreamableHttpCapabilityClient.SESSION_HEADER));
    }

    @Test
    void shouldFailStartWithoutUrl() {
        ProviderConfig config = ProviderConfig.builder()
                .name("broken")
                .transport(TransportType.HTTP)
                .build();
        StreamableHttpCapabilityClient broken = new StreamableHttpCapabilityClient(config, objectMapper,
                new OkHttpClient());

        assertThrows(IOException.class, broken::start);
    }

    // ===== tool calls =====

    @Test
    void shouldInvokeToolThroughEventStream() throws Exception {
        enqueueHandshake();
        client.start();
        httpEngine.enqueueEventStream(200, """
                event: message
                data: {"jsonrpc":"2.0","method":"notifications/progress","params":{"progress":1}}

                event: message
                data: {"jsonrpc":"2.0","id":3,"result":{"content":[{"type":"text","text":"urn:li:share:1"}]}}

                """);

        ToolResult result = client.invoke(PUBLISH_TOOL, Map.of("params", Map.of("commentary", "Hello")))
                .get(5, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals("urn:li:share:1", result.getOutput());
        skipHandshakeRequests();
        JsonNode call = objectMapper.readTree(httpEngine.takeRequest().body());
        assertEquals("tools/call", call.get("method").asText());
        assertEquals("Hello", call.get("params").get("arguments").get("params").get("commentary").asText());
    }

    @Test
    void shouldFailCallOnHttpError() throws Exception {
        enqueueHandshake();
        client.start();
        httpEngine.enqueueJson(500, "{\"error\":\"boom\"}");

        ToolResult result = client.invoke(PUBLISH_TOOL, Map.of()).get(5, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertTrue(result.getError().contains("HTTP 500"));
    }

    @Test
    void shouldFailCallOnNetworkError() throws Exception {
        enqueueHandshake();
        client.start();
        httpEngine.enqueueFailure(new IOException("connection reset"));

        ToolResult result = client.invoke(PUBLISH_TOOL, Map.of()).get(5, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("connection reset"));
    }

    // ===== shutdown =====

    @Test
    void shouldDeleteSessionOnClose() throws Exception {
        enqueueHandshake();
        client.start();
        httpEngine.enqueueEmpty(204);

        client.close();

        assertFalse(client.isRunning());
        assertNull(client.getSessionId());
        skipHandshakeRequests();
        OkHttpMockEngine.CapturedRequest delete = httpEngine.takeRequest();
        assertEquals("DELETE", delete.method());
        assertEquals(SESSION, delete.header(StreamableHttpCapabilityClient.SESSION_HEADER));
    }

    private void enqueueHandshake() {
        httpEngine.enqueueJson(200, """
                {"jsonrpc":"2.0","id":1,"result":{"protocolVersion":"2024-11-05","capabilities":{}}}
                """, Map.of(StreamableHttpCapabilityClient.SESSION_HEADER, SESSION));
        httpEngine.enqueueEmpty(202);
        httpEngine.enqueueEventStream(200, """
                event: message
                data: {"jsonrpc":"2.0","id":2,"result":{"tools":[{"name":"LINKEDIN_CREATE_LINKED_IN_POST","description":"Create a post"}]}}

                """);
    }

    private void skipHandshakeRequests() {
        httpEngine.takeRequest();
        httpEngine.takeRequest();
        httpEngine.takeRequest();
    }
}
