package me.golemcore.newsroom.adapter.outbound.capability;

import me.golemcore.newsroom.domain.model.ToolDefinition;
import me.golemcore.newsroom.domain.model.ToolFailureKind;
import me.golemcore.newsroom.domain.model.ToolResult;
import me.golemcore.newsroom.domain.model.TransportType;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CapabilityRouterTest {

    private static final String SEARCH = "search_and_content";
    private static final String PUBLISH = "LINKEDIN_CREATE_LINKED_IN_POST";

    private NewsroomProperties properties;
    private CapabilityClientFactory factory;
    private AbstractMcpClient searchClient;
    private AbstractMcpClient publishClient;
    private CapabilityRouter router;

    @BeforeEach
    void setUp() throws Exception {
        properties = new NewsroomProperties();
        properties.getProviders().put("linkedin_tools_stdio", provider(TransportType.STDIO));
        properties.getProviders().put("linkedin", provider(TransportType.HTTP));

        factory = mock(CapabilityClientFactory.class);
        searchClient = mock(AbstractMcpClient.class);
        publishClient = mock(AbstractMcpClient.class);
        when(factory.create(eq("linkedin_tools_stdio"), any())).thenReturn(searchClient);
        when(factory.create(eq("linkedin"), any())).thenReturn(publishClient);
        when(searchClient.start()).thenReturn(List.of(tool(SEARCH)));
        when(publishClient.start()).thenReturn(List.of(tool(PUBLISH)));
        when(searchClient.listTools()).thenReturn(List.of(tool(SEARCH)));
        when(publishClient.listTools()).thenReturn(List.of(tool(PUBLISH)));
        when(searchClient.isRunning()).thenReturn(true);
        when(publishClient.isRunning()).thenReturn(true);

        router = new CapabilityRouter(properties, factory);
    }

    // ===== routing =====

    @Test
    void shouldRouteToolToAdvertisingProvider() throws Exception {
        when(publishClient.invoke(eq(PUBLISH), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("posted")));

        ToolResult result = router.invoke(PUBLISH, Map.of("params", Map.of())).get();

        assertTrue(result.isSuccess());
        assertEquals("posted", result.getOutput());
        verify(searchClient, never()).invoke(any(), anyMap());
    }

    @Test
    void shouldReportUnknownTool() throws Exception {
        ToolResult result = router.invoke("does_not_exist", Map.of()).get();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.UNKNOWN_TOOL, result.getFailureKind());
    }

    @Test
    void shouldStartProvidersOnlyOnce() {
        router.listTools();
        router.listTools();

        verify(factory, times(1)).create(eq("linkedin_tools_stdio"), any());
        verify(factory, times(1)).create(eq("linkedin"), any());
    }

    @Test
    void shouldAggregateToolsFromAllProviders() {
        List<String> names = router.listTools().stream().map(ToolDefinition::getName).toList();

        assertEquals(2, names.size());
        assertTrue(names.containsAll(List.of(SEARCH, PUBLISH)));
    }

    // ===== failures =====

    @Test
    void shouldSkipDisabledProvider() throws Exception {
        properties.getProviders().get("linkedin").setEnabled(false);

        ToolResult result = router.invoke(PUBLISH, Map.of()).get();

        assertEquals(ToolFailureKind.UNKNOWN_TOOL, result.getFailureKind());
        verify(factory, never()).create(eq("linkedin"), any());
    }

    @Test
    void shouldReportUnavailableProviderThatFailsToStart() throws Exception {
        when(searchClient.start()).thenThrow(new IOException("python not found"));

        ToolResult result = router.invoke(SEARCH, Map.of()).get();

        assertEquals(ToolFailureKind.PROVIDER_UNAVAILABLE, result.getFailureKind());
        assertTrue(result.getFailureKind().isNeverSent());
        verify(searchClient, times(2)).close();
    }

    @Test
    void shouldRetryStartOfProviderThatFailedEarlier() throws Exception {
        AbstractMcpClient broken = mock(AbstractMcpClient.class);
        when(broken.start()).thenThrow(new IOException("python not found"));
        when(searchClient.invoke(eq(SEARCH), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("found")));
        when(factory.create(eq("linkedin_tools_stdio"), any())).thenReturn(broken, searchClient);

        router.listTools();
        ToolResult result = router.invoke(SEARCH, Map.of()).get();

        assertTrue(result.isSuccess());
        assertEquals("found", result.getOutput());
        verify(broken).close();
        verify(factory, times(2)).create(eq("linkedin_tools_stdio"), any());
        verify(factory, times(1)).create(eq("linkedin"), any());
    }

    @Test
    void shouldKeepReportingUnknownToolOnceAllProvidersRun() throws Exception {
        router.listTools();

        router.invoke("does_not_exist", Map.of()).get();
        router.invoke("does_not_exist", Map.of()).get();

        verify(factory, times(1)).create(eq("linkedin_tools_stdio"), any());
        verify(factory, times(1)).create(eq("linkedin"), any());
    }

    @Test
    void shouldRestartDeadProvider() throws Exception {
        AbstractMcpClient restarted = mock(AbstractMcpClient.class);
        when(restarted.start()).thenReturn(List.of(tool(SEARCH)));
        when(restarted.isRunning()).thenReturn(true);
        when(restarted.invoke(eq(SEARCH), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("ok")));
        when(factory.create(eq("linkedin_tools_stdio"), any())).thenReturn(searchClient, restarted);
        router.listTools();
        when(searchClient.isRunning()).thenReturn(false);

        ToolResult result = router.invoke(SEARCH, Map.of()).get();

        assertTrue(result.isSuccess());
        verify(searchClient).close();
    }

    @Test
    void shouldReportUnavailableProviderWhenRestartFails() throws Exception {
        router.listTools();
        when(searchClient.isRunning()).thenReturn(false);
        when(searchClient.start()).thenThrow(new IOException("still broken"));

        ToolResult result = router.invoke(SEARCH, Map.of()).get();

        assertEquals(ToolFailureKind.PROVIDER_UNAVAILABLE, result.getFailureKind());
    }

    @Test
    void shouldCloseClientsOnShutdown() {
        router.listTools();

        router.shutdown();

        verify(searchClient).close();
        verify(publishClient).close();
    }

    private static NewsroomProperties.ProviderProperties provider(TransportType transport) {
        NewsroomProperties.ProviderProperties provider = new NewsroomProperties.ProviderProperties();
        provider.setTransport(transport);
        return provider;
    }

    private static ToolDefinition tool(String name) {
        return ToolDefinition.builder().name(name).description(name).build();
    }
}
