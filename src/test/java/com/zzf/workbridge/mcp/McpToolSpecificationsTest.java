package com.zzf.workbridge.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.workbridge.core.tool.ToolHandler;
import com.zzf.workbridge.core.tool.ToolProtocol.ToolCall;
import com.zzf.workbridge.core.tool.ToolProtocol.ToolSpec;
import com.zzf.workbridge.core.tool.ToolRegistry;
import com.zzf.workbridge.core.tool.ToolResult;
import com.zzf.workbridge.core.tool.ToolRouter;
import com.zzf.workbridge.core.util.JsonUtils;
import io.modelcontextprotocol.server.McpStatelessServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class McpToolSpecificationsTest {

    private final ObjectMapper mapper = JsonUtils.newMapper();

    private ToolHandler handler;
    private ToolRouter router;

    @BeforeEach
    void setUp() {
        handler = mock(ToolHandler.class);
        when(handler.spec()).thenReturn(new ToolSpec("workspace_get_status", "Get the status",
                JsonUtils.objectSchema(mapper, Map.of("verbose", JsonUtils.booleanSchema(mapper, null)))));
        ToolRegistry registry = new ToolRegistry();
        registry.register(handler);
        router = new ToolRouter(registry);
    }

    private static String text(McpSchema.CallToolResult result) {
        return ((McpSchema.TextContent) result.content().get(0)).text();
    }

    @Test
    void shouldPublishRegistrySpecsAsSdkTools() {
        List<McpStatelessServerFeatures.SyncToolSpecification> specs = McpToolSpecifications.from(router, mapper);

        assertEquals(1, specs.size());
        McpSchema.Tool tool = specs.get(0).tool();
        assertEquals("workspace_get_status", tool.name());
        assertEquals("Get the status", tool.description());
        assertEquals("object", tool.inputSchema().type());
        assertTrue(tool.inputSchema().properties().containsKey("verbose"));
    }

    @Test
    void shouldHandWorkspaceFromTransportContextToHandler() {
        when(handler.execute(any())).thenReturn(CompletableFuture.<ToolResult<?>>completedFuture(ToolResult.ok(Map.of("isDirty", true))));
        McpStatelessServerFeatures.SyncToolSpecification spec = McpToolSpecifications.from(router, mapper).get(0);

        McpSchema.CallToolResult result = spec.callHandler().apply(
                WorkspaceHttpTransport.contextFor("/repo/ws/feature/"),
                new McpSchema.CallToolRequest("workspace_get_status", Map.<String, Object>of("verbose", true)));

        ArgumentCaptor<ToolCall> call = ArgumentCaptor.forClass(ToolCall.class);
        verify(handler).execute(call.capture());
        assertEquals("/repo/ws/feature/", call.getValue().getWorkspacePath());
        assertTrue(call.getValue().getArgs().get("verbose").asBoolean());
        assertFalse(Boolean.TRUE.equals(result.isError()));
        assertEquals("{\"isDirty\":true}", text(result));
    }

    @Test
    void shouldWriteAbsentValueAsNullText() {
        McpSchema.CallToolResult result = McpToolSpecifications.toCallResult(ToolResult.ok(null), mapper);

        assertEquals("null", text(result));
        assertFalse(Boolean.TRUE.equals(result.isError()));
    }

    @Test
    void shouldFlagErrorsWithIsError() throws Exception {
        McpSchema.CallToolResult result = McpToolSpecifications.toCallResult(ToolResult.workspaceNotFound("/repo/gone"), mapper);

        assertTrue(result.isError());
        String code = mapper.readTree(text(result)).at("/error/code").asText();
        assertEquals("workspace-not-found", code);
        assertTrue(text(result).contains("/repo/gone"));
    }
}
