package com.zzf.workbridge.core.tool;

import com.zzf.workbridge.core.tool.ToolProtocol.ToolCall;
import com.zzf.workbridge.core.tool.ToolProtocol.ToolSpec;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolRouterTest {

    private static ToolHandler handler(String name) {
        ToolHandler handler = mock(ToolHandler.class);
        when(handler.spec()).thenReturn(new ToolSpec(name, name + " tool", null));
        return handler;
    }

    @Test
    void shouldRouteToRegisteredHandler() {
        ToolRegistry registry = new ToolRegistry();
        ToolHandler handler = handler("workspace_get_status");
        when(handler.execute(any())).thenReturn(CompletableFuture.<ToolResult<?>>completedFuture(ToolResult.ok("clean")));
        registry.register(handler);

        ToolResult<?> result = new ToolRouter(registry)
                .execute(new ToolCall("workspace_get_status", null, "/ws"))
                .join();

        assertTrue(result.isSuccess());
        assertEquals("clean", result.getData());
    }

    @Test
    void shouldRejectUnknownTool() {
        ToolResult<?> result = new ToolRouter(new ToolRegistry())
                .execute(new ToolCall("nope", null, null))
                .join();

        assertEquals(ToolErrorCode.INVALID_INPUT, result.getError().getCode());
        assertEquals("Unknown tool: nope", result.getError().getMessage());
    }

    @Test
    void shouldTurnHandlerExceptionIntoInternalError() {
        ToolRegistry registry = new ToolRegistry();
        ToolHandler handler = handler("broken");
        when(handler.execute(any())).thenThrow(new IllegalStateException("kaput"));
        registry.register(handler);

        ToolResult<?> result = new ToolRouter(registry).execute(new ToolCall("broken", null, null)).join();

        assertEquals(ToolErrorCode.INTERNAL_ERROR, result.getError().getCode());
        assertEquals("kaput", result.getError().getMessage());
    }

    @Test
    void shouldListSpecsInRegistrationOrder() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(handler("b"));
        registry.register(handler("a"));

        assertEquals("b", registry.listSpecs().get(0).getName());
        assertEquals("a", registry.listSpecs().get(1).getName());
    }
}
