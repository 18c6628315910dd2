package com.zzf.workbridge.core.tool;

import com.zzf.workbridge.core.tool.ToolProtocol.ToolCall;
import com.zzf.workbridge.core.util.Errors;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

@Slf4j
public final class ToolRouter {
    private final ToolRegistry registry;

    public ToolRouter(ToolRegistry registry) {
        this.registry = registry;
    }

    public ToolRegistry getRegistry() {
        return registry;
    }

    public CompletableFuture<ToolResult<?>> execute(ToolCall call) {
        if (call == null || call.getTool().isEmpty()) {
            return CompletableFuture.completedFuture(ToolResult.invalidInput("Tool name is required"));
        }
        ToolHandler handler = registry.get(call.getTool());
        if (handler == null) {
            return CompletableFuture.completedFuture(ToolResult.invalidInput("Unknown tool: " + call.getTool()));
        }
        CompletableFuture<ToolResult<?>> future;
        try {
            future = handler.execute(call);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.exceptionally(err -> {
            String message = Errors.messageOf(err);
            log.error("tool.fail tool={} workspace={} err={}", call.getTool(), call.getWorkspacePath(), message, Errors.unwrap(err));
            return ToolResult.internalError(message);
        });
    }
}
