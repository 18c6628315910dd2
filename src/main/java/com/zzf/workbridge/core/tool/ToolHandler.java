package com.zzf.workbridge.core.tool;

import com.zzf.workbridge.core.tool.ToolProtocol.ToolCall;
import com.zzf.workbridge.core.tool.ToolProtocol.ToolSpec;

import java.util.concurrent.CompletableFuture;

public interface ToolHandler {
    ToolSpec spec();

    /**
     * Runs the tool. Failures are reported inside the returned {@link ToolResult}; the future
     * itself never completes exceptionally.
     */
    CompletableFuture<ToolResult<?>> execute(ToolCall call);
}
