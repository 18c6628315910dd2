package com.zzf.workbridge.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.workbridge.core.tool.ToolResult;

import java.util.concurrent.CompletableFuture;

/**
 * Server-side implementation of the calls an editor extension can make over its socket.
 * {@code workspacePath} is the normalized path the connection authenticated with.
 */
public interface PluginApiHandlers {

    /**
     * Handles one {@code api:workspace:*} request. The returned future always completes normally.
     */
    CompletableFuture<ToolResult<?>> handle(String event, String workspacePath, JsonNode payload);

    /**
     * Handles an {@code api:log} line. Invalid lines are dropped.
     */
    void log(String workspacePath, JsonNode payload);
}
