package com.zzf.workbridge.mcp;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Read-only queries against a workspace's agent server listening on the loopback interface.
 */
public interface AgentSessionClient {

    /**
     * {@code GET /session}: the sessions known to the agent server, most recent first.
     */
    CompletableFuture<JsonNode> listSessions(int port);

    /**
     * {@code GET /session/{id}/message}: the messages of one session in chronological order.
     */
    CompletableFuture<JsonNode> listMessages(int port, String sessionId);
}
