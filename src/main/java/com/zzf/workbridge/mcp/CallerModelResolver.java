package com.zzf.workbridge.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.workbridge.api.AgentSession;
import com.zzf.workbridge.api.PromptModel;
import com.zzf.workbridge.api.WorkspaceApi;
import com.zzf.workbridge.core.util.Errors;
import com.zzf.workbridge.core.util.JsonUtils;
import com.zzf.workbridge.workspace.WorkspaceIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Finds the model the caller's agent is currently using: the model of the last user message in
 * the first session listed by the caller's agent server.
 * <p>
 * Best effort. The returned future never fails; every problem is logged and yields {@code null}.
 */
public final class CallerModelResolver {
    private final WorkspaceApi api;
    private final AgentSessionClient agents;
    private final Logger logger;

    public CallerModelResolver(WorkspaceApi api, AgentSessionClient agents) {
        this(api, agents, LoggerFactory.getLogger(CallerModelResolver.class));
    }

    public CallerModelResolver(WorkspaceApi api, AgentSessionClient agents, Logger logger) {
        this.api = api;
        this.agents = agents;
        this.logger = logger;
    }

    public CompletableFuture<PromptModel> resolve(WorkspaceIdentity caller) {
        CompletableFuture<PromptModel> lookup;
        try {
            lookup = api.getAgentSession(caller.getProjectId(), caller.getWorkspaceName())
                    .thenCompose(session -> fromSession(caller, session));
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }
        return lookup.exceptionally(err -> {
            logger.warn("caller.model.fail workspace={} err={}", caller.getWorkspacePath(), Errors.messageOf(err));
            return null;
        });
    }

    private CompletableFuture<PromptModel> fromSession(WorkspaceIdentity caller, AgentSession session) {
        if (session == null) {
            logger.debug("caller.model.skip workspace={} reason=no_agent_session", caller.getWorkspacePath());
            return CompletableFuture.completedFuture(null);
        }
        int port = session.getPort();
        return agents.listSessions(port).thenCompose(sessions -> {
            String sessionId = firstSessionId(sessions);
            if (sessionId == null) {
                logger.debug("caller.model.skip workspace={} reason=no_active_session", caller.getWorkspacePath());
                return CompletableFuture.completedFuture(null);
            }
            return agents.listMessages(port, sessionId).thenApply(messages -> {
                PromptModel model = lastUserModel(messages);
                if (model == null) {
                    logger.debug("caller.model.skip workspace={} session={} reason=no_user_model",
                            caller.getWorkspacePath(), sessionId);
                } else {
                    logger.debug("caller.model.ok workspace={} model={}", caller.getWorkspacePath(), model);
                }
                return model;
            });
        });
    }

    static String firstSessionId(JsonNode sessions) {
        if (sessions == null || !sessions.isArray() || sessions.isEmpty()) {
            return null;
        }
        String id = JsonUtils.textOrNull(sessions.get(0), "id");
        return id == null || id.isBlank() ? null : id;
    }

    static PromptModel lastUserModel(JsonNode messages) {
        if (messages == null || !messages.isArray()) {
            return null;
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            JsonNode info = messages.get(i).path("info");
            if (!"user".equals(info.path("role").asText(""))) {
                continue;
            }
            JsonNode model = info.path("model");
            String providerId = JsonUtils.textOrNull(model, "providerID");
            String modelId = JsonUtils.textOrNull(model, "modelID");
            if (providerId == null || modelId == null) {
                return null;
            }
            return new PromptModel(providerId, modelId);
        }
        return null;
    }
}
