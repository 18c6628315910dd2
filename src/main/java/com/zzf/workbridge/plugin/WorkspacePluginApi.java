package com.zzf.workbridge.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.workbridge.api.WorkspaceApi;
import com.zzf.workbridge.api.WorkspaceCreateOptions;
import com.zzf.workbridge.core.tool.InvalidInputException;
import com.zzf.workbridge.core.tool.StructuredLog;
import com.zzf.workbridge.core.tool.ToolResult;
import com.zzf.workbridge.core.tool.WorkspaceDispatcher;
import com.zzf.workbridge.core.tool.WorkspaceRequests;
import com.zzf.workbridge.core.tool.WorkspaceRequests.CreateWorkspaceRequest;
import com.zzf.workbridge.core.tool.WorkspaceRequests.DeleteWorkspaceRequest;
import com.zzf.workbridge.core.tool.WorkspaceRequests.ExecuteCommandRequest;
import com.zzf.workbridge.core.tool.WorkspaceRequests.LogRequest;
import com.zzf.workbridge.core.tool.WorkspaceRequests.SetMetadataRequest;
import com.zzf.workbridge.workspace.WorkspaceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link PluginApiHandlers} backed by the workspace API. Arguments are validated first, then the
 * connection's workspace is resolved and the call dispatched exactly like a tool call.
 */
public final class WorkspacePluginApi implements PluginApiHandlers {
    public static final String EXTENSION_LOGGER_NAME = "workbridge.extension";

    private final WorkspaceApi api;
    private final WorkspaceDispatcher dispatcher;
    private final Logger logger;
    private final Logger extensionLog;

    public WorkspacePluginApi(WorkspaceApi api, WorkspaceResolver resolver) {
        this(api, resolver, LoggerFactory.getLogger(WorkspacePluginApi.class), LoggerFactory.getLogger(EXTENSION_LOGGER_NAME));
    }

    public WorkspacePluginApi(WorkspaceApi api, WorkspaceResolver resolver, Logger logger, Logger extensionLog) {
        this.api = api;
        this.dispatcher = new WorkspaceDispatcher(resolver, logger);
        this.logger = logger;
        this.extensionLog = extensionLog;
    }

    @Override
    public CompletableFuture<ToolResult<?>> handle(String event, String workspacePath, JsonNode payload) {
        try {
            return route(event == null ? "" : event, workspacePath, payload);
        } catch (InvalidInputException e) {
            logger.warn("plugin.api.invalid event={} workspace={} err={}", event, workspacePath, e.getMessage());
            return CompletableFuture.completedFuture(ToolResult.invalidInput(e.getMessage()));
        }
    }

    private CompletableFuture<ToolResult<?>> route(String event, String path, JsonNode payload) {
        switch (event) {
            case PluginProtocol.GET_STATUS:
                return widen(dispatcher.dispatch(event, path,
                        ws -> api.getStatus(ws.getProjectId(), ws.getWorkspaceName())));
            case PluginProtocol.GET_AGENT_SESSION:
                return widen(dispatcher.dispatch(event, path,
                        ws -> api.getAgentSession(ws.getProjectId(), ws.getWorkspaceName())));
            case PluginProtocol.GET_METADATA:
                return widen(dispatcher.dispatch(event, path,
                        ws -> api.getMetadata(ws.getProjectId(), ws.getWorkspaceName())));
            case PluginProtocol.SET_METADATA: {
                SetMetadataRequest request = WorkspaceRequests.parseSetMetadata(payload);
                return widen(dispatcher.dispatch(event, path,
                        ws -> api.setMetadata(ws.getProjectId(), ws.getWorkspaceName(), request.getKey(), request.getValue())));
            }
            case PluginProtocol.DELETE: {
                DeleteWorkspaceRequest request = WorkspaceRequests.parseDelete(payload);
                return widen(dispatcher.dispatch(event, path,
                        ws -> api.remove(ws.getProjectId(), ws.getWorkspaceName(), request.isKeepBranch())));
            }
            case PluginProtocol.EXECUTE_COMMAND: {
                ExecuteCommandRequest request = WorkspaceRequests.parseExecuteCommand(payload);
                return widen(dispatcher.dispatch(event, path,
                        ws -> api.executeCommand(ws.getProjectId(), ws.getWorkspaceName(), request.getCommand(), request.getArgs())));
            }
            case PluginProtocol.CREATE: {
                CreateWorkspaceRequest request = WorkspaceRequests.parseCreate(payload, false);
                return widen(dispatcher.dispatch(event, path, ws -> api.create(ws.getProjectId(), request.getName(), request.getBase(),
                        WorkspaceCreateOptions.builder()
                                .callerWorkspacePath(ws.getWorkspacePath())
                                .initialPrompt(request.getInitialPrompt())
                                .keepInBackground(request.isKeepInBackground())
                                .build())));
            }
            default:
                return CompletableFuture.completedFuture(ToolResult.invalidInput("Unknown event: " + event));
        }
    }

    @Override
    public void log(String workspacePath, JsonNode payload) {
        LogRequest request;
        try {
            request = WorkspaceRequests.parseLog(payload);
        } catch (InvalidInputException e) {
            logger.debug("plugin.log.drop workspace={} err={}", workspacePath, e.getMessage());
            return;
        }
        Map<String, Object> context = new LinkedHashMap<>(request.getContext());
        context.put("workspace", workspacePath);
        StructuredLog.write(extensionLog, request.getLevel(), request.getMessage(), context);
    }

    private static <T> CompletableFuture<ToolResult<?>> widen(CompletableFuture<ToolResult<T>> future) {
        return future.<ToolResult<?>>thenApply(result -> result);
    }
}
