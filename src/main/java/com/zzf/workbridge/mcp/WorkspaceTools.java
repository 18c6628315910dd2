package com.zzf.workbridge.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workbridge.api.AgentSession;
import com.zzf.workbridge.api.InitialPrompt;
import com.zzf.workbridge.api.MetadataKeys;
import com.zzf.workbridge.api.PromptModel;
import com.zzf.workbridge.api.RemovalStarted;
import com.zzf.workbridge.api.Workspace;
import com.zzf.workbridge.api.WorkspaceApi;
import com.zzf.workbridge.api.WorkspaceCreateOptions;
import com.zzf.workbridge.api.WorkspaceStatus;
import com.zzf.workbridge.core.tool.InvalidInputException;
import com.zzf.workbridge.core.tool.LogLevel;
import com.zzf.workbridge.core.tool.StructuredLog;
import com.zzf.workbridge.core.tool.ToolHandler;
import com.zzf.workbridge.core.tool.ToolProtocol.ToolCall;
import com.zzf.workbridge.core.tool.ToolProtocol.ToolSpec;
import com.zzf.workbridge.core.tool.ToolRegistry;
import com.zzf.workbridge.core.tool.ToolResult;
import com.zzf.workbridge.core.tool.WorkspaceDispatcher;
import com.zzf.workbridge.core.tool.WorkspaceRequests;
import com.zzf.workbridge.core.tool.WorkspaceRequests.CreateWorkspaceRequest;
import com.zzf.workbridge.core.tool.WorkspaceRequests.DeleteWorkspaceRequest;
import com.zzf.workbridge.core.tool.WorkspaceRequests.ExecuteCommandRequest;
import com.zzf.workbridge.core.tool.WorkspaceRequests.LogRequest;
import com.zzf.workbridge.core.tool.WorkspaceRequests.SetMetadataRequest;
import com.zzf.workbridge.core.util.JsonUtils;
import com.zzf.workbridge.workspace.WorkspaceIdentity;
import org.slf4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The fixed tool set of the tool server. Every tool except {@code log} acts on the workspace named
 * by the request's {@code X-Workspace-Path} header.
 */
public final class WorkspaceTools {
    public static final String GET_STATUS = "workspace_get_status";
    public static final String GET_METADATA = "workspace_get_metadata";
    public static final String SET_METADATA = "workspace_set_metadata";
    public static final String GET_AGENT_SESSION = "workspace_get_agent_session";
    public static final String RESTART_AGENT_SERVER = "workspace_restart_agent_server";
    public static final String CREATE = "workspace_create";
    public static final String DELETE = "workspace_delete";
    public static final String EXECUTE_COMMAND = "workspace_execute_command";
    public static final String LOG = "log";

    private WorkspaceTools() {}

    public static void registerAll(
            ToolRegistry registry,
            WorkspaceApi api,
            WorkspaceDispatcher dispatcher,
            CallerModelResolver models,
            Logger agentLog,
            ObjectMapper mapper
    ) {
        registry.register(new GetStatusTool(api, dispatcher, mapper));
        registry.register(new GetMetadataTool(api, dispatcher, mapper));
        registry.register(new SetMetadataTool(api, dispatcher, mapper));
        registry.register(new GetAgentSessionTool(api, dispatcher, mapper));
        registry.register(new RestartAgentServerTool(api, dispatcher, mapper));
        registry.register(new CreateTool(api, dispatcher, models, mapper));
        registry.register(new DeleteTool(api, dispatcher, mapper));
        registry.register(new ExecuteCommandTool(api, dispatcher, mapper));
        registry.register(new LogTool(agentLog, mapper));
    }

    /**
     * Parse the arguments, then resolve and dispatch through the shared dispatcher.
     *
     * @param <A> parsed argument type
     * @param <R> value produced by the workspace API
     */
    private abstract static class WorkspaceTool<A, R> implements ToolHandler {
        private final ToolSpec spec;
        protected final WorkspaceApi api;
        private final WorkspaceDispatcher dispatcher;

        WorkspaceTool(ToolSpec spec, WorkspaceApi api, WorkspaceDispatcher dispatcher) {
            this.spec = spec;
            this.api = api;
            this.dispatcher = dispatcher;
        }

        @Override
        public ToolSpec spec() {
            return spec;
        }

        protected abstract A parse(JsonNode args);

        protected abstract CompletableFuture<R> invoke(WorkspaceIdentity workspace, A args);

        @Override
        public CompletableFuture<ToolResult<?>> execute(ToolCall call) {
            A args;
            try {
                args = parse(call.getArgs());
            } catch (InvalidInputException e) {
                return CompletableFuture.completedFuture(ToolResult.invalidInput(e.getMessage()));
            }
            return dispatcher.<R>dispatch(spec.getName(), call.getWorkspacePath(),
                            workspace -> invoke(workspace, args))
                    .<ToolResult<?>>thenApply(result -> result);
        }
    }

    private abstract static class NoArgsTool<R> extends WorkspaceTool<Void, R> {
        NoArgsTool(String name, String description, WorkspaceApi api, WorkspaceDispatcher dispatcher, ObjectMapper mapper) {
            super(new ToolSpec(name, description, JsonUtils.emptyObjectSchema(mapper)), api, dispatcher);
        }

        @Override
        protected Void parse(JsonNode args) {
            return null;
        }
    }

    private static final class GetStatusTool extends NoArgsTool<WorkspaceStatus> {
        GetStatusTool(WorkspaceApi api, WorkspaceDispatcher dispatcher, ObjectMapper mapper) {
            super(GET_STATUS, "Get the status of the current workspace: dirty flag and agent status.",
                    api, dispatcher, mapper);
        }

        @Override
        protected CompletableFuture<WorkspaceStatus> invoke(WorkspaceIdentity workspace, Void args) {
            return api.getStatus(workspace.getProjectId(), workspace.getWorkspaceName());
        }
    }

    private static final class GetMetadataTool extends NoArgsTool<Map<String, String>> {
        GetMetadataTool(WorkspaceApi api, WorkspaceDispatcher dispatcher, ObjectMapper mapper) {
            super(GET_METADATA, "Get all metadata of the current workspace.", api, dispatcher, mapper);
        }

        @Override
        protected CompletableFuture<Map<String, String>> invoke(WorkspaceIdentity workspace, Void args) {
            return api.getMetadata(workspace.getProjectId(), workspace.getWorkspaceName());
        }
    }

    private static final class GetAgentSessionTool extends NoArgsTool<AgentSession> {
        GetAgentSessionTool(WorkspaceApi api, WorkspaceDispatcher dispatcher, ObjectMapper mapper) {
            super(GET_AGENT_SESSION, "Get the agent server port and session id of the current workspace.",
                    api, dispatcher, mapper);
        }

        @Override
        protected CompletableFuture<AgentSession> invoke(WorkspaceIdentity workspace, Void args) {
            return api.getAgentSession(workspace.getProjectId(), workspace.getWorkspaceName());
        }
    }

    private static final class RestartAgentServerTool extends NoArgsTool<Integer> {
        RestartAgentServerTool(WorkspaceApi api, WorkspaceDispatcher dispatcher, ObjectMapper mapper) {
            super(RESTART_AGENT_SERVER, "Restart the agent server of the current workspace on the same port.",
                    api, dispatcher, mapper);
        }

        @Override
        protected CompletableFuture<Integer> invoke(WorkspaceIdentity workspace, Void args) {
            return api.restartAgentServer(workspace.getProjectId(), workspace.getWorkspaceName());
        }
    }

    private static final class SetMetadataTool extends WorkspaceTool<SetMetadataRequest, Void> {
        SetMetadataTool(WorkspaceApi api, WorkspaceDispatcher dispatcher, ObjectMapper mapper) {
            super(new ToolSpec(SET_METADATA, "Set a metadata key of the current workspace, or delete it with a null value.",
                    schema(mapper)), api, dispatcher);
        }

        private static ObjectNode schema(ObjectMapper mapper) {
            ObjectNode key = JsonUtils.stringSchema(mapper,
                    "Metadata key: starts with a letter, then letters, digits or hyphens");
            key.put("pattern", MetadataKeys.KEY_PATTERN.pattern());
            key.put("maxLength", MetadataKeys.MAX_LENGTH);
            ObjectNode value = mapper.createObjectNode();
            value.putArray("type").add("string").add("null");
            value.put("description", "Value to store, or null to delete the key");
            Map<String, JsonNode> props = new LinkedHashMap<>();
            props.put("key", key);
            props.put("value", value);
            return JsonUtils.objectSchema(mapper, props, "key", "value");
        }

        @Override
        protected SetMetadataRequest parse(JsonNode args) {
            return WorkspaceRequests.parseSetMetadata(args);
        }

        @Override
        protected CompletableFuture<Void> invoke(WorkspaceIdentity workspace, SetMetadataRequest args) {
            return api.setMetadata(workspace.getProjectId(), workspace.getWorkspaceName(), args.getKey(), args.getValue())
                    .thenApply(ignored -> null);
        }
    }

    private static final class DeleteTool extends WorkspaceTool<DeleteWorkspaceRequest, RemovalStarted> {
        DeleteTool(WorkspaceApi api, WorkspaceDispatcher dispatcher, ObjectMapper mapper) {
            super(new ToolSpec(DELETE, "Delete the current workspace and terminate its agent session.",
                    JsonUtils.objectSchema(mapper, Map.of("keepBranch",
                            JsonUtils.booleanSchema(mapper, "Keep the git branch after removing the worktree (default false)")))),
                    api, dispatcher);
        }

        @Override
        protected DeleteWorkspaceRequest parse(JsonNode args) {
            return WorkspaceRequests.parseDelete(args);
        }

        @Override
        protected CompletableFuture<RemovalStarted> invoke(WorkspaceIdentity workspace, DeleteWorkspaceRequest args) {
            return api.remove(workspace.getProjectId(), workspace.getWorkspaceName(), args.isKeepBranch());
        }
    }

    private static final class ExecuteCommandTool extends WorkspaceTool<ExecuteCommandRequest, Object> {
        ExecuteCommandTool(WorkspaceApi api, WorkspaceDispatcher dispatcher, ObjectMapper mapper) {
            super(new ToolSpec(EXECUTE_COMMAND,
                    "Execute an editor command in the current workspace. Most commands return null.",
                    schema(mapper)), api, dispatcher);
        }

        private static ObjectNode schema(ObjectMapper mapper) {
            ObjectNode command = JsonUtils.stringSchema(mapper, "Editor command identifier, e.g. workbench.action.files.save");
            command.put("minLength", 1);
            command.put("maxLength", WorkspaceRequests.MAX_COMMAND_LENGTH);
            ObjectNode args = mapper.createObjectNode();
            args.put("type", "array");
            args.put("description", "Optional command arguments");
            Map<String, JsonNode> props = new LinkedHashMap<>();
            props.put("command", command);
            props.put("args", args);
            return JsonUtils.objectSchema(mapper, props, "command");
        }

        @Override
        protected ExecuteCommandRequest parse(JsonNode args) {
            return WorkspaceRequests.parseExecuteCommand(args);
        }

        @Override
        protected CompletableFuture<Object> invoke(WorkspaceIdentity workspace, ExecuteCommandRequest args) {
            return api.executeCommand(workspace.getProjectId(), workspace.getWorkspaceName(), args.getCommand(), args.getArgs());
        }
    }

    /**
     * Creates a sibling workspace in the caller's project. A prompt without a model inherits the
     * model the caller's own agent is using, when that can be found.
     */
    private static final class CreateTool extends WorkspaceTool<CreateWorkspaceRequest, Workspace> {
        private final CallerModelResolver models;

        CreateTool(WorkspaceApi api, WorkspaceDispatcher dispatcher, CallerModelResolver models, ObjectMapper mapper) {
            super(new ToolSpec(CREATE,
                    "Create a new workspace in the same project as the caller and return it.",
                    schema(mapper)), api, dispatcher);
            this.models = models;
        }

        private static ObjectNode schema(ObjectMapper mapper) {
            ObjectNode model = JsonUtils.objectSchema(mapper, Map.of(
                    "providerID", JsonUtils.stringSchema(mapper, null),
                    "modelID", JsonUtils.stringSchema(mapper, null)
            ), "providerID", "modelID");
            Map<String, JsonNode> promptProps = new LinkedHashMap<>();
            promptProps.put("prompt", JsonUtils.stringSchema(mapper, null));
            promptProps.put("agent", JsonUtils.stringSchema(mapper, "Agent mode; \"plan\" starts read-only"));
            promptProps.put("model", model);
            ObjectNode promptObject = JsonUtils.objectSchema(mapper, promptProps, "prompt");
            ObjectNode initialPrompt = mapper.createObjectNode();
            ArrayNode anyOf = initialPrompt.putArray("anyOf");
            anyOf.add(JsonUtils.stringSchema(mapper, null));
            anyOf.add(promptObject);
            initialPrompt.put("description", "Prompt sent to the new workspace's agent once it is created");

            Map<String, JsonNode> props = new LinkedHashMap<>();
            props.put("name", JsonUtils.stringSchema(mapper, "Name of the new workspace; becomes the branch name"));
            props.put("base", JsonUtils.stringSchema(mapper, "Branch to create the workspace from"));
            props.put("initialPrompt", initialPrompt);
            props.put("keepInBackground", JsonUtils.booleanSchema(mapper,
                    "Do not switch to the new workspace (default true)"));
            return JsonUtils.objectSchema(mapper, props, "name", "base");
        }

        @Override
        protected CreateWorkspaceRequest parse(JsonNode args) {
            return WorkspaceRequests.parseCreate(args, true);
        }

        @Override
        protected CompletableFuture<Workspace> invoke(WorkspaceIdentity caller, CreateWorkspaceRequest args) {
            return completePrompt(caller, args.getInitialPrompt()).thenCompose(prompt -> {
                WorkspaceCreateOptions options = WorkspaceCreateOptions.builder()
                        .callerWorkspacePath(caller.getWorkspacePath())
                        .initialPrompt(prompt)
                        .keepInBackground(args.isKeepInBackground())
                        .build();
                return api.create(caller.getProjectId(), args.getName(), args.getBase(), options);
            });
        }

        private CompletableFuture<InitialPrompt> completePrompt(WorkspaceIdentity caller, InitialPrompt prompt) {
            if (prompt == null || prompt.getModel() != null || models == null) {
                return CompletableFuture.completedFuture(prompt);
            }
            return models.resolve(caller).thenApply(model -> withModel(prompt, model));
        }

        private static InitialPrompt withModel(InitialPrompt prompt, PromptModel model) {
            if (model == null) {
                return prompt;
            }
            return prompt.toBuilder().model(model).build();
        }
    }

    /**
     * Forwards an agent's log line to the local log. Needs no resolvable workspace.
     */
    private static final class LogTool implements ToolHandler {
        private final ToolSpec spec;
        private final Logger agentLog;

        LogTool(Logger agentLog, ObjectMapper mapper) {
            this.agentLog = agentLog;
            ObjectNode level = JsonUtils.stringSchema(mapper, "Log level, silly being the most verbose");
            ArrayNode levels = level.putArray("enum");
            for (String name : LogLevel.names()) {
                levels.add(name);
            }
            ObjectNode message = JsonUtils.stringSchema(mapper, "Log message");
            message.put("minLength", 1);
            ObjectNode context = mapper.createObjectNode();
            context.put("type", "object");
            context.put("description", "Optional structured context; values must be primitives");
            Map<String, JsonNode> props = new LinkedHashMap<>();
            props.put("level", level);
            props.put("message", message);
            props.put("context", context);
            this.spec = new ToolSpec(LOG, "Write a structured message to the host application's log.",
                    JsonUtils.objectSchema(mapper, props, "level", "message"));
        }

        @Override
        public ToolSpec spec() {
            return spec;
        }

        @Override
        public CompletableFuture<ToolResult<?>> execute(ToolCall call) {
            LogRequest request;
            try {
                request = WorkspaceRequests.parseLog(call.getArgs());
            } catch (InvalidInputException e) {
                return CompletableFuture.completedFuture(ToolResult.invalidInput(e.getMessage()));
            }
            Map<String, Object> context = new LinkedHashMap<>(request.getContext());
            context.put("workspace", call.getWorkspacePath());
            StructuredLog.write(agentLog, request.getLevel(), request.getMessage(), context);
            return CompletableFuture.completedFuture(ToolResult.ok(null));
        }
    }
}
