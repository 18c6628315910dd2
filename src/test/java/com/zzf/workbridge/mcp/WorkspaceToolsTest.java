package com.zzf.workbridge.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.workbridge.api.AgentSession;
import com.zzf.workbridge.api.AgentStatus;
import com.zzf.workbridge.api.InitialPrompt;
import com.zzf.workbridge.api.PromptModel;
import com.zzf.workbridge.api.RemovalStarted;
import com.zzf.workbridge.api.Workspace;
import com.zzf.workbridge.api.WorkspaceApi;
import com.zzf.workbridge.api.WorkspaceCreateOptions;
import com.zzf.workbridge.api.WorkspaceStatus;
import com.zzf.workbridge.core.tool.ToolErrorCode;
import com.zzf.workbridge.core.tool.ToolProtocol.ToolCall;
import com.zzf.workbridge.core.tool.ToolRegistry;
import com.zzf.workbridge.core.tool.ToolResult;
import com.zzf.workbridge.core.tool.ToolRouter;
import com.zzf.workbridge.core.tool.WorkspaceDispatcher;
import com.zzf.workbridge.core.util.JsonUtils;
import com.zzf.workbridge.workspace.WorkspaceIdentity;
import com.zzf.workbridge.workspace.WorkspaceIdentityRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class WorkspaceToolsTest {

    private static final String CALLER_PATH = "/repo/.worktrees/main-ws";

    private final ObjectMapper mapper = JsonUtils.newMapper();

    private WorkspaceApi api;
    private AgentSessionClient agents;
    private Logger agentLog;
    private ToolRouter router;

    @BeforeEach
    void setUp() {
        api = mock(WorkspaceApi.class);
        agents = mock(AgentSessionClient.class);
        agentLog = mock(Logger.class);
        WorkspaceIdentityRegistry registry = new WorkspaceIdentityRegistry();
        registry.register(new WorkspaceIdentity("proj", "main-ws", CALLER_PATH));
        ToolRegistry tools = new ToolRegistry();
        WorkspaceTools.registerAll(tools, api, new WorkspaceDispatcher(registry),
                new CallerModelResolver(api, agents), agentLog, mapper);
        router = new ToolRouter(tools);
    }

    private ToolResult<?> call(String tool, String args, String workspacePath) throws Exception {
        JsonNode node = args == null ? null : mapper.readTree(args);
        return router.execute(new ToolCall(tool, node, workspacePath)).join();
    }

    @Test
    void shouldRegisterFixedToolSet() {
        assertEquals(9, router.getRegistry().size());
        assertEquals(WorkspaceTools.GET_STATUS, router.getRegistry().listSpecs().get(0).getName());
    }

    @Test
    void shouldReturnStatusOfCallerWorkspace() throws Exception {
        WorkspaceStatus status = new WorkspaceStatus(true, AgentStatus.of(1, 0));
        when(api.getStatus("proj", "main-ws")).thenReturn(CompletableFuture.completedFuture(status));

        ToolResult<?> result = call(WorkspaceTools.GET_STATUS, null, CALLER_PATH + "/");

        assertTrue(result.isSuccess());
        assertSame(status, result.getData());
    }

    @Test
    void shouldNotTouchApiForUnknownWorkspace() throws Exception {
        ToolResult<?> result = call(WorkspaceTools.GET_METADATA, null, "/elsewhere");

        assertEquals(ToolErrorCode.WORKSPACE_NOT_FOUND, result.getError().getCode());
        verifyNoInteractions(api);
    }

    @Test
    void shouldValidateBeforeResolving() throws Exception {
        ToolResult<?> result = call(WorkspaceTools.SET_METADATA, "{\"key\":\"-bad\",\"value\":\"x\"}", "/elsewhere");

        assertEquals(ToolErrorCode.INVALID_INPUT, result.getError().getCode());
        verifyNoInteractions(api);
    }

    @Test
    void shouldReturnNullAfterSettingMetadata() throws Exception {
        when(api.setMetadata("proj", "main-ws", "prUrl", null)).thenReturn(CompletableFuture.completedFuture(null));

        ToolResult<?> result = call(WorkspaceTools.SET_METADATA, "{\"key\":\"prUrl\",\"value\":null}", CALLER_PATH);

        assertTrue(result.isSuccess());
        assertNull(result.getData());
        verify(api).setMetadata("proj", "main-ws", "prUrl", null);
    }

    @Test
    void shouldDeleteKeepingBranchWhenAsked() throws Exception {
        when(api.remove("proj", "main-ws", true)).thenReturn(CompletableFuture.completedFuture(RemovalStarted.started()));

        ToolResult<?> result = call(WorkspaceTools.DELETE, "{\"keepBranch\":true}", CALLER_PATH);

        assertTrue(((RemovalStarted) result.getData()).isStarted());
    }

    @Test
    void shouldReportCommandFailureAsInternalError() throws Exception {
        when(api.executeCommand(eq("proj"), eq("main-ws"), eq("editor.save"), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("no editor window")));

        ToolResult<?> result = call(WorkspaceTools.EXECUTE_COMMAND, "{\"command\":\"editor.save\"}", CALLER_PATH);

        assertEquals(ToolErrorCode.INTERNAL_ERROR, result.getError().getCode());
        assertEquals("no editor window", result.getError().getMessage());
    }

    @Test
    void shouldCreateInCallerProjectWithCallerModel() throws Exception {
        when(api.getAgentSession("proj", "main-ws"))
                .thenReturn(CompletableFuture.completedFuture(new AgentSession(4096, "ses_main")));
        when(agents.listSessions(4096)).thenReturn(CompletableFuture.completedFuture(mapper.readTree("[{\"id\":\"ses_1\"}]")));
        when(agents.listMessages(4096, "ses_1")).thenReturn(CompletableFuture.completedFuture(mapper.readTree(
                "[{\"info\":{\"role\":\"user\",\"model\":{\"providerID\":\"anthropic\",\"modelID\":\"m-1\"}}}]")));
        Workspace created = Workspace.builder().projectId("proj").name("fix-login").branch("fix-login").build();
        when(api.create(eq("proj"), eq("fix-login"), eq("main"), any())).thenReturn(CompletableFuture.completedFuture(created));

        ToolResult<?> result = call(WorkspaceTools.CREATE,
                "{\"name\":\"fix-login\",\"base\":\"main\",\"initialPrompt\":\"Fix the login bug\"}", CALLER_PATH);

        assertSame(created, result.getData());
        ArgumentCaptor<WorkspaceCreateOptions> options = ArgumentCaptor.forClass(WorkspaceCreateOptions.class);
        verify(api).create(eq("proj"), eq("fix-login"), eq("main"), options.capture());
        assertEquals(CALLER_PATH, options.getValue().getCallerWorkspacePath());
        assertTrue(options.getValue().isKeepInBackground());
        InitialPrompt prompt = options.getValue().getInitialPrompt();
        assertEquals("Fix the login bug", prompt.getPrompt());
        assertEquals(new PromptModel("anthropic", "m-1"), prompt.getModel());
    }

    @Test
    void shouldKeepExplicitModel() throws Exception {
        when(api.create(eq("proj"), eq("fix"), eq("main"), any()))
                .thenReturn(CompletableFuture.completedFuture(Workspace.builder().name("fix").build()));

        call(WorkspaceTools.CREATE, "{\"name\":\"fix\",\"base\":\"main\",\"keepInBackground\":false,"
                + "\"initialPrompt\":{\"prompt\":\"p\",\"agent\":\"plan\",\"model\":{\"providerID\":\"x\",\"modelID\":\"y\"}}}", CALLER_PATH);

        ArgumentCaptor<WorkspaceCreateOptions> options = ArgumentCaptor.forClass(WorkspaceCreateOptions.class);
        verify(api).create(eq("proj"), eq("fix"), eq("main"), options.capture());
        assertFalse(options.getValue().isKeepInBackground());
        assertEquals("plan", options.getValue().getInitialPrompt().getAgent());
        assertEquals(new PromptModel("x", "y"), options.getValue().getInitialPrompt().getModel());
        verify(api, never()).getAgentSession(anyString(), anyString());
        verify(agents, never()).listSessions(anyInt());
    }

    @Test
    void shouldCreateWithoutModelWhenLookupFails() throws Exception {
        when(api.getAgentSession("proj", "main-ws"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("agent down")));
        when(api.create(eq("proj"), eq("fix"), eq("main"), any()))
                .thenReturn(CompletableFuture.completedFuture(Workspace.builder().name("fix").build()));

        ToolResult<?> result = call(WorkspaceTools.CREATE,
                "{\"name\":\"fix\",\"base\":\"main\",\"initialPrompt\":\"go\"}", CALLER_PATH);

        assertTrue(result.isSuccess());
        ArgumentCaptor<WorkspaceCreateOptions> options = ArgumentCaptor.forClass(WorkspaceCreateOptions.class);
        verify(api).create(eq("proj"), eq("fix"), eq("main"), options.capture());
        assertNull(options.getValue().getInitialPrompt().getModel());
    }

    @Test
    void shouldLogForUnregisteredWorkspace() throws Exception {
        ToolResult<?> result = call(WorkspaceTools.LOG,
                "{\"level\":\"warn\",\"message\":\"retrying push\",\"context\":{\"attempt\":2}}", "/not/registered");

        assertTrue(result.isSuccess());
        assertNull(result.getData());
        verify(agentLog).warn("retrying push attempt=2 workspace=/not/registered");
        verifyNoInteractions(api);
    }

    @Test
    void shouldRejectUnknownLogLevel() throws Exception {
        ToolResult<?> result = call(WorkspaceTools.LOG, "{\"level\":\"loud\",\"message\":\"m\"}", CALLER_PATH);

        assertEquals(ToolErrorCode.INVALID_INPUT, result.getError().getCode());
        verifyNoInteractions(agentLog);
    }

    @Test
    void shouldExposeSchemasForEveryTool() {
        Map<String, Boolean> seen = new HashMap<>();
        router.getRegistry().listSpecs().forEach(spec -> seen.put(spec.getName(), "object".equals(spec.getInputSchema().path("type").asText())));

        assertEquals(9, seen.size());
        assertFalse(seen.containsValue(false));
    }
}
