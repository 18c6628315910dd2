package com.zzf.workbridge.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.workbridge.api.AgentSession;
import com.zzf.workbridge.api.Workspace;
import com.zzf.workbridge.api.WorkspaceApi;
import com.zzf.workbridge.api.WorkspaceCreateOptions;
import com.zzf.workbridge.core.tool.ToolErrorCode;
import com.zzf.workbridge.core.tool.ToolResult;
import com.zzf.workbridge.core.util.JsonUtils;
import com.zzf.workbridge.workspace.WorkspaceIdentity;
import com.zzf.workbridge.workspace.WorkspaceIdentityRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class WorkspacePluginApiTest {

    private static final String PATH = "/repo/.worktrees/feature";

    private final ObjectMapper mapper = JsonUtils.newMapper();

    private WorkspaceApi api;
    private Logger extensionLog;
    private WorkspacePluginApi handlers;

    @BeforeEach
    void setUp() {
        api = mock(WorkspaceApi.class);
        extensionLog = mock(Logger.class);
        WorkspaceIdentityRegistry registry = new WorkspaceIdentityRegistry();
        registry.register(new WorkspaceIdentity("proj", "feature", PATH));
        handlers = new WorkspacePluginApi(api, registry, LoggerFactory.getLogger(WorkspacePluginApi.class), extensionLog);
    }

    private ToolResult<?> handle(String event, String payload) throws Exception {
        JsonNode node = payload == null ? null : mapper.readTree(payload);
        return handlers.handle(event, PATH, node).join();
    }

    @Test
    void shouldReturnAgentSession() throws Exception {
        when(api.getAgentSession("proj", "feature"))
                .thenReturn(CompletableFuture.completedFuture(new AgentSession(4100, "ses_9")));

        ToolResult<?> result = handle(PluginProtocol.GET_AGENT_SESSION, null);

        assertEquals(new AgentSession(4100, "ses_9"), result.getData());
    }

    @Test
    void shouldReturnNullWhenNoAgentIsRunning() throws Exception {
        when(api.getAgentSession("proj", "feature")).thenReturn(CompletableFuture.completedFuture(null));

        ToolResult<?> result = handle(PluginProtocol.GET_AGENT_SESSION, null);

        assertTrue(result.isSuccess());
        assertNull(result.getData());
    }

    @Test
    void shouldPassCommandArguments() throws Exception {
        when(api.executeCommand(eq("proj"), eq("feature"), eq("git.sync"), any()))
                .thenReturn(CompletableFuture.completedFuture(null));

        handle(PluginProtocol.EXECUTE_COMMAND, "{\"command\":\"git.sync\",\"args\":[true]}");

        verify(api).executeCommand("proj", "feature", "git.sync", List.of(true));
    }

    @Test
    void shouldCreateInForegroundByDefault() throws Exception {
        when(api.create(eq("proj"), eq("next"), eq("main"), any()))
                .thenReturn(CompletableFuture.completedFuture(Workspace.builder().name("next").build()));

        ToolResult<?> result = handle(PluginProtocol.CREATE, "{\"name\":\"next\",\"base\":\"main\",\"initialPrompt\":\"go\"}");

        assertTrue(result.isSuccess());
        ArgumentCaptor<WorkspaceCreateOptions> options = ArgumentCaptor.forClass(WorkspaceCreateOptions.class);
        verify(api).create(eq("proj"), eq("next"), eq("main"), options.capture());
        assertFalse(options.getValue().isKeepInBackground());
        assertEquals(PATH, options.getValue().getCallerWorkspacePath());
        assertEquals("go", options.getValue().getInitialPrompt().getPrompt());
    }

    @Test
    void shouldRejectInvalidPayloadWithoutCallingApi() throws Exception {
        ToolResult<?> result = handle(PluginProtocol.SET_METADATA, "{\"key\":\"\",\"value\":\"x\"}");

        assertEquals(ToolErrorCode.INVALID_INPUT, result.getError().getCode());
        verifyNoInteractions(api);
    }

    @Test
    void shouldRejectUnknownEvent() throws Exception {
        ToolResult<?> result = handle("api:workspace:explode", null);

        assertEquals(ToolErrorCode.INVALID_INPUT, result.getError().getCode());
        assertEquals("Unknown event: api:workspace:explode", result.getError().getMessage());
    }

    @Test
    void shouldReportNotFoundForOtherPath() throws Exception {
        ToolResult<?> result = handlers.handle(PluginProtocol.GET_METADATA, "/repo/unknown", null).join();

        assertEquals(ToolErrorCode.WORKSPACE_NOT_FOUND, result.getError().getCode());
        verify(api, never()).getMetadata(anyString(), anyString());
    }

    @Test
    void shouldWriteLogWithWorkspaceContext() throws Exception {
        handlers.log(PATH, mapper.readTree("{\"level\":\"error\",\"message\":\"sync failed\",\"context\":{\"code\":128}}"));

        verify(extensionLog).error("sync failed code=128 workspace=" + PATH);
    }

    @Test
    void shouldDropInvalidLogLines() throws Exception {
        handlers.log(PATH, mapper.readTree("{\"level\":\"shout\",\"message\":\"x\"}"));
        handlers.log(PATH, null);

        verifyNoInteractions(extensionLog);
    }
}
