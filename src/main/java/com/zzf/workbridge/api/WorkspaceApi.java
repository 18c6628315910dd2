package com.zzf.workbridge.api;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Capability interface of the workspace orchestration layer. Every operation addresses a
 * workspace by its internal {@code (projectId, workspaceName)} pair; resolving external paths to
 * that pair is the job of the protocol fronts.
 */
public interface WorkspaceApi {

    /**
     * Creates a workspace (git worktree plus agent session) in the given project.
     */
    CompletableFuture<Workspace> create(String projectId, String name, String base, WorkspaceCreateOptions options);

    /**
     * Starts removal of a workspace. Completes as soon as removal has been scheduled.
     */
    CompletableFuture<RemovalStarted> remove(String projectId, String workspaceName, boolean keepBranch);

    CompletableFuture<WorkspaceStatus> getStatus(String projectId, String workspaceName);

    /**
     * @return metadata, always containing at least the {@code base} key
     */
    CompletableFuture<Map<String, String>> getMetadata(String projectId, String workspaceName);

    /**
     * Sets a metadata key, or deletes it when {@code value} is null.
     */
    CompletableFuture<Void> setMetadata(String projectId, String workspaceName, String key, String value);

    /**
     * Runs an editor command in the workspace. Most commands complete with {@code null}.
     */
    CompletableFuture<Object> executeCommand(String projectId, String workspaceName, String command, List<Object> args);

    /**
     * @return the session of the workspace's agent server, or {@code null} if none is running
     */
    CompletableFuture<AgentSession> getAgentSession(String projectId, String workspaceName);

    /**
     * Restarts the workspace's agent server on the same port.
     *
     * @return the port the agent server listens on
     */
    CompletableFuture<Integer> restartAgentServer(String projectId, String workspaceName);

    Unsubscribe on(WorkspaceEventType type, Consumer<WorkspaceEvent> listener);

    void dispose();
}
