package com.zzf.workbridge.core.tool;

import com.zzf.workbridge.core.util.Errors;
import com.zzf.workbridge.workspace.WorkspaceIdentity;
import com.zzf.workbridge.workspace.WorkspaceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Resolve, dispatch, wrap: the one code path every workspace operation of both fronts goes
 * through.
 * <ul>
 *   <li>an unresolvable path yields {@code workspace-not-found} and the call is never made;</li>
 *   <li>a value (including {@code null}) becomes a success envelope;</li>
 *   <li>an exception, thrown or delivered through the future, becomes {@code internal-error} and
 *   is logged at error level with the operation name.</li>
 * </ul>
 */
public final class WorkspaceDispatcher {
    private final WorkspaceResolver resolver;
    private final Logger logger;

    public WorkspaceDispatcher(WorkspaceResolver resolver) {
        this(resolver, LoggerFactory.getLogger(WorkspaceDispatcher.class));
    }

    public WorkspaceDispatcher(WorkspaceResolver resolver, Logger logger) {
        this.resolver = resolver;
        this.logger = logger;
    }

    public WorkspaceIdentity resolve(String workspacePath) {
        if (workspacePath == null || workspacePath.isBlank()) {
            return null;
        }
        return resolver.resolve(workspacePath);
    }

    public <T> CompletableFuture<ToolResult<T>> dispatch(
            String operation,
            String workspacePath,
            Function<WorkspaceIdentity, CompletableFuture<T>> call
    ) {
        WorkspaceIdentity identity = resolve(workspacePath);
        if (identity == null) {
            logger.debug("workspace.unresolved operation={} workspace={}", operation, workspacePath);
            if (workspacePath == null || workspacePath.isBlank()) {
                return CompletableFuture.completedFuture(
                        ToolResult.error(ToolErrorCode.WORKSPACE_NOT_FOUND, "Missing workspace path"));
            }
            return CompletableFuture.completedFuture(ToolResult.workspaceNotFound(workspacePath));
        }

        CompletableFuture<T> future;
        try {
            future = call.apply(identity);
            if (future == null) {
                future = CompletableFuture.completedFuture(null);
            }
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        return future.<ToolResult<T>>handle((value, err) -> {
            if (err == null) {
                logger.debug("workspace.call.ok operation={} workspace={}", operation, identity.getWorkspacePath());
                return ToolResult.ok(value);
            }
            String message = Errors.messageOf(err);
            logger.error("workspace.call.fail operation={} workspace={} err={}",
                    operation, identity.getWorkspacePath(), message, Errors.unwrap(err));
            return ToolResult.internalError(message);
        });
    }
}
