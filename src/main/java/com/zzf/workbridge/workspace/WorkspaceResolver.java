package com.zzf.workbridge.workspace;

/**
 * Resolves an externally supplied workspace path to its internal identity.
 */
@FunctionalInterface
public interface WorkspaceResolver {

    /**
     * @return the identity, or {@code null} when the path is unknown or not a valid absolute path
     */
    WorkspaceIdentity resolve(String workspacePath);
}
