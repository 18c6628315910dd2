package com.zzf.workbridge.workspace;

import java.util.Objects;

/**
 * Internal identity of a workspace as seen by the workspace API, keyed externally by path.
 */
public final class WorkspaceIdentity {
    private final String projectId;
    private final String workspaceName;
    private final String workspacePath;

    public WorkspaceIdentity(String projectId, String workspaceName, String workspacePath) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        if (workspaceName == null || workspaceName.isBlank()) {
            throw new IllegalArgumentException("workspaceName is required");
        }
        if (!WorkspacePaths.isAbsolute(workspacePath)) {
            throw new IllegalArgumentException("workspacePath must be absolute: " + workspacePath);
        }
        this.projectId = projectId.trim();
        this.workspaceName = workspaceName.trim();
        this.workspacePath = WorkspacePaths.normalize(workspacePath);
    }

    /**
     * Derives the identity of a workspace from its project directory and its own directory.
     * The workspace name is the last path segment.
     */
    public static WorkspaceIdentity of(String projectPath, String workspacePath) {
        return new WorkspaceIdentity(
                ProjectIds.generate(projectPath),
                WorkspacePaths.basename(workspacePath),
                workspacePath
        );
    }

    public String getProjectId() {
        return projectId;
    }

    public String getWorkspaceName() {
        return workspaceName;
    }

    public String getWorkspacePath() {
        return workspacePath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorkspaceIdentity)) {
            return false;
        }
        WorkspaceIdentity that = (WorkspaceIdentity) o;
        return projectId.equals(that.projectId)
                && workspaceName.equals(that.workspaceName)
                && workspacePath.equals(that.workspacePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, workspaceName, workspacePath);
    }

    @Override
    public String toString() {
        return projectId + "/" + workspaceName + " (" + workspacePath + ")";
    }
}
