package com.zzf.workbridge.api;

public enum WorkspaceEventType {
    WORKSPACE_CREATED,
    WORKSPACE_REMOVED,
    AGENT_RESTARTED
}
