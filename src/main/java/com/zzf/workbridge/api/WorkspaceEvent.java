package com.zzf.workbridge.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkspaceEvent {
    private WorkspaceEventType type;
    private String projectId;
    private String workspaceName;
    private String workspacePath;
}
