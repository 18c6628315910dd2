package com.zzf.workbridge.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkspaceCreateOptions {
    /** Workspace that asked for the creation, when the request came from a tool client. */
    private String callerWorkspacePath;
    private InitialPrompt initialPrompt;
    /** When true the new workspace is not focused in the UI. */
    private boolean keepInBackground;
}
