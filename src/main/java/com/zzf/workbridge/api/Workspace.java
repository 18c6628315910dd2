package com.zzf.workbridge.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A workspace as reported by the orchestration layer (one git worktree).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Workspace {
    private String projectId;
    private String name;
    /** null for a detached HEAD */
    private String branch;
    private Map<String, String> metadata;
    private String path;
}
