package com.zzf.workbridge.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkspaceStatus {
    @JsonProperty("isDirty")
    private boolean dirty;
    private AgentStatus agent;
}
