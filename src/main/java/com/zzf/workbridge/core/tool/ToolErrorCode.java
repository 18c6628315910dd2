package com.zzf.workbridge.core.tool;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of failure codes reported by workspace operations on every transport.
 */
public enum ToolErrorCode {
    WORKSPACE_NOT_FOUND("workspace-not-found"),
    INVALID_INPUT("invalid-input"),
    INTERNAL_ERROR("internal-error");

    private final String wireName;

    ToolErrorCode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
