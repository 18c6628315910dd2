package com.zzf.workbridge.config;

/**
 * Beans of this type are told when an agent first contacts the tool server about a workspace.
 */
@FunctionalInterface
public interface FirstRequestListener {
    void onFirstRequest(String workspacePath);
}
