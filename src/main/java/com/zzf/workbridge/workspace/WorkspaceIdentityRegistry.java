package com.zzf.workbridge.workspace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory table of workspace identities keyed by normalized path.
 * One instance belongs to one running tool server; a restart starts from a fresh registry.
 */
public final class WorkspaceIdentityRegistry implements WorkspaceResolver {
    private final Map<String, WorkspaceIdentity> identities = new ConcurrentHashMap<>();

    /**
     * Inserts the identity, replacing any entry registered for the same normalized path.
     */
    public void register(WorkspaceIdentity identity) {
        if (identity == null) {
            return;
        }
        identities.put(identity.getWorkspacePath(), identity);
    }

    public void unregister(String workspacePath) {
        String key = keyOf(workspacePath);
        if (key != null) {
            identities.remove(key);
        }
    }

    @Override
    public WorkspaceIdentity resolve(String workspacePath) {
        String key = keyOf(workspacePath);
        if (key == null) {
            return null;
        }
        return identities.get(key);
    }

    public boolean contains(String workspacePath) {
        return resolve(workspacePath) != null;
    }

    public int size() {
        return identities.size();
    }

    public List<WorkspaceIdentity> list() {
        if (identities.isEmpty()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(identities.values());
    }

    static String keyOf(String workspacePath) {
        if (!WorkspacePaths.isAbsolute(workspacePath)) {
            return null;
        }
        return WorkspacePaths.normalize(workspacePath);
    }
}
