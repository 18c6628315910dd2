package com.zzf.workbridge.workspace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registrations accepted while no tool server is running. Drained into the live registry
 * exactly once when the server starts.
 */
public final class PendingRegistrations implements WorkspaceResolver {
    private final Map<String, WorkspaceIdentity> pending = new LinkedHashMap<>();

    public synchronized void put(WorkspaceIdentity identity) {
        if (identity == null) {
            return;
        }
        pending.put(identity.getWorkspacePath(), identity);
    }

    public synchronized void remove(String workspacePath) {
        String key = WorkspaceIdentityRegistry.keyOf(workspacePath);
        if (key != null) {
            pending.remove(key);
        }
    }

    @Override
    public synchronized WorkspaceIdentity resolve(String workspacePath) {
        String key = WorkspaceIdentityRegistry.keyOf(workspacePath);
        if (key == null) {
            return null;
        }
        return pending.get(key);
    }

    /**
     * Moves every queued identity into {@code live} in insertion order and empties the queue.
     *
     * @return number of identities handed over
     */
    public synchronized int drainInto(WorkspaceIdentityRegistry live) {
        List<WorkspaceIdentity> batch = new ArrayList<>(pending.values());
        pending.clear();
        for (WorkspaceIdentity identity : batch) {
            live.register(identity);
        }
        return batch.size();
    }

    public synchronized void clear() {
        pending.clear();
    }

    public synchronized int size() {
        return pending.size();
    }
}
