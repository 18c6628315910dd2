package com.zzf.workbridge.config;

import com.zzf.workbridge.api.Unsubscribe;
import com.zzf.workbridge.api.WorkspaceApi;
import com.zzf.workbridge.api.WorkspaceEvent;
import com.zzf.workbridge.api.WorkspaceEventType;
import com.zzf.workbridge.core.util.Errors;
import com.zzf.workbridge.lifecycle.McpServerManager;
import com.zzf.workbridge.plugin.PluginServer;
import com.zzf.workbridge.plugin.WorkspacePluginApi;
import com.zzf.workbridge.workspace.WorkspaceIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Brings both protocol fronts up with the application context and keeps the tool server's
 * identity table in step with workspace events.
 */
@Slf4j
public class BridgeLifecycle implements SmartLifecycle {
    private final WorkspaceApi api;
    private final McpServerManager manager;
    private final PluginServer pluginServer;
    private final BridgeProperties properties;
    private final List<FirstRequestListener> firstRequestListeners;
    private final List<Unsubscribe> subscriptions = new ArrayList<>();

    private volatile boolean running;

    public BridgeLifecycle(
            WorkspaceApi api,
            McpServerManager manager,
            PluginServer pluginServer,
            BridgeProperties properties,
            List<FirstRequestListener> firstRequestListeners
    ) {
        this.api = api;
        this.manager = manager;
        this.pluginServer = pluginServer;
        this.properties = properties;
        this.firstRequestListeners = firstRequestListeners == null ? List.of() : List.copyOf(firstRequestListeners);
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        subscriptions.add(api.on(WorkspaceEventType.WORKSPACE_CREATED, this::onCreated));
        subscriptions.add(api.on(WorkspaceEventType.WORKSPACE_REMOVED, this::onRemoved));
        subscriptions.add(api.on(WorkspaceEventType.AGENT_RESTARTED, this::onAgentRestarted));
        try {
            if (properties.getMcp().isEnabled()) {
                subscriptions.add(manager.onFirstRequest(path -> log.info("mcp.first.request workspace={}", path)));
                for (FirstRequestListener listener : firstRequestListeners) {
                    subscriptions.add(manager.onFirstRequest(listener::onFirstRequest));
                }
                int port = manager.start();
                log.info("bridge.mcp.ready port={}", port);
            }
            if (properties.getPlugin().isEnabled()) {
                pluginServer.onApiCall(new WorkspacePluginApi(api, manager));
                subscriptions.add(pluginServer.onConnect(path -> log.info("plugin.client.ready workspace={}", path)));
                int port = pluginServer.start();
                log.info("bridge.plugin.ready port={}", port);
            }
        } catch (IOException e) {
            shutdown();
            throw new BridgeException("Failed to start workspace bridge: " + Errors.messageOf(e), e);
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void shutdown() {
        for (Unsubscribe subscription : subscriptions) {
            subscription.unsubscribe();
        }
        subscriptions.clear();
        pluginServer.close();
        manager.stop();
    }

    private void onCreated(WorkspaceEvent event) {
        try {
            manager.registerWorkspace(new WorkspaceIdentity(event.getProjectId(), event.getWorkspaceName(), event.getWorkspacePath()));
        } catch (IllegalArgumentException e) {
            log.warn("bridge.register.skip workspace={} err={}", event.getWorkspacePath(), e.getMessage());
        }
    }

    private void onRemoved(WorkspaceEvent event) {
        manager.unregisterWorkspace(event.getWorkspacePath());
    }

    private void onAgentRestarted(WorkspaceEvent event) {
        manager.clearFirstRequestTracking(event.getWorkspacePath());
    }
}
