package com.zzf.workbridge.lifecycle;

import com.zzf.workbridge.api.Unsubscribe;
import com.zzf.workbridge.api.WorkspaceApi;
import com.zzf.workbridge.core.util.Errors;
import com.zzf.workbridge.mcp.AgentSessionClient;
import com.zzf.workbridge.mcp.McpToolServer;
import com.zzf.workbridge.workspace.PendingRegistrations;
import com.zzf.workbridge.workspace.WorkspaceIdentity;
import com.zzf.workbridge.workspace.WorkspaceIdentityRegistry;
import com.zzf.workbridge.workspace.WorkspaceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * Owns the tool server's lifecycle: port allocation, start/stop, registrations that arrive while
 * it is down, and first-request detection per workspace.
 * <p>
 * While stopped, registrations go to a pending queue which {@link #start()} hands to the fresh
 * registry before the listener is bound. Each start begins a new generation: nothing seen or
 * registered in an earlier one survives {@link #stop()}.
 */
public final class McpServerManager implements WorkspaceResolver {

    @FunctionalInterface
    public interface ServerFactory {
        McpToolServer create(WorkspaceIdentityRegistry registry, Consumer<String> requestListener);
    }

    private final PortAllocator ports;
    private final ServerFactory factory;
    private final Logger logger;
    private final PendingRegistrations pending = new PendingRegistrations();
    private final FirstRequestNotifier firstRequests;
    private final Object lock = new Object();

    private volatile McpToolServer server;
    private volatile Integer port;

    public McpServerManager(PortAllocator ports, WorkspaceApi api, AgentSessionClient agents) {
        this(ports, (registry, listener) -> new McpToolServer(api, registry, agents, listener),
                LoggerFactory.getLogger(McpServerManager.class));
    }

    public McpServerManager(PortAllocator ports, ServerFactory factory, Logger logger) {
        this.ports = ports;
        this.factory = factory;
        this.logger = logger;
        this.firstRequests = new FirstRequestNotifier(logger);
    }

    /**
     * Starts the tool server on a freshly allocated port. While running, returns the current port
     * without allocating another one.
     *
     * @throws IOException when no port can be allocated or bound; the manager is fully reset first
     */
    public int start() throws IOException {
        synchronized (lock) {
            McpToolServer current = server;
            Integer currentPort = port;
            if (current != null && current.isRunning() && currentPort != null) {
                return currentPort;
            }
            try {
                int allocated = allocatePort();
                WorkspaceIdentityRegistry registry = new WorkspaceIdentityRegistry();
                McpToolServer created = factory.create(registry, firstRequests::onRequest);
                int replayed = pending.drainInto(registry);
                server = created;
                created.start(allocated);
                port = allocated;
                logger.info("mcp.manager.started port={} replayed={}", allocated, replayed);
                return allocated;
            } catch (IOException | RuntimeException e) {
                logger.error("mcp.manager.start.fail err={}", Errors.messageOf(e), e);
                stop();
                throw e;
            }
        }
    }

    /**
     * Stops the server and clears the port, seen workspaces, subscribers and pending
     * registrations. A no-op when never started; safe to repeat.
     */
    public void stop() {
        synchronized (lock) {
            McpToolServer current = server;
            server = null;
            port = null;
            if (current != null) {
                current.stop();
                logger.info("mcp.manager.stopped");
            }
            firstRequests.clearSeen();
            firstRequests.clearSubscribers();
            pending.clear();
        }
    }

    public void dispose() {
        stop();
    }

    /**
     * @return the port, or {@code null} unless running
     */
    public Integer getPort() {
        return isRunning() ? port : null;
    }

    public boolean isRunning() {
        McpToolServer current = server;
        return current != null && current.isRunning();
    }

    public void registerWorkspace(WorkspaceIdentity identity) {
        synchronized (lock) {
            McpToolServer current = server;
            if (current != null && current.isRunning()) {
                current.registerWorkspace(identity);
            } else {
                pending.put(identity);
            }
        }
        logger.debug("mcp.workspace.register workspace={} running={}",
                identity == null ? null : identity.getWorkspacePath(), isRunning());
    }

    /**
     * Removes the workspace and forgets that it was seen, so a workspace recreated at the same path
     * is first again.
     */
    public void unregisterWorkspace(String workspacePath) {
        synchronized (lock) {
            McpToolServer current = server;
            if (current != null && current.isRunning()) {
                current.unregisterWorkspace(workspacePath);
            } else {
                pending.remove(workspacePath);
            }
            firstRequests.clear(workspacePath);
        }
        logger.debug("mcp.workspace.unregister workspace={}", workspacePath);
    }

    /**
     * Resolves against the live registry while running, otherwise against the pending queue.
     */
    @Override
    public WorkspaceIdentity resolve(String workspacePath) {
        McpToolServer current = server;
        if (current != null && current.isRunning()) {
            return current.resolveWorkspace(workspacePath);
        }
        return pending.resolve(workspacePath);
    }

    public WorkspaceIdentity resolveWorkspace(String workspacePath) {
        return resolve(workspacePath);
    }

    /**
     * @param callback receives the normalized path of each workspace on its first request
     */
    public Unsubscribe onFirstRequest(Consumer<String> callback) {
        return firstRequests.subscribe(callback);
    }

    public void clearFirstRequestTracking(String workspacePath) {
        firstRequests.clear(workspacePath);
    }

    private int allocatePort() throws IOException {
        try {
            Integer allocated = ports.findFreePort().join();
            if (allocated == null || allocated <= 0 || allocated > 65535) {
                throw new IOException("Port allocator returned an invalid port: " + allocated);
            }
            return allocated;
        } catch (CompletionException e) {
            Throwable cause = Errors.unwrap(e);
            if (cause instanceof UncheckedIOException unchecked) {
                throw unchecked.getCause();
            }
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Port allocation failed: " + Errors.messageOf(cause), cause);
        }
    }
}
