package com.zzf.workbridge.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import com.zzf.workbridge.api.WorkspaceApi;
import com.zzf.workbridge.core.tool.ToolRegistry;
import com.zzf.workbridge.core.tool.ToolRouter;
import com.zzf.workbridge.core.tool.WorkspaceDispatcher;
import com.zzf.workbridge.core.util.JsonUtils;
import com.zzf.workbridge.workspace.WorkspaceIdentity;
import com.zzf.workbridge.workspace.WorkspaceIdentityRegistry;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpStatelessSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Tool protocol front: a stateless MCP SDK server behind {@code POST /mcp} on the loopback
 * interface. The caller's workspace travels in the {@code X-Workspace-Path} header and reaches
 * tool handlers through the SDK transport context.
 * <p>
 * The request listener is called once per accepted request, off the request thread.
 */
public final class McpToolServer {
    public static final String ENDPOINT = "/mcp";
    public static final String WORKSPACE_PATH_HEADER = "X-Workspace-Path";
    public static final String AGENT_LOGGER_NAME = "workbridge.mcp";
    public static final String SERVER_NAME = "workspace-bridge";
    public static final String SERVER_VERSION = "1.0.0";

    public static final String SERVER_INSTRUCTIONS = String.join("\n",
            "Each workspace is a git worktree with its own agent session.",
            "",
            "workspace_create starts a sibling workspace in your project. Its initialPrompt tells the new agent what to do:",
            "- { prompt, agent: \"plan\" } starts the agent in read-only plan mode, for research and planning.",
            "- { prompt } without agent starts it with full permissions, for direct implementation.",
            "",
            "The model of your current session is propagated automatically when the prompt names none.");

    private final WorkspaceApi api;
    private final WorkspaceIdentityRegistry registry;
    private final AgentSessionClient agents;
    private final Consumer<String> requestListener;
    private final ObjectMapper mapper;
    private final Logger logger;
    private final Logger agentLog;
    private final Object lock = new Object();

    private volatile boolean running;
    private volatile McpStatelessSyncServer engine;
    private volatile HttpServer server;
    private ExecutorService executor;
    private ExecutorService listenerExecutor;

    public McpToolServer(
            WorkspaceApi api,
            WorkspaceIdentityRegistry registry,
            AgentSessionClient agents,
            Consumer<String> requestListener
    ) {
        this(api, registry, agents, requestListener, JsonUtils.newMapper(),
                LoggerFactory.getLogger(McpToolServer.class), LoggerFactory.getLogger(AGENT_LOGGER_NAME));
    }

    public McpToolServer(
            WorkspaceApi api,
            WorkspaceIdentityRegistry registry,
            AgentSessionClient agents,
            Consumer<String> requestListener,
            ObjectMapper mapper,
            Logger logger,
            Logger agentLog
    ) {
        this.api = api;
        this.registry = registry;
        this.agents = agents;
        this.requestListener = requestListener;
        this.mapper = mapper;
        this.logger = logger;
        this.agentLog = agentLog;
    }

    /**
     * Builds the engine with the fixed tool set and binds {@code 127.0.0.1:port}. Calling it while
     * running only logs a warning.
     *
     * @throws IOException when the port cannot be bound; the server stays stopped
     */
    public void start(int port) throws IOException {
        synchronized (lock) {
            if (running) {
                logger.warn("mcp.start.skip reason=already_running port={}", getPort());
                return;
            }
            ToolRegistry tools = new ToolRegistry();
            WorkspaceDispatcher dispatcher = new WorkspaceDispatcher(registry);
            CallerModelResolver models = agents == null ? null : new CallerModelResolver(api, agents);
            WorkspaceTools.registerAll(tools, api, dispatcher, models, agentLog, mapper);

            ExecutorService events = Executors.newSingleThreadExecutor(daemonThreads("workbridge-mcp-events-"));
            WorkspaceHttpTransport transport = new WorkspaceHttpTransport(mapper, requestListener, events);
            McpStatelessSyncServer created = McpServer.sync(transport)
                    .serverInfo(SERVER_NAME, SERVER_VERSION)
                    .instructions(SERVER_INSTRUCTIONS)
                    .capabilities(McpSchema.ServerCapabilities.builder().tools(false).build())
                    .tools(McpToolSpecifications.from(new ToolRouter(tools), mapper))
                    .build();
            logger.debug("mcp.tools.registered count={}", tools.size());

            ExecutorService pool = Executors.newCachedThreadPool(daemonThreads("workbridge-mcp-"));
            HttpServer http;
            try {
                http = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 0);
            } catch (IOException e) {
                created.close();
                pool.shutdownNow();
                events.shutdownNow();
                throw e;
            }
            http.createContext("/", transport);
            http.setExecutor(pool);
            http.start();

            this.engine = created;
            this.server = http;
            this.executor = pool;
            this.listenerExecutor = events;
            this.running = true;
            logger.info("mcp.started port={} workspaces={}", http.getAddress().getPort(), registry.size());
        }
    }

    /**
     * Stops accepting requests, drops the engine, then releases the listener and its threads.
     * Safe to call when never started and more than once.
     */
    public void stop() {
        synchronized (lock) {
            if (!running && server == null && executor == null) {
                return;
            }
            logger.info("mcp.stopping");
            running = false;
            if (engine != null) {
                engine.close();
                engine = null;
            }
            if (server != null) {
                server.stop(0);
                server = null;
            }
            if (executor != null) {
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                        executor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    executor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            if (listenerExecutor != null) {
                listenerExecutor.shutdown();
                listenerExecutor = null;
            }
            logger.info("mcp.stopped");
        }
    }

    public void dispose() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return the bound port, or {@code -1} when stopped
     */
    public int getPort() {
        HttpServer current = server;
        return current == null ? -1 : current.getAddress().getPort();
    }

    public void registerWorkspace(WorkspaceIdentity identity) {
        registry.register(identity);
    }

    public void unregisterWorkspace(String workspacePath) {
        registry.unregister(workspacePath);
    }

    public WorkspaceIdentity resolveWorkspace(String workspacePath) {
        return registry.resolve(workspacePath);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
