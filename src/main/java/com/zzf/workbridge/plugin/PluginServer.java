package com.zzf.workbridge.plugin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.workbridge.api.Unsubscribe;
import com.zzf.workbridge.core.tool.ToolResult;
import com.zzf.workbridge.core.util.Errors;
import com.zzf.workbridge.core.util.JsonUtils;
import com.zzf.workbridge.lifecycle.PortAllocator;
import com.zzf.workbridge.workspace.WorkspacePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Socket protocol front for editor extensions. Each connection authenticates with its workspace
 * path; at most one connection per normalized path is kept, a newer one replaces the older.
 */
public final class PluginServer {
    public static final long DEFAULT_COMMAND_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 5_000L;
    static final int HANDSHAKE_TIMEOUT_MS = 5_000;

    private final PortAllocator ports;
    private final boolean development;
    private final long commandTimeoutMs;
    private final long shutdownTimeoutMs;
    private final ObjectMapper mapper;
    private final Logger logger;
    private final Object lock = new Object();
    private final Map<String, PluginConnection> connections = new ConcurrentHashMap<>();
    private final List<PluginConnection> unauthenticated = new CopyOnWriteArrayList<>();
    private final List<ConnectSubscription> connectCallbacks = new CopyOnWriteArrayList<>();
    private final AtomicLong connectionIds = new AtomicLong();
    private final AtomicLong commandIds = new AtomicLong();

    private volatile PluginApiHandlers apiHandlers;
    private volatile ServerSocket listener;
    private volatile Integer port;
    private ExecutorService executor;

    public PluginServer(PortAllocator ports, boolean development) {
        this(ports, development, DEFAULT_COMMAND_TIMEOUT_MS, DEFAULT_SHUTDOWN_TIMEOUT_MS);
    }

    public PluginServer(PortAllocator ports, boolean development, long commandTimeoutMs, long shutdownTimeoutMs) {
        this(ports, development, commandTimeoutMs, shutdownTimeoutMs,
                JsonUtils.newMapper(), LoggerFactory.getLogger(PluginServer.class));
    }

    public PluginServer(
            PortAllocator ports,
            boolean development,
            long commandTimeoutMs,
            long shutdownTimeoutMs,
            ObjectMapper mapper,
            Logger logger
    ) {
        this.ports = ports;
        this.development = development;
        this.commandTimeoutMs = commandTimeoutMs > 0 ? commandTimeoutMs : DEFAULT_COMMAND_TIMEOUT_MS;
        this.shutdownTimeoutMs = shutdownTimeoutMs > 0 ? shutdownTimeoutMs : DEFAULT_SHUTDOWN_TIMEOUT_MS;
        this.mapper = mapper;
        this.logger = logger;
    }

    /**
     * Binds a loopback listener on an allocated port. Returns the current port when already started.
     */
    public int start() throws IOException {
        synchronized (lock) {
            if (listener != null && port != null) {
                return port;
            }
            int allocated = allocatePort();
            ServerSocket bound = new ServerSocket();
            try {
                bound.setReuseAddress(true);
                bound.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), allocated));
            } catch (IOException e) {
                bound.close();
                throw e;
            }
            ExecutorService pool = Executors.newCachedThreadPool(daemonThreads());
            this.listener = bound;
            this.port = bound.getLocalPort();
            this.executor = pool;
            pool.execute(() -> acceptLoop(bound));
            logger.info("plugin.started port={} development={}", port, development);
            return port;
        }
    }

    /**
     * Disconnects every client and releases the listener. Safe to call twice.
     */
    public void close() {
        synchronized (lock) {
            ServerSocket current = listener;
            if (current == null) {
                return;
            }
            listener = null;
            port = null;
            closeQuietly(current);
            for (PluginConnection connection : connections.values()) {
                disconnect(connection);
            }
            connections.clear();
            for (PluginConnection connection : unauthenticated) {
                disconnect(connection);
            }
            unauthenticated.clear();
            if (executor != null) {
                executor.shutdownNow();
                executor = null;
            }
            logger.info("plugin.closed");
        }
    }

    public Integer getPort() {
        return port;
    }

    public boolean isConnected(String workspacePath) {
        String key = WorkspacePaths.tryNormalize(workspacePath);
        if (key == null) {
            return false;
        }
        PluginConnection connection = connections.get(key);
        return connection != null && !connection.isClosed();
    }

    /**
     * Installs the handlers for {@code api:*} requests, replacing earlier ones.
     */
    public void onApiCall(PluginApiHandlers handlers) {
        this.apiHandlers = handlers;
    }

    /**
     * @param callback receives the normalized workspace path after each successful handshake
     */
    public Unsubscribe onConnect(Consumer<String> callback) {
        ConnectSubscription subscription = new ConnectSubscription(callback);
        connectCallbacks.add(subscription);
        return () -> connectCallbacks.remove(subscription);
    }

    /**
     * Sends an editor command and waits for the client's acknowledgement.
     *
     * @return the client's result, or an error when not connected, disconnected or timed out
     */
    public CompletableFuture<ToolResult<Object>> sendCommand(String workspacePath, String command, List<?> args, long timeoutMs) {
        String key = WorkspacePaths.tryNormalize(workspacePath);
        PluginConnection connection = key == null ? null : connections.get(key);
        if (connection == null) {
            return CompletableFuture.completedFuture(ToolResult.internalError("Workspace not connected"));
        }
        if (connection.isClosed()) {
            connections.remove(key, connection);
            return CompletableFuture.completedFuture(ToolResult.internalError("Workspace disconnected"));
        }
        long commandId = commandIds.incrementAndGet();
        CompletableFuture<JsonNode> ack = connection.expectAck(commandId);
        try {
            connection.send(PluginProtocol.command(mapper, commandId, command, args));
        } catch (IOException e) {
            connection.forgetAck(commandId);
            logger.warn("plugin.command.send.fail workspace={} command={} err={}", key, command, e.getMessage());
            return CompletableFuture.completedFuture(ToolResult.internalError("Workspace disconnected"));
        }
        long timeout = timeoutMs > 0 ? timeoutMs : commandTimeoutMs;
        return ack.orTimeout(timeout, TimeUnit.MILLISECONDS).handle((result, err) -> {
            if (err != null) {
                connection.forgetAck(commandId);
                if (Errors.unwrap(err) instanceof TimeoutException) {
                    logger.warn("plugin.command.timeout workspace={} command={} timeoutMs={}", key, command, timeout);
                    return ToolResult.internalError("Command timed out");
                }
                return ToolResult.internalError(Errors.messageOf(err));
            }
            if (result == null) {
                return ToolResult.internalError("Workspace disconnected");
            }
            ToolResult<Object> parsed = parseAck(result);
            logger.debug("plugin.command.result workspace={} command={} success={}", key, command, parsed.isSuccess());
            return parsed;
        });
    }

    public CompletableFuture<ToolResult<Object>> sendCommand(String workspacePath, String command, List<?> args) {
        return sendCommand(workspacePath, command, args, commandTimeoutMs);
    }

    public CompletableFuture<Boolean> sendShutdown(String workspacePath) {
        return sendShutdown(workspacePath, shutdownTimeoutMs);
    }

    /**
     * Asks the client to shut down and waits for it to disconnect. Completes normally on timeout.
     *
     * @return true when the client disconnected within the timeout, or was not connected
     */
    public CompletableFuture<Boolean> sendShutdown(String workspacePath, long timeoutMs) {
        String key = WorkspacePaths.tryNormalize(workspacePath);
        PluginConnection connection = key == null ? null : connections.get(key);
        if (connection == null || connection.isClosed()) {
            logger.debug("plugin.shutdown.skip workspace={} reason=not_connected", workspacePath);
            return CompletableFuture.completedFuture(true);
        }
        long timeout = timeoutMs > 0 ? timeoutMs : shutdownTimeoutMs;
        CompletableFuture<Boolean> done = connection.closedFuture()
                .thenApply(ignored -> true)
                .completeOnTimeout(false, timeout, TimeUnit.MILLISECONDS);
        try {
            logger.debug("plugin.shutdown.send workspace={}", key);
            connection.send(PluginProtocol.shutdown(mapper));
        } catch (IOException e) {
            logger.warn("plugin.shutdown.send.fail workspace={} err={}", key, e.getMessage());
            disconnect(connection);
            return CompletableFuture.completedFuture(true);
        }
        return done.thenApply(disconnected -> {
            if (!disconnected) {
                logger.warn("plugin.shutdown.timeout workspace={} timeoutMs={}", key, timeout);
            }
            return disconnected;
        });
    }

    private void acceptLoop(ServerSocket server) {
        while (!server.isClosed()) {
            Socket socket;
            try {
                socket = server.accept();
            } catch (IOException e) {
                if (!server.isClosed()) {
                    logger.warn("plugin.accept.fail err={}", e.getMessage());
                }
                continue;
            }
            ExecutorService pool = executor;
            if (pool == null || pool.isShutdown()) {
                closeQuietly(socket);
                return;
            }
            pool.execute(() -> serve(socket));
        }
    }

    private void serve(Socket socket) {
        PluginConnection connection;
        try {
            connection = new PluginConnection(connectionIds.incrementAndGet(), socket, mapper);
        } catch (IOException e) {
            logger.warn("plugin.connection.fail err={}", e.getMessage());
            closeQuietly(socket);
            return;
        }
        unauthenticated.add(connection);
        try {
            if (!handshake(connection)) {
                return;
            }
            readLoop(connection);
        } finally {
            unauthenticated.remove(connection);
            disconnect(connection);
            String path = connection.getWorkspacePath();
            if (path != null && connections.remove(path, connection)) {
                logger.info("plugin.disconnected workspace={} connection={}", path, connection.getId());
            }
        }
    }

    private boolean handshake(PluginConnection connection) {
        JsonNode auth;
        try {
            connection.setReadTimeout(HANDSHAKE_TIMEOUT_MS);
            auth = connection.readFrame();
            connection.setReadTimeout(0);
        } catch (SocketTimeoutException e) {
            logger.warn("plugin.reject connection={} reason=handshake_timeout", connection.getId());
            return false;
        } catch (IOException e) {
            logger.warn("plugin.reject connection={} reason=invalid_auth err={}", connection.getId(), e.getMessage());
            return false;
        }
        if (!PluginProtocol.TYPE_AUTH.equals(PluginProtocol.typeOf(auth))) {
            logger.warn("plugin.reject connection={} reason=invalid_auth", connection.getId());
            return false;
        }
        String raw = JsonUtils.textOrNull(auth, "workspacePath");
        if (raw == null || raw.isBlank() || !WorkspacePaths.isAbsolute(raw)) {
            logger.warn("plugin.reject connection={} reason=invalid_path path={}", connection.getId(), raw);
            return false;
        }
        String workspacePath = WorkspacePaths.normalize(raw);
        connection.setWorkspacePath(workspacePath);

        PluginConnection previous;
        synchronized (lock) {
            if (listener == null) {
                return false;
            }
            previous = connections.put(workspacePath, connection);
            unauthenticated.remove(connection);
        }
        if (previous != null && previous != connection) {
            logger.info("plugin.duplicate workspace={} old={} new={}", workspacePath, previous.getId(), connection.getId());
            disconnect(previous);
        }
        logger.info("plugin.connected workspace={} connection={}", workspacePath, connection.getId());

        for (ConnectSubscription subscription : connectCallbacks) {
            try {
                subscription.callback.accept(workspacePath);
            } catch (RuntimeException e) {
                logger.error("plugin.connect.callback.fail workspace={} err={}", workspacePath, Errors.messageOf(e), e);
            }
        }
        // config goes out last; clients treat it as the end of the handshake
        try {
            connection.send(PluginProtocol.config(mapper, development));
        } catch (IOException e) {
            logger.warn("plugin.config.fail workspace={} err={}", workspacePath, e.getMessage());
            return false;
        }
        return true;
    }

    private void readLoop(PluginConnection connection) {
        String workspacePath = connection.getWorkspacePath();
        while (!connection.isClosed()) {
            JsonNode frame;
            try {
                frame = connection.readFrame();
            } catch (JsonProcessingException e) {
                logger.warn("plugin.frame.invalid workspace={} err={}", workspacePath, e.getOriginalMessage());
                continue;
            } catch (IOException e) {
                if (!connection.isClosed()) {
                    logger.warn("plugin.read.fail workspace={} err={}", workspacePath, e.getMessage());
                }
                return;
            }
            if (frame == null) {
                return;
            }
            String type = PluginProtocol.typeOf(frame);
            switch (type) {
                case PluginProtocol.TYPE_REQUEST -> onRequest(connection, frame);
                case PluginProtocol.TYPE_ACK -> {
                    if (!connection.completeAck(frame.path("id").asLong(-1), frame.path("result"))) {
                        logger.debug("plugin.ack.orphan workspace={} id={}", workspacePath, frame.path("id").asText());
                    }
                }
                default -> logger.debug("plugin.frame.ignored workspace={} type={}", workspacePath, type);
            }
        }
    }

    private void onRequest(PluginConnection connection, JsonNode frame) {
        String workspacePath = connection.getWorkspacePath();
        String event = JsonUtils.textOrNull(frame, "event");
        JsonNode payload = frame.get("payload");
        PluginApiHandlers handlers = apiHandlers;

        if (PluginProtocol.EVENT_LOG.equals(event)) {
            if (handlers != null) {
                handlers.log(workspacePath, payload);
            }
            return;
        }
        JsonNode id = frame.get("id");
        if (id == null || id.isNull()) {
            logger.debug("plugin.request.drop workspace={} event={} reason=missing_id", workspacePath, event);
            return;
        }
        if (handlers == null) {
            logger.warn("plugin.request.unhandled workspace={} event={}", workspacePath, event);
            respond(connection, id, ToolResult.internalError("API handlers not registered"));
            return;
        }
        logger.debug("plugin.request workspace={} event={}", workspacePath, event);
        CompletableFuture<ToolResult<?>> result;
        try {
            result = handlers.handle(event, workspacePath, payload);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        result.whenComplete((value, err) -> {
            if (err != null) {
                logger.error("plugin.request.fail workspace={} event={} err={}", workspacePath, event, Errors.messageOf(err), Errors.unwrap(err));
                respond(connection, id, ToolResult.internalError(Errors.messageOf(err)));
            } else {
                respond(connection, id, value);
            }
        });
    }

    private void respond(PluginConnection connection, JsonNode id, ToolResult<?> result) {
        try {
            connection.send(PluginProtocol.response(mapper, id, result.toJson(mapper)));
        } catch (IOException e) {
            logger.warn("plugin.respond.fail workspace={} id={} err={}", connection.getWorkspacePath(), id, e.getMessage());
        }
    }

    private ToolResult<Object> parseAck(JsonNode result) {
        if (result.path("success").asBoolean(false)) {
            JsonNode data = result.get("data");
            Object value = JsonUtils.isAbsent(data) ? null : mapper.convertValue(data, Object.class);
            return ToolResult.ok(value);
        }
        JsonNode error = result.path("error");
        String message = error.isTextual() ? error.asText() : error.path("message").asText("Command failed");
        return ToolResult.internalError(message);
    }

    private int allocatePort() throws IOException {
        try {
            Integer allocated = ports.findFreePort().join();
            if (allocated == null || allocated < 0 || allocated > 65535) {
                throw new IOException("Port allocator returned an invalid port: " + allocated);
            }
            return allocated;
        } catch (CompletionException e) {
            Throwable cause = Errors.unwrap(e);
            if (cause instanceof UncheckedIOException unchecked) {
                throw unchecked.getCause();
            }
            throw new IOException("Port allocation failed: " + Errors.messageOf(cause), cause);
        }
    }

    private void disconnect(PluginConnection connection) {
        try {
            connection.close();
        } catch (IOException e) {
            logger.debug("plugin.close.fail connection={} err={}", connection.getId(), e.getMessage());
        }
    }

    private void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            logger.debug("plugin.close.fail err={}", e.getMessage());
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "workbridge-plugin-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class ConnectSubscription {
        private final Consumer<String> callback;

        private ConnectSubscription(Consumer<String> callback) {
            this.callback = callback;
        }
    }
}
