package com.zzf.workbridge.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.zzf.workbridge.core.util.Errors;
import io.modelcontextprotocol.server.DefaultMcpTransportContext;
import io.modelcontextprotocol.server.McpStatelessServerHandler;
import io.modelcontextprotocol.server.McpTransportContext;
import io.modelcontextprotocol.spec.McpError;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpStatelessServerTransport;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Stateless MCP transport on the JDK HTTP server. Each {@code POST /mcp} carries one JSON-RPC
 * message. The {@code X-Workspace-Path} header goes into the SDK transport context under
 * {@link #WORKSPACE_PATH_KEY}, next to the message rather than inside its arguments.
 */
@Slf4j
final class WorkspaceHttpTransport implements McpStatelessServerTransport, HttpHandler {
    static final String WORKSPACE_PATH_KEY = "workspacePath";

    private final ObjectMapper mapper;
    private final Consumer<String> requestListener;
    private final Executor listenerExecutor;

    private volatile McpStatelessServerHandler handler;
    private volatile boolean closing;

    WorkspaceHttpTransport(ObjectMapper mapper, Consumer<String> requestListener, Executor listenerExecutor) {
        this.mapper = mapper;
        this.requestListener = requestListener;
        this.listenerExecutor = listenerExecutor;
    }

    static McpTransportContext contextFor(String workspacePath) {
        DefaultMcpTransportContext context = new DefaultMcpTransportContext();
        context.put(WORKSPACE_PATH_KEY, workspacePath);
        return context;
    }

    /**
     * @return the raw header value the request arrived with, or an empty string
     */
    static String workspacePathOf(McpTransportContext context) {
        Object value = context == null ? null : context.get(WORKSPACE_PATH_KEY);
        return value == null ? "" : value.toString();
    }

    @Override
    public void setMcpHandler(McpStatelessServerHandler handler) {
        this.handler = handler;
    }

    @Override
    public Mono<Void> closeGracefully() {
        return Mono.fromRunnable(() -> closing = true);
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())
                    || !McpToolServer.ENDPOINT.equals(exchange.getRequestURI().getPath())) {
                writeText(exchange, 404, "Not Found");
                return;
            }
            String workspacePath = exchange.getRequestHeaders().getFirst(McpToolServer.WORKSPACE_PATH_HEADER);
            if (workspacePath == null || workspacePath.isEmpty()) {
                log.warn("mcp.request.reject reason=missing_workspace_header remote={}", exchange.getRemoteAddress());
                ObjectNode body = mapper.createObjectNode();
                body.put("error", "Missing " + McpToolServer.WORKSPACE_PATH_HEADER + " header");
                writeJson(exchange, 400, body);
                return;
            }
            McpStatelessServerHandler current = handler;
            if (closing || current == null) {
                writeText(exchange, 503, "Service Unavailable");
                return;
            }
            log.debug("mcp.request workspace={}", workspacePath);
            notifyListener(workspacePath);
            serve(exchange, current, exchange.getRequestBody().readAllBytes(), contextFor(workspacePath), workspacePath);
        } catch (IOException e) {
            log.warn("mcp.io.fail err={}", e.getMessage());
            throw e;
        } finally {
            exchange.close();
        }
    }

    private void serve(
            HttpExchange exchange,
            McpStatelessServerHandler current,
            byte[] raw,
            McpTransportContext context,
            String workspacePath
    ) throws IOException {
        JsonNode message;
        try {
            message = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("mcp.parse.fail workspace={} err={}", workspacePath, e.getOriginalMessage());
            writeJson(exchange, 400, errorResponse(null, McpSchema.ErrorCodes.PARSE_ERROR, "Parse error"));
            return;
        }
        if (message == null || !message.isObject() || !message.path("method").isTextual()) {
            writeJson(exchange, 400, errorResponse(null, McpSchema.ErrorCodes.INVALID_REQUEST,
                    "The server accepts either requests or notifications"));
            return;
        }
        try {
            if (message.has("id")) {
                McpSchema.JSONRPCRequest request = mapper.treeToValue(message, McpSchema.JSONRPCRequest.class);
                writeJson(exchange, 200, respond(current, request, context, workspacePath));
            } else {
                McpSchema.JSONRPCNotification notification = mapper.treeToValue(message, McpSchema.JSONRPCNotification.class);
                accept(current, notification, context, workspacePath);
                exchange.sendResponseHeaders(202, -1);
            }
        } catch (JsonProcessingException e) {
            log.debug("mcp.message.invalid workspace={} err={}", workspacePath, e.getOriginalMessage());
            writeJson(exchange, 400, errorResponse(message.get("id"), McpSchema.ErrorCodes.INVALID_REQUEST, "Invalid Request"));
        }
    }

    private McpSchema.JSONRPCResponse respond(
            McpStatelessServerHandler current,
            McpSchema.JSONRPCRequest request,
            McpTransportContext context,
            String workspacePath
    ) {
        try {
            McpSchema.JSONRPCResponse response = current.handleRequest(context, request).block();
            if (response != null) {
                return response;
            }
            return errorResponse(request.id(), McpSchema.ErrorCodes.INTERNAL_ERROR, "No response for " + request.method());
        } catch (McpError e) {
            log.warn("mcp.request.error method={} workspace={} err={}", request.method(), workspacePath, e.getMessage());
            McpSchema.JSONRPCResponse.JSONRPCError error = e.getJsonRpcError();
            if (error == null) {
                error = new McpSchema.JSONRPCResponse.JSONRPCError(McpSchema.ErrorCodes.INTERNAL_ERROR, e.getMessage(), null);
            }
            return new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), null, error);
        } catch (RuntimeException e) {
            log.error("mcp.request.fail method={} workspace={} err={}",
                    request.method(), workspacePath, Errors.messageOf(e), Errors.unwrap(e));
            return errorResponse(request.id(), McpSchema.ErrorCodes.INTERNAL_ERROR, "Internal error: " + Errors.messageOf(e));
        }
    }

    private void accept(
            McpStatelessServerHandler current,
            McpSchema.JSONRPCNotification notification,
            McpTransportContext context,
            String workspacePath
    ) {
        try {
            current.handleNotification(context, notification).block();
        } catch (RuntimeException e) {
            log.debug("mcp.notification.fail method={} workspace={} err={}",
                    notification.method(), workspacePath, Errors.messageOf(e));
        }
    }

    private void notifyListener(String workspacePath) {
        if (requestListener == null) {
            return;
        }
        try {
            listenerExecutor.execute(() -> {
                try {
                    requestListener.accept(workspacePath);
                } catch (RuntimeException e) {
                    log.error("mcp.request.listener.fail workspace={} err={}", workspacePath, Errors.messageOf(e), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("mcp.request.listener.skip reason=stopping workspace={}", workspacePath);
        }
    }

    private static McpSchema.JSONRPCResponse errorResponse(Object id, int code, String message) {
        return new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION, id, null,
                new McpSchema.JSONRPCResponse.JSONRPCError(code, message, null));
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static void writeText(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
