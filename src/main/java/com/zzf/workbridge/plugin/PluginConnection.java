package com.zzf.workbridge.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One extension socket. Writes are serialized; reads happen on the connection's own thread.
 */
final class PluginConnection {
    private final long id;
    private final Socket socket;
    private final BufferedReader reader;
    private final Writer writer;
    private final ObjectMapper mapper;
    private final Map<Long, CompletableFuture<JsonNode>> pendingAcks = new ConcurrentHashMap<>();
    private final CompletableFuture<Void> closed = new CompletableFuture<>();
    private final AtomicBoolean closing = new AtomicBoolean();

    private volatile String workspacePath;

    PluginConnection(long id, Socket socket, ObjectMapper mapper) throws IOException {
        this.id = id;
        this.socket = socket;
        this.mapper = mapper;
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    long getId() {
        return id;
    }

    String getWorkspacePath() {
        return workspacePath;
    }

    void setWorkspacePath(String workspacePath) {
        this.workspacePath = workspacePath;
    }

    void setReadTimeout(int millis) throws IOException {
        socket.setSoTimeout(millis);
    }

    /**
     * @return the next frame, or {@code null} at end of stream
     * @throws IOException on read failure, oversized frames or invalid JSON
     */
    JsonNode readFrame() throws IOException {
        String line = readLine();
        while (line != null && line.isBlank()) {
            line = readLine();
        }
        if (line == null) {
            return null;
        }
        return mapper.readTree(line);
    }

    /**
     * Reads up to the next {@code \n}, holding at most {@link PluginProtocol#MAX_FRAME_CHARS}
     * characters; one more fails the read.
     */
    private String readLine() throws IOException {
        StringBuilder line = new StringBuilder();
        int c;
        while ((c = reader.read()) != -1) {
            if (c == '\n') {
                int end = line.length();
                if (end > 0 && line.charAt(end - 1) == '\r') {
                    line.setLength(end - 1);
                }
                return line.toString();
            }
            if (line.length() >= PluginProtocol.MAX_FRAME_CHARS) {
                throw new IOException("Frame exceeds " + PluginProtocol.MAX_FRAME_CHARS + " characters");
            }
            line.append((char) c);
        }
        return line.length() == 0 ? null : line.toString();
    }

    void send(JsonNode frame) throws IOException {
        String line = mapper.writeValueAsString(frame);
        synchronized (writer) {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        }
    }

    CompletableFuture<JsonNode> expectAck(long commandId) {
        CompletableFuture<JsonNode> ack = new CompletableFuture<>();
        pendingAcks.put(commandId, ack);
        if (isClosed()) {
            pendingAcks.remove(commandId);
            ack.complete(null);
        }
        return ack;
    }

    void forgetAck(long commandId) {
        pendingAcks.remove(commandId);
    }

    boolean completeAck(long commandId, JsonNode result) {
        CompletableFuture<JsonNode> ack = pendingAcks.remove(commandId);
        return ack != null && ack.complete(result);
    }

    CompletableFuture<Void> closedFuture() {
        return closed;
    }

    boolean isClosed() {
        return closing.get() || socket.isClosed();
    }

    /**
     * Closes the socket once. Outstanding acks complete with {@code null}.
     */
    void close() throws IOException {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        try {
            socket.close();
        } finally {
            for (CompletableFuture<JsonNode> ack : pendingAcks.values()) {
                ack.complete(null);
            }
            pendingAcks.clear();
            closed.complete(null);
        }
    }

    @Override
    public String toString() {
        return "PluginConnection#" + id + (workspacePath == null ? "" : "(" + workspacePath + ")");
    }
}
