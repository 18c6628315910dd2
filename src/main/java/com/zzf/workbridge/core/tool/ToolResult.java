package com.zzf.workbridge.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Success/error envelope shared by the tool server and the plugin socket server.
 * Exactly one of {@code data} (possibly null) or {@code error} is meaningful.
 */
public final class ToolResult<T> {
    private final boolean success;
    private final T data;
    private final ToolError error;

    private ToolResult(boolean success, T data, ToolError error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static <T> ToolResult<T> ok(T data) {
        return new ToolResult<>(true, data, null);
    }

    public static <T> ToolResult<T> error(ToolErrorCode code, String message) {
        return new ToolResult<>(false, null, new ToolError(code, message));
    }

    public static <T> ToolResult<T> workspaceNotFound(String workspacePath) {
        return error(ToolErrorCode.WORKSPACE_NOT_FOUND, "Workspace not found: " + workspacePath);
    }

    public static <T> ToolResult<T> invalidInput(String message) {
        return error(ToolErrorCode.INVALID_INPUT, message);
    }

    public static <T> ToolResult<T> internalError(String message) {
        return error(ToolErrorCode.INTERNAL_ERROR, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public T getData() {
        return data;
    }

    public ToolError getError() {
        return error;
    }

    /**
     * {@code {"success":true,"data":...}} with an explicit null data, or
     * {@code {"success":false,"error":{"code":...,"message":...}}}.
     */
    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode out = mapper.createObjectNode();
        out.put("success", success);
        if (success) {
            out.set("data", mapper.valueToTree(data));
        } else {
            out.set("error", error.toJson(mapper));
        }
        return out;
    }

    @Override
    public String toString() {
        return success ? "ok(" + data + ")" : "error(" + error + ")";
    }

    public static final class ToolError {
        private final ToolErrorCode code;
        private final String message;

        public ToolError(ToolErrorCode code, String message) {
            this.code = Objects.requireNonNull(code, "code");
            this.message = message == null ? "" : message;
        }

        public ToolErrorCode getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }

        public ObjectNode toJson(ObjectMapper mapper) {
            ObjectNode node = mapper.createObjectNode();
            node.put("code", code.wireName());
            node.put("message", message);
            return node;
        }

        @Override
        public String toString() {
            return code + ": " + message;
        }
    }
}
