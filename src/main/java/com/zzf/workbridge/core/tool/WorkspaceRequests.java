package com.zzf.workbridge.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.workbridge.api.InitialPrompt;
import com.zzf.workbridge.api.MetadataKeys;
import com.zzf.workbridge.api.PromptModel;
import com.zzf.workbridge.core.util.JsonUtils;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed argument objects for workspace operations and their validation. Each {@code parse*}
 * method either returns a fully validated request or throws {@link InvalidInputException}.
 */
public final class WorkspaceRequests {
    public static final int MAX_COMMAND_LENGTH = 256;

    private static final ObjectMapper MAPPER = JsonUtils.newMapper();

    private WorkspaceRequests() {}

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SetMetadataRequest {
        private String key;
        /** null deletes the key */
        private String value;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExecuteCommandRequest {
        private String command;
        /** null when the caller sent no arguments */
        private List<Object> args;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeleteWorkspaceRequest {
        private boolean keepBranch;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateWorkspaceRequest {
        private String name;
        private String base;
        private InitialPrompt initialPrompt;
        private boolean keepInBackground;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LogRequest {
        private LogLevel level;
        private String message;
        private Map<String, Object> context;
    }

    public static SetMetadataRequest parseSetMetadata(JsonNode payload) {
        requireObject(payload);
        if (!payload.has("key")) {
            throw new InvalidInputException("Missing required field: key");
        }
        JsonNode key = payload.get("key");
        if (!key.isTextual()) {
            throw new InvalidInputException("Field 'key' must be a string");
        }
        if (key.asText().isEmpty()) {
            throw new InvalidInputException("Field 'key' cannot be empty");
        }
        if (!MetadataKeys.isValid(key.asText())) {
            throw new InvalidInputException("Invalid key format: must match " + MetadataKeys.KEY_PATTERN.pattern()
                    + ", at most " + MetadataKeys.MAX_LENGTH + " characters, not ending with '-'");
        }
        if (!payload.has("value")) {
            throw new InvalidInputException("Missing required field: value");
        }
        JsonNode value = payload.get("value");
        if (!value.isNull() && !value.isTextual()) {
            throw new InvalidInputException("Field 'value' must be a string or null");
        }
        return new SetMetadataRequest(key.asText(), value.isNull() ? null : value.asText());
    }

    public static ExecuteCommandRequest parseExecuteCommand(JsonNode payload) {
        requireObject(payload);
        JsonNode command = payload.get("command");
        if (command == null || !command.isTextual()) {
            throw new InvalidInputException("Field 'command' must be a string");
        }
        String text = command.asText();
        if (text.trim().isEmpty()) {
            throw new InvalidInputException("Field 'command' cannot be empty");
        }
        if (text.length() > MAX_COMMAND_LENGTH) {
            throw new InvalidInputException("Field 'command' exceeds " + MAX_COMMAND_LENGTH + " characters");
        }
        JsonNode args = payload.get("args");
        List<Object> converted = null;
        if (!JsonUtils.isAbsent(args)) {
            if (!args.isArray()) {
                throw new InvalidInputException("Field 'args' must be an array");
            }
            converted = new ArrayList<>();
            for (JsonNode arg : args) {
                converted.add(MAPPER.convertValue(arg, Object.class));
            }
        }
        return new ExecuteCommandRequest(text, converted);
    }

    /**
     * Accepts a missing, null or object payload; {@code keepBranch} defaults to false.
     */
    public static DeleteWorkspaceRequest parseDelete(JsonNode payload) {
        if (JsonUtils.isAbsent(payload)) {
            return new DeleteWorkspaceRequest(false);
        }
        requireObject(payload);
        return new DeleteWorkspaceRequest(optionalBoolean(payload, "keepBranch", false));
    }

    public static CreateWorkspaceRequest parseCreate(JsonNode payload, boolean keepInBackgroundDefault) {
        requireObject(payload);
        String name = requireNonEmptyString(payload, "name");
        String base = requireNonEmptyString(payload, "base");
        InitialPrompt prompt = parseInitialPrompt(payload.get("initialPrompt"));
        boolean keepInBackground = optionalBoolean(payload, "keepInBackground", keepInBackgroundDefault);
        return new CreateWorkspaceRequest(name, base, prompt, keepInBackground);
    }

    /**
     * A prompt is either a non-empty string or {@code {prompt, agent?, model?}}.
     *
     * @return the normalized prompt, or {@code null} when absent
     */
    public static InitialPrompt parseInitialPrompt(JsonNode node) {
        if (JsonUtils.isAbsent(node)) {
            return null;
        }
        if (node.isTextual()) {
            if (node.asText().isEmpty()) {
                throw new InvalidInputException("Field 'initialPrompt' cannot be empty");
            }
            return InitialPrompt.of(node.asText());
        }
        if (!node.isObject()) {
            throw new InvalidInputException("Field 'initialPrompt' must be a string or an object");
        }
        String prompt = JsonUtils.textOrNull(node, "prompt");
        if (prompt == null || prompt.isEmpty()) {
            throw new InvalidInputException("Field 'initialPrompt.prompt' must be a non-empty string");
        }
        JsonNode agentNode = node.get("agent");
        String agent = null;
        if (!JsonUtils.isAbsent(agentNode)) {
            if (!agentNode.isTextual()) {
                throw new InvalidInputException("Field 'initialPrompt.agent' must be a string");
            }
            agent = agentNode.asText();
        }
        PromptModel model = null;
        JsonNode modelNode = node.get("model");
        if (!JsonUtils.isAbsent(modelNode)) {
            String providerId = JsonUtils.textOrNull(modelNode, "providerID");
            String modelId = JsonUtils.textOrNull(modelNode, "modelID");
            if (providerId == null || providerId.isEmpty() || modelId == null || modelId.isEmpty()) {
                throw new InvalidInputException("Field 'initialPrompt.model' requires providerID and modelID");
            }
            model = new PromptModel(providerId, modelId);
        }
        return new InitialPrompt(prompt, agent, model);
    }

    public static LogRequest parseLog(JsonNode payload) {
        requireObject(payload);
        String levelName = JsonUtils.textOrNull(payload, "level");
        LogLevel level = LogLevel.fromName(levelName);
        if (level == null) {
            throw new InvalidInputException("Field 'level' must be one of " + LogLevel.names());
        }
        String message = JsonUtils.textOrNull(payload, "message");
        if (message == null || message.isEmpty()) {
            throw new InvalidInputException("Field 'message' must be a non-empty string");
        }
        Map<String, Object> context = Collections.emptyMap();
        JsonNode contextNode = payload.get("context");
        if (!JsonUtils.isAbsent(contextNode)) {
            if (!contextNode.isObject()) {
                throw new InvalidInputException("Field 'context' must be an object");
            }
            context = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = contextNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (!value.isValueNode()) {
                    throw new InvalidInputException("Context value for '" + field.getKey() + "' must be a primitive");
                }
                context.put(field.getKey(), MAPPER.convertValue(value, Object.class));
            }
        }
        return new LogRequest(level, message, context);
    }

    private static void requireObject(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new InvalidInputException("Request must be an object");
        }
    }

    private static String requireNonEmptyString(JsonNode payload, String field) {
        String value = JsonUtils.textOrNull(payload, field);
        if (value == null || value.isEmpty()) {
            throw new InvalidInputException("Field '" + field + "' must be a non-empty string");
        }
        return value;
    }

    private static boolean optionalBoolean(JsonNode payload, String field, boolean defaultValue) {
        JsonNode value = payload.get(field);
        if (JsonUtils.isAbsent(value)) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw new InvalidInputException("Field '" + field + "' must be a boolean");
        }
        return value.asBoolean();
    }
}
