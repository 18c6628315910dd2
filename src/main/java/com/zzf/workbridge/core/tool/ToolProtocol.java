package com.zzf.workbridge.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

public final class ToolProtocol {

    private ToolProtocol() {}

    /**
     * One invocation of a named tool. {@code workspacePath} is the caller's workspace as sent by the
     * client, kept apart from the arguments; handlers normalize it through the registry.
     */
    public static final class ToolCall {
        private final String tool;
        private final JsonNode args;
        private final String workspacePath;

        public ToolCall(String tool, JsonNode args, String workspacePath) {
            this.tool = tool == null ? "" : tool.trim();
            this.args = args == null || args.isNull() || args.isMissingNode()
                    ? JsonNodeFactory.instance.objectNode()
                    : args;
            this.workspacePath = workspacePath == null ? "" : workspacePath;
        }

        public String getTool() {
            return tool;
        }

        public JsonNode getArgs() {
            return args;
        }

        public String getWorkspacePath() {
            return workspacePath;
        }
    }

    public static final class ToolSpec {
        private final String name;
        private final String description;
        private final JsonNode inputSchema;

        public ToolSpec(String name, String description, JsonNode inputSchema) {
            this.name = name == null ? "" : name.trim();
            this.description = description == null ? "" : description.trim();
            this.inputSchema = inputSchema;
        }

        public String getName() {
            return name;
        }

        public String getDescription() {
            return description;
        }

        public JsonNode getInputSchema() {
            return inputSchema;
        }
    }
}
