package com.zzf.workbridge.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workbridge.core.tool.ToolProtocol.ToolCall;
import com.zzf.workbridge.core.tool.ToolProtocol.ToolSpec;
import com.zzf.workbridge.core.tool.ToolResult;
import com.zzf.workbridge.core.tool.ToolRouter;
import io.modelcontextprotocol.server.McpStatelessServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Publishes the tool registry to the MCP SDK server. Every call answers with one text part: the
 * JSON of the value ({@code "null"} when absent), or {@code {"error":{...}}} flagged with
 * {@code isError}.
 */
@Slf4j
final class McpToolSpecifications {

    private McpToolSpecifications() {}

    static List<McpStatelessServerFeatures.SyncToolSpecification> from(ToolRouter router, ObjectMapper mapper) {
        List<McpStatelessServerFeatures.SyncToolSpecification> out = new ArrayList<>();
        for (ToolSpec spec : router.getRegistry().listSpecs()) {
            McpSchema.Tool tool = McpSchema.Tool.builder()
                    .name(spec.getName())
                    .description(spec.getDescription())
                    .inputSchema(mapper.convertValue(spec.getInputSchema(), McpSchema.JsonSchema.class))
                    .build();
            String name = spec.getName();
            out.add(new McpStatelessServerFeatures.SyncToolSpecification(tool, (context, request) ->
                    call(router, mapper, name, WorkspaceHttpTransport.workspacePathOf(context), request.arguments())));
        }
        return out;
    }

    static McpSchema.CallToolResult call(
            ToolRouter router,
            ObjectMapper mapper,
            String tool,
            String workspacePath,
            Map<String, Object> arguments
    ) {
        log.info("tool.call tool={} workspace={}", tool, workspacePath);
        long t0 = System.nanoTime();
        JsonNode args = arguments == null ? null : mapper.valueToTree(arguments);
        ToolResult<?> result = router.execute(new ToolCall(tool, args, workspacePath)).join();
        log.info("tool.result tool={} workspace={} success={} tookMs={}",
                tool, workspacePath, result.isSuccess(), (System.nanoTime() - t0) / 1_000_000L);
        return toCallResult(result, mapper);
    }

    static McpSchema.CallToolResult toCallResult(ToolResult<?> result, ObjectMapper mapper) {
        if (result.isSuccess()) {
            try {
                return text(mapper.writeValueAsString(result.getData()), false);
            } catch (JsonProcessingException e) {
                log.error("tool.result.serialize.fail err={}", e.getOriginalMessage(), e);
                result = ToolResult.internalError("Failed to serialize result: " + e.getOriginalMessage());
            }
        }
        ObjectNode wrapper = mapper.createObjectNode();
        wrapper.set("error", result.getError().toJson(mapper));
        return text(wrapper.toString(), true);
    }

    private static McpSchema.CallToolResult text(String text, boolean error) {
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(text)), error);
    }
}
