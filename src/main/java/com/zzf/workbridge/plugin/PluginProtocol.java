package com.zzf.workbridge.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Frames of the editor-extension socket. One JSON object per line, discriminated by {@code type}:
 * <pre>
 * client → server   {"type":"auth","workspacePath":"/abs/path"}           first frame, once
 * server → client   {"type":"config","payload":{"isDevelopment":false}}
 * client → server   {"type":"request","id":1,"event":"api:workspace:getStatus","payload":{}}
 * server → client   {"type":"response","id":1,"result":{"success":true,"data":{...}}}
 * server → client   {"type":"command","id":7,"payload":{"command":"...","args":[]}}
 * client → server   {"type":"ack","id":7,"result":{"success":true,"data":null}}
 * server → client   {"type":"shutdown"}
 * </pre>
 * {@code api:log} requests are fire-and-forget and never answered.
 */
public final class PluginProtocol {
    public static final String TYPE_AUTH = "auth";
    public static final String TYPE_CONFIG = "config";
    public static final String TYPE_REQUEST = "request";
    public static final String TYPE_RESPONSE = "response";
    public static final String TYPE_COMMAND = "command";
    public static final String TYPE_ACK = "ack";
    public static final String TYPE_SHUTDOWN = "shutdown";

    public static final String WORKSPACE_EVENT_PREFIX = "api:workspace:";
    public static final String EVENT_LOG = "api:log";

    public static final String GET_STATUS = WORKSPACE_EVENT_PREFIX + "getStatus";
    public static final String GET_AGENT_SESSION = WORKSPACE_EVENT_PREFIX + "getAgentSession";
    public static final String GET_METADATA = WORKSPACE_EVENT_PREFIX + "getMetadata";
    public static final String SET_METADATA = WORKSPACE_EVENT_PREFIX + "setMetadata";
    public static final String DELETE = WORKSPACE_EVENT_PREFIX + "delete";
    public static final String EXECUTE_COMMAND = WORKSPACE_EVENT_PREFIX + "executeCommand";
    public static final String CREATE = WORKSPACE_EVENT_PREFIX + "create";

    public static final int MAX_FRAME_CHARS = 1 << 20;

    private PluginProtocol() {}

    public static ObjectNode auth(ObjectMapper mapper, String workspacePath) {
        ObjectNode frame = frame(mapper, TYPE_AUTH);
        frame.put("workspacePath", workspacePath);
        return frame;
    }

    public static ObjectNode config(ObjectMapper mapper, boolean development) {
        ObjectNode frame = frame(mapper, TYPE_CONFIG);
        frame.putObject("payload").put("isDevelopment", development);
        return frame;
    }

    public static ObjectNode response(ObjectMapper mapper, JsonNode id, JsonNode result) {
        ObjectNode frame = frame(mapper, TYPE_RESPONSE);
        frame.set("id", id);
        frame.set("result", result);
        return frame;
    }

    /**
     * @param args omitted from the payload when null
     */
    public static ObjectNode command(ObjectMapper mapper, long id, String command, List<?> args) {
        ObjectNode frame = frame(mapper, TYPE_COMMAND);
        frame.put("id", id);
        ObjectNode payload = frame.putObject("payload");
        payload.put("command", command);
        if (args != null) {
            ArrayNode array = payload.putArray("args");
            for (Object arg : args) {
                array.add(mapper.valueToTree(arg));
            }
        }
        return frame;
    }

    public static ObjectNode shutdown(ObjectMapper mapper) {
        return frame(mapper, TYPE_SHUTDOWN);
    }

    public static String typeOf(JsonNode frame) {
        return frame == null ? "" : frame.path("type").asText("");
    }

    private static ObjectNode frame(ObjectMapper mapper, String type) {
        ObjectNode frame = mapper.createObjectNode();
        frame.put("type", type);
        return frame;
    }
}
