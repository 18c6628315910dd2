package com.zzf.workbridge.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workbridge.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolResultTest {

    private final ObjectMapper mapper = JsonUtils.newMapper();

    @Test
    void shouldSerializeSuccessWithExplicitNullData() {
        ObjectNode json = ToolResult.ok(null).toJson(mapper);

        assertTrue(json.get("success").asBoolean());
        assertTrue(json.has("data"));
        assertTrue(json.get("data").isNull());
        assertFalse(json.has("error"));
    }

    @Test
    void shouldSerializeDataValue() {
        ObjectNode json = ToolResult.ok(Map.of("base", "main")).toJson(mapper);

        assertEquals("main", json.get("data").get("base").asText());
    }

    @Test
    void shouldUseWireCodesForErrors() {
        ToolResult<Object> notFound = ToolResult.workspaceNotFound("/ws/missing");
        ObjectNode json = notFound.toJson(mapper);

        assertFalse(json.get("success").asBoolean());
        assertEquals("workspace-not-found", json.get("error").get("code").asText());
        assertEquals("Workspace not found: /ws/missing", json.get("error").get("message").asText());
        assertNull(notFound.getData());
        assertEquals("invalid-input", ToolResult.invalidInput("bad").toJson(mapper).get("error").get("code").asText());
        assertEquals("internal-error", ToolResult.internalError("boom").toJson(mapper).get("error").get("code").asText());
    }
}
