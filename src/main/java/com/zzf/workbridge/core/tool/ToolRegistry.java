package com.zzf.workbridge.core.tool;

import com.zzf.workbridge.core.tool.ToolProtocol.ToolSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ToolRegistry {
    private final Map<String, ToolHandler> handlers = new LinkedHashMap<>();

    public void register(ToolHandler handler) {
        if (handler == null) {
            return;
        }
        ToolSpec spec = handler.spec();
        if (spec == null || spec.getName().isEmpty()) {
            return;
        }
        handlers.put(spec.getName(), handler);
    }

    public ToolHandler get(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return handlers.get(name.trim());
    }

    public List<ToolSpec> listSpecs() {
        if (handlers.isEmpty()) {
            return Collections.emptyList();
        }
        List<ToolSpec> out = new ArrayList<>();
        for (ToolHandler handler : handlers.values()) {
            out.add(handler.spec());
        }
        return out;
    }

    public int size() {
        return handlers.size();
    }
}
