package com.zzf.workbridge.core.tool;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Levels accepted from remote callers. {@code silly} has no SLF4J counterpart and maps to trace.
 */
public enum LogLevel {
    SILLY("silly"),
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error");

    private final String wireName;

    LogLevel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return the level for {@code name}, or {@code null} when it is not one of the accepted names
     */
    public static LogLevel fromName(String name) {
        if (name == null) {
            return null;
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        for (LogLevel level : values()) {
            if (level.wireName.equals(lower)) {
                return level;
            }
        }
        return null;
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(LogLevel::wireName).collect(Collectors.toList());
    }
}
