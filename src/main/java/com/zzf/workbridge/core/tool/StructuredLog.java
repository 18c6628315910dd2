package com.zzf.workbridge.core.tool;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes a remote caller's log line at the requested level with its context in {@link MDC} for the
 * duration of the call. The context is also appended to the message so it survives layouts
 * without an MDC converter.
 */
public final class StructuredLog {

    private StructuredLog() {}

    public static void write(Logger logger, LogLevel level, String message, Map<String, Object> context) {
        List<String> keys = new ArrayList<>();
        StringBuilder suffix = new StringBuilder();
        try {
            if (context != null) {
                for (Map.Entry<String, Object> entry : context.entrySet()) {
                    String value = String.valueOf(entry.getValue());
                    MDC.put(entry.getKey(), value);
                    keys.add(entry.getKey());
                    suffix.append(' ').append(entry.getKey()).append('=').append(value);
                }
            }
            String line = message + suffix;
            switch (level) {
                case SILLY -> logger.trace(line);
                case DEBUG -> logger.debug(line);
                case INFO -> logger.info(line);
                case WARN -> logger.warn(line);
                case ERROR -> logger.error(line);
                default -> logger.info(line);
            }
        } finally {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
