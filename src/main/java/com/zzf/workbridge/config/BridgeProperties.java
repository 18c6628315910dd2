package com.zzf.workbridge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "workbridge")
public class BridgeProperties {
    private final Mcp mcp = new Mcp();
    private final Plugin plugin = new Plugin();
    private final Agent agent = new Agent();

    public Mcp getMcp() {
        return mcp;
    }

    public Plugin getPlugin() {
        return plugin;
    }

    public Agent getAgent() {
        return agent;
    }

    public static class Mcp {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Plugin {
        private boolean enabled = true;
        /** Sent to extensions in the config frame. */
        private boolean development = false;
        private long commandTimeoutMs = 10_000L;
        private long shutdownTimeoutMs = 5_000L;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isDevelopment() {
            return development;
        }

        public void setDevelopment(boolean development) {
            this.development = development;
        }

        public long getCommandTimeoutMs() {
            return commandTimeoutMs;
        }

        public void setCommandTimeoutMs(long commandTimeoutMs) {
            this.commandTimeoutMs = commandTimeoutMs;
        }

        public long getShutdownTimeoutMs() {
            return shutdownTimeoutMs;
        }

        public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
        }
    }

    public static class Agent {
        /** Timeout of each query against a workspace's agent server. */
        private long queryTimeoutMs = 3_000L;

        public long getQueryTimeoutMs() {
            return queryTimeoutMs;
        }

        public void setQueryTimeoutMs(long queryTimeoutMs) {
            this.queryTimeoutMs = queryTimeoutMs;
        }
    }
}
