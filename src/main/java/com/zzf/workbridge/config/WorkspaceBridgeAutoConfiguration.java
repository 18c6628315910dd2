package com.zzf.workbridge.config;

import com.zzf.workbridge.api.WorkspaceApi;
import com.zzf.workbridge.core.util.JsonUtils;
import com.zzf.workbridge.lifecycle.LoopbackPortAllocator;
import com.zzf.workbridge.lifecycle.McpServerManager;
import com.zzf.workbridge.lifecycle.PortAllocator;
import com.zzf.workbridge.mcp.AgentSessionClient;
import com.zzf.workbridge.mcp.HttpAgentSessionClient;
import com.zzf.workbridge.plugin.PluginServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.stream.Collectors;

@Configuration(proxyBeanMethods = false)
@ConditionalOnBean(WorkspaceApi.class)
@EnableConfigurationProperties(BridgeProperties.class)
public class WorkspaceBridgeAutoConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(WorkspaceBridgeAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public PortAllocator portAllocator() {
        return new LoopbackPortAllocator();
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentSessionClient agentSessionClient(BridgeProperties properties) {
        return new HttpAgentSessionClient(JsonUtils.newMapper(), properties.getAgent().getQueryTimeoutMs());
    }

    @Bean(destroyMethod = "dispose")
    @ConditionalOnMissingBean
    public McpServerManager mcpServerManager(PortAllocator ports, WorkspaceApi api, AgentSessionClient agents) {
        return new McpServerManager(ports, api, agents);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public PluginServer pluginServer(PortAllocator ports, BridgeProperties properties) {
        logger.info("bridge.config mcpEnabled={} pluginEnabled={} development={}",
                properties.getMcp().isEnabled(), properties.getPlugin().isEnabled(), properties.getPlugin().isDevelopment());
        BridgeProperties.Plugin plugin = properties.getPlugin();
        return new PluginServer(ports, plugin.isDevelopment(), plugin.getCommandTimeoutMs(), plugin.getShutdownTimeoutMs());
    }

    @Bean
    @ConditionalOnMissingBean
    public BridgeLifecycle bridgeLifecycle(
            WorkspaceApi api,
            McpServerManager manager,
            PluginServer pluginServer,
            BridgeProperties properties,
            ObjectProvider<FirstRequestListener> firstRequestListeners
    ) {
        return new BridgeLifecycle(api, manager, pluginServer, properties,
                firstRequestListeners.orderedStream().collect(Collectors.toList()));
    }
}
