package dev.compass.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link RouteToolService} methods as MCP tools. Spring AI's MCP server
 * auto-configuration picks up the {@link ToolCallbackProvider} bean.
 */
@Configuration
public class McpToolConfig {

  @Bean
  public ToolCallbackProvider compassTools(RouteToolService toolService) {
    return MethodToolCallbackProvider.builder().toolObjects(toolService).build();
  }
}
