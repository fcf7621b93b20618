package dev.compass.retrieval;

import dev.langchain4j.rag.content.retriever.ContentRetriever;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes an application-supplied {@link ContentRetriever} as the {@link LocalRetriever} used by
 * the REST and MCP surfaces. Without one, routing runs with no local retriever.
 */
@Configuration
public class LocalRetrievalConfig {

  @Bean
  @ConditionalOnBean(ContentRetriever.class)
  @ConditionalOnMissingBean(LocalRetriever.class)
  public LocalRetriever contentRetrieverLocalRetriever(ContentRetriever contentRetriever) {
    return new ContentRetrieverLocalRetriever(contentRetriever);
  }
}
