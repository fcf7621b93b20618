package dev.compass.routing;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds the {@link QueryClassifier} with the LLM client when one is configured. */
@Configuration
public class RoutingConfig {

  @Bean
  public QueryClassifier queryClassifier(
      ObjectProvider<ClassifierClient> classifierClient,
      ClassificationResponseParser parser,
      HeuristicClassifier heuristic) {
    return new QueryClassifier(classifierClient.getIfAvailable(), parser, heuristic);
  }
}
