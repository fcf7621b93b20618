package dev.compass.routing;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the OpenAI chat model behind {@link ClassifierClient}. Both beans exist only when {@code
 * compass.classifier.api-key} is set; without them {@link QueryClassifier} runs heuristics only.
 */
@Configuration
@ConditionalOnExpression("'${compass.classifier.api-key:}' != ''")
public class ClassifierConfig {

  @Bean
  public ChatModel classifierChatModel(ClassifierProperties properties) {
    return OpenAiChatModel.builder()
        .apiKey(properties.apiKey())
        .modelName(properties.model())
        .temperature(properties.temperature())
        .timeout(properties.timeout())
        .build();
  }

  @Bean
  public ClassifierClient classifierClient(ChatModel classifierChatModel) {
    return new ChatModelClassifierClient(classifierChatModel);
  }
}
