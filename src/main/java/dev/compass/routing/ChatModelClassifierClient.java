package dev.compass.routing;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;

/**
 * {@link ClassifierClient} backed by a LangChain4j {@link ChatModel}. The system prompt states the
 * routing rules and asks for a bare JSON object.
 */
public class ChatModelClassifierClient implements ClassifierClient {

  static final String SYSTEM_PROMPT =
      """
      You are an expert query router for a retrieval system.
      Analyze the user's query and determine the best data source(s) to use.

      Available sources:
      - local_rag: ONLY for questions EXPLICITLY about UPLOADED DOCUMENTS
      - web_search: for general knowledge, facts, definitions, current events, external information
      - hybrid: ONLY when the query explicitly needs BOTH uploaded documents AND web information

      Rules:
      1. web_search is the default. Use it for "What is X?", "Explain Y", "How does Z work?",
         news, weather, "latest", "recent", and any question that does not mention documents.
      2. local_rag only when the query references uploaded content, e.g. "what does my document
         say", "according to my file", "summarize my PDF".
      3. hybrid only when the query asks to combine document content with web information, e.g.
         "compare my document with current industry standards".

      Respond with ONLY a JSON object:
      {"datasource": "local_rag" | "web_search" | "hybrid", "reasoning": "brief explanation", "confidence": 0.85}
      """;

  private final ChatModel chatModel;

  public ChatModelClassifierClient(ChatModel chatModel) {
    this.chatModel = chatModel;
  }

  @Override
  public String classify(String query, String contextHint) {
    String prompt =
        "User Query: %s%n%nContext: %s%n%nRoute this query:".formatted(query, contextHint);
    ChatResponse response =
        chatModel.chat(List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(prompt)));
    return response.aiMessage().text();
  }
}
