package dev.compass.search.provider;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Request body for the Tavily {@code /search} endpoint. */
record TavilyRequest(
    String query,
    @JsonProperty("max_results") int maxResults,
    @JsonProperty("include_answer") boolean includeAnswer,
    @JsonProperty("include_raw_content") boolean includeRawContent,
    String topic) {

  static TavilyRequest general(String query, int maxResults) {
    return new TavilyRequest(query, maxResults, true, false, "general");
  }
}
