package dev.compass.search.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Subset of the Tavily search response this application reads. */
@JsonIgnoreProperties(ignoreUnknown = true)
record TavilyResponse(@Nullable String answer, @Nullable List<Hit> results) {

  List<Hit> hits() {
    return results == null ? List.of() : results;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Hit(@Nullable String title, @Nullable String url, @Nullable String content) {}
}
