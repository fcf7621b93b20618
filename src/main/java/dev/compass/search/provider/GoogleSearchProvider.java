package dev.compass.search.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.compass.search.ResultSet;
import dev.compass.search.SearchProperties;
import dev.compass.search.SearchProvider;
import dev.compass.search.SearchResult;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Google Custom Search provider. Needs both an API key and a search engine id; the API serves at
 * most {@value #MAX_PAGE_SIZE} results per request.
 */
@Component
public class GoogleSearchProvider implements SearchProvider {

  private static final Logger log = LoggerFactory.getLogger(GoogleSearchProvider.class);

  static final String NAME = "Google";
  static final int MAX_PAGE_SIZE = 10;

  private final RestClient restClient;
  private final @Nullable String apiKey;
  private final @Nullable String engineId;

  public GoogleSearchProvider(
      @Qualifier("googleRestClient") RestClient restClient, SearchProperties properties) {
    this.restClient = restClient;
    this.apiKey = properties.credentials().googleApiKey();
    this.engineId = properties.credentials().googleSearchEngineId();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public int priority() {
    return 40;
  }

  @Override
  @Retryable(
      retryFor = {HttpServerErrorException.class, HttpClientErrorException.TooManyRequests.class},
      maxAttemptsExpression = "${compass.search.retry.max-attempts:3}",
      backoff =
          @Backoff(
              delayExpression = "${compass.search.retry.delay-ms:1000}",
              multiplierExpression = "${compass.search.retry.multiplier:2.0}"))
  public ResultSet search(String query, int limit) {
    if (!HtmlText.hasText(apiKey) || !HtmlText.hasText(engineId)) {
      return ResultSet.empty();
    }

    GoogleResponse response =
        restClient
            .get()
            .uri(
                uri ->
                    uri.path("/customsearch/v1")
                        .queryParam("q", query)
                        .queryParam("key", apiKey)
                        .queryParam("cx", engineId)
                        .queryParam("num", Math.min(limit, MAX_PAGE_SIZE))
                        .build())
            .retrieve()
            .body(GoogleResponse.class);
    if (response == null || response.items() == null) {
      return ResultSet.empty();
    }

    List<SearchResult> results =
        response.items().stream()
            .limit(limit)
            .map(item -> SearchResult.web(item.title(), item.link(), item.snippet(), NAME))
            .toList();
    return ResultSet.of(NAME, results);
  }

  @Recover
  ResultSet recover(RestClientException e, String query, int limit) {
    log.warn("Google request failed after retries: {}", e.getMessage());
    return ResultSet.empty();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record GoogleResponse(@Nullable List<Item> items) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Item(@Nullable String title, @Nullable String link, @Nullable String snippet) {}
}
