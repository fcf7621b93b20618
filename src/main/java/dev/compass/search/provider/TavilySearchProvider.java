package dev.compass.search.provider;

import dev.compass.search.ResultKind;
import dev.compass.search.ResultSet;
import dev.compass.search.SearchProperties;
import dev.compass.search.SearchProvider;
import dev.compass.search.SearchResult;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Answer engine provider backed by the Tavily search API. Tried first in the chain.
 *
 * <p>A direct answer, when Tavily returns one, becomes the first result with kind {@link
 * ResultKind#ANSWER}. Without an API key the provider declines without touching the network.
 */
@Component
public class TavilySearchProvider implements SearchProvider {

  private static final Logger log = LoggerFactory.getLogger(TavilySearchProvider.class);

  static final String NAME = "Tavily";

  private final RestClient restClient;
  private final @Nullable String apiKey;

  public TavilySearchProvider(
      @Qualifier("tavilyRestClient") RestClient restClient, SearchProperties properties) {
    this.restClient = restClient;
    this.apiKey = properties.credentials().tavilyApiKey();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public int priority() {
    return 10;
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
    if (!HtmlText.hasText(apiKey)) {
      log.debug("Tavily API key not configured, skipping");
      return ResultSet.empty();
    }

    TavilyResponse response =
        restClient
            .post()
            .uri("/search")
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
            .body(TavilyRequest.general(query, limit))
            .retrieve()
            .body(TavilyResponse.class);
    if (response == null) {
      return ResultSet.empty();
    }

    List<SearchResult> results = new ArrayList<>();
    if (HtmlText.hasText(response.answer())) {
      results.add(
          new SearchResult("Direct Answer", null, response.answer(), null, NAME, ResultKind.ANSWER));
    }
    response.hits().stream()
        .limit(limit)
        .map(hit -> SearchResult.web(hit.title(), hit.url(), hit.content(), NAME))
        .forEach(results::add);
    return ResultSet.of(NAME, results);
  }

  @Recover
  ResultSet recover(RestClientException e, String query, int limit) {
    log.warn("Tavily request failed after retries: {}", e.getMessage());
    return ResultSet.empty();
  }
}
