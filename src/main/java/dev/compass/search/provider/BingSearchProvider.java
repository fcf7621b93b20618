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

/** Bing Web Search provider, last of the real providers. Gated on the subscription key. */
@Component
public class BingSearchProvider implements SearchProvider {

  private static final Logger log = LoggerFactory.getLogger(BingSearchProvider.class);

  static final String NAME = "Bing";
  static final String SUBSCRIPTION_HEADER = "Ocp-Apim-Subscription-Key";

  private final RestClient restClient;
  private final @Nullable String apiKey;

  public BingSearchProvider(
      @Qualifier("bingRestClient") RestClient restClient, SearchProperties properties) {
    this.restClient = restClient;
    this.apiKey = properties.credentials().bingApiKey();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public int priority() {
    return 50;
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
      return ResultSet.empty();
    }

    BingResponse response =
        restClient
            .get()
            .uri(
                uri ->
                    uri.path("/v7.0/search")
                        .queryParam("q", query)
                        .queryParam("count", limit)
                        .queryParam("textDecorations", true)
                        .queryParam("textFormat", "HTML")
                        .build())
            .header(SUBSCRIPTION_HEADER, apiKey)
            .retrieve()
            .body(BingResponse.class);
    if (response == null || response.webPages() == null || response.webPages().value() == null) {
      return ResultSet.empty();
    }

    List<SearchResult> results =
        response.webPages().value().stream()
            .limit(limit)
            .map(
                page ->
                    SearchResult.web(
                        HtmlText.plain(page.name()), page.url(), HtmlText.plain(page.snippet()), NAME))
            .toList();
    return ResultSet.of(NAME, results);
  }

  @Recover
  ResultSet recover(RestClientException e, String query, int limit) {
    log.warn("Bing request failed after retries: {}", e.getMessage());
    return ResultSet.empty();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record BingResponse(@Nullable WebPages webPages) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record WebPages(@Nullable List<Page> value) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Page(@Nullable String name, @Nullable String url, @Nullable String snippet) {}
}
