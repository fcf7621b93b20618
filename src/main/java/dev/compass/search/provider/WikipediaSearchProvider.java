package dev.compass.search.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.compass.search.ResultSet;
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

/** Encyclopedia provider using the MediaWiki full-text search API. No credential required. */
@Component
public class WikipediaSearchProvider implements SearchProvider {

  private static final Logger log = LoggerFactory.getLogger(WikipediaSearchProvider.class);

  static final String NAME = "Wikipedia";
  static final String ARTICLE_BASE_URL = "https://en.wikipedia.org/wiki/";

  private final RestClient restClient;

  public WikipediaSearchProvider(@Qualifier("wikipediaRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public int priority() {
    return 20;
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
    WikipediaResponse response =
        restClient
            .get()
            .uri(
                uri ->
                    uri.path("/w/api.php")
                        .queryParam("action", "query")
                        .queryParam("format", "json")
                        .queryParam("list", "search")
                        .queryParam("srsearch", query)
                        .queryParam("srlimit", limit)
                        .queryParam("srwhat", "text")
                        .build())
            .retrieve()
            .body(WikipediaResponse.class);
    if (response == null || response.query() == null) {
      return ResultSet.empty();
    }

    List<SearchResult> results =
        response.query().hits().stream()
            .limit(limit)
            .map(
                hit ->
                    SearchResult.web(
                        hit.title(), articleUrl(hit.title()), HtmlText.plain(hit.snippet()), NAME))
            .toList();
    return ResultSet.of(NAME, results);
  }

  @Recover
  ResultSet recover(RestClientException e, String query, int limit) {
    log.warn("Wikipedia request failed after retries: {}", e.getMessage());
    return ResultSet.empty();
  }

  static @Nullable String articleUrl(@Nullable String title) {
    if (!HtmlText.hasText(title)) {
      return null;
    }
    return ARTICLE_BASE_URL + title.replace(' ', '_');
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record WikipediaResponse(@Nullable Query query) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Query(@Nullable List<Hit> search) {
    List<Hit> hits() {
      return search == null ? List.of() : search;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Hit(@Nullable String title, @Nullable String snippet) {}
}
