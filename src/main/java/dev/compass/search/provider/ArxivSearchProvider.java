package dev.compass.search.provider;

import dev.compass.search.ResultSet;
import dev.compass.search.SearchProvider;
import dev.compass.search.SearchResult;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
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
 * Preprint index provider over the arXiv Atom API, newest submissions first.
 *
 * <p>Entry ids are upgraded to https and used as result URLs; abstracts are clipped to {@value
 * #SUMMARY_LIMIT} characters.
 */
@Component
public class ArxivSearchProvider implements SearchProvider {

  private static final Logger log = LoggerFactory.getLogger(ArxivSearchProvider.class);

  static final String NAME = "ArXiv";
  static final int SUMMARY_LIMIT = 300;

  private final RestClient restClient;

  public ArxivSearchProvider(@Qualifier("arxivRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public int priority() {
    return 30;
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
    String atom =
        restClient
            .get()
            .uri(
                uri ->
                    uri.path("/api/query")
                        .queryParam("search_query", "all:" + query)
                        .queryParam("start", 0)
                        .queryParam("max_results", limit)
                        .queryParam("sortBy", "submittedDate")
                        .queryParam("sortOrder", "descending")
                        .build())
            .retrieve()
            .body(String.class);
    if (atom == null || atom.isBlank()) {
      return ResultSet.empty();
    }
    return ResultSet.of(NAME, parseFeed(atom, limit));
  }

  @Recover
  ResultSet recover(RestClientException e, String query, int limit) {
    log.warn("ArXiv request failed after retries: {}", e.getMessage());
    return ResultSet.empty();
  }

  static List<SearchResult> parseFeed(String atom, int limit) {
    Document feed = Jsoup.parse(atom, "", Parser.xmlParser());
    List<SearchResult> results = new ArrayList<>();
    for (Element entry : feed.select("entry")) {
      if (results.size() >= limit) {
        break;
      }
      Element title = entry.selectFirst("title");
      if (title == null) {
        continue;
      }
      results.add(
          SearchResult.web(
              title.text(),
              secureUrl(textOf(entry.selectFirst("id"))),
              clip(textOf(entry.selectFirst("summary"))),
              NAME));
    }
    return results;
  }

  private static String textOf(@Nullable Element element) {
    return element == null ? "" : element.text();
  }

  private static String secureUrl(String id) {
    return id.replace("http://", "https://");
  }

  private static String clip(String summary) {
    return summary.length() <= SUMMARY_LIMIT ? summary : summary.substring(0, SUMMARY_LIMIT);
  }
}
