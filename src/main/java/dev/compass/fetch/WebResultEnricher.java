package dev.compass.fetch;

import dev.compass.search.SearchResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fills {@link SearchResult#fullContent()} for a batch of results, one page at a time with a pause
 * between requests. A result whose page cannot be fetched, or that has no http URL, keeps its
 * snippet as full content. A single failure never aborts the batch.
 */
@Component
public class WebResultEnricher {

  private static final Logger log = LoggerFactory.getLogger(WebResultEnricher.class);

  private final ContentFetcher fetcher;
  private final Duration pause;

  public WebResultEnricher(ContentFetcher fetcher, FetchProperties properties) {
    this.fetcher = fetcher;
    this.pause = properties.pause();
  }

  public List<SearchResult> enrich(List<SearchResult> results) {
    log.info("Fetching full content for {} results", results.size());
    List<SearchResult> enriched = new ArrayList<>(results.size());
    boolean fetched = false;
    for (SearchResult result : results) {
      if (!result.hasHttpUrl()) {
        enriched.add(result.withFullContent(result.snippet()));
        continue;
      }
      if (fetched) {
        pause();
      }
      fetched = true;
      String content = fetcher.fetchText(result.url()).orElse(result.snippet());
      enriched.add(result.withFullContent(content));
    }
    return List.copyOf(enriched);
  }

  private void pause() {
    if (pause.isZero()) {
      return;
    }
    try {
      Thread.sleep(pause.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
