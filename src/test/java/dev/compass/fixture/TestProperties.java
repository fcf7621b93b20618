package dev.compass.fixture;

import dev.compass.fetch.FetchProperties;
import dev.compass.search.SearchProperties;
import java.time.Duration;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Property records with the application defaults, for tests that build components by hand. */
public final class TestProperties {

  private TestProperties() {}

  public static SearchProperties search() {
    return search(new SearchProperties.Credentials(null, null, null, null));
  }

  public static SearchProperties search(SearchProperties.Credentials credentials) {
    return search(true, credentials);
  }

  public static SearchProperties search(
      boolean enabled, SearchProperties.Credentials credentials) {
    return new SearchProperties(
        enabled,
        5,
        3,
        Duration.ofSeconds(15),
        Duration.ZERO,
        5000,
        15000,
        "https://api.tavily.com",
        "https://en.wikipedia.org",
        "http://export.arxiv.org",
        "https://www.googleapis.com",
        "https://api.bing.microsoft.com",
        credentials,
        new SearchProperties.Retry(3, 1, 1.0));
  }

  public static SearchProperties.Credentials credentials(
      @Nullable String tavily,
      @Nullable String google,
      @Nullable String googleEngine,
      @Nullable String bing) {
    return new SearchProperties.Credentials(tavily, google, googleEngine, bing);
  }

  public static FetchProperties fetch(boolean enabled) {
    return new FetchProperties(enabled, 3000, 2_097_152, 10000, Duration.ZERO, List.of("compass-test/1.0"));
  }
}
