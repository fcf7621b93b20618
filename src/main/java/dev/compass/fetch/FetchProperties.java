package dev.compass.fetch;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Page fetching settings bound from {@code compass.fetch.*}.
 *
 * @param enabled whether web results are enriched with fetched page text
 * @param maxChars maximum characters of text kept per page
 * @param maxBytes maximum bytes of a page body read from the wire
 * @param timeoutMs connect and read timeout for a single page, also the budget for reading its body
 * @param pause delay between consecutive page fetches
 * @param userAgents browser user agents, used in rotation
 */
@ConfigurationProperties(prefix = "compass.fetch")
public record FetchProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("3000") int maxChars,
    @DefaultValue("2097152") int maxBytes,
    @DefaultValue("10000") int timeoutMs,
    @DefaultValue("200ms") Duration pause,
    @DefaultValue({
          "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
          "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
          "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"
        })
        List<String> userAgents) {

  public FetchProperties {
    if (maxChars < 1) {
      throw new IllegalStateException("compass.fetch.max-chars must be positive, got: " + maxChars);
    }
    if (maxBytes < 1) {
      throw new IllegalStateException("compass.fetch.max-bytes must be positive, got: " + maxBytes);
    }
    if (timeoutMs < 1) {
      throw new IllegalStateException(
          "compass.fetch.timeout-ms must be positive, got: " + timeoutMs);
    }
    if (pause.isNegative()) {
      throw new IllegalStateException("compass.fetch.pause must not be negative");
    }
    if (userAgents == null || userAgents.isEmpty()) {
      throw new IllegalStateException("compass.fetch.user-agents must not be empty");
    }
    userAgents = List.copyOf(userAgents);
  }
}
