package dev.compass.search;

import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised configuration for the web search chain, bound from {@code compass.search.*}.
 *
 * <ul>
 *   <li>{@code enabled} - when false the web path reports search as disabled
 *   <li>{@code max-results} / {@code hybrid-web-results} - result limits for web and hybrid mode
 *   <li>{@code provider-timeout} - upper bound on a single provider call inside the chain
 *   <li>{@code backoff} - pause between consecutive provider attempts
 *   <li>{@code credentials.*} - optional API keys; a blank key disables its provider
 * </ul>
 *
 * <p>Out-of-range values fail startup.
 */
@ConfigurationProperties(prefix = "compass.search")
public record SearchProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("5") int maxResults,
    @DefaultValue("3") int hybridWebResults,
    @DefaultValue("15s") Duration providerTimeout,
    @DefaultValue("200ms") Duration backoff,
    @DefaultValue("5000") int connectTimeoutMs,
    @DefaultValue("15000") int readTimeoutMs,
    @DefaultValue("https://api.tavily.com") String tavilyBaseUrl,
    @DefaultValue("https://en.wikipedia.org") String wikipediaBaseUrl,
    @DefaultValue("http://export.arxiv.org") String arxivBaseUrl,
    @DefaultValue("https://www.googleapis.com") String googleBaseUrl,
    @DefaultValue("https://api.bing.microsoft.com") String bingBaseUrl,
    @DefaultValue Credentials credentials,
    @DefaultValue Retry retry) {

  public SearchProperties {
    if (maxResults < 1 || maxResults > 50) {
      throw new IllegalStateException(
          "compass.search.max-results must be in [1, 50], got: " + maxResults);
    }
    if (hybridWebResults < 1 || hybridWebResults > 50) {
      throw new IllegalStateException(
          "compass.search.hybrid-web-results must be in [1, 50], got: " + hybridWebResults);
    }
    if (providerTimeout.isNegative() || providerTimeout.isZero()) {
      throw new IllegalStateException(
          "compass.search.provider-timeout must be positive, got: " + providerTimeout);
    }
    if (backoff.isNegative()) {
      throw new IllegalStateException("compass.search.backoff must not be negative");
    }
  }

  /** Provider credentials. Any of them may be absent. */
  public record Credentials(
      @Nullable String tavilyApiKey,
      @Nullable String googleApiKey,
      @Nullable String googleSearchEngineId,
      @Nullable String bingApiKey) {}

  /** Retry policy for transient upstream failures (HTTP 429 and 5xx). */
  public record Retry(
      @DefaultValue("3") int maxAttempts,
      @DefaultValue("1000") long delayMs,
      @DefaultValue("2.0") double multiplier) {}
}
